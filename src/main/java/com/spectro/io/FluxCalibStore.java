package com.spectro.io;

import com.spectro.model.FluxCalibCurve;
import java.io.File;
import java.io.IOException;

public interface FluxCalibStore {

    FluxCalibCurve read(File file) throws IOException;

    void write(File file, FluxCalibCurve curve) throws IOException;
}
