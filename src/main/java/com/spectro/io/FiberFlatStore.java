package com.spectro.io;

import com.spectro.model.FiberFlat;
import java.io.File;
import java.io.IOException;
import java.util.Map;

public interface FiberFlatStore {

    FiberFlat read(File file) throws IOException;

    void write(File file, FiberFlat flat, Map<String, Object> header) throws IOException;
}
