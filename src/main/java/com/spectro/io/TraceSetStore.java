package com.spectro.io;

import com.spectro.model.TraceSet;
import java.io.File;
import java.io.IOException;

public interface TraceSetStore {

    TraceSet read(File file) throws IOException;

    void write(File file, TraceSet traceSet) throws IOException;
}
