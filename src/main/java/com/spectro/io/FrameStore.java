package com.spectro.io;

import com.spectro.model.Frame;
import java.io.File;
import java.io.IOException;

public interface FrameStore {

    Frame read(File file) throws IOException;

    void write(File file, Frame frame) throws IOException;
}
