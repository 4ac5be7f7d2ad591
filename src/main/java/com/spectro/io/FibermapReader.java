package com.spectro.io;

import com.spectro.model.Fibermap;
import java.io.File;
import java.io.IOException;

public interface FibermapReader {

    Fibermap read(File file) throws IOException;
}
