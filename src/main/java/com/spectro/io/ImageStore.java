package com.spectro.io;

import com.spectro.model.Image;
import java.io.File;
import java.io.IOException;
import java.util.Map;

public interface ImageStore {

    boolean isPreprocessed(File file) throws IOException;

    Image readPreprocessed(File file) throws IOException;

    Image readRaw(File file, String camera) throws IOException;

    Map<String, Object> readPrimaryHeader(File file) throws IOException;

    void write(File file, Image image) throws IOException;
}
