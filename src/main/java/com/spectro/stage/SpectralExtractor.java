package com.spectro.stage;

import com.spectro.model.Fibermap;
import com.spectro.model.Frame;
import com.spectro.model.Image;
import com.spectro.model.TraceSet;

public interface SpectralExtractor {

    Frame extract(TraceSet traceSet, Image image, int width, Fibermap fibermap);
}
