package com.spectro.stage;

import com.spectro.model.Image;
import com.spectro.model.TraceSet;

public interface TraceShiftFitter {

    TraceSet fit(Image image, TraceSet traceSet);
}
