package com.spectro.stage;

import com.spectro.model.Frame;
import com.spectro.model.TraceSet;

public interface LsfSigmaEstimator {

    TraceSet estimate(Frame frame, TraceSet traceSet);
}
