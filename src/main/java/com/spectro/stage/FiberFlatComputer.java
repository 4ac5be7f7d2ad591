package com.spectro.stage;

import com.spectro.model.FiberFlat;
import com.spectro.model.Frame;

public interface FiberFlatComputer {

    FiberFlat compute(Frame frame);
}
