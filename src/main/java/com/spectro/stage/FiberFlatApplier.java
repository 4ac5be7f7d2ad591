package com.spectro.stage;

import com.spectro.model.FiberFlat;
import com.spectro.model.Frame;

public interface FiberFlatApplier {

    // Corrige el frame en sitio y lo devuelve.
    Frame apply(Frame frame, FiberFlat flat);
}
