package com.spectro.stage;

import com.spectro.model.Frame;

public interface SkySubtractor {

    // Resta el cielo del flujo en sitio y devuelve el modelo restado
    double[][] subtract(Frame frame);
}
