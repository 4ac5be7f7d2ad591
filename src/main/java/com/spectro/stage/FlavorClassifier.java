package com.spectro.stage;

import com.spectro.model.Frame;

public interface FlavorClassifier {

    // Tipo de exposición que sugieren los datos; devuelve inputFlavor si no hay evidencia contraria.
    String classify(Frame frame, String inputFlavor);
}
