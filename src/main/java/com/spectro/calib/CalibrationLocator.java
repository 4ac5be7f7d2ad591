package com.spectro.calib;

import java.io.File;
import java.util.List;
import java.util.Map;

// Encuentra el fichero de calibración de un producto (PSF, FIBERFLAT, FLUXCALIB) a partir de las cabeceras
// de la exposición. Las cabeceras se consultan en orden: la primera que define una clave gana.
public interface CalibrationLocator {

    String PSF = "PSF";
    String FIBERFLAT = "FIBERFLAT";
    String FLUXCALIB = "FLUXCALIB";

    File findFile(String product, List<Map<String, Object>> headers) throws CalibrationNotFoundException;
}
