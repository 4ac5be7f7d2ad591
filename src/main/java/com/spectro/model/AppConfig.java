package com.spectro.model;

import java.util.prefs.Preferences;

public class AppConfig {
    private static final Preferences prefs = Preferences.userNodeForPackage(AppConfig.class);

    private static final String KEY_CALIB_DIR = "calib_dir";
    private static final String KEY_WIDTH = "extraction_width";
    private static final String KEY_OUTPUT_DIR = "auto_output_dir";

    // Raíz de los ficheros de calibración (PSF, FIBERFLAT, FLUXCALIB). Vacía: directorio de trabajo
    public static String getCalibDir() { return prefs.get(KEY_CALIB_DIR, ""); }

    public static int getExtractionWidth() { return prefs.getInt(KEY_WIDTH, RunDirectives.DEFAULT_WIDTH); }

    public static String getAutoOutputDir() { return prefs.get(KEY_OUTPUT_DIR, "."); }
}
