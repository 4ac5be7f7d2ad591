package com.spectro.model;

import java.io.File;
import java.util.Locale;

public enum OutputProduct {
    PREPROC("preproc"),
    PSF("psf"),
    RAW_FRAME("qframe"),
    FIBERFLAT("qfiberflat"),
    SKY_FRAME("qsky"),
    FRAME("qcframe");

    public final String prefix;

    OutputProduct(String prefix) { this.prefix = prefix; }

    // <dir>/<prefix>-<camera>-<expid 8 dígitos>.fits
    public File fileFor(File dir, String camera, long expid) {
        String cam = camera == null ? "unknown" : camera.toLowerCase(Locale.ROOT);
        return new File(dir, String.format(Locale.ROOT, "%s-%s-%08d.fits", prefix, cam, expid));
    }
}
