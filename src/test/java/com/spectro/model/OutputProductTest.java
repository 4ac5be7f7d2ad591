package com.spectro.model;

import org.junit.jupiter.api.Test;
import java.io.File;

import static org.junit.jupiter.api.Assertions.assertEquals;

class OutputProductTest {

    @Test
    void autoFileNamesUsePrefixCameraAndPaddedExposure() {
        File dir = new File("out");

        assertEquals(new File(dir, "qcframe-r7-00001234.fits"), OutputProduct.FRAME.fileFor(dir, "R7", 1234));
        assertEquals(new File(dir, "qfiberflat-b1-00000042.fits"), OutputProduct.FIBERFLAT.fileFor(dir, "b1", 42));
        assertEquals(new File(dir, "preproc-z3-00000001.fits"), OutputProduct.PREPROC.fileFor(dir, "z3", 1));
    }

    @Test
    void unrecognisedFlavorsAreUnknown() {
        assertEquals(Flavor.SCIENCE, Flavor.parse(" science "));
        assertEquals(Flavor.UNKNOWN, Flavor.parse("ZERO"));
        assertEquals(Flavor.UNKNOWN, Flavor.parse("TESTARC"));
        assertEquals(Flavor.UNKNOWN, Flavor.parse(null));
    }
}
