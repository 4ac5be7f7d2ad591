package com.spectro.main;

import com.beust.jcommander.ParameterException;
import com.spectro.model.RunDirectives;
import org.junit.jupiter.api.Test;
import java.io.File;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QprocOptionsTest {

    @Test
    void flagsMapOntoRunDirectives() {
        QprocOptions o = new QprocOptions();
        o.parse(new String[]{"-i", "raw.fits", "-c", "r7", "-p", "psf.fits", "-o", "frame.fits",
                "--fibers", "0:10", "--width", "5", "--shift-psf", "--compute-lsf-sigma",
                "--compute-fiberflat", "flat.fits", "--input-fiberflat", "in-flat.fits", "--skysub", "--fluxcalib",
                "--output-preproc", "pre.fits", "--output-rawframe", "qframe.fits",
                "--output-skyframe", "qsky.fits", "--output-psf", "psf-out.fits", "--plot"});

        RunDirectives d = o.toDirectives(7, ".");

        assertEquals(new File("raw.fits"), d.image);
        assertEquals("r7", d.camera);
        assertEquals(new File("psf.fits"), d.psf);
        assertEquals(new File("frame.fits"), d.outframe);
        assertEquals("0:10", d.fibers);
        assertEquals(5, d.width);
        assertTrue(d.shiftPsf && d.computeLsfSigma && d.skysub && d.fluxcalib && d.plot);
        assertEquals(new File("flat.fits"), d.computeFiberflat);
        assertEquals(new File("in-flat.fits"), d.inputFiberflat);
        assertTrue(d.fiberflatApplication());
        assertFalse(d.applyFiberflat);
        assertEquals(new File("pre.fits"), d.outputPreproc);
        assertEquals(new File("qframe.fits"), d.outputRawframe);
        assertEquals(new File("qsky.fits"), d.outputSkyframe);
        assertEquals(new File("psf-out.fits"), d.outputPsf);
        assertFalse(d.auto);
    }

    @Test
    void defaultsComeFromTheCaller() {
        QprocOptions o = new QprocOptions();
        o.parse(new String[]{"--image", "img.fits", "--auto"});

        RunDirectives d = o.toDirectives(9, "products");

        assertTrue(d.auto);
        assertEquals(9, d.width);
        assertEquals(new File("products"), d.autoOutputDir);
        assertNull(d.camera);
        assertNull(d.psf);
        assertNull(d.fibers);
    }

    @Test
    void calibrationRootPrefersTheCommandLine() {
        QprocOptions o = new QprocOptions();
        o.parse(new String[]{"-i", "img.fits", "--calib-dir", "/data/calib"});
        assertEquals(new File("/data/calib"), o.calibRoot("/home/calib"));

        QprocOptions p = new QprocOptions();
        p.parse(new String[]{"-i", "img.fits"});
        assertEquals(new File("/home/calib"), p.calibRoot("/home/calib"));
        assertEquals(new File("."), p.calibRoot(""));
    }

    @Test
    void imageIsRequiredUnlessAskingForHelp() {
        assertThrows(ParameterException.class, () -> new QprocOptions().parse(new String[]{"--auto"}));

        QprocOptions o = new QprocOptions();
        o.parse(new String[]{"-h"});
        assertTrue(o.help);
    }
}
