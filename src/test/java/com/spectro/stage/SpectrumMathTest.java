package com.spectro.stage;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

class SpectrumMathTest {

    @Test
    void interpolationClampsToEdgeValues() {
        double[] out = SpectrumMath.interp(new double[]{0, 1.5, 5}, new double[]{1, 2, 3}, new double[]{10, 20, 40});
        assertArrayEquals(new double[]{10, 15, 40}, out, 1e-12);
    }

    @Test
    void interpolationAcceptsDescendingGrids() {
        double[] out = SpectrumMath.interp(new double[]{2.5}, new double[]{3, 2, 1}, new double[]{40, 20, 10});
        assertEquals(30, out[0], 1e-12);
    }

    @Test
    void robustSigmaIgnoresOutliers() {
        double[] v = {1, 2, 3, 4, 5, 1000};
        assertEquals(3.5, SpectrumMath.median(v), 1e-12);
        assertEquals(1.4826 * 1.5, SpectrumMath.robustSigma(v), 1e-9);
    }
}
