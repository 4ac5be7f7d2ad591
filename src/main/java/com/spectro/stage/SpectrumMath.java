package com.spectro.stage;

import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import java.util.Arrays;

public final class SpectrumMath {

    private SpectrumMath() {}

    // Interpolación lineal de (xp, fp) en x. Fuera de la malla se usa el valor del extremo.
    // xp debe ser estrictamente monótona; si es decreciente se invierte.
    public static double[] interp(double[] x, double[] xp, double[] fp) {
        double[] out = new double[x.length];
        if (xp.length == 0) return out;
        if (xp.length == 1) {
            Arrays.fill(out, fp[0]);
            return out;
        }
        if (xp[0] > xp[xp.length - 1]) {
            xp = reversed(xp);
            fp = reversed(fp);
        }
        PolynomialSplineFunction f = new LinearInterpolator().interpolate(xp, fp);
        double lo = xp[0], hi = xp[xp.length - 1];
        for (int i = 0; i < x.length; i++) {
            out[i] = f.value(Math.max(lo, Math.min(hi, x[i])));
        }
        return out;
    }

    public static double median(double[] values) {
        if (values.length == 0) return Double.NaN;
        return new Median().evaluate(values);
    }

    public static double robustSigma(double[] values) {
        double med = median(values);
        double[] dev = new double[values.length];
        for (int i = 0; i < values.length; i++) dev[i] = Math.abs(values[i] - med);
        return 1.4826 * median(dev);
    }

    private static double[] reversed(double[] a) {
        double[] r = new double[a.length];
        for (int i = 0; i < a.length; i++) r[i] = a[a.length - 1 - i];
        return r;
    }
}
