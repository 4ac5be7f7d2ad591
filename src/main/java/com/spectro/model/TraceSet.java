package com.spectro.model;

import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.apache.commons.math3.analysis.polynomials.PolynomialsUtils;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

// Geometría de las trazas: para cada fibra, x(wave) e y(wave) en el detector como serie de Legendre
// sobre u = 2 (w - wavemin) / (wavemax - wavemin) - 1. Opcionalmente las sigmas gaussianas xsig, ysig.
public class TraceSet {

    private static final int INVERSION_SAMPLES = 2000;
    private static final List<PolynomialFunction> LEGENDRE = new ArrayList<>();

    public final double wavemin;
    public final double wavemax;
    private final double[][] xCoef;
    private final double[][] yCoef;
    private double[][] xsigCoef;
    private double[][] ysigCoef;
    private final Map<String, Object> meta;

    public TraceSet(double wavemin, double wavemax, double[][] xCoef, double[][] yCoef) {
        this(wavemin, wavemax, xCoef, yCoef, null, null, null);
    }

    public TraceSet(double wavemin, double wavemax, double[][] xCoef, double[][] yCoef,
                    double[][] xsigCoef, double[][] ysigCoef, Map<String, Object> meta) {
        if (!(wavemax > wavemin)) throw new IllegalArgumentException("wavemax debe ser mayor que wavemin");
        if (xCoef.length != yCoef.length) throw new IllegalArgumentException("XTRACE e YTRACE con distinto número de fibras");
        this.wavemin = wavemin;
        this.wavemax = wavemax;
        this.xCoef = xCoef;
        this.yCoef = yCoef;
        this.xsigCoef = xsigCoef;
        this.ysigCoef = ysigCoef;
        this.meta = (meta == null) ? new LinkedHashMap<>() : new LinkedHashMap<>(meta);
    }

    public int nfibers() { return xCoef.length; }

    public Map<String, Object> getMeta() { return meta; }

    public double[][] getXCoef() { return xCoef; }
    public double[][] getYCoef() { return yCoef; }
    public double[][] getXsigCoef() { return xsigCoef; }
    public double[][] getYsigCoef() { return ysigCoef; }

    public boolean hasYsig() { return ysigCoef != null; }

    public double x(int fiber, double wave) { return legendre(xCoef[fiber], reduced(wave)); }
    public double y(int fiber, double wave) { return legendre(yCoef[fiber], reduced(wave)); }

    public double xsig(int fiber, double wave) {
        return xsigCoef == null ? Double.NaN : legendre(xsigCoef[fiber], reduced(wave));
    }

    public double ysig(int fiber, double wave) {
        return ysigCoef == null ? Double.NaN : legendre(ysigCoef[fiber], reduced(wave));
    }

    public void setYsigCoef(double[][] coef) {
        if (coef.length != nfibers()) throw new IllegalArgumentException("YSIG con distinto número de fibras");
        this.ysigCoef = coef;
    }

    public void shiftX(double dx) {
        for (double[] c : xCoef) c[0] += dx;
    }

    public void shiftY(double dy) {
        for (double[] c : yCoef) c[0] += dy;
    }

    // Rango [ymin, ymax] cubierto por la traza entre wavemin y wavemax.
    public double[] yRange(int fiber) {
        double a = y(fiber, wavemin), b = y(fiber, wavemax);
        return new double[]{Math.min(a, b), Math.max(a, b)};
    }

    // Invierte y(wave): longitud de onda en cada fila pedida. Las filas fuera de rango se acotan al extremo.
    public double[] waveAtY(int fiber, double[] ys) {
        double[] w = new double[INVERSION_SAMPLES];
        double[] y = new double[INVERSION_SAMPLES];
        for (int i = 0; i < INVERSION_SAMPLES; i++) {
            w[i] = wavemin + (wavemax - wavemin) * i / (INVERSION_SAMPLES - 1);
            y[i] = y(fiber, w[i]);
        }
        if (y[INVERSION_SAMPLES - 1] < y[0]) {
            reverse(w);
            reverse(y);
        }
        PolynomialSplineFunction inverse = new LinearInterpolator().interpolate(y, w);
        double[] out = new double[ys.length];
        for (int i = 0; i < ys.length; i++) {
            double yy = Math.max(y[0], Math.min(y[INVERSION_SAMPLES - 1], ys[i]));
            out[i] = inverse.value(yy);
        }
        return out;
    }

    public TraceSet copy() {
        return new TraceSet(wavemin, wavemax, deepCopy(xCoef), deepCopy(yCoef),
                deepCopy(xsigCoef), deepCopy(ysigCoef), meta);
    }

    private double reduced(double wave) {
        return 2.0 * (wave - wavemin) / (wavemax - wavemin) - 1.0;
    }

    static double legendre(double[] coef, double u) {
        double s = 0;
        for (int k = 0; k < coef.length; k++) s += coef[k] * legendrePolynomial(k).value(u);
        return s;
    }

    private static synchronized PolynomialFunction legendrePolynomial(int k) {
        while (LEGENDRE.size() <= k) LEGENDRE.add(PolynomialsUtils.createLegendrePolynomial(LEGENDRE.size()));
        return LEGENDRE.get(k);
    }

    private static void reverse(double[] a) {
        for (int i = 0, j = a.length - 1; i < j; i++, j--) { double t = a[i]; a[i] = a[j]; a[j] = t; }
    }

    private static double[][] deepCopy(double[][] a) {
        if (a == null) return null;
        double[][] c = new double[a.length][];
        for (int i = 0; i < a.length; i++) c[i] = a[i].clone();
        return c;
    }
}
