package com.spectro.model;

public class FluxCalibCurve {

    public static final double DEFAULT_PIVOT_AIRMASS = 1.0;
    public static final double DEFAULT_PIVOT_SEEING = 1.1;

    public final double[] wave;
    public final double[] averageCalib;
    public final double[] atmosphericExtinction;
    public final double[] seeingTerm;
    public final double pivotAirmass;
    public final double pivotSeeing;

    public FluxCalibCurve(double[] wave, double[] averageCalib, double[] atmosphericExtinction, double[] seeingTerm,
                          double pivotAirmass, double pivotSeeing) {
        int n = wave.length;
        if (averageCalib.length != n
                || (atmosphericExtinction != null && atmosphericExtinction.length != n)
                || (seeingTerm != null && seeingTerm.length != n)) {
            throw new IllegalArgumentException("curva de calibración con longitudes distintas");
        }
        this.wave = wave;
        this.averageCalib = averageCalib;
        this.atmosphericExtinction = atmosphericExtinction;
        this.seeingTerm = seeingTerm;
        this.pivotAirmass = pivotAirmass;
        this.pivotSeeing = pivotSeeing;
    }

    public static FluxCalibCurve flat(double[] wave, double[] calib) {
        return new FluxCalibCurve(wave, calib, null, null, DEFAULT_PIVOT_AIRMASS, DEFAULT_PIVOT_SEEING);
    }

    public double[] value(double seeing, double airmass) {
        double[] out = new double[wave.length];
        for (int i = 0; i < wave.length; i++) {
            double ext = (atmosphericExtinction == null) ? 0 : atmosphericExtinction[i] * (airmass - pivotAirmass);
            double see = (seeingTerm == null) ? 0 : seeingTerm[i] * (seeing - pivotSeeing);
            out[i] = averageCalib[i] * Math.pow(10, -0.4 * (ext + see));
        }
        return out;
    }
}
