package com.spectro.stage;

import com.spectro.model.FiberFlat;
import com.spectro.model.Frame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.util.Arrays;
import java.util.LinkedHashMap;

public class FiberFlatService implements FiberFlatComputer, FiberFlatApplier {

    private static final Logger LOG = LoggerFactory.getLogger(FiberFlatService.class);

    @Override
    public FiberFlat compute(Frame frame) {
        int nspec = frame.nspec();
        if (nspec == 0) throw new IllegalArgumentException("frame vacío, no se puede calcular el flat");

        double[] ref = frame.wave[nspec / 2];
        double[][] onRef = new double[nspec][];
        for (int i = 0; i < nspec; i++) onRef[i] = SpectrumMath.interp(ref, frame.wave[i], frame.flux[i]);

        // Espectro medio: mediana entre fibras en cada longitud de onda
        double[] mean = new double[ref.length];
        double[] column = new double[nspec];
        for (int j = 0; j < ref.length; j++) {
            for (int i = 0; i < nspec; i++) column[i] = onRef[i][j];
            mean[j] = SpectrumMath.median(column);
        }

        double[][] wave = new double[nspec][];
        double[][] flat = new double[nspec][];
        double[][] ivar = new double[nspec][];
        int bad = 0;
        for (int i = 0; i < nspec; i++) {
            int nw = frame.wave[i].length;
            double[] m = SpectrumMath.interp(frame.wave[i], ref, mean);
            wave[i] = frame.wave[i].clone();
            flat[i] = new double[nw];
            ivar[i] = new double[nw];
            for (int j = 0; j < nw; j++) {
                if (m[j] > 0 && frame.ivar[i][j] > 0) {
                    flat[i][j] = frame.flux[i][j] / m[j];
                    ivar[i][j] = frame.ivar[i][j] * m[j] * m[j];
                } else {
                    bad++;
                }
            }
        }
        if (bad > 0) LOG.debug("fiberflat: {} muestras sin flat válido", bad);
        return new FiberFlat(wave, flat, ivar, frame.fibers.clone(),
                frame.getMeta() == null ? null : new LinkedHashMap<>(frame.getMeta()));
    }

    @Override
    public Frame apply(Frame frame, FiberFlat flat) {
        int missing = 0;
        for (int i = 0; i < frame.nspec(); i++) {
            int k = flat.rowOf(frame.fibers[i]);
            if (k < 0) {
                missing++;
                Arrays.fill(frame.ivar[i], 0.0);
                continue;
            }
            double[] f = SpectrumMath.interp(frame.wave[i], flat.wave[k], flat.fiberflat[k]);
            for (int j = 0; j < f.length; j++) {
                if (f[j] > 0) {
                    frame.flux[i][j] /= f[j];
                    frame.ivar[i][j] *= f[j] * f[j];
                } else {
                    frame.ivar[i][j] = 0;
                }
            }
        }
        if (missing > 0) LOG.warn("{} fibras sin entrada en el fiberflat, marcadas con ivar=0", missing);
        return frame;
    }
}
