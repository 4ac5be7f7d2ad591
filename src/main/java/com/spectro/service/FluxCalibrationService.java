package com.spectro.service;

import com.spectro.model.FluxCalibCurve;
import com.spectro.model.Frame;
import com.spectro.model.Meta;
import com.spectro.stage.SpectrumMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// Calibración en flujo de una exposición: la curva promedio se evalúa en el seeing y la masa de aire
// de la exposición, se interpola en la malla de cada fibra y se multiplica por el tiempo de exposición.
public class FluxCalibrationService {

    private static final Logger LOG = LoggerFactory.getLogger(FluxCalibrationService.class);

    public static final String SEEING = "SEEING";
    public static final String AIRMASS = "AIRMASS";
    public static final String EXPTIME = "EXPTIME";

    public Frame calibrate(Frame frame, FluxCalibCurve curve) throws ReductionException {
        double seeing = required(frame, SEEING);
        double airmass = required(frame, AIRMASS);
        double exptime = required(frame, EXPTIME);
        return calibrate(frame, curve, seeing, airmass, exptime);
    }

    public Frame calibrate(Frame frame, FluxCalibCurve curve, double seeing, double airmass, double exptime) {
        double[] exposureCalib = curve.value(seeing, airmass);
        int unusable = 0;
        for (int q = 0; q < frame.nspec(); q++) {
            double[] c = SpectrumMath.interp(frame.wave[q], curve.wave, exposureCalib);
            boolean any = false;
            for (int j = 0; j < c.length; j++) {
                double cal = c[j] * exptime;
                // Calibración nula o negativa: la muestra queda inutilizable (flux=0, ivar=0)
                if (cal > 0) {
                    frame.flux[q][j] /= cal;
                    frame.ivar[q][j] *= cal * cal;
                    any = true;
                } else {
                    frame.flux[q][j] = 0;
                    frame.ivar[q][j] = 0;
                }
            }
            if (!any) unusable++;
        }
        if (unusable > 0) LOG.warn("{} fibras sin calibración positiva, marcadas con ivar=0", unusable);
        LOG.debug("calibración en flujo: seeing={}, airmass={}, exptime={}", seeing, airmass, exptime);
        return frame;
    }

    private static double required(Frame frame, String key) throws ReductionException {
        Double v = (frame.getMeta() == null) ? null : Meta.asDouble(frame.getMeta().get(key));
        if (v == null) {
            throw new ReductionException(ReductionFailure.METADATA,
                    "falta " + key + " en la cabecera, necesario para la calibración en flujo");
        }
        return v;
    }
}
