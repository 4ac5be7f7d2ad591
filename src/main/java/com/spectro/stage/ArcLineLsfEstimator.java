package com.spectro.stage;

import com.spectro.model.Frame;
import com.spectro.model.Meta;
import com.spectro.model.TraceSet;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.fitting.GaussianCurveFitter;
import org.apache.commons.math3.fitting.PolynomialCurveFitter;
import org.apache.commons.math3.fitting.WeightedObservedPoints;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.util.ArrayList;
import java.util.List;

// Estima la sigma de la LSF en la dirección espectral a partir de las líneas de una lámpara de arco.
// Cada línea se ajusta con una gaussiana; por fibra se ajusta una recta sigma(u) que se guarda como
// coeficientes de Legendre de YSIG (con dos coeficientes las bases de potencias y de Legendre coinciden).
public class ArcLineLsfEstimator implements LsfSigmaEstimator {

    private static final Logger LOG = LoggerFactory.getLogger(ArcLineLsfEstimator.class);

    private static final int NCOEF = 2;

    private final int halfWindow;
    private final double nsigma;

    public ArcLineLsfEstimator() {
        this(4, 5.0);
    }

    public ArcLineLsfEstimator(int halfWindow, double nsigma) {
        this.halfWindow = halfWindow;
        this.nsigma = nsigma;
    }

    @Override
    public TraceSet estimate(Frame frame, TraceSet traceSet) {
        TraceSet out = traceSet.copy();
        int fibermin = Meta.getInt(traceSet.getMeta(), BoxcarExtractor.FIBERMIN, 0);

        List<double[]> perFiberCoef = new ArrayList<>();
        List<Integer> perFiberIndex = new ArrayList<>();
        List<Double> allSigmas = new ArrayList<>();
        int nlines = 0;

        for (int row = 0; row < frame.nspec(); row++) {
            int index = frame.fibers[row] - fibermin;
            if (index < 0 || index >= traceSet.nfibers()) continue;

            List<double[]> lines = fitLines(frame.wave[row], frame.flux[row], frame.ivar[row]);
            nlines += lines.size();
            if (lines.isEmpty()) continue;

            WeightedObservedPoints obs = new WeightedObservedPoints();
            double[] sig = new double[lines.size()];
            for (int i = 0; i < lines.size(); i++) {
                double u = 2.0 * (lines.get(i)[0] - traceSet.wavemin) / (traceSet.wavemax - traceSet.wavemin) - 1.0;
                obs.add(u, lines.get(i)[1]);
                sig[i] = lines.get(i)[1];
                allSigmas.add(sig[i]);
            }
            double[] coef;
            if (lines.size() > NCOEF) {
                coef = PolynomialCurveFitter.create(NCOEF - 1).fit(obs.toList());
            } else {
                coef = new double[]{SpectrumMath.median(sig), 0.0};
            }
            perFiberCoef.add(coef);
            perFiberIndex.add(index);
        }

        if (allSigmas.isEmpty()) {
            LOG.warn("no se encontraron líneas de arco, la LSF no se modifica");
            return out;
        }

        double[] all = new double[allSigmas.size()];
        for (int i = 0; i < all.length; i++) all[i] = allSigmas.get(i);
        double medianSigma = SpectrumMath.median(all);

        double[][] ysig = new double[traceSet.nfibers()][];
        double[][] previous = traceSet.getYsigCoef();
        for (int f = 0; f < ysig.length; f++) {
            ysig[f] = (previous != null) ? previous[f].clone() : new double[]{medianSigma, 0.0};
        }
        for (int i = 0; i < perFiberIndex.size(); i++) ysig[perFiberIndex.get(i)] = perFiberCoef.get(i);
        out.setYsigCoef(ysig);

        out.getMeta().put("LSFSIGMA", medianSigma);
        out.getMeta().put("NLSFLINE", (long) nlines);
        LOG.info("LSF: sigma mediana {} px con {} líneas en {} fibras",
                String.format("%.3f", medianSigma), nlines, perFiberIndex.size());
        return out;
    }

    // Líneas detectadas en un espectro: {wave, sigma en muestras}.
    List<double[]> fitLines(double[] wave, double[] flux, double[] ivar) {
        List<double[]> lines = new ArrayList<>();
        int n = flux.length;
        if (n < 2 * halfWindow + 3) return lines;

        double cont = SpectrumMath.median(flux);
        double noise = SpectrumMath.robustSigma(flux);
        if (!(noise > 0)) noise = 1.0;
        double threshold = cont + nsigma * noise;

        for (int i = halfWindow; i < n - halfWindow; i++) {
            if (flux[i] < threshold || flux[i] <= flux[i - 1] || flux[i] < flux[i + 1]) continue;

            WeightedObservedPoints obs = new WeightedObservedPoints();
            boolean ok = true;
            for (int j = i - halfWindow; j <= i + halfWindow; j++) {
                if (ivar[j] <= 0) { ok = false; break; }
                obs.add(j, flux[j] - cont);
            }
            if (!ok) continue;

            try {
                double[] p = GaussianCurveFitter.create().fit(obs.toList());
                double mean = p[1], sigma = Math.abs(p[2]);
                if (!(sigma > 0.3 && sigma < halfWindow) || Math.abs(mean - i) > 1.5) continue;
                int k = (int) Math.floor(mean);
                double w = wave[k] + (mean - k) * (wave[Math.min(k + 1, n - 1)] - wave[k]);
                lines.add(new double[]{w, sigma});
            } catch (MathIllegalStateException | MathIllegalArgumentException e) {
                LOG.debug("ajuste gaussiano fallido en la muestra {}: {}", i, e.getMessage());
            }
            i += halfWindow;
        }
        return lines;
    }
}
