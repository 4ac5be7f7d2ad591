package com.spectro.stage;

import com.spectro.model.Flavor;
import com.spectro.model.Frame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// Clasifica por la forma de los espectros: ARC si la señal se concentra en líneas estrechas,
// FLAT si el continuo es alto y parecido en todas las fibras. En otro caso se respeta el tipo declarado.
public class ContinuumFlavorClassifier implements FlavorClassifier {

    private static final Logger LOG = LoggerFactory.getLogger(ContinuumFlavorClassifier.class);

    private final double arcLineFraction;
    private final double flatContinuum;
    private final double flatDispersion;

    public ContinuumFlavorClassifier() {
        this(0.5, 1000.0, 0.5);
    }

    // arcLineFraction: fracción mínima del flujo en líneas para un arco
    // flatContinuum: continuo mínimo (mediana por muestra) para un flat
    // flatDispersion: dispersión relativa máxima del continuo entre fibras para un flat
    public ContinuumFlavorClassifier(double arcLineFraction, double flatContinuum, double flatDispersion) {
        this.arcLineFraction = arcLineFraction;
        this.flatContinuum = flatContinuum;
        this.flatDispersion = flatDispersion;
    }

    @Override
    public String classify(Frame frame, String inputFlavor) {
        int n = frame.nspec();
        if (n == 0) return inputFlavor;

        double[] continuum = new double[n];
        double[] lineFraction = new double[n];
        for (int i = 0; i < n; i++) {
            double[] f = frame.flux[i];
            double cont = SpectrumMath.median(f);
            double noise = SpectrumMath.robustSigma(f);
            double cut = cont + 5 * Math.max(noise, 1e-12);
            double total = 0, excess = 0;
            for (double v : f) {
                if (v > 0) total += v;
                if (v > cut) excess += v - cont;
            }
            continuum[i] = cont;
            lineFraction[i] = (total > 0) ? excess / total : 0;
        }

        double medLine = SpectrumMath.median(lineFraction);
        double medCont = SpectrumMath.median(continuum);
        double dispersion = (medCont > 0) ? SpectrumMath.robustSigma(continuum) / medCont : Double.POSITIVE_INFINITY;
        LOG.debug("flavor: fracción en líneas {}, continuo {}, dispersión {}", medLine, medCont, dispersion);

        if (medLine > arcLineFraction) return Flavor.ARC.name();
        if (medCont > flatContinuum && dispersion < flatDispersion) return Flavor.FLAT.name();
        return inputFlavor;
    }
}
