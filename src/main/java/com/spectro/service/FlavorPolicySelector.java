package com.spectro.service;

import com.spectro.model.Flavor;
import com.spectro.model.Frame;
import com.spectro.model.OutputProduct;
import com.spectro.model.RunDirectives;
import com.spectro.stage.FlavorClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.io.File;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

// Modo automático: verifica el tipo de exposición con los datos extraídos y decide qué etapas
// se ejecutan y qué productos se escriben.
public class FlavorPolicySelector {

    private static final Logger LOG = LoggerFactory.getLogger(FlavorPolicySelector.class);

    public static final String FLAVOR = "FLAVOR";
    public static final String IFLAVOR = "IFLAVOR";

    public static final class FlavorPolicy {
        public final boolean shiftPsf;
        public final boolean computeLsfSigma;
        public final boolean applyFiberflat;
        public final boolean skysub;
        public final boolean fluxcalib;
        public final Set<OutputProduct> outputs;

        FlavorPolicy(boolean shiftPsf, boolean computeLsfSigma, boolean applyFiberflat, boolean skysub,
                     boolean fluxcalib, Set<OutputProduct> outputs) {
            this.shiftPsf = shiftPsf;
            this.computeLsfSigma = computeLsfSigma;
            this.applyFiberflat = applyFiberflat;
            this.skysub = skysub;
            this.fluxcalib = fluxcalib;
            this.outputs = Collections.unmodifiableSet(outputs);
        }

        public boolean computeFiberflat() { return outputs.contains(OutputProduct.FIBERFLAT); }
    }

    private static final Map<Flavor, FlavorPolicy> POLICIES = new EnumMap<>(Flavor.class);

    static {
        POLICIES.put(Flavor.SCIENCE, new FlavorPolicy(true, false, true, true, true,
                EnumSet.of(OutputProduct.PSF, OutputProduct.RAW_FRAME, OutputProduct.SKY_FRAME, OutputProduct.FRAME)));
        POLICIES.put(Flavor.ARC, new FlavorPolicy(true, true, false, false, false,
                EnumSet.of(OutputProduct.PSF, OutputProduct.RAW_FRAME)));
        POLICIES.put(Flavor.FLAT, new FlavorPolicy(true, false, false, false, false,
                EnumSet.of(OutputProduct.PSF, OutputProduct.RAW_FRAME, OutputProduct.FIBERFLAT)));
        // Solo extracción
        POLICIES.put(Flavor.UNKNOWN, new FlavorPolicy(false, false, false, false, false,
                EnumSet.noneOf(OutputProduct.class)));
    }

    private final FlavorClassifier classifier;

    public FlavorPolicySelector(FlavorClassifier classifier) {
        this.classifier = classifier;
    }

    public static FlavorPolicy policyFor(Flavor flavor) {
        return POLICIES.get(flavor);
    }

    // Guarda el tipo declarado en IFLAVOR, el verificado en FLAVOR y devuelve el verificado.
    // Un cambio de tipo es un aviso, nunca un error.
    public String verifyFlavor(Frame preliminary, String declaredFlavor) {
        String declared = declaredFlavor.trim().toUpperCase(Locale.ROOT);
        preliminary.meta().put(IFLAVOR, declared);
        String detected = classifier.classify(preliminary, declared);
        detected = (detected == null) ? declared : detected.trim().toUpperCase(Locale.ROOT);
        preliminary.meta().put(FLAVOR, detected);
        if (!detected.equals(declared)) {
            LOG.warn("modo automático: cambio de flavor '{}' -> '{}'", declared, detected);
        }
        return detected;
    }

    // Directivas del tipo de exposición a partir de las del usuario; los productos van a autoOutputDir.
    public RunDirectives resolve(String flavor, RunDirectives base, String camera, long expid) {
        Flavor f = Flavor.parse(flavor);
        FlavorPolicy policy = POLICIES.get(f);
        if (f == Flavor.UNKNOWN) {
            LOG.info("modo automático: flavor '{}' sin política, solo extracción", flavor);
            return base;
        }
        LOG.debug("modo automático: flavor={}, etapas y productos {}", f, policy.outputs);

        File dir = base.autoOutputDir;
        RunDirectives.Builder b = base.toBuilder();
        if (policy.shiftPsf) b.shiftPsf(true);
        if (policy.computeLsfSigma) b.computeLsfSigma(true);
        if (policy.applyFiberflat) b.applyFiberflat(true);
        if (policy.skysub) b.skysub(true);
        if (policy.fluxcalib) b.fluxcalib(true);

        for (OutputProduct p : policy.outputs) {
            File file = p.fileFor(dir, camera, expid);
            switch (p) {
                case PSF: b.outputPsf(file); break;
                case RAW_FRAME: b.outputRawframe(file); break;
                case FIBERFLAT: b.computeFiberflat(file); break;
                case SKY_FRAME: b.outputSkyframe(file); break;
                case FRAME: b.outframe(file); break;
                default: break;
            }
        }
        return b.build();
    }
}
