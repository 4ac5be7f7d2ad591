package com.spectro.service;

import com.spectro.calib.CalibrationLocator;
import com.spectro.calib.CalibrationNotFoundException;
import com.spectro.model.FiberFlat;
import com.spectro.model.Fibermap;
import com.spectro.model.FluxCalibCurve;
import com.spectro.model.Frame;
import com.spectro.model.Image;
import com.spectro.model.Meta;
import com.spectro.model.OutputProduct;
import com.spectro.model.RunDirectives;
import com.spectro.model.RunReport;
import com.spectro.model.TraceSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

// Reducción de una exposición de una cámara: ingesta, geometría, extracción y las etapas opcionales
// (refit de trazas, LSF, flat de fibras, cielo, calibración en flujo, selección de fibras) en orden fijo.
public class PipelineController {

    private static final Logger LOG = LoggerFactory.getLogger(PipelineController.class);

    public static final String NIGHT = "NIGHT";
    public static final String EXPID = "EXPID";
    public static final String EXPNUM = "EXPNUM";

    private final PipelineStages stages;
    private final CalibrationLocator locator;
    private final FlavorPolicySelector policySelector;
    private final FluxCalibrationService fluxCalibration = new FluxCalibrationService();
    private final FiberSelector fiberSelector = new FiberSelector();

    public PipelineController(PipelineStages stages, CalibrationLocator locator) {
        this.stages = stages;
        this.locator = locator;
        this.policySelector = new FlavorPolicySelector(stages.flavorClassifier);
    }

    @FunctionalInterface
    private interface IoCall<T> {
        T call() throws IOException;
    }

    @FunctionalInterface
    private interface IoAction {
        void run() throws IOException;
    }

    public RunReport run(RunDirectives directives) throws ReductionException {
        long start = System.currentTimeMillis();
        RunDirectives d = directives;
        LOG.info("run: entry, directives={}", d);
        Map<OutputProduct, File> outputs = new LinkedHashMap<>();

        int[] wantedFibers;
        try {
            wantedFibers = FiberSelector.parseFibers(d.fibers);
        } catch (IllegalArgumentException e) {
            throw new ReductionException(ReductionFailure.CONFIGURATION, e.getMessage(), e);
        }

        // --- 1. INGESTA ---
        final File imageFile = d.image;
        boolean preprocessed = fetch(imageFile, () -> stages.images.isPreprocessed(imageFile));
        final String requestedCamera = (d.camera == null || d.camera.trim().isEmpty())
                ? null : d.camera.trim().toLowerCase(Locale.ROOT);
        if (!preprocessed && requestedCamera == null) {
            throw new ReductionException(ReductionFailure.CONFIGURATION,
                    "se necesita la cámara para preprocesar una imagen raw: use --camera xx, p.ej. r7");
        }
        Image image = preprocessed
                ? fetch(imageFile, () -> stages.images.readPreprocessed(imageFile))
                : fetch(imageFile, () -> stages.images.readRaw(imageFile, requestedCamera));
        Map<String, Object> primary = fetch(imageFile, () -> stages.images.readPrimaryHeader(imageFile));
        String camera = requestedCamera != null ? requestedCamera : image.camera;

        // --- MODO AUTOMÁTICO: metadatos y valores por defecto ---
        String declaredFlavor = null;
        long expid = -1;
        if (d.auto) {
            Map<String, Object> extra = new LinkedHashMap<>();
            if (image.get(EXPID) == null && image.get(EXPNUM) != null) {
                LOG.warn("modo automático: falta EXPID en la cabecera, se usa EXPNUM={}", image.get(EXPNUM));
                extra.put(EXPID, image.get(EXPNUM));
            }
            if (!extra.isEmpty()) image = image.withMeta(extra);

            List<String> missing = new ArrayList<>();
            for (String key : Arrays.asList(FlavorPolicySelector.FLAVOR, NIGHT, EXPID)) {
                if (image.get(key) == null) missing.add(key);
            }
            if (!missing.isEmpty()) {
                throw new ReductionException(ReductionFailure.METADATA,
                        "el modo automático necesita " + String.join(", ", missing) + " en la cabecera de " + imageFile);
            }
            Long id = Meta.asLong(image.get(EXPID));
            if (id == null) {
                throw new ReductionException(ReductionFailure.METADATA, "EXPID no numérico: " + image.get(EXPID));
            }
            expid = id;
            declaredFlavor = image.get(FlavorPolicySelector.FLAVOR).toString();
            if (camera == null) {
                throw new ReductionException(ReductionFailure.CONFIGURATION,
                        "el modo automático necesita la cámara: use --camera o CAMERA en la cabecera");
            }

            File outDir = d.autoOutputDir;
            if (!outDir.isDirectory() && !outDir.mkdirs()) {
                throw new ReductionException(ReductionFailure.IO, "no se pudo crear el directorio de salida " + outDir);
            }
            RunDirectives.Builder b = d.toBuilder();
            if (d.fibermap == null) {
                File candidate = new File(imageFile.getAbsoluteFile().getParentFile(), String.format("fibermap-%08d.fits", expid));
                if (candidate.isFile()) {
                    LOG.info("modo automático: fibermap {}", candidate);
                    b.fibermap(candidate);
                }
            }
            if (!preprocessed && d.outputPreproc == null) {
                b.outputPreproc(OutputProduct.PREPROC.fileFor(outDir, camera, expid));
            }
            d = b.build();
        }

        if (d.outputPreproc != null) {
            final File file = d.outputPreproc;
            final Image toWrite = image;
            io(file, () -> stages.images.write(file, toWrite));
            outputs.put(OutputProduct.PREPROC, file);
            LOG.info("escrito {}", file);
        }

        // --- 2. GEOMETRÍA ---
        final File psfFile = d.psf != null ? d.psf : locate(CalibrationLocator.PSF, image.getMeta(), primary);
        TraceSet tset = fetch(psfFile, () -> stages.traceSets.read(psfFile));
        LOG.info("PSF {}: {} fibras", psfFile, tset.nfibers());

        Fibermap fibermap = null;
        if (d.fibermap != null) {
            final File fmFile = d.fibermap;
            if (!fmFile.isFile()) {
                LOG.error("no existe el fibermap {}, se continúa sin él", fmFile);
            } else {
                fibermap = fetch(fmFile, () -> stages.fibermaps.read(fmFile));
            }
        }

        // --- 3. CLASIFICACIÓN ---
        String flavor = null;
        if (d.auto) {
            Frame preliminary = handOff(stages.extractor.extract(tset, image, d.width, fibermap), "extracción preliminar");
            flavor = policySelector.verifyFlavor(preliminary, declaredFlavor);
            d = policySelector.resolve(flavor, d, camera, expid);
            LOG.info("modo automático: flavor={}, directivas {}", flavor, d);
        }

        // --- 4. REFIT DE TRAZAS ---
        if (d.shiftPsf) {
            tset = stages.traceShiftFitter.fit(image, tset);
        }

        // --- 5. EXTRACCIÓN ---
        Frame frame = handOff(stages.extractor.extract(tset, image, d.width, fibermap), "extracción");
        frame.mergeMeta(tset.getMeta());
        if (d.auto) {
            frame.meta().put(FlavorPolicySelector.IFLAVOR, declaredFlavor.trim().toUpperCase(Locale.ROOT));
            frame.meta().put(FlavorPolicySelector.FLAVOR, flavor);
        }
        if (d.outputRawframe != null) {
            writeFrame(d.outputRawframe, frame, OutputProduct.RAW_FRAME, outputs);
        }

        // --- 6. LSF ---
        if (d.computeLsfSigma) {
            tset = stages.lsfEstimator.estimate(frame, tset);
        }
        if (d.outputPsf != null) {
            if (frame.getMeta() != null) {
                for (Map.Entry<String, Object> e : frame.getMeta().entrySet()) {
                    tset.getMeta().putIfAbsent(e.getKey(), e.getValue());
                }
            }
            final File file = d.outputPsf;
            final TraceSet toWrite = tset;
            io(file, () -> stages.traceSets.write(file, toWrite));
            outputs.put(OutputProduct.PSF, file);
            LOG.info("escrito {}", file);
        }

        // --- 7. FLAT DE FIBRAS ---
        if (d.computeFiberflat != null) {
            final File file = d.computeFiberflat;
            final FiberFlat flat = stages.fiberFlatComputer.compute(frame);
            final Map<String, Object> header = frame.getMeta() == null ? new LinkedHashMap<>() : frame.getMeta();
            io(file, () -> stages.fiberFlats.write(file, flat, header));
            outputs.put(OutputProduct.FIBERFLAT, file);
            LOG.info("escrito {}", file);
        }
        if (d.fiberflatApplication()) {
            final File file = d.inputFiberflat != null ? d.inputFiberflat
                    : locate(CalibrationLocator.FIBERFLAT, frame.getMeta(), primary);
            FiberFlat flat = fetch(file, () -> stages.fiberFlats.read(file));
            LOG.info("aplicando flat de fibras {}", file);
            frame = handOff(stages.fiberFlatApplier.apply(frame, flat), "flat de fibras");
        }

        // --- 8. CIELO ---
        if (d.skysub) {
            double[][] sky = stages.skySubtractor.subtract(frame);
            handOff(frame, "resta de cielo");
            if (d.outputSkyframe != null) {
                writeFrame(d.outputSkyframe, skyFrame(frame, sky), OutputProduct.SKY_FRAME, outputs);
            }
        }

        // --- 9. CALIBRACIÓN EN FLUJO ---
        if (d.fluxcalib) {
            final File file = locate(CalibrationLocator.FLUXCALIB, frame.getMeta(), primary);
            FluxCalibCurve curve = fetch(file, () -> stages.fluxCalibs.read(file));
            LOG.info("calibración en flujo con {}", file);
            frame = handOff(fluxCalibration.calibrate(frame, curve), "calibración en flujo");
        }

        // --- 10. SELECCIÓN DE FIBRAS ---
        if (wantedFibers != null) {
            frame = handOff(fiberSelector.select(frame, wantedFibers), "selección de fibras");
        }

        if (d.outframe != null) {
            writeFrame(d.outframe, frame, OutputProduct.FRAME, outputs);
        }

        double elapsed = (System.currentTimeMillis() - start) / 1000.0;
        LOG.info("todo listo en {} s", String.format(Locale.ROOT, "%.1f", elapsed));
        RunReport report = new RunReport(d, flavor, frame, outputs, elapsed);

        if (d.plot) {
            stages.display.show(frame);
        }
        return report;
    }

    static Frame skyFrame(Frame frame, double[][] sky) {
        double[][] wave = new double[frame.nspec()][];
        double[][] ivar = new double[frame.nspec()][];
        for (int q = 0; q < frame.nspec(); q++) {
            wave[q] = frame.wave[q].clone();
            ivar[q] = new double[sky[q].length];
            Arrays.fill(ivar[q], 1.0);
        }
        Map<String, Object> meta = frame.getMeta() == null ? null : new LinkedHashMap<>(frame.getMeta());
        return new Frame(wave, sky, ivar, frame.fibers.clone(), meta);
    }

    private void writeFrame(File file, Frame frame, OutputProduct product, Map<OutputProduct, File> outputs)
            throws ReductionException {
        io(file, () -> stages.frames.write(file, frame));
        outputs.put(product, file);
        LOG.info("escrito {}", file);
    }

    private File locate(String product, Map<String, Object> header, Map<String, Object> primary) throws ReductionException {
        List<Map<String, Object>> headers = new ArrayList<>();
        headers.add(header);
        headers.add(primary);
        try {
            File file = locator.findFile(product, headers);
            LOG.info("{}: {}", product, file);
            return file;
        } catch (CalibrationNotFoundException e) {
            throw new ReductionException(ReductionFailure.CALIBRATION, e.getMessage(), e);
        }
    }

    private static Frame handOff(Frame frame, String stage) {
        frame.checkShape();
        LOG.debug("{}: {} fibras x {} muestras", stage, frame.nspec(), frame.nwave());
        return frame;
    }

    private static <T> T fetch(File file, IoCall<T> call) throws ReductionException {
        try {
            return call.call();
        } catch (IOException e) {
            throw new ReductionException(ReductionFailure.IO, "error de E/S con " + file + ": " + e.getMessage(), e);
        }
    }

    private static void io(File file, IoAction action) throws ReductionException {
        try {
            action.run();
        } catch (IOException e) {
            throw new ReductionException(ReductionFailure.IO, "error de E/S con " + file + ": " + e.getMessage(), e);
        }
    }
}
