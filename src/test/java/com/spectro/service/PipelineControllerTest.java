package com.spectro.service;

import com.spectro.TestData;
import com.spectro.calib.CalibrationLocator;
import com.spectro.calib.CalibrationNotFoundException;
import com.spectro.io.FiberFlatStore;
import com.spectro.io.FitsImageStore;
import com.spectro.io.FluxCalibStore;
import com.spectro.io.FrameStore;
import com.spectro.io.ImageStore;
import com.spectro.io.TraceSetStore;
import com.spectro.model.FiberFlat;
import com.spectro.model.FluxCalibCurve;
import com.spectro.model.Frame;
import com.spectro.model.Image;
import com.spectro.model.OutputProduct;
import com.spectro.model.RunDirectives;
import com.spectro.model.RunReport;
import com.spectro.model.TraceSet;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.util.BufferedFile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PipelineControllerTest {

    @TempDir
    Path tmp;

    private FakeImageStore images;
    private FakeTraceSetStore traceSets;
    private FakeFrameStore frames;
    private FakeFiberFlatStore fiberFlats;
    private MapLocator locator;
    private List<String> calls;
    private File imageFile;
    private File outDir;

    @BeforeEach
    void setUp() {
        images = new FakeImageStore();
        traceSets = new FakeTraceSetStore();
        frames = new FakeFrameStore();
        fiberFlats = new FakeFiberFlatStore();
        locator = new MapLocator();
        calls = new ArrayList<>();
        imageFile = tmp.resolve("image.fits").toFile();
        outDir = tmp.resolve("products").toFile();
        images.image = TestData.image(10, "b1", scienceMeta("SCIENCE"));
    }

    private static Map<String, Object> scienceMeta(String flavor) {
        return TestData.meta("CAMERA", "b1", "FLAVOR", flavor, "NIGHT", 20200315L, "EXPID", 42L,
                "SEEING", 1.1, "AIRMASS", 1.0, "EXPTIME", 10.0);
    }

    private PipelineStages.Builder stages() {
        return PipelineStages.builder()
                .images(images)
                .traceSets(traceSets)
                .frames(frames)
                .fiberFlats(fiberFlats)
                .fluxCalibs(new ConstantFluxCalibStore())
                .fibermaps(file -> { throw new IOException("sin fibermap"); })
                .traceShiftFitter((image, tset) -> { calls.add("shift"); return tset; })
                .lsfEstimator((frame, tset) -> { calls.add("lsf"); return tset; })
                .flavorClassifier((frame, flavor) -> flavor)
                .display(frame -> calls.add("plot"));
    }

    private RunReport run(PipelineStages.Builder stages, RunDirectives d) throws ReductionException {
        return new PipelineController(stages.build(), locator).run(d);
    }

    private RunDirectives.Builder auto() {
        return RunDirectives.builder(imageFile).auto(true).autoOutputDir(outDir);
    }

    private File product(String name) {
        return new File(outDir, name);
    }

    // --- FALLOS ---

    @Test
    void rawImageWithoutCameraIsAConfigurationFailure() {
        images.preprocessed = false;

        ReductionException e = assertThrows(ReductionException.class,
                () -> run(stages(), RunDirectives.builder(imageFile).psf(new File("psf.fits")).build()));

        assertEquals(ReductionFailure.CONFIGURATION, e.getFailure());
        assertEquals(12, e.getExitCode());
        assertTrue(e.getMessage().contains("--camera"));
        assertNull(images.rawCamera);
    }

    @Test
    void imageWithoutIvarExtensionNeedsTheCamera() throws Exception {
        File file = tmp.resolve("image-no-ivar.fits").toFile();
        BasicHDU<?> hdu = Fits.makeHDU(new double[4][5]);
        hdu.getHeader().addValue("EXTNAME", "IMAGE", "");
        try (Fits fits = new Fits(); BufferedFile out = new BufferedFile(file, "rw")) {
            fits.addHDU(hdu);
            fits.write(out);
        }

        ReductionException e = assertThrows(ReductionException.class,
                () -> run(stages().images(new FitsImageStore()),
                        RunDirectives.builder(file).psf(new File("psf.fits")).build()));

        assertEquals(ReductionFailure.CONFIGURATION, e.getFailure());
        assertEquals(12, e.getExitCode());
    }

    @Test
    void malformedFiberFilterIsAConfigurationFailure() {
        ReductionException e = assertThrows(ReductionException.class,
                () -> run(stages(), RunDirectives.builder(imageFile).fibers("x:y").build()));
        assertEquals(ReductionFailure.CONFIGURATION, e.getFailure());
    }

    @Test
    void autoModeNeedsFlavorNightAndExposure() {
        images.image = TestData.image(10, "b1", TestData.meta("CAMERA", "b1", "FLAVOR", "ARC"));

        ReductionException e = assertThrows(ReductionException.class, () -> run(stages(), auto().build()));

        assertEquals(ReductionFailure.METADATA, e.getFailure());
        assertEquals(13, e.getExitCode());
        assertTrue(e.getMessage().contains("NIGHT"));
        assertTrue(e.getMessage().contains("EXPID"));
    }

    @Test
    void missingCalibrationIsACalibrationFailure() {
        ReductionException e = assertThrows(ReductionException.class,
                () -> run(stages(), RunDirectives.builder(imageFile).build()));

        assertEquals(ReductionFailure.CALIBRATION, e.getFailure());
        assertEquals(14, e.getExitCode());
    }

    @Test
    void fiberFilterWithoutMatchesIsASelectionFailure() {
        ReductionException e = assertThrows(ReductionException.class,
                () -> run(stages(), RunDirectives.builder(imageFile).psf(new File("psf.fits")).fibers("100:110").build()));

        assertEquals(ReductionFailure.SELECTION, e.getFailure());
        assertEquals(15, e.getExitCode());
        assertTrue(e.getMessage().contains("[0:3]"));
    }

    @Test
    void unreadableTraceSetIsAnIoFailure() {
        traceSets.failReads = true;

        ReductionException e = assertThrows(ReductionException.class,
                () -> run(stages(), RunDirectives.builder(imageFile).psf(new File("psf.fits")).build()));

        assertEquals(ReductionFailure.IO, e.getFailure());
        assertEquals(16, e.getExitCode());
        assertTrue(e.getMessage().contains("psf.fits"));
    }

    @Test
    void fluxCalibrationWithoutAirmassIsAMetadataFailure() {
        images.image = TestData.image(10, "b1", TestData.meta("CAMERA", "b1", "SEEING", 1.1, "EXPTIME", 10.0));
        locator.files.put(CalibrationLocator.FLUXCALIB, new File("fluxcalib.fits"));

        ReductionException e = assertThrows(ReductionException.class,
                () -> run(stages(), RunDirectives.builder(imageFile).psf(new File("psf.fits")).fluxcalib(true).build()));

        assertEquals(ReductionFailure.METADATA, e.getFailure());
    }

    // --- DIRECTIVAS EXPLÍCITAS ---

    @Test
    void explicitRunExtractsSelectsWritesAndPlots() throws Exception {
        File out = tmp.resolve("frame.fits").toFile();
        RunDirectives d = RunDirectives.builder(imageFile).psf(new File("psf.fits")).width(3)
                .fibers("2,0").outframe(out).plot(true).build();

        RunReport report = run(stages(), d);

        Frame written = frames.written.get(out);
        assertArrayEquals(new int[]{0, 2}, written.fibers);
        assertEquals(30, written.flux[1][5], 1e-9);
        assertEquals(EnumSet.of(OutputProduct.FRAME), report.outputs.keySet());
        assertNull(report.flavor);
        assertTrue(calls.contains("plot"));
        assertFalse(calls.contains("shift"));
    }

    @Test
    void rawImagesAreReadWithTheLowerCasedCamera() throws Exception {
        images.preprocessed = false;
        File preproc = tmp.resolve("preproc.fits").toFile();

        RunReport report = run(stages(), RunDirectives.builder(imageFile).camera(" B1 ").psf(new File("psf.fits"))
                .outputPreproc(preproc).build());

        assertEquals("b1", images.rawCamera);
        assertEquals(preproc, report.outputs.get(OutputProduct.PREPROC));
        assertTrue(images.written.containsKey(preproc));
    }

    @Test
    void traceSetMetadataNeverOverridesTheImageHeader() throws Exception {
        traceSets.traceSet = TestData.traceSet(3, TestData.meta("NIGHT", 19990101L, "PSFVER", "v2"));

        RunReport report = run(stages(), RunDirectives.builder(imageFile).psf(new File("psf.fits")).build());

        assertEquals(20200315L, report.frame.getMeta().get("NIGHT"));
        assertEquals("v2", report.frame.getMeta().get("PSFVER"));
    }

    @Test
    void missingFibermapFileDoesNotStopTheRun() throws Exception {
        RunReport report = run(stages(), RunDirectives.builder(imageFile).psf(new File("psf.fits"))
                .fibermap(tmp.resolve("fibermap-00000042.fits").toFile()).build());

        assertEquals(3, report.frame.nspec());
        assertNull(report.frame.getFibermap());
    }

    // --- MODO AUTOMÁTICO ---

    @Test
    void flatExposureWritesExactlyTraceFrameAndFiberflat() throws Exception {
        images.image = TestData.image(10, "b1", scienceMeta("FLAT"));
        locator.files.put(CalibrationLocator.PSF, new File("psf-b1-20200301.fits"));

        RunReport report = run(stages(), auto().build());

        assertEquals("FLAT", report.flavor);
        assertEquals(EnumSet.of(OutputProduct.PSF, OutputProduct.RAW_FRAME, OutputProduct.FIBERFLAT),
                report.outputs.keySet());
        assertTrue(traceSets.written.containsKey(product("psf-b1-00000042.fits")));
        assertTrue(frames.written.containsKey(product("qframe-b1-00000042.fits")));
        assertTrue(fiberFlats.written.containsKey(product("qfiberflat-b1-00000042.fits")));
        assertEquals("FLAT", fiberFlats.headers.get(product("qfiberflat-b1-00000042.fits")).get("FLAVOR"));
        assertEquals(1, frames.written.size());
        assertTrue(outDir.isDirectory());
        assertTrue(calls.contains("shift"));
        assertFalse(calls.contains("lsf"));
    }

    @Test
    void writtenTraceSetCarriesTheFrameHeader() throws Exception {
        images.image = TestData.image(10, "b1", scienceMeta("ARC"));
        traceSets.traceSet = TestData.traceSet(3, TestData.meta("NIGHT", 19990101L));
        locator.files.put(CalibrationLocator.PSF, new File("psf.fits"));

        run(stages(), auto().build());

        TraceSet psf = traceSets.written.get(product("psf-b1-00000042.fits"));
        assertEquals(19990101L, psf.getMeta().get("NIGHT"));
        assertEquals(42L, psf.getMeta().get("EXPID"));
        assertEquals("ARC", psf.getMeta().get("FLAVOR"));
        assertTrue(calls.contains("lsf"));
    }

    @Test
    void scienceExposureRunsTheFullChain() throws Exception {
        locator.files.put(CalibrationLocator.PSF, new File("psf.fits"));
        locator.files.put(CalibrationLocator.FIBERFLAT, new File("fiberflat.fits"));
        locator.files.put(CalibrationLocator.FLUXCALIB, new File("fluxcalib.fits"));

        RunReport report = run(stages(), auto().width(3).build());

        assertEquals(EnumSet.of(OutputProduct.PSF, OutputProduct.RAW_FRAME, OutputProduct.SKY_FRAME, OutputProduct.FRAME),
                report.outputs.keySet());
        assertEquals("SCIENCE", report.frame.getMeta().get("FLAVOR"));
        assertEquals("SCIENCE", report.frame.getMeta().get("IFLAVOR"));

        Frame raw = frames.written.get(product("qframe-b1-00000042.fits"));
        assertEquals(30, raw.flux[0][4], 1e-9);

        // cielo = las tres fibras iguales
        Frame sky = frames.written.get(product("qsky-b1-00000042.fits"));
        assertEquals(30, sky.flux[2][4], 1e-9);
        assertEquals(1.0, sky.ivar[2][4], 0);

        // calibración 2 x 10 s
        Frame calibrated = frames.written.get(product("qcframe-b1-00000042.fits"));
        assertEquals(0, calibrated.flux[1][4], 1e-9);
        assertEquals(400.0 / 3, calibrated.ivar[1][4], 1e-6);
        assertEquals(new File("fiberflat.fits"), fiberFlats.lastRead);
    }

    @Test
    void reclassifiedExposureFollowsTheDetectedFlavor() throws Exception {
        images.image = TestData.image(10, "b1", scienceMeta("FLAT"));
        locator.files.put(CalibrationLocator.PSF, new File("psf.fits"));

        RunReport report = run(stages().flavorClassifier((frame, flavor) -> "ARC"), auto().build());

        assertEquals("ARC", report.flavor);
        assertEquals("FLAT", report.frame.getMeta().get("IFLAVOR"));
        assertEquals("ARC", report.frame.getMeta().get("FLAVOR"));
        assertEquals(EnumSet.of(OutputProduct.PSF, OutputProduct.RAW_FRAME), report.outputs.keySet());
        assertTrue(calls.contains("lsf"));
    }

    @Test
    void unknownFlavorOnlyExtracts() throws Exception {
        images.image = TestData.image(10, "b1", TestData.meta("CAMERA", "b1", "FLAVOR", "ZERO",
                "NIGHT", 20200315L, "EXPNUM", 7L));
        locator.files.put(CalibrationLocator.PSF, new File("psf.fits"));

        RunReport report = run(stages(), auto().build());

        assertEquals("ZERO", report.flavor);
        assertTrue(report.outputs.isEmpty());
        assertEquals(3, report.frame.nspec());
        assertEquals(7L, report.frame.getMeta().get("EXPID"));
        assertTrue(calls.isEmpty());
    }

    @Test
    void autoModeWritesThePreprocessedRawImage() throws Exception {
        images.preprocessed = false;
        images.image = TestData.image(10, "b1", TestData.meta("FLAVOR", "DARK", "NIGHT", 20200315L, "EXPID", 7L));
        locator.files.put(CalibrationLocator.PSF, new File("psf.fits"));

        RunReport report = run(stages(), auto().camera("B1").build());

        assertEquals(product("preproc-b1-00000007.fits"), report.outputs.get(OutputProduct.PREPROC));
        assertTrue(images.written.containsKey(product("preproc-b1-00000007.fits")));
    }

    // --- DOBLES ---

    private static final class FakeImageStore implements ImageStore {
        boolean preprocessed = true;
        Image image;
        String rawCamera;
        final Map<File, Image> written = new HashMap<>();

        @Override public boolean isPreprocessed(File file) { return preprocessed; }
        @Override public Image readPreprocessed(File file) { return image; }
        @Override public Image readRaw(File file, String camera) { rawCamera = camera; return image; }
        @Override public Map<String, Object> readPrimaryHeader(File file) { return new LinkedHashMap<>(); }
        @Override public void write(File file, Image img) { written.put(file, img); }
    }

    private static final class FakeTraceSetStore implements TraceSetStore {
        TraceSet traceSet = TestData.traceSet(3);
        boolean failReads;
        final Map<File, TraceSet> written = new HashMap<>();

        @Override
        public TraceSet read(File file) throws IOException {
            if (failReads) throw new IOException("cabecera corrupta");
            return traceSet.copy();
        }

        @Override public void write(File file, TraceSet t) { written.put(file, t.copy()); }
    }

    // Guarda una copia: el controlador sigue modificando el frame tras escribirlo.
    private static final class FakeFrameStore implements FrameStore {
        final Map<File, Frame> written = new HashMap<>();

        @Override public Frame read(File file) throws IOException { throw new IOException("no implementado"); }

        @Override
        public void write(File file, Frame frame) {
            int[] rows = new int[frame.nspec()];
            for (int i = 0; i < rows.length; i++) rows[i] = i;
            written.put(file, frame.select(rows));
        }
    }

    private static final class FakeFiberFlatStore implements FiberFlatStore {
        final Map<File, FiberFlat> written = new HashMap<>();
        final Map<File, Map<String, Object>> headers = new HashMap<>();
        File lastRead;

        @Override
        public FiberFlat read(File file) {
            lastRead = file;
            double[][] wave = {{4000, 7000}, {4000, 7000}, {4000, 7000}};
            double[][] ones = {{1, 1}, {1, 1}, {1, 1}};
            return new FiberFlat(wave, ones, ones, new int[]{0, 1, 2}, null);
        }

        @Override
        public void write(File file, FiberFlat flat, Map<String, Object> header) {
            written.put(file, flat);
            headers.put(file, new LinkedHashMap<>(header));
        }
    }

    private static final class ConstantFluxCalibStore implements FluxCalibStore {
        @Override
        public FluxCalibCurve read(File file) {
            return FluxCalibCurve.flat(new double[]{4000, 7000}, new double[]{2, 2});
        }

        @Override public void write(File file, FluxCalibCurve curve) { }
    }

    private static final class MapLocator implements CalibrationLocator {
        final Map<String, File> files = new HashMap<>();

        @Override
        public File findFile(String product, List<Map<String, Object>> headers) throws CalibrationNotFoundException {
            File f = files.get(product);
            if (f == null) throw new CalibrationNotFoundException(product, "no hay " + product);
            return f;
        }
    }
}
