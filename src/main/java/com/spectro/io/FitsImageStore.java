package com.spectro.io;

import com.spectro.model.Image;
import ij.measure.Measurements;
import ij.process.FloatProcessor;
import ij.process.ImageStatistics;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

// Imágenes de cámara. Un fichero preprocesado tiene extensiones IMAGE e IVAR; un fichero raw
// tiene una extensión por cámara (EXTNAME = nombre de la cámara) que se preprocesa al leerla.
public class FitsImageStore implements ImageStore {

    private static final Logger LOG = LoggerFactory.getLogger(FitsImageStore.class);

    private static final double DEFAULT_GAIN = 1.0;
    private static final double DEFAULT_READ_NOISE = 3.0;

    @Override
    public boolean isPreprocessed(File file) throws IOException {
        return FitsSupport.read(file, hdus ->
                FitsSupport.find(hdus, "IMAGE") != null && FitsSupport.find(hdus, "IVAR") != null);
    }

    @Override
    public Map<String, Object> readPrimaryHeader(File file) throws IOException {
        return FitsSupport.read(file, hdus -> FitsSupport.readMeta(hdus[0].getHeader()));
    }

    @Override
    public Image readPreprocessed(File file) throws IOException {
        return FitsSupport.read(file, hdus -> {
            BasicHDU<?> img = FitsSupport.require(hdus, "IMAGE", file);
            BasicHDU<?> iv = FitsSupport.require(hdus, "IVAR", file);

            Map<String, Object> meta = new LinkedHashMap<>(FitsSupport.readMeta(hdus[0].getHeader()));
            meta.putAll(FitsSupport.readMeta(img.getHeader()));
            Object camera = meta.get("CAMERA");
            return new Image(FitsSupport.physical2D(img), FitsSupport.physical2D(iv),
                    camera == null ? null : camera.toString().trim().toLowerCase(Locale.ROOT), meta);
        });
    }

    @Override
    public Image readRaw(File file, String camera) throws IOException {
        return FitsSupport.read(file, hdus -> {
            BasicHDU<?> hdu = FitsSupport.find(hdus, camera);
            if (hdu == null) throw new IOException("no hay extensión para la cámara " + camera + " en " + file);

            Header header = hdu.getHeader();
            Map<String, Object> meta = new LinkedHashMap<>(FitsSupport.readMeta(hdus[0].getHeader()));
            meta.putAll(FitsSupport.readMeta(header));
            String cam = camera.toLowerCase(Locale.ROOT);
            meta.put("CAMERA", cam);

            double[][] raw = FitsSupport.physical2D(hdu);
            int noverscan = header.getIntValue("NOVERSCN", 0);
            double gain = header.getDoubleValue("GAIN", DEFAULT_GAIN);
            double readNoise = header.getDoubleValue("RDNOISE", DEFAULT_READ_NOISE);
            return preprocess(raw, noverscan, gain, readNoise, cam, meta);
        });
    }

    // Resta el bias (mediana del overscan, las últimas noverscan columnas), convierte a electrones
    // y estima la ivar con ruido de Poisson más ruido de lectura.
    Image preprocess(double[][] raw, int noverscan, double gain, double readNoise, String camera, Map<String, Object> meta) {
        int ny = raw.length, nxRaw = raw[0].length;
        int nx = nxRaw - Math.max(0, noverscan);
        if (nx <= 0) throw new IllegalArgumentException("NOVERSCN=" + noverscan + " no deja columnas de datos");

        FloatProcessor ip = new FloatProcessor(nxRaw, ny);
        float[] px = (float[]) ip.getPixels();
        for (int y = 0; y < ny; y++)
            for (int x = 0; x < nxRaw; x++)
                px[y * nxRaw + x] = (float) raw[y][x];

        // --- BIAS ---
        double bias = 0;
        if (noverscan > 0) {
            ip.setRoi(nx, 0, noverscan, ny);
            ImageStatistics stats = ImageStatistics.getStatistics(ip, Measurements.MEDIAN, null);
            bias = stats.median;
        }

        double rn2 = readNoise * readNoise;
        double[][] pix = new double[ny][nx];
        double[][] ivar = new double[ny][nx];
        for (int y = 0; y < ny; y++) {
            for (int x = 0; x < nx; x++) {
                double e = (raw[y][x] - bias) * gain;
                pix[y][x] = e;
                ivar[y][x] = 1.0 / (Math.max(e, 0) + rn2);
            }
        }
        LOG.debug("preproc {}: bias={} ADU, gain={}, rdnoise={}", camera, bias, gain, readNoise);

        Map<String, Object> m = new LinkedHashMap<>(meta);
        m.put("BIASLEV", bias);
        return new Image(pix, ivar, camera, m);
    }

    @Override
    public void write(File file, Image image) throws IOException {
        List<BasicHDU<?>> hdus = new ArrayList<>();
        try {
            BasicHDU<?> img = FitsSupport.imageHdu(image.pix, "IMAGE");
            Map<String, Object> meta = new LinkedHashMap<>(image.getMeta());
            if (image.camera != null) meta.putIfAbsent("CAMERA", image.camera);
            FitsSupport.writeMeta(img.getHeader(), meta);
            hdus.add(img);
            hdus.add(FitsSupport.imageHdu(image.ivar, "IVAR"));
        } catch (FitsException e) {
            throw new IOException("no se pudo preparar " + file + ": " + e.getMessage(), e);
        }
        FitsSupport.write(file, hdus);
    }
}
