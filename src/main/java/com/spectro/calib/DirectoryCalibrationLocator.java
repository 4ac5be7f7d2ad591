package com.spectro.calib;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.io.File;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

// Busca calibraciones en <raíz>/<cámara>/<producto>-<cámara>-<AAAAMMDD>.fits y elige la más reciente
// cuya fecha no sea posterior a la noche (NIGHT) de la exposición.
public class DirectoryCalibrationLocator implements CalibrationLocator {

    private static final Logger LOG = LoggerFactory.getLogger(DirectoryCalibrationLocator.class);

    private final File root;

    public DirectoryCalibrationLocator(File root) {
        this.root = root;
    }

    public File getRoot() { return root; }

    @Override
    public File findFile(String product, List<Map<String, Object>> headers) throws CalibrationNotFoundException {
        Object cameraValue = lookup(headers, "CAMERA");
        if (cameraValue == null) {
            throw new CalibrationNotFoundException(product, "no se puede buscar " + product + ": falta CAMERA en la cabecera");
        }
        String camera = cameraValue.toString().trim().toLowerCase(Locale.ROOT);
        Integer night = parseNight(lookup(headers, "NIGHT"));

        File dir = new File(root, camera);
        File[] files = dir.listFiles();
        if (files == null) {
            throw new CalibrationNotFoundException(product, "no existe el directorio de calibración " + dir);
        }

        Pattern p = Pattern.compile("^" + Pattern.quote(product.toLowerCase(Locale.ROOT)) + "-"
                + Pattern.quote(camera) + "-(\\d{8})\\.fits(\\.gz)?$");
        File best = null;
        int bestDate = -1;
        for (File f : files) {
            Matcher m = p.matcher(f.getName());
            if (!m.matches()) continue;
            int date = Integer.parseInt(m.group(1));
            if (night != null && date > night) continue;
            if (date > bestDate) { best = f; bestDate = date; }
        }
        if (best == null) {
            throw new CalibrationNotFoundException(product, String.format("no hay %s para la cámara %s%s en %s",
                    product, camera, night == null ? "" : " (noche " + night + ")", dir));
        }
        LOG.debug("calibración {} para {}: {}", product, camera, best);
        return best;
    }

    private static Object lookup(List<Map<String, Object>> headers, String key) {
        for (Map<String, Object> h : headers) {
            if (h != null && h.get(key) != null) return h.get(key);
        }
        return null;
    }

    private static Integer parseNight(Object v) {
        if (v == null) return null;
        if (v instanceof Number) return ((Number) v).intValue();
        try {
            return Integer.parseInt(v.toString().trim());
        } catch (NumberFormatException e) {
            LOG.warn("NIGHT no numérico '{}', se usa la calibración más reciente", v);
            return null;
        }
    }
}
