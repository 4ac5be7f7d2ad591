package com.spectro.io;

import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import nom.tam.fits.HeaderCard;
import nom.tam.util.BufferedFile;
import nom.tam.util.Cursor;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

final class FitsSupport {

    private static final Pattern VALID_KEY = Pattern.compile("[A-Z0-9_-]{1,8}");
    private static final int MAX_STRING = 68;

    private static final Set<String> STRUCTURAL = new HashSet<>(Arrays.asList(
            "SIMPLE", "BITPIX", "EXTEND", "XTENSION", "PCOUNT", "GCOUNT", "TFIELDS", "EXTNAME",
            "BZERO", "BSCALE", "END", "COMMENT", "HISTORY", "CHECKSUM", "DATASUM", "THEAP"));
    private static final String[] STRUCTURAL_PREFIXES = {"NAXIS", "TTYPE", "TFORM", "TUNIT", "TDIM", "TNULL", "TSCAL", "TZERO", "TDISP"};

    interface HduReader<T> {
        T read(BasicHDU<?>[] hdus) throws FitsException, IOException;
    }

    private FitsSupport() {}

    static <T> T read(File file, HduReader<T> reader) throws IOException {
        if (!file.isFile()) throw new IOException("no existe el fichero FITS " + file);
        // Liberación explícita del fichero con try-with-resources
        try (Fits fits = new Fits(file)) {
            BasicHDU<?>[] hdus = fits.read();
            if (hdus == null || hdus.length == 0) throw new IOException("fichero FITS vacío " + file);
            return reader.read(hdus);
        } catch (FitsException e) {
            throw new IOException("FITS ilegible " + file + ": " + e.getMessage(), e);
        }
    }

    static void write(File file, List<BasicHDU<?>> hdus) throws IOException {
        File parent = file.getAbsoluteFile().getParentFile();
        if (parent != null && !parent.isDirectory()) Files.createDirectories(parent.toPath());
        Files.deleteIfExists(file.toPath());
        try (Fits fits = new Fits(); BufferedFile out = new BufferedFile(file, "rw")) {
            for (BasicHDU<?> hdu : hdus) fits.addHDU(hdu);
            fits.write(out);
        } catch (FitsException e) {
            throw new IOException("no se pudo escribir " + file + ": " + e.getMessage(), e);
        }
    }

    static BasicHDU<?> imageHdu(Object data, String extname) throws FitsException {
        BasicHDU<?> hdu = Fits.makeHDU(data);
        hdu.getHeader().addValue("EXTNAME", extname, "");
        return hdu;
    }

    static String extname(BasicHDU<?> hdu) {
        String name = hdu.getHeader().getStringValue("EXTNAME");
        return name == null ? null : name.trim();
    }

    static BasicHDU<?> find(BasicHDU<?>[] hdus, String extname) {
        for (BasicHDU<?> hdu : hdus) {
            String name = extname(hdu);
            if (name != null && name.equalsIgnoreCase(extname)) return hdu;
        }
        return null;
    }

    static BasicHDU<?> require(BasicHDU<?>[] hdus, String extname, File file) throws IOException {
        BasicHDU<?> hdu = find(hdus, extname);
        if (hdu == null) throw new IOException("falta la extensión " + extname + " en " + file);
        return hdu;
    }

    // --- CABECERA <-> METADATOS ---

    static Map<String, Object> readMeta(Header header, Set<String> skip) {
        Map<String, Object> meta = new LinkedHashMap<>();
        Cursor<String, HeaderCard> it = header.iterator();
        while (it.hasNext()) {
            HeaderCard card = it.next();
            String key = card.getKey();
            if (key == null || !card.isKeyValuePair() || isStructural(key) || skip.contains(key)) continue;
            String raw = card.getValue();
            if (raw == null) continue;
            meta.put(key, card.isStringValue() ? raw.trim() : parseScalar(raw.trim()));
        }
        return meta;
    }

    static Map<String, Object> readMeta(Header header) {
        return readMeta(header, Set.of());
    }

    // Escribe los metadatos que la cabecera aún no contiene; claves no válidas en FITS se omiten.
    static void writeMeta(Header header, Map<String, Object> meta) throws FitsException {
        if (meta == null) return;
        for (Map.Entry<String, Object> e : meta.entrySet()) {
            String key = e.getKey();
            Object v = e.getValue();
            if (v == null || key == null || !VALID_KEY.matcher(key).matches()
                    || isStructural(key) || header.containsKey(key)) continue;
            if (v instanceof Boolean) {
                header.addValue(key, ((Boolean) v).booleanValue(), "");
            } else if (v instanceof Long || v instanceof Integer || v instanceof Short || v instanceof Byte) {
                header.addValue(key, ((Number) v).longValue(), "");
            } else if (v instanceof Number) {
                double d = ((Number) v).doubleValue();
                if (Double.isFinite(d)) header.addValue(key, d, "");
            } else {
                header.addValue(key, printable(v.toString()), "");
            }
        }
    }

    static Object parseScalar(String s) {
        if ("T".equals(s)) return Boolean.TRUE;
        if ("F".equals(s)) return Boolean.FALSE;
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            try {
                return Double.parseDouble(s.replace('D', 'E'));
            } catch (NumberFormatException e2) {
                return s;
            }
        }
    }

    private static boolean isStructural(String key) {
        if (STRUCTURAL.contains(key)) return true;
        for (String p : STRUCTURAL_PREFIXES) if (key.startsWith(p)) return true;
        return false;
    }

    private static String printable(String s) {
        StringBuilder sb = new StringBuilder(Math.min(s.length(), MAX_STRING));
        for (int i = 0; i < s.length() && sb.length() < MAX_STRING; i++) {
            char c = s.charAt(i);
            sb.append(c >= 0x20 && c <= 0x7E ? c : '?');
        }
        return sb.toString();
    }

    // --- KERNELS ---

    static double[][] toDouble2D(Object k) {
        if (k instanceof double[][]) {
            double[][] s = (double[][]) k;
            double[][] d = new double[s.length][];
            for (int i = 0; i < s.length; i++) d[i] = s[i].clone();
            return d;
        }
        if (k instanceof float[][]) {
            float[][] f = (float[][]) k;
            double[][] d = new double[f.length][f.length == 0 ? 0 : f[0].length];
            for (int i = 0; i < f.length; i++) for (int j = 0; j < f[i].length; j++) d[i][j] = f[i][j];
            return d;
        }
        if (k instanceof int[][]) {
            int[][] s = (int[][]) k;
            double[][] d = new double[s.length][s.length == 0 ? 0 : s[0].length];
            for (int i = 0; i < s.length; i++) for (int j = 0; j < s[i].length; j++) d[i][j] = s[i][j];
            return d;
        }
        if (k instanceof short[][]) {
            short[][] s = (short[][]) k;
            double[][] d = new double[s.length][s.length == 0 ? 0 : s[0].length];
            for (int i = 0; i < s.length; i++) for (int j = 0; j < s[i].length; j++) d[i][j] = s[i][j];
            return d;
        }
        if (k instanceof long[][]) {
            long[][] s = (long[][]) k;
            double[][] d = new double[s.length][s.length == 0 ? 0 : s[0].length];
            for (int i = 0; i < s.length; i++) for (int j = 0; j < s[i].length; j++) d[i][j] = s[i][j];
            return d;
        }
        throw new IllegalArgumentException("kernel FITS no soportado: " + (k == null ? "null" : k.getClass().getSimpleName()));
    }

    // Valor físico = BSCALE * almacenado + BZERO (p.ej. enteros sin signo de 16 bits con BZERO=32768)
    static double[][] physical2D(BasicHDU<?> hdu) {
        Header header = hdu.getHeader();
        double bscale = header.getDoubleValue("BSCALE", 1.0);
        double bzero = header.getDoubleValue("BZERO", 0.0);
        double[][] d = toDouble2D(hdu.getKernel());
        if (bscale == 1.0 && bzero == 0.0) return d;
        for (double[] row : d) for (int j = 0; j < row.length; j++) row[j] = bscale * row[j] + bzero;
        return d;
    }

    static double[] toDouble1D(Object k) {
        if (k instanceof double[]) return ((double[]) k).clone();
        if (k instanceof float[]) { float[] f = (float[]) k; double[] d = new double[f.length]; for (int i = 0; i < f.length; i++) d[i] = f[i]; return d; }
        if (k instanceof int[]) { int[] s = (int[]) k; double[] d = new double[s.length]; for (int i = 0; i < s.length; i++) d[i] = s[i]; return d; }
        if (k instanceof long[]) { long[] s = (long[]) k; double[] d = new double[s.length]; for (int i = 0; i < s.length; i++) d[i] = s[i]; return d; }
        if (k instanceof short[]) { short[] s = (short[]) k; double[] d = new double[s.length]; for (int i = 0; i < s.length; i++) d[i] = s[i]; return d; }
        throw new IllegalArgumentException("vector FITS no soportado: " + (k == null ? "null" : k.getClass().getSimpleName()));
    }

    static int[] toInt1D(Object k) {
        if (k instanceof int[]) return ((int[]) k).clone();
        if (k instanceof long[]) { long[] s = (long[]) k; int[] d = new int[s.length]; for (int i = 0; i < s.length; i++) d[i] = (int) s[i]; return d; }
        if (k instanceof short[]) { short[] s = (short[]) k; int[] d = new int[s.length]; for (int i = 0; i < s.length; i++) d[i] = s[i]; return d; }
        if (k instanceof byte[]) { byte[] s = (byte[]) k; int[] d = new int[s.length]; for (int i = 0; i < s.length; i++) d[i] = s[i]; return d; }
        double[] d = toDouble1D(k);
        int[] out = new int[d.length];
        for (int i = 0; i < d.length; i++) out[i] = (int) Math.round(d[i]);
        return out;
    }
}
