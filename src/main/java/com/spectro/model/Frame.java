package com.spectro.model;

import java.util.LinkedHashMap;
import java.util.Map;

// Spectros extraídos de una cámara: una fila por fibra (wave, flux, ivar).
// Las tres matrices comparten forma nfiber x nwave y fibers tiene nfiber elementos.
public class Frame {

    public final double[][] wave;
    public final double[][] flux;
    public final double[][] ivar;
    public final int[] fibers;

    private Map<String, Object> meta;
    private Fibermap fibermap;

    public Frame(double[][] wave, double[][] flux, double[][] ivar, int[] fibers) {
        this(wave, flux, ivar, fibers, null);
    }

    public Frame(double[][] wave, double[][] flux, double[][] ivar, int[] fibers, Map<String, Object> meta) {
        this.wave = wave;
        this.flux = flux;
        this.ivar = ivar;
        this.fibers = (fibers != null) ? fibers : defaultFibers(wave.length);
        this.meta = meta;
        checkShape();
    }

    public int nspec() { return flux.length; }
    public int nwave() { return flux.length == 0 ? 0 : flux[0].length; }

    public Map<String, Object> getMeta() { return meta; }

    public Map<String, Object> meta() {
        if (meta == null) meta = new LinkedHashMap<>();
        return meta;
    }

    public Fibermap getFibermap() { return fibermap; }
    public void setFibermap(Fibermap fibermap) { this.fibermap = fibermap; }

    // Añade las claves de other que todavía no están en este frame.
    // Un valor ya presente nunca se sobrescribe.
    public void mergeMeta(Map<String, Object> other) {
        if (other == null) return;
        Map<String, Object> m = meta();
        for (Map.Entry<String, Object> e : other.entrySet()) {
            m.putIfAbsent(e.getKey(), e.getValue());
        }
    }

    // Subconjunto de filas en el orden dado. Copia las filas; los metadatos se copian superficialmente.
    public Frame select(int[] rows) {
        int n = rows.length;
        double[][] w = new double[n][];
        double[][] f = new double[n][];
        double[][] iv = new double[n][];
        int[] fib = new int[n];
        for (int i = 0; i < n; i++) {
            int r = rows[i];
            w[i] = wave[r].clone();
            f[i] = flux[r].clone();
            iv[i] = ivar[r].clone();
            fib[i] = fibers[r];
        }
        Frame out = new Frame(w, f, iv, fib, meta == null ? null : new LinkedHashMap<>(meta));
        if (fibermap != null) out.setFibermap(fibermap.selectFibers(fib));
        return out;
    }

    public int rowOf(int fiber) {
        for (int i = 0; i < fibers.length; i++) if (fibers[i] == fiber) return i;
        return -1;
    }

    public final void checkShape() {
        if (flux.length != wave.length || ivar.length != wave.length) {
            throw new IllegalStateException(String.format("Frame inconsistente: wave=%d flux=%d ivar=%d filas",
                    wave.length, flux.length, ivar.length));
        }
        if (fibers.length != wave.length) {
            throw new IllegalStateException(String.format("Frame inconsistente: %d fibras para %d filas",
                    fibers.length, wave.length));
        }
        for (int i = 0; i < wave.length; i++) {
            int nw = wave[i].length;
            if (flux[i].length != nw || ivar[i].length != nw) {
                throw new IllegalStateException("Frame inconsistente en la fila " + i);
            }
        }
    }

    private static int[] defaultFibers(int n) {
        int[] f = new int[n];
        for (int i = 0; i < n; i++) f[i] = i;
        return f;
    }
}
