package com.spectro.model;

import java.util.LinkedHashMap;
import java.util.Map;

public class FiberFlat {

    public final double[][] wave;
    public final double[][] fiberflat;
    public final double[][] ivar;
    public final int[] fibers;
    public final Map<String, Object> meta;

    public FiberFlat(double[][] wave, double[][] fiberflat, double[][] ivar, int[] fibers, Map<String, Object> meta) {
        if (fiberflat.length != wave.length || ivar.length != wave.length || fibers.length != wave.length) {
            throw new IllegalArgumentException("FiberFlat inconsistente");
        }
        this.wave = wave;
        this.fiberflat = fiberflat;
        this.ivar = ivar;
        this.fibers = fibers;
        this.meta = (meta == null) ? new LinkedHashMap<>() : new LinkedHashMap<>(meta);
    }

    public int nspec() { return fiberflat.length; }

    public int rowOf(int fiber) {
        for (int i = 0; i < fibers.length; i++) if (fibers[i] == fiber) return i;
        return -1;
    }
}
