package com.spectro.model;

import java.util.ArrayList;
import java.util.List;

public class Fibermap {

    public static final String SKY = "SKY";

    public final int[] fibers;
    public final String[] objtype;

    public Fibermap(int[] fibers, String[] objtype) {
        if (fibers.length != objtype.length) {
            throw new IllegalArgumentException("FIBER y OBJTYPE con longitudes distintas");
        }
        this.fibers = fibers;
        this.objtype = objtype;
    }

    public String objtypeOf(int fiber) {
        for (int i = 0; i < fibers.length; i++) {
            if (fibers[i] == fiber) return objtype[i] == null ? "" : objtype[i].trim();
        }
        return "";
    }

    public boolean isSky(int fiber) { return SKY.equalsIgnoreCase(objtypeOf(fiber)); }

    public Fibermap selectFibers(int[] wanted) {
        List<Integer> idx = new ArrayList<>();
        for (int w : wanted) {
            for (int i = 0; i < fibers.length; i++) {
                if (fibers[i] == w) { idx.add(i); break; }
            }
        }
        int[] f = new int[idx.size()];
        String[] o = new String[idx.size()];
        for (int i = 0; i < f.length; i++) {
            f[i] = fibers[idx.get(i)];
            o[i] = objtype[idx.get(i)];
        }
        return new Fibermap(f, o);
    }
}
