package com.spectro.service;

import com.spectro.model.Frame;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

// Selección de fibras con la sintaxis desde:hasta,fibra,...; el extremo superior de un rango no se incluye.
public class FiberSelector {

    public static int[] parseFibers(String filter) {
        if (filter == null || filter.trim().isEmpty()) return null;
        Set<Integer> fibers = new LinkedHashSet<>();
        for (String part : filter.split(",")) {
            String p = part.trim();
            if (p.isEmpty()) continue;
            try {
                int colon = p.indexOf(':');
                if (colon >= 0) {
                    int from = Integer.parseInt(p.substring(0, colon).trim());
                    int to = Integer.parseInt(p.substring(colon + 1).trim());
                    if (to <= from) throw new IllegalArgumentException("rango de fibras vacío '" + p + "'");
                    for (int f = from; f < to; f++) fibers.add(f);
                } else {
                    fibers.add(Integer.parseInt(p));
                }
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("filtro de fibras no válido '" + p + "'", e);
            }
        }
        if (fibers.isEmpty()) throw new IllegalArgumentException("filtro de fibras vacío '" + filter + "'");
        int[] out = new int[fibers.size()];
        int i = 0;
        for (int f : fibers) out[i++] = f;
        return out;
    }

    // Filas del frame cuyas fibras están pedidas, en el orden del frame.
    public Frame select(Frame frame, int[] wanted) throws ReductionException {
        Set<Integer> set = new LinkedHashSet<>();
        for (int w : wanted) set.add(w);
        List<Integer> rows = new ArrayList<>();
        for (int i = 0; i < frame.fibers.length; i++) if (set.contains(frame.fibers[i])) rows.add(i);

        if (rows.isEmpty()) {
            String range = frame.fibers.length == 0 ? "[]"
                    : String.format("[%d:%d]", frame.fibers[0], frame.fibers[frame.fibers.length - 1] + 1);
            throw new ReductionException(ReductionFailure.SELECTION,
                    "no existen esas fibras en el frame; las fibras están en el rango " + range);
        }
        int[] idx = new int[rows.size()];
        for (int i = 0; i < idx.length; i++) idx[i] = rows.get(i);
        return frame.select(idx);
    }
}
