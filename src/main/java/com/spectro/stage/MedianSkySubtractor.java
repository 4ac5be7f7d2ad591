package com.spectro.stage;

import com.spectro.model.Fibermap;
import com.spectro.model.Frame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.util.ArrayList;
import java.util.List;

// Cielo = mediana de las fibras de cielo (OBJTYPE SKY del fibermap) en una malla común,
// interpolado en la malla de cada fibra. Sin fibermap, o sin fibras de cielo, se usan todas.
public class MedianSkySubtractor implements SkySubtractor {

    private static final Logger LOG = LoggerFactory.getLogger(MedianSkySubtractor.class);

    @Override
    public double[][] subtract(Frame frame) {
        List<Integer> skyRows = skyRows(frame);
        if (skyRows.isEmpty()) {
            throw new IllegalArgumentException("frame vacío, no hay cielo que restar");
        }

        double[] ref = frame.wave[skyRows.get(0)];
        double[][] onRef = new double[skyRows.size()][];
        for (int k = 0; k < skyRows.size(); k++) {
            int r = skyRows.get(k);
            onRef[k] = SpectrumMath.interp(ref, frame.wave[r], frame.flux[r]);
        }
        double[] sky = new double[ref.length];
        double[] column = new double[skyRows.size()];
        for (int j = 0; j < ref.length; j++) {
            for (int k = 0; k < column.length; k++) column[k] = onRef[k][j];
            sky[j] = SpectrumMath.median(column);
        }

        double[][] model = new double[frame.nspec()][];
        for (int i = 0; i < frame.nspec(); i++) {
            model[i] = SpectrumMath.interp(frame.wave[i], ref, sky);
            for (int j = 0; j < model[i].length; j++) frame.flux[i][j] -= model[i][j];
        }
        return model;
    }

    private static List<Integer> skyRows(Frame frame) {
        List<Integer> rows = new ArrayList<>();
        Fibermap fm = frame.getFibermap();
        if (fm != null) {
            for (int i = 0; i < frame.nspec(); i++) if (fm.isSky(frame.fibers[i])) rows.add(i);
        }
        if (rows.isEmpty()) {
            LOG.info("sin fibras de cielo identificadas, el cielo se estima con todas las fibras");
            for (int i = 0; i < frame.nspec(); i++) rows.add(i);
        } else {
            LOG.info("cielo estimado con {} fibras SKY", rows.size());
        }
        return rows;
    }
}
