package com.spectro.stage;

import com.spectro.model.Image;
import com.spectro.model.TraceSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.util.ArrayList;
import java.util.List;

// Mide el desplazamiento en x de las trazas con el centroide del flujo alrededor de cada traza,
// cada rowStep filas, y aplica la mediana a todas las fibras.
public class CentroidTraceShiftFitter implements TraceShiftFitter {

    private static final Logger LOG = LoggerFactory.getLogger(CentroidTraceShiftFitter.class);

    private final int rowStep;
    private final int halfWindow;
    private final double minSignal;

    public CentroidTraceShiftFitter() {
        this(20, 3, 10.0);
    }

    public CentroidTraceShiftFitter(int rowStep, int halfWindow, double minSignal) {
        this.rowStep = rowStep;
        this.halfWindow = halfWindow;
        this.minSignal = minSignal;
    }

    @Override
    public TraceSet fit(Image image, TraceSet traceSet) {
        TraceSet out = traceSet.copy();
        List<Double> offsets = new ArrayList<>();

        for (int f = 0; f < traceSet.nfibers(); f++) {
            double[] r = traceSet.yRange(f);
            int y0 = Math.max(0, (int) Math.ceil(r[0]));
            int y1 = Math.min(image.ny() - 1, (int) Math.floor(r[1]));
            if (y1 < y0) continue;
            int n = (y1 - y0) / rowStep + 1;
            double[] rows = new double[n];
            for (int i = 0; i < n; i++) rows[i] = y0 + i * rowStep;
            double[] wave = traceSet.waveAtY(f, rows);

            for (int i = 0; i < n; i++) {
                int y = (int) rows[i];
                double xc = traceSet.x(f, wave[i]);
                Double dx = centroidOffset(image, y, xc);
                if (dx != null) offsets.add(dx);
            }
        }

        if (offsets.isEmpty()) {
            LOG.warn("sin señal suficiente para medir el desplazamiento de las trazas, se mantienen");
            out.getMeta().put("NDXFIT", 0L);
            return out;
        }

        double[] dx = new double[offsets.size()];
        double sum = 0, min = Double.MAX_VALUE, max = -Double.MAX_VALUE;
        for (int i = 0; i < dx.length; i++) {
            dx[i] = offsets.get(i);
            sum += dx[i];
            min = Math.min(min, dx[i]);
            max = Math.max(max, dx[i]);
        }
        double shift = SpectrumMath.median(dx);
        out.shiftX(shift);

        out.getMeta().put("MEANDX", sum / dx.length);
        out.getMeta().put("MINDX", min);
        out.getMeta().put("MAXDX", max);
        out.getMeta().put("MEDDX", shift);
        out.getMeta().put("NDXFIT", (long) dx.length);
        LOG.info("desplazamiento de trazas dx={} px ({} medidas)", String.format("%.3f", shift), dx.length);
        return out;
    }

    private Double centroidOffset(Image image, int y, double xc) {
        int xi = (int) Math.round(xc);
        int a = xi - halfWindow, b = xi + halfWindow;
        if (a < 0 || b >= image.nx()) return null;

        // Fondo local: el mínimo de la ventana
        double bg = Double.MAX_VALUE;
        for (int x = a; x <= b; x++) bg = Math.min(bg, image.pix[y][x]);

        double s = 0, sx = 0;
        for (int x = a; x <= b; x++) {
            if (image.ivar[y][x] <= 0) return null;
            double v = image.pix[y][x] - bg;
            s += v;
            sx += v * x;
        }
        if (s < minSignal) return null;
        return sx / s - xc;
    }
}
