package com.spectro.stage;

import com.spectro.model.Fibermap;
import com.spectro.model.Frame;
import com.spectro.model.Image;
import com.spectro.model.Meta;
import com.spectro.model.TraceSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// Extracción boxcar: en cada fila del detector suma width píxeles centrados en la traza.
// Un píxel fuera del detector o con ivar nula anula la ivar de la muestra.
public class BoxcarExtractor implements SpectralExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(BoxcarExtractor.class);

    public static final String FIBERMIN = "FIBERMIN";

    @Override
    public Frame extract(TraceSet tset, Image image, int width, Fibermap fibermap) {
        int nfib = tset.nfibers();
        int ny = image.ny(), nx = image.nx();

        // Filas cubiertas por todas las trazas
        int ymin = 0, ymax = ny - 1;
        for (int f = 0; f < nfib; f++) {
            double[] r = tset.yRange(f);
            ymin = Math.max(ymin, (int) Math.ceil(r[0]));
            ymax = Math.min(ymax, (int) Math.floor(r[1]));
        }
        if (ymax < ymin) {
            throw new IllegalStateException("las trazas no cubren ninguna fila del detector");
        }
        int nw = ymax - ymin + 1;
        double[] rows = new double[nw];
        for (int i = 0; i < nw; i++) rows[i] = ymin + i;

        double[][] wave = new double[nfib][];
        double[][] flux = new double[nfib][nw];
        double[][] ivar = new double[nfib][nw];
        int[] fibers = new int[nfib];
        int fibermin = Meta.getInt(tset.getMeta(), FIBERMIN, 0);

        for (int f = 0; f < nfib; f++) {
            fibers[f] = fibermin + f;
            wave[f] = tset.waveAtY(f, rows);
            for (int i = 0; i < nw; i++) {
                int y = ymin + i;
                double xc = tset.x(f, wave[f][i]);
                int x0 = (int) Math.round(xc - (width - 1) / 2.0);
                double sum = 0, var = 0;
                boolean bad = false;
                for (int x = x0; x < x0 + width; x++) {
                    if (x < 0 || x >= nx || image.ivar[y][x] <= 0) { bad = true; continue; }
                    sum += image.pix[y][x];
                    var += 1.0 / image.ivar[y][x];
                }
                flux[f][i] = sum;
                ivar[f][i] = (bad || var <= 0) ? 0 : 1.0 / var;
            }
        }

        Frame frame = new Frame(wave, flux, ivar, fibers);
        frame.mergeMeta(image.getMeta());
        if (fibermap != null) frame.setFibermap(fibermap.selectFibers(fibers));
        LOG.debug("boxcar: {} fibras x {} filas (y={}..{}), ancho {}", nfib, nw, ymin, ymax, width);
        return frame;
    }
}
