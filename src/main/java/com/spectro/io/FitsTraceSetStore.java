package com.spectro.io;

import com.spectro.model.TraceSet;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

// PSF simplificada: extensiones XTRACE e YTRACE (coeficientes de Legendre, una fila por fibra) con
// WAVEMIN/WAVEMAX, y opcionalmente XSIG e YSIG. Los metadatos van en la cabecera de XTRACE.
public class FitsTraceSetStore implements TraceSetStore {

    private static final Set<String> RANGE_KEYS = Set.of("WAVEMIN", "WAVEMAX");

    @Override
    public TraceSet read(File file) throws IOException {
        return FitsSupport.read(file, hdus -> {
            BasicHDU<?> xt = FitsSupport.require(hdus, "XTRACE", file);
            BasicHDU<?> yt = FitsSupport.require(hdus, "YTRACE", file);
            Header h = xt.getHeader();
            if (!h.containsKey("WAVEMIN") || !h.containsKey("WAVEMAX")) {
                throw new IOException("faltan WAVEMIN/WAVEMAX en XTRACE de " + file);
            }
            BasicHDU<?> xs = FitsSupport.find(hdus, "XSIG");
            BasicHDU<?> ys = FitsSupport.find(hdus, "YSIG");
            return new TraceSet(h.getDoubleValue("WAVEMIN", 0), h.getDoubleValue("WAVEMAX", 0),
                    FitsSupport.toDouble2D(xt.getKernel()), FitsSupport.toDouble2D(yt.getKernel()),
                    xs == null ? null : FitsSupport.toDouble2D(xs.getKernel()),
                    ys == null ? null : FitsSupport.toDouble2D(ys.getKernel()),
                    FitsSupport.readMeta(h, RANGE_KEYS));
        });
    }

    @Override
    public void write(File file, TraceSet traceSet) throws IOException {
        List<BasicHDU<?>> hdus = new ArrayList<>();
        try {
            BasicHDU<?> xt = FitsSupport.imageHdu(traceSet.getXCoef(), "XTRACE");
            xt.getHeader().addValue("WAVEMIN", traceSet.wavemin, "");
            xt.getHeader().addValue("WAVEMAX", traceSet.wavemax, "");
            FitsSupport.writeMeta(xt.getHeader(), traceSet.getMeta());
            hdus.add(xt);
            hdus.add(FitsSupport.imageHdu(traceSet.getYCoef(), "YTRACE"));
            if (traceSet.getXsigCoef() != null) hdus.add(FitsSupport.imageHdu(traceSet.getXsigCoef(), "XSIG"));
            if (traceSet.getYsigCoef() != null) hdus.add(FitsSupport.imageHdu(traceSet.getYsigCoef(), "YSIG"));
        } catch (FitsException e) {
            throw new IOException("no se pudo preparar " + file + ": " + e.getMessage(), e);
        }
        FitsSupport.write(file, hdus);
    }
}
