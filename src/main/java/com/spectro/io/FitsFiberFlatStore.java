package com.spectro.io;

import com.spectro.model.FiberFlat;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.FitsException;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class FitsFiberFlatStore implements FiberFlatStore {

    @Override
    public FiberFlat read(File file) throws IOException {
        return FitsSupport.read(file, hdus -> {
            BasicHDU<?> flat = FitsSupport.require(hdus, "FIBERFLAT", file);
            BasicHDU<?> ivar = FitsSupport.require(hdus, "IVAR", file);
            BasicHDU<?> wave = FitsSupport.require(hdus, "WAVELENGTH", file);
            BasicHDU<?> fibers = FitsSupport.require(hdus, "FIBERS", file);
            return new FiberFlat(FitsSupport.toDouble2D(wave.getKernel()),
                    FitsSupport.toDouble2D(flat.getKernel()),
                    FitsSupport.toDouble2D(ivar.getKernel()),
                    FitsSupport.toInt1D(fibers.getKernel()),
                    FitsSupport.readMeta(flat.getHeader()));
        });
    }

    @Override
    public void write(File file, FiberFlat flat, Map<String, Object> header) throws IOException {
        Map<String, Object> meta = new LinkedHashMap<>();
        if (header != null) meta.putAll(header);
        for (Map.Entry<String, Object> e : flat.meta.entrySet()) meta.putIfAbsent(e.getKey(), e.getValue());

        List<BasicHDU<?>> hdus = new ArrayList<>();
        try {
            BasicHDU<?> f = FitsSupport.imageHdu(flat.fiberflat, "FIBERFLAT");
            FitsSupport.writeMeta(f.getHeader(), meta);
            hdus.add(f);
            hdus.add(FitsSupport.imageHdu(flat.ivar, "IVAR"));
            hdus.add(FitsSupport.imageHdu(flat.wave, "WAVELENGTH"));
            hdus.add(FitsSupport.imageHdu(flat.fibers, "FIBERS"));
        } catch (FitsException e) {
            throw new IOException("no se pudo preparar " + file + ": " + e.getMessage(), e);
        }
        FitsSupport.write(file, hdus);
    }
}
