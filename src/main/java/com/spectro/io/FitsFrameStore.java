package com.spectro.io;

import com.spectro.model.Frame;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.FitsException;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

public class FitsFrameStore implements FrameStore {

    @Override
    public Frame read(File file) throws IOException {
        return FitsSupport.read(file, hdus -> {
            BasicHDU<?> flux = FitsSupport.require(hdus, "FLUX", file);
            BasicHDU<?> ivar = FitsSupport.require(hdus, "IVAR", file);
            BasicHDU<?> wave = FitsSupport.require(hdus, "WAVELENGTH", file);
            BasicHDU<?> fibers = FitsSupport.find(hdus, "FIBERS");
            return new Frame(FitsSupport.toDouble2D(wave.getKernel()),
                    FitsSupport.toDouble2D(flux.getKernel()),
                    FitsSupport.toDouble2D(ivar.getKernel()),
                    fibers == null ? null : FitsSupport.toInt1D(fibers.getKernel()),
                    FitsSupport.readMeta(flux.getHeader()));
        });
    }

    @Override
    public void write(File file, Frame frame) throws IOException {
        frame.checkShape();
        List<BasicHDU<?>> hdus = new ArrayList<>();
        try {
            BasicHDU<?> flux = FitsSupport.imageHdu(frame.flux, "FLUX");
            FitsSupport.writeMeta(flux.getHeader(), frame.getMeta());
            hdus.add(flux);
            hdus.add(FitsSupport.imageHdu(frame.ivar, "IVAR"));
            hdus.add(FitsSupport.imageHdu(frame.wave, "WAVELENGTH"));
            hdus.add(FitsSupport.imageHdu(frame.fibers, "FIBERS"));
        } catch (FitsException e) {
            throw new IOException("no se pudo preparar " + file + ": " + e.getMessage(), e);
        }
        FitsSupport.write(file, hdus);
    }
}
