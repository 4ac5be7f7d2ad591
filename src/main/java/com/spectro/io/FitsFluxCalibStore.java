package com.spectro.io;

import com.spectro.model.FluxCalibCurve;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

// Calibración promedio: AVGCALIB (con AIRMASS y SEEING de pivote), WAVELENGTH y,
// si existen, ATMEXT (extinción, mag por masa de aire) y SEETERM (mag por segundo de arco).
public class FitsFluxCalibStore implements FluxCalibStore {

    @Override
    public FluxCalibCurve read(File file) throws IOException {
        return FitsSupport.read(file, hdus -> {
            BasicHDU<?> calib = FitsSupport.require(hdus, "AVGCALIB", file);
            BasicHDU<?> wave = FitsSupport.require(hdus, "WAVELENGTH", file);
            BasicHDU<?> ext = FitsSupport.find(hdus, "ATMEXT");
            BasicHDU<?> see = FitsSupport.find(hdus, "SEETERM");
            Header h = calib.getHeader();
            return new FluxCalibCurve(FitsSupport.toDouble1D(wave.getKernel()),
                    FitsSupport.toDouble1D(calib.getKernel()),
                    ext == null ? null : FitsSupport.toDouble1D(ext.getKernel()),
                    see == null ? null : FitsSupport.toDouble1D(see.getKernel()),
                    h.getDoubleValue("AIRMASS", FluxCalibCurve.DEFAULT_PIVOT_AIRMASS),
                    h.getDoubleValue("SEEING", FluxCalibCurve.DEFAULT_PIVOT_SEEING));
        });
    }

    @Override
    public void write(File file, FluxCalibCurve curve) throws IOException {
        List<BasicHDU<?>> hdus = new ArrayList<>();
        try {
            BasicHDU<?> calib = FitsSupport.imageHdu(curve.averageCalib, "AVGCALIB");
            calib.getHeader().addValue("AIRMASS", curve.pivotAirmass, "");
            calib.getHeader().addValue("SEEING", curve.pivotSeeing, "");
            hdus.add(calib);
            hdus.add(FitsSupport.imageHdu(curve.wave, "WAVELENGTH"));
            if (curve.atmosphericExtinction != null) hdus.add(FitsSupport.imageHdu(curve.atmosphericExtinction, "ATMEXT"));
            if (curve.seeingTerm != null) hdus.add(FitsSupport.imageHdu(curve.seeingTerm, "SEETERM"));
        } catch (FitsException e) {
            throw new IOException("no se pudo preparar " + file + ": " + e.getMessage(), e);
        }
        FitsSupport.write(file, hdus);
    }
}
