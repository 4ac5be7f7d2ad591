package com.spectro.io;

import com.spectro.model.Fibermap;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.TableHDU;
import java.io.File;
import java.io.IOException;

public class FitsFibermapReader implements FibermapReader {

    @Override
    public Fibermap read(File file) throws IOException {
        return FitsSupport.read(file, hdus -> {
            BasicHDU<?> hdu = FitsSupport.find(hdus, "FIBERMAP");
            if (hdu == null && hdus.length > 1) hdu = hdus[1];
            if (!(hdu instanceof TableHDU)) throw new IOException("no hay tabla FIBERMAP en " + file);
            TableHDU<?> table = (TableHDU<?>) hdu;

            int fiberCol = table.findColumn("FIBER");
            int typeCol = table.findColumn("OBJTYPE");
            if (fiberCol < 0 || typeCol < 0) throw new IOException("FIBERMAP sin columnas FIBER/OBJTYPE en " + file);

            int[] fibers = FitsSupport.toInt1D(table.getColumn(fiberCol));
            Object types = table.getColumn(typeCol);
            String[] objtype = new String[fibers.length];
            if (types instanceof String[]) {
                String[] s = (String[]) types;
                for (int i = 0; i < objtype.length; i++) objtype[i] = s[i] == null ? "" : s[i].trim();
            } else {
                throw new IOException("columna OBJTYPE no es texto en " + file);
            }
            return new Fibermap(fibers, objtype);
        });
    }
}
