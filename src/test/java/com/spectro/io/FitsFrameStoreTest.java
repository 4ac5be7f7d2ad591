package com.spectro.io;

import com.spectro.TestData;
import com.spectro.model.Frame;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import java.io.File;
import java.io.IOException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FitsFrameStoreTest {

    @TempDir
    Path tmp;

    private final FitsFrameStore store = new FitsFrameStore();

    @Test
    void framesKeepFibersArraysAndHeader() throws IOException {
        Frame frame = TestData.frame(new int[]{500, 501, 502}, new double[]{1.5, 2.5, 3.5}, 8);
        frame.ivar[1][3] = 0;
        frame.meta().put("FLAVOR", "SCIENCE");
        frame.meta().put("NIGHT", 20200315L);
        frame.meta().put("EXPTIME", 900.5);
        frame.meta().put("lowercase key", "skipped");
        File file = tmp.resolve("sub/qframe-b1-00000042.fits").toFile();

        store.write(file, frame);
        Frame back = store.read(file);

        assertArrayEquals(new int[]{500, 501, 502}, back.fibers);
        assertArrayEquals(frame.wave[2], back.wave[2], 0);
        assertArrayEquals(frame.flux[1], back.flux[1], 0);
        assertEquals(0, back.ivar[1][3]);
        assertEquals("SCIENCE", back.getMeta().get("FLAVOR"));
        assertEquals(20200315L, back.getMeta().get("NIGHT"));
        assertEquals(900.5, (Double) back.getMeta().get("EXPTIME"), 1e-12);
        assertFalse(back.getMeta().containsKey("lowercase key"));
    }

    @Test
    void missingFileIsAnIoError() {
        assertThrows(IOException.class, () -> store.read(tmp.resolve("nope.fits").toFile()));
    }
}
