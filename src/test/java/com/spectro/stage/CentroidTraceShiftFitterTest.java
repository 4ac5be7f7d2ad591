package com.spectro.stage;

import com.spectro.TestData;
import com.spectro.model.Image;
import com.spectro.model.TraceSet;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class CentroidTraceShiftFitterTest {

    @Test
    void shiftsTracesOntoTheObservedCentroid() {
        Image image = TestData.image(0, "b1", null);
        for (int y = 0; y < TestData.NY; y++) {
            for (int x : new int[]{6, 16, 26}) image.pix[y][x] = 100;
        }
        TraceSet tset = TestData.traceSet(3);

        TraceSet out = new CentroidTraceShiftFitter(5, 3, 10).fit(image, tset);

        assertEquals(6.0, out.x(0, 5500), 1e-9);
        assertEquals(26.0, out.x(2, 5100), 1e-9);
        assertEquals(1.0, (Double) out.getMeta().get("MEDDX"), 1e-9);
        assertEquals(12L, out.getMeta().get("NDXFIT"));
        assertEquals(5.0, tset.x(0, 5500), 1e-9);
    }

    @Test
    void keepsTracesWithoutSignal() {
        Image image = TestData.image(3, "b1", null);

        TraceSet out = new CentroidTraceShiftFitter().fit(image, TestData.traceSet(3));

        assertEquals(5.0, out.x(0, 5500), 1e-9);
        assertEquals(0L, out.getMeta().get("NDXFIT"));
    }
}
