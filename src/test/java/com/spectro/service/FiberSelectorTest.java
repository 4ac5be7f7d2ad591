package com.spectro.service;

import com.spectro.TestData;
import com.spectro.model.Frame;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FiberSelectorTest {

    private final FiberSelector selector = new FiberSelector();

    @Test
    void parsesRangesWithExclusiveUpperBound() {
        assertArrayEquals(new int[]{0, 1, 2, 7}, FiberSelector.parseFibers("0:3, 7"));
        assertArrayEquals(new int[]{5, 3}, FiberSelector.parseFibers("5,3,5"));
        assertNull(FiberSelector.parseFibers("  "));
        assertNull(FiberSelector.parseFibers(null));
    }

    @Test
    void rejectsMalformedFilters() {
        assertThrows(IllegalArgumentException.class, () -> FiberSelector.parseFibers("a"));
        assertThrows(IllegalArgumentException.class, () -> FiberSelector.parseFibers("5:3"));
        assertThrows(IllegalArgumentException.class, () -> FiberSelector.parseFibers(","));
    }

    @Test
    void selectionFollowsFrameOrder() throws Exception {
        Frame frame = TestData.frame(new int[]{1, 2, 3, 4, 5}, new double[]{1, 2, 3, 4, 5}, 3);

        Frame out = selector.select(frame, new int[]{5, 3});

        assertArrayEquals(new int[]{3, 5}, out.fibers);
        assertEquals(3, out.flux[0][0]);
        assertEquals(5, out.flux[1][2]);
    }

    @Test
    void noMatchingFiberIsASelectionFailure() {
        Frame frame = TestData.frame(new int[]{1, 2, 3, 4, 5}, new double[]{1, 2, 3, 4, 5}, 3);

        ReductionException e = assertThrows(ReductionException.class, () -> selector.select(frame, new int[]{40, 41}));

        assertEquals(ReductionFailure.SELECTION, e.getFailure());
        assertEquals(15, e.getExitCode());
        assertTrue(e.getMessage().contains("[1:6]"));
    }
}
