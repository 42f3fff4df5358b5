package edu.harvard.hms.dbmi.avillach.gvcf.etl.genotype;

import com.google.common.base.Ticker;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class AdaptiveBatchSizerTest {

    private final AtomicLong nanos = new AtomicLong();

    private final Ticker ticker = new Ticker() {
        @Override
        public long read() {
            return nanos.get();
        }
    };

    private void advance(long seconds) {
        nanos.addAndGet(TimeUnit.SECONDS.toNanos(seconds));
    }

    @Test
    public void fixedSizeNeverChanges() {
        AdaptiveBatchSizer sizer = AdaptiveBatchSizer.fixed(500);
        assertFalse(sizer.isAdaptive());
        for (int i = 0; i < 50; i++) {
            assertEquals(500, sizer.getAsInt());
        }
    }

    @Test
    public void fixedSizeMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> AdaptiveBatchSizer.fixed(0));
        assertThrows(IllegalArgumentException.class, () -> AdaptiveBatchSizer.adaptive(0));
    }

    @Test
    public void forConfig() {
        assertTrue(AdaptiveBatchSizer.forConfig(0, 4).isAdaptive());
        assertEquals(AdaptiveBatchSizer.INITIAL_SIZE, AdaptiveBatchSizer.forConfig(0, 4).getAsInt());
        assertFalse(AdaptiveBatchSizer.forConfig(1000, 4).isAdaptive());
        assertEquals(1000, AdaptiveBatchSizer.forConfig(1000, 4).getAsInt());
    }

    @Test
    public void firstRoundIsNotUsed() {
        AdaptiveBatchSizer sizer = AdaptiveBatchSizer.adaptive(2, ticker);
        advance(5000);
        assertEquals(20000, sizer.getAsInt());
        assertEquals(20000, sizer.getAsInt());
        advance(5000);
        assertEquals(20000, sizer.getAsInt());
    }

    @Test
    public void fastRoundGrowsSlowRoundShrinks() {
        AdaptiveBatchSizer sizer = AdaptiveBatchSizer.adaptive(2, ticker);
        sizer.getAsInt();
        sizer.getAsInt();

        advance(10);
        assertEquals(20000, sizer.getAsInt());
        int grown = (int) (1.2 * 20000 * 120 / 11);
        assertEquals(grown, sizer.getAsInt());
        assertTrue(grown > 20000);

        advance(1000);
        assertEquals(grown, sizer.getAsInt());
        int shrunk = (int) (grown * 600.0 / 1000 / 1.2);
        assertEquals(shrunk, sizer.getAsInt());
        assertTrue(shrunk < grown);

        advance(300);
        sizer.getAsInt();
        assertEquals(shrunk, sizer.getAsInt());
    }

    @Test
    public void onlyEveryWorkersBatches() {
        AdaptiveBatchSizer sizer = AdaptiveBatchSizer.adaptive(3, ticker);
        for (int i = 0; i < 3; i++) {
            sizer.getAsInt();
        }
        advance(1);
        assertEquals(20000, sizer.getAsInt());
        assertEquals(20000, sizer.getAsInt());
        assertEquals((int) (1.2 * 20000 * 120 / 2), sizer.getAsInt());
    }
}
