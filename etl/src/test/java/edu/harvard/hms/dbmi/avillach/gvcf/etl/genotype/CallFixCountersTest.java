package edu.harvard.hms.dbmi.avillach.gvcf.etl.genotype;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class CallFixCountersTest {

    @Test
    public void concurrentMergesAreNotLost() throws InterruptedException {
        CallFixCounters total = new CallFixCounters();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        for (int batch = 0; batch < 1000; batch++) {
            pool.execute(() -> {
                CallFixCounters perBatch = new CallFixCounters();
                perBatch.incrementFixedToHV();
                perBatch.incrementFixedToHET();
                perBatch.incrementFixedToHET();
                perBatch.incrementFixedDP();
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                total.add(perBatch);
                total.incrementFixedDP();
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(1, TimeUnit.MINUTES));

        assertEquals(1000, total.getFixedToHV());
        assertEquals(2000, total.getFixedToHET());
        assertEquals(2000, total.getFixedDP());
        assertEquals("fixedToHV=1000, fixedToHET=2000, fixedDP=2000", total.toString());
    }
}
