package com.imagemonitor.app.archive;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.imagemonitor.app.config.ScanSettings.StorageProfile;

public class ConcurrencyBudgetTest {

    private static final long MB = 1024L * 1024L;

    @Test
    void entryConcurrency_staysWithinBounds() {
        for (int images : new int[] {1, 49, 50, 199, 200, 499, 500, 5000}) {
            for (long bytes : new long[] {MB, 150 * MB, 600 * MB}) {
                for (int cpus : new int[] {1, 4, 32}) {
                    int c = ConcurrencyBudget.entryConcurrency(images, bytes, cpus);
                    assertTrue(c >= ConcurrencyBudget.MIN_ENTRY_CONCURRENCY && c <= ConcurrencyBudget.MAX_ENTRY_CONCURRENCY,
                            images + "/" + bytes + "/" + cpus + " -> " + c);
                }
            }
        }
    }

    @Test
    void entryConcurrency_shrinksForLargeArchives() {
        int small = ConcurrencyBudget.entryConcurrency(10, MB, 8);
        int large = ConcurrencyBudget.entryConcurrency(10, 600 * MB, 8);
        assertEquals(16, small);
        assertEquals(8, large);
    }

    @Test
    void hddBatchSize_isOneForFewOrHugeArchives() {
        assertEquals(1, ConcurrencyBudget.hddBatchSize(3, MB, 8));
        assertEquals(1, ConcurrencyBudget.hddBatchSize(20, 2000 * MB, 8));
        assertEquals(20, ConcurrencyBudget.hddBatchSize(20, 10 * MB, 8));
        assertEquals(2, ConcurrencyBudget.hddBatchSize(20, 500 * MB, 8));
    }

    @Test
    void ssdBatchSize_takesAllWhenFew() {
        assertEquals(5, ConcurrencyBudget.ssdBatchSize(5, 5000 * MB, 8));
        assertEquals(24, ConcurrencyBudget.ssdBatchSize(100, 10 * MB, 8));
    }

    @Test
    void restAndParallelism_dependOnProfile() {
        assertEquals(0, ConcurrencyBudget.restMillis(StorageProfile.SSD, 5000 * MB));
        assertEquals(200, ConcurrencyBudget.restMillis(StorageProfile.HDD, 5000 * MB));
        assertEquals(0, ConcurrencyBudget.restMillis(StorageProfile.HDD, 10 * MB));

        assertEquals(2, ConcurrencyBudget.batchParallelism(StorageProfile.HDD, 10, 16, 8));
        assertEquals(1, ConcurrencyBudget.batchParallelism(StorageProfile.HDD, 10, 1, 8));
        assertEquals(4, ConcurrencyBudget.batchParallelism(StorageProfile.SSD, 10, 16, 4));
    }
}
