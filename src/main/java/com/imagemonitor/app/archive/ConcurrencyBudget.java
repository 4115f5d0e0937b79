package com.imagemonitor.app.archive;

import com.imagemonitor.app.config.ScanSettings.StorageProfile;

/**
 * Heurísticas de paralelismo e lote. Todas recebem o número de processadores
 * para serem determinísticas em teste.
 */
public final class ConcurrencyBudget {

    private static final long MB = 1024L * 1024L;

    public static final int MIN_ENTRY_CONCURRENCY = 2;
    public static final int MAX_ENTRY_CONCURRENCY = 16;

    private ConcurrencyBudget() {}

    public static int processors() {
        return Runtime.getRuntime().availableProcessors();
    }

    /**
     * Paralelismo por entrada dentro de um arquivo: muitos itens ou arquivos grandes reduzem o paralelismo.
     */
    public static int entryConcurrency(int imageCount, long archiveBytes, int processors) {
        int base = Math.max(1, processors);
        int c;
        if (imageCount < 50) c = Math.min(base * 2, MAX_ENTRY_CONCURRENCY);
        else if (imageCount < 200) c = base;
        else if (imageCount < 500) c = Math.max(base / 2, 4);
        else c = Math.max(base / 4, 2);

        if (archiveBytes > 500 * MB) c = Math.max(c / 2, 2);
        else if (archiveBytes > 100 * MB) c = Math.max(c * 3 / 4, 3);

        return clamp(c, MIN_ENTRY_CONCURRENCY, MAX_ENTRY_CONCURRENCY);
    }

    public static int batchSize(StorageProfile profile, int archiveCount, long totalBytes, int processors) {
        return profile == StorageProfile.SSD
                ? ssdBatchSize(archiveCount, totalBytes, processors)
                : hddBatchSize(archiveCount, totalBytes, processors);
    }

    /** Disco mecânico: lotes pequenos, leitura sequencial primeiro. */
    public static int hddBatchSize(int archiveCount, long totalBytes, int processors) {
        if (archiveCount <= 0) return 1;
        int hddOptimal = Math.max(processors / 2, 2);
        long totalMb = totalBytes / MB;

        int batch;
        if (totalMb < 50) batch = archiveCount;
        else if (totalMb < 200) batch = Math.max(hddOptimal, 2);
        else if (totalMb < 1000) batch = 2;
        else batch = 1;

        if (archiveCount <= 3) batch = 1;
        return clamp(batch, 1, archiveCount);
    }

    public static int ssdBatchSize(int archiveCount, long totalBytes, int processors) {
        if (archiveCount <= 0) return 1;
        int base = Math.max(1, processors);
        long totalMb = totalBytes / MB;

        int batch;
        if (totalMb < 100) batch = Math.min(archiveCount, base * 3);
        else if (totalMb < 500) batch = Math.min(archiveCount, base * 2);
        else if (totalMb < 2000) batch = Math.min(archiveCount, base);
        else batch = Math.min(archiveCount, Math.max(base / 2, 2));

        if (archiveCount <= 5) batch = archiveCount;
        return Math.max(1, batch);
    }

    /** Pausa entre lotes, proporcional ao volume total. SSD não descansa. */
    public static long restMillis(StorageProfile profile, long totalBytes) {
        if (profile == StorageProfile.SSD) return 0;
        long totalMb = totalBytes / MB;
        if (totalMb > 1000) return 200;
        if (totalMb > 500) return 100;
        if (totalMb > 100) return 50;
        return 0;
    }

    /**
     * Quantos arquivos do lote abrem ao mesmo tempo. No HDD nunca mais de 2.
     */
    public static int batchParallelism(StorageProfile profile, int batchCount, int processors, int maxConcurrentScans) {
        int limit = Math.max(1, maxConcurrentScans);
        if (profile == StorageProfile.SSD) {
            return clamp(Math.min(batchCount, limit), 1, limit);
        }
        int c = Math.min(Math.min(batchCount, processors / 2), 2);
        return clamp(Math.min(c, limit), 1, 2);
    }

    private static int clamp(int v, int min, int max) {
        return Math.max(min, Math.min(max, v));
    }
}
