package com.imagemonitor.app.scan;

import java.io.IOException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.imagemonitor.app.archive.ArchiveBatchProcessor;
import com.imagemonitor.app.archive.ArchiveBatchProcessor.Outcome;
import com.imagemonitor.app.archive.ConcurrencyBudget;
import com.imagemonitor.app.config.ScanSettings;
import com.imagemonitor.app.database.Database.ImageRecord;
import com.imagemonitor.app.database.Database.ScanHistoryRecord;
import com.imagemonitor.app.database.ItemIds;
import com.imagemonitor.app.database.PersistenceGateway;
import com.imagemonitor.app.metadata.ImageMetadata;
import com.imagemonitor.app.metadata.MetadataCache;
import com.imagemonitor.app.metadata.MetadataExtractor;
import com.imagemonitor.app.thumbnail.ThumbnailService;

/**
 * Orquestra um scan: descobre arquivos, despacha arquivos compactados em lotes
 * pensados para HDD e grava imagens avulsas em streaming.
 *
 * <p>Cancelamento é cooperativo: verificado entre arquivos e entre lotes. O que já começou
 * termina, e então {@link CancellationException} sobe para o chamador.
 */
public final class DirectoryScanner {

    private static final Logger logger = LoggerFactory.getLogger(DirectoryScanner.class);

    static final int WRITER_QUEUE_CAPACITY = 1000;

    public record ScanProgress(
            String currentFileName,
            long processedCount,
            long totalCount,
            String message,
            boolean isCompleted
    ) {}

    public static final class ScanMetrics {
        public final LongAdder filesFound = new LongAdder();
        public final LongAdder archivesProcessed = new LongAdder();
        public final LongAdder archivesSkipped = new LongAdder();
        public final LongAdder imagesProcessed = new LongAdder();
        public final LongAdder itemsInserted = new LongAdder();
        public final LongAdder errors = new LongAdder();
        public final AtomicBoolean running = new AtomicBoolean(false);
        public final Instant start = Instant.now();

        public String summary(long elapsedMs) {
            return String.format("Scan finished: %d files found, %d archives persisted, %d archives skipped, "
                            + "%d images, %d inserted, %d errors in %.1fs",
                    filesFound.sum(), archivesProcessed.sum(), archivesSkipped.sum(),
                    imagesProcessed.sum(), itemsInserted.sum(), errors.sum(), elapsedMs / 1000.0);
        }
    }

    /** Arquivos candidatos de um diretório configurado. */
    record Candidates(Path root, List<Path> images, List<Path> archives, long archiveBytes) {
        int total() {
            return images.size() + archives.size();
        }
    }

    private final ScanSettings settings;
    private final EntryValidator validator;
    private final MetadataExtractor extractor;
    private final MetadataCache cache;
    private final ThumbnailService thumbnails;
    private final ArchiveBatchProcessor archives;
    private final PersistenceGateway gateway;
    private final Clock clock;
    private final int processors;

    private volatile ScanMetrics lastMetrics = new ScanMetrics();

    public DirectoryScanner(
            ScanSettings settings,
            EntryValidator validator,
            MetadataExtractor extractor,
            MetadataCache cache,
            ThumbnailService thumbnails,
            ArchiveBatchProcessor archives,
            PersistenceGateway gateway,
            Clock clock
    ) {
        this.settings = settings;
        this.validator = validator;
        this.extractor = extractor;
        this.cache = cache;
        this.thumbnails = thumbnails;
        this.archives = archives;
        this.gateway = gateway;
        this.clock = clock;
        this.processors = ConcurrencyBudget.processors();
    }

    public ScanMetrics lastMetrics() {
        return lastMetrics;
    }

    /**
     * Scans every directory and appends one history row per directory.
     *
     * @return number of files processed (persisted, skipped or failed)
     * @throws CancellationException when {@code cancel} is observed
     */
    public int scan(List<Path> directories, String scanType, Consumer<ScanProgress> progress, AtomicBoolean cancel) {
        ScanMetrics metrics = new ScanMetrics();
        lastMetrics = metrics;
        metrics.running.set(true);
        Consumer<ScanProgress> sink = progress == null ? p -> { } : progress;
        long started = System.nanoTime();

        try {
            // Fase 1: descoberta
            Map<Path, Candidates> found = new LinkedHashMap<>();
            for (Path dir : directories) {
                checkCancel(cancel);
                Path root = dir.toAbsolutePath().normalize();
                if (!Files.isDirectory(root)) {
                    logger.warn("Skipping missing scan directory {}", root);
                    continue;
                }
                found.put(root, discover(root, metrics, cancel));
            }
            checkCancel(cancel);

            long total = 0;
            for (Candidates c : found.values()) total += c.total();
            logger.info("Discovered {} candidate files in {} directories", total, found.size());

            // Fase 2: processamento por diretório
            Progress tracker = new Progress(sink, total);
            int processed = 0;
            for (Candidates c : found.values()) {
                processed += scanDirectory(c, scanType, metrics, tracker, cancel);
            }

            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
            String summary = metrics.summary(elapsedMs);
            logger.info(summary);
            sink.accept(new ScanProgress("", processed, total, summary, true));
            return processed;
        } finally {
            metrics.running.set(false);
        }
    }

    private int scanDirectory(Candidates c, String scanType, ScanMetrics metrics, Progress tracker, AtomicBoolean cancel) {
        long scanMillis = clock.millis();
        long started = System.nanoTime();
        logger.info("Scanning {} ({} archives, {} images)", c.root(), c.archives().size(), c.images().size());

        int[] archiveCounts = processArchives(c, metrics, tracker, cancel);
        int[] imageCounts = processImages(c, metrics, tracker, cancel);

        int processed = archiveCounts[0] + imageCounts[0];
        int inserted = archiveCounts[1] + imageCounts[1];
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        gateway.insertScanHistory(new ScanHistoryRecord(
                ItemIds.scanHistoryId(c.root().toString(), scanMillis),
                c.root().toString(),
                scanMillis,
                c.total(),
                processed,
                inserted,
                elapsedMs,
                scanType
        ));
        logger.info("{} scan of {}: {} processed, {} inserted in {}ms", scanType, c.root(), processed, inserted, elapsedMs);
        return processed;
    }

    // --- descoberta ---

    Candidates discover(Path root, ScanMetrics metrics, AtomicBoolean cancel) {
        List<Path> images = new ArrayList<>();
        List<Path> archiveFiles = new ArrayList<>();
        long[] archiveBytes = {0};

        try {
            Files.walkFileTree(root, EnumSet.noneOf(FileVisitOption.class), Integer.MAX_VALUE, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (cancel.get()) return FileVisitResult.TERMINATE;
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (cancel.get()) return FileVisitResult.TERMINATE;
                    if (!attrs.isRegularFile()) return FileVisitResult.CONTINUE;

                    String name = file.getFileName().toString();
                    if (validator.isArchivePath(name)) {
                        if (validator.isValidArchiveFile(name, attrs.size())) {
                            archiveFiles.add(file);
                            archiveBytes[0] += attrs.size();
                            metrics.filesFound.increment();
                        }
                    } else if (validator.isImagePath(name)) {
                        if (validator.isValidImageFile(name, attrs.size())) {
                            images.add(file);
                            metrics.filesFound.increment();
                        }
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    metrics.errors.increment();
                    logger.debug("Cannot read {}: {}", file, exc.toString());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            metrics.errors.increment();
            logger.warn("Directory walk failed for {}: {}", root, e.toString());
        }
        return new Candidates(root, images, archiveFiles, archiveBytes[0]);
    }

    // --- arquivos compactados ---

    /** @return {processed, inserted} */
    private int[] processArchives(Candidates c, ScanMetrics metrics, Progress tracker, AtomicBoolean cancel) {
        List<Path> sorted = new ArrayList<>(c.archives());
        if (sorted.isEmpty()) return new int[] {0, 0};
        sorted.sort(Comparator.comparingLong(DirectoryScanner::sizeOf));

        ScanSettings.StorageProfile profile = settings.storageProfile();
        int batchSize = ConcurrencyBudget.batchSize(profile, sorted.size(), c.archiveBytes(), processors);
        long rest = ConcurrencyBudget.restMillis(profile, c.archiveBytes());
        int parallelism = ConcurrencyBudget.batchParallelism(profile, batchSize, processors, settings.maxConcurrentScans());
        int batches = (sorted.size() + batchSize - 1) / batchSize;
        logger.info("Archive plan for {}: {} archives, {}MB, {} batches of {} ({} parallel, {}ms rest, {})",
                c.root(), sorted.size(), c.archiveBytes() / (1024 * 1024), batches, batchSize, parallelism, rest, profile);

        AtomicInteger processed = new AtomicInteger();
        AtomicInteger inserted = new AtomicInteger();

        // limite fixo para a sessão inteira
        ExecutorService pool = Executors.newFixedThreadPool(parallelism, namedFactory("archive-scan-"));
        try {
            for (int b = 0; b < batches; b++) {
                checkCancel(cancel);
                List<Path> batch = sorted.subList(b * batchSize, Math.min(sorted.size(), (b + 1) * batchSize));
                logger.debug("Batch {}/{}: {} archives", b + 1, batches, batch.size());

                List<Future<Outcome>> futures = new ArrayList<>(batch.size());
                for (Path archive : batch) {
                    futures.add(pool.submit(() -> {
                        if (cancel.get()) return null;
                        return archives.process(archive, cancel);
                    }));
                }
                for (Future<Outcome> f : futures) {
                    Outcome outcome = await(f);
                    if (outcome == null) continue;
                    processed.incrementAndGet();
                    if (outcome.persisted()) {
                        metrics.archivesProcessed.increment();
                        if (outcome.inserted()) {
                            inserted.incrementAndGet();
                            metrics.itemsInserted.increment();
                        }
                    } else {
                        metrics.archivesSkipped.increment();
                        if (outcome.status() == ArchiveBatchProcessor.Status.FAILED) metrics.errors.increment();
                    }
                    tracker.advance(outcome.archive().getFileName().toString(), describe(outcome));
                }

                if (rest > 0 && b + 1 < batches) {
                    sleep(rest);
                }
            }
            checkCancel(cancel);
        } finally {
            pool.shutdown();
        }
        return new int[] {processed.get(), inserted.get()};
    }

    private static Outcome await(Future<Outcome> f) {
        try {
            return f.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for archive batch");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new IllegalStateException("Archive task failed", cause);
        }
    }

    private static String describe(Outcome o) {
        return switch (o.status()) {
            case PERSISTED -> o.inserted() ? "Added archive" : "Updated archive";
            case BELOW_THRESHOLD -> "Skipped: image ratio below threshold";
            case TOO_MANY_ENTRIES -> "Skipped: too many entries";
            case NO_IMAGES -> "Skipped: no images";
            case FAILED -> "Failed to read archive";
        };
    }

    // --- imagens avulsas ---

    /** @return {processed, inserted} */
    private int[] processImages(Candidates c, ScanMetrics metrics, Progress tracker, AtomicBoolean cancel) {
        if (c.images().isEmpty()) return new int[] {0, 0};

        if (settings.archivesOnly()) {
            for (Path image : c.images()) {
                checkCancel(cancel);
                tracker.advance(image.getFileName().toString(), "Skipped (archives only)");
            }
            return new int[] {c.images().size(), 0};
        }

        int processed = 0;
        int inserted;
        try (ImageWriter writer = new ImageWriter(gateway, WRITER_QUEUE_CAPACITY)) {
            for (Path image : c.images()) {
                checkCancel(cancel);
                ImageRecord record = imageRecord(image, metrics);
                if (record != null) {
                    writer.add(record);
                    metrics.imagesProcessed.increment();
                }
                processed++;
                tracker.advance(image.getFileName().toString(), record == null ? "Failed to read image" : "Indexed image");
            }
            inserted = writer.finish();
        }
        metrics.itemsInserted.add(inserted);
        return new int[] {processed, inserted};
    }

    private ImageRecord imageRecord(Path image, ScanMetrics metrics) {
        Path abs = image.toAbsolutePath().normalize();
        BasicFileAttributes attrs;
        try {
            attrs = Files.readAttributes(abs, BasicFileAttributes.class);
        } catch (IOException e) {
            metrics.errors.increment();
            logger.warn("Cannot stat image {}: {}", abs, e.toString());
            return null;
        }

        String key = MetadataCache.key(abs.toString(), attrs.size(), attrs.lastModifiedTime().toMillis());
        ImageMetadata meta = cache.getOrCompute(key, () -> extractor.extract(abs));

        String thumb = null;
        if (settings.generateArchiveThumbnails()) {
            thumb = thumbnails.getOrCreate(abs, settings.thumbnailSize(), false).map(Path::toString).orElse(null);
        }

        Long taken = meta.captureDate() == null
                ? null
                : meta.captureDate().atZone(ZoneId.systemDefault()).toInstant().toEpochMilli();
        Path parent = abs.getParent();
        return new ImageRecord(
                ItemIds.imageId(abs.toString()),
                abs.toString(),
                parent == null ? "" : parent.toString(),
                abs.getFileName().toString(),
                attrs.size(),
                meta.width(),
                meta.height(),
                meta.format(),
                meta.hasCaptureDate(),
                taken,
                thumb,
                attrs.creationTime().toMillis(),
                attrs.lastModifiedTime().toMillis(),
                clock.millis()
        );
    }

    // --- utilitários ---

    /** Serializa o callback: arquivos terminam em várias threads. */
    private static final class Progress {
        private final Consumer<ScanProgress> sink;
        private final long total;
        private long processed;

        Progress(Consumer<ScanProgress> sink, long total) {
            this.sink = sink;
            this.total = total;
        }

        synchronized void advance(String fileName, String message) {
            processed++;
            try {
                sink.accept(new ScanProgress(fileName, processed, total, message, false));
            } catch (RuntimeException e) {
                logger.warn("Progress callback failed", e);
            }
        }
    }

    private static void checkCancel(AtomicBoolean cancel) {
        if (cancel.get()) throw new CancellationException("Scan cancelled");
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted between batches");
        }
    }

    private static long sizeOf(Path p) {
        try {
            return Files.size(p);
        } catch (IOException e) {
            return Long.MAX_VALUE;
        }
    }

    private static ThreadFactory namedFactory(String prefix) {
        return new ThreadFactory() {
            private final ThreadFactory base = Executors.defaultThreadFactory();
            private final AtomicInteger seq = new AtomicInteger(1);
            @Override public Thread newThread(Runnable r) {
                Thread t = base.newThread(r);
                t.setName(prefix + seq.getAndIncrement());
                t.setDaemon(true);
                return t;
            }
        };
    }
}
