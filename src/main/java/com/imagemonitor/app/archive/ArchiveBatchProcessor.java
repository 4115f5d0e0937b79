package com.imagemonitor.app.archive;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.imagemonitor.app.config.ScanSettings;
import com.imagemonitor.app.database.Database.ArchiveEntryRecord;
import com.imagemonitor.app.database.Database.ArchiveRecord;
import com.imagemonitor.app.database.ItemIds;
import com.imagemonitor.app.database.PersistenceGateway;
import com.imagemonitor.app.metadata.ImageMetadata;
import com.imagemonitor.app.metadata.MetadataCache;
import com.imagemonitor.app.metadata.MetadataExtractor;
import com.imagemonitor.app.scan.EntryValidator;
import com.imagemonitor.app.thumbnail.ThumbnailService;

/**
 * Processa um arquivo compactado: abre uma vez, filtra e ordena as imagens, aplica o limiar
 * de proporção, monta os registros das entradas em paralelo, gera uma miniatura e grava.
 *
 * <p>Falhas por entrada ficam aqui dentro; falha ao abrir afeta só este arquivo.
 */
public final class ArchiveBatchProcessor implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ArchiveBatchProcessor.class);

    public enum Status { PERSISTED, BELOW_THRESHOLD, TOO_MANY_ENTRIES, NO_IMAGES, FAILED }

    /** Resultado de um arquivo. {@code record} só existe quando {@code status == PERSISTED}. */
    public record Outcome(Path archive, Status status, Optional<ArchiveRecord> record, boolean inserted) {
        static Outcome skipped(Path archive, Status status) {
            return new Outcome(archive, status, Optional.empty(), false);
        }

        public boolean persisted() {
            return status == Status.PERSISTED;
        }
    }

    public static final class Metrics {
        public final LongAdder archivesPersisted = new LongAdder();
        public final LongAdder archivesSkipped = new LongAdder();
        public final LongAdder archivesFailed = new LongAdder();
        public final LongAdder entriesProcessed = new LongAdder();
        public final LongAdder entryErrors = new LongAdder();
        public final LongAdder entryTimeouts = new LongAdder();
    }

    private final ScanSettings settings;
    private final EntryValidator validator;
    private final MetadataExtractor extractor;
    private final MetadataCache cache;
    private final ThumbnailService thumbnails;
    private final PersistenceGateway gateway;
    private final int processors;
    private final ExecutorService entryPool;
    private final Metrics metrics = new Metrics();

    public ArchiveBatchProcessor(
            ScanSettings settings,
            EntryValidator validator,
            MetadataExtractor extractor,
            MetadataCache cache,
            ThumbnailService thumbnails,
            PersistenceGateway gateway
    ) {
        this(settings, validator, extractor, cache, thumbnails, gateway, ConcurrencyBudget.processors());
    }

    ArchiveBatchProcessor(
            ScanSettings settings,
            EntryValidator validator,
            MetadataExtractor extractor,
            MetadataCache cache,
            ThumbnailService thumbnails,
            PersistenceGateway gateway,
            int processors
    ) {
        this.settings = settings;
        this.validator = validator;
        this.extractor = extractor;
        this.cache = cache;
        this.thumbnails = thumbnails;
        this.gateway = gateway;
        this.processors = Math.max(1, processors);
        this.entryPool = Executors.newFixedThreadPool(ConcurrencyBudget.MAX_ENTRY_CONCURRENCY, namedFactory("archive-entry-"));
    }

    public Metrics metrics() {
        return metrics;
    }

    /**
     * @return the persisted record, or empty when the archive was skipped or failed
     */
    public Optional<ArchiveRecord> processArchive(Path archive) {
        return process(archive, new AtomicBoolean(false)).record();
    }

    /**
     * Falhas de leitura/decodificação (inclusive unchecked do junrar/commons-compress) viram
     * {@code FAILED} só para este arquivo. Cancelamento e falha do banco propagam.
     */
    public Outcome process(Path archive, AtomicBoolean cancel) {
        Path abs = archive.toAbsolutePath().normalize();
        long started = System.nanoTime();
        Outcome outcome;
        try {
            outcome = inspect(abs, cancel);
        } catch (CancellationException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            metrics.archivesFailed.increment();
            logger.warn("Failed to process archive {}: {}", abs, e.toString());
            return Outcome.skipped(abs, Status.FAILED);
        }

        if (outcome.persisted()) {
            ArchiveRecord record = outcome.record().orElseThrow();
            boolean inserted = gateway.upsertArchive(record);
            outcome = new Outcome(abs, Status.PERSISTED, outcome.record(), inserted);
        }
        switch (outcome.status()) {
            case PERSISTED -> metrics.archivesPersisted.increment();
            case FAILED -> metrics.archivesFailed.increment();
            default -> metrics.archivesSkipped.increment();
        }
        logger.debug("Archive {} -> {} in {}ms", abs.getFileName(), outcome.status(),
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
        return outcome;
    }

    /** Lê e monta o registro; não grava nada. */
    private Outcome inspect(Path archive, AtomicBoolean cancel) throws IOException {
        BasicFileAttributes attrs = Files.readAttributes(archive, BasicFileAttributes.class);

        try (ArchiveReader reader = ArchiveReaders.open(archive)) {
            List<ArchiveEntry> listing = reader.entries();
            int totalFiles = 0;
            for (ArchiveEntry e : listing) {
                if (!e.directory()) totalFiles++;
            }
            if (totalFiles > settings.maxArchiveEntries()) {
                logger.warn("Skipping archive {}: {} entries exceed limit {}", archive, totalFiles, settings.maxArchiveEntries());
                return Outcome.skipped(archive, Status.TOO_MANY_ENTRIES);
            }

            List<ArchiveEntry> images = validator.imageEntries(listing);
            if (images.isEmpty()) {
                logger.debug("No image entries in {}", archive);
                return Outcome.skipped(archive, Status.NO_IMAGES);
            }

            double ratio = (double) images.size() / totalFiles;
            if (ratio < settings.imageRatioThreshold()) {
                logger.debug("Skipping {}: image ratio {} below {}", archive, String.format("%.2f", ratio),
                        settings.imageRatioThreshold());
                return Outcome.skipped(archive, Status.BELOW_THRESHOLD);
            }

            String archiveId = ItemIds.archiveId(archive.toString());
            List<ArchiveEntryRecord> entries = buildEntries(reader, archive, archiveId, images, attrs.size(), cancel);

            String thumb = null;
            if (settings.generateArchiveThumbnails()) {
                thumb = thumbnails.getOrCreate(archive, settings.thumbnailSize(), true)
                        .map(Path::toString)
                        .orElse(null);
            }

            List<ArchiveEntryRecord> stamped = new ArrayList<>(entries.size());
            for (ArchiveEntryRecord e : entries) {
                stamped.add(e.withThumbnail(thumb, ratio));
            }

            Path parent = archive.getParent();
            ArchiveRecord record = new ArchiveRecord(
                    archiveId,
                    archive.toString(),
                    parent == null ? "" : parent.toString(),
                    archive.getFileName().toString(),
                    attrs.size(),
                    attrs.creationTime().toMillis(),
                    attrs.lastModifiedTime().toMillis(),
                    System.currentTimeMillis(),
                    reader.type(),
                    totalFiles,
                    images.size(),
                    ratio,
                    thumb,
                    stamped
            );
            return new Outcome(archive, Status.PERSISTED, Optional.of(record), false);
        }
    }

    /**
     * Monta as entradas com no máximo {@code budget} leituras em voo. O prazo por entrada conta
     * a partir do envio; ao vencer, a entrada recebe metadados padrão, a thread é interrompida e a
     * vaga é liberada, então entradas travadas não seguram o restante do arquivo.
     */
    private List<ArchiveEntryRecord> buildEntries(
            ArchiveReader reader,
            Path archive,
            String archiveId,
            List<ArchiveEntry> images,
            long archiveBytes,
            AtomicBoolean cancel
    ) {
        int budget = ConcurrencyBudget.entryConcurrency(images.size(), archiveBytes, processors);
        Semaphore permits = new Semaphore(budget);
        long timeoutSeconds = settings.entryTimeoutSeconds();
        logger.debug("Archive {}: {} images, entry concurrency {}", archive.getFileName(), images.size(), budget);

        List<CompletableFuture<ArchiveEntryRecord>> pending = new ArrayList<>(images.size());
        boolean stopped = false;
        for (int i = 0; i < images.size(); i++) {
            if (cancel.get()) {
                stopped = true;
                break;
            }
            try {
                permits.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                stopped = true;
                break;
            }
            pending.add(submitEntry(reader, archive, archiveId, images.get(i), i, permits, timeoutSeconds));
        }

        // tarefas já enviadas terminam (ou vencem) mesmo com cancelamento
        List<ArchiveEntryRecord> out = new ArrayList<>(pending.size());
        for (int i = 0; i < pending.size(); i++) {
            ArchiveEntry entry = images.get(i);
            try {
                out.add(pending.get(i).get());
                metrics.entriesProcessed.increment();
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                if (cause instanceof TimeoutException) {
                    metrics.entryTimeouts.increment();
                    logger.warn("Timeout after {}s on {} in {}, using default metadata", timeoutSeconds, entry.internalPath(), archive);
                    out.add(entryRecord(archiveId, archive, entry, ImageMetadata.defaults(entry.fileName()), i));
                } else {
                    metrics.entryErrors.increment();
                    logger.warn("Skipping entry {} in {}: {}", entry.internalPath(), archive, cause.toString());
                }
            } catch (CancellationException e) {
                metrics.entryErrors.increment();
                logger.warn("Skipping entry {} in {}: {}", entry.internalPath(), archive, e.toString());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                stopped = true;
                break;
            }
        }
        if (stopped) {
            // registro parcial nunca é gravado
            throw new CancellationException("Cancelled while processing " + archive);
        }
        return out;
    }

    private CompletableFuture<ArchiveEntryRecord> submitEntry(
            ArchiveReader reader,
            Path archive,
            String archiveId,
            ArchiveEntry entry,
            int order,
            Semaphore permits,
            long timeoutSeconds
    ) {
        CompletableFuture<ArchiveEntryRecord> result = new CompletableFuture<>();
        Future<?> worker;
        try {
            worker = entryPool.submit(() -> {
                try {
                    result.complete(buildEntry(reader, archive, archiveId, entry, order));
                } catch (IOException | RuntimeException e) {
                    result.completeExceptionally(e);
                }
            });
        } catch (RuntimeException e) {
            permits.release();
            throw e;
        }
        result.orTimeout(timeoutSeconds, TimeUnit.SECONDS).whenComplete((record, error) -> {
            permits.release();
            if (error instanceof TimeoutException) worker.cancel(true);
        });
        return result;
    }

    private ArchiveEntryRecord buildEntry(ArchiveReader reader, Path archive, String archiveId, ArchiveEntry entry, int order)
            throws IOException {
        ImageMetadata meta;
        if (settings.extractArchiveDimensions()) {
            String key = MetadataCache.entryKey(archive.toString(), entry.internalPath(), entry.size(), entry.modifiedMillis());
            Optional<ImageMetadata> cached = cache.get(key);
            if (cached.isPresent()) {
                meta = cached.get();
            } else {
                meta = extractor.extract(reader.read(entry), entry.fileName());
                cache.put(key, meta);
            }
        } else {
            // formato pela extensão, dimensões ficam 0
            meta = ImageMetadata.defaults(entry.fileName());
        }
        return entryRecord(archiveId, archive, entry, meta, order);
    }

    private static ArchiveEntryRecord entryRecord(String archiveId, Path archive, ArchiveEntry entry, ImageMetadata meta, int order) {
        return new ArchiveEntryRecord(
                ItemIds.entryId(archive.toString(), entry.internalPath()),
                archiveId,
                entry.internalPath(),
                entry.fileName(),
                entry.size(),
                meta.width(),
                meta.height(),
                meta.format(),
                null,
                0.0,
                order
        );
    }

    @Override
    public void close() {
        entryPool.shutdown();
        try {
            if (!entryPool.awaitTermination(5, TimeUnit.SECONDS)) {
                entryPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            entryPool.shutdownNow();
            Thread.currentThread().interrupt();
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
