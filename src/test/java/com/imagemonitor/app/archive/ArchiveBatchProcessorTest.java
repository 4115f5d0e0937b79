package com.imagemonitor.app.archive;

import static org.junit.jupiter.api.Assertions.*;

import java.awt.Color;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.imagemonitor.app.TestFixtures;
import com.imagemonitor.app.archive.ArchiveBatchProcessor.Outcome;
import com.imagemonitor.app.archive.ArchiveBatchProcessor.Status;
import com.imagemonitor.app.config.ScanSettings;
import com.imagemonitor.app.database.Database;
import com.imagemonitor.app.database.Database.ArchiveEntryRecord;
import com.imagemonitor.app.database.Database.ArchiveRecord;
import com.imagemonitor.app.database.JdbiPersistenceGateway;
import com.imagemonitor.app.database.PersistenceGateway;
import com.imagemonitor.app.metadata.ImageMetadata;
import com.imagemonitor.app.metadata.MetadataCache;
import com.imagemonitor.app.metadata.MetadataExtractor;
import com.imagemonitor.app.scan.EntryValidator;
import com.imagemonitor.app.thumbnail.ThumbnailService;

public class ArchiveBatchProcessorTest {

    private Path root;
    private PersistenceGateway gateway;
    private ThumbnailService thumbnails;
    private MetadataCache cache;

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createTempDirectory("imagemonitor-archive-").toAbsolutePath().normalize();
        Database.init();
        gateway = new JdbiPersistenceGateway(Database.jdbi());
        thumbnails = new ThumbnailService(root.resolve("thumbs"), 2, EntryValidator.defaults());
        cache = new MetadataCache(100);
    }

    @AfterEach
    void tearDown() {
        thumbnails.close();
        Database.shutdown();
    }

    private ArchiveBatchProcessor processor(ScanSettings settings) {
        return new ArchiveBatchProcessor(settings, EntryValidator.from(settings), new MetadataExtractor(), cache,
                thumbnails, gateway, 4);
    }

    private static ScanSettings settings(boolean extractDimensions, int maxEntries) {
        return new ScanSettings(null, 128, 0.5, 2, 100, 24, true, true, maxEntries, 2, 10,
                extractDimensions, 30, ScanSettings.StorageProfile.SSD, null, null);
    }

    private Path zipWith(String name, int images, int others) throws Exception {
        Map<String, byte[]> entries = new LinkedHashMap<>();
        for (int i = 0; i < images; i++) {
            entries.put(String.format("page%02d.jpg", i), TestFixtures.jpeg(120, 90, Color.DARK_GRAY));
        }
        for (int i = 0; i < others; i++) {
            entries.put("notes" + i + ".txt", TestFixtures.filler(300, i));
        }
        return TestFixtures.zip(root.resolve("library").resolve(name), entries);
    }

    @Test
    void process_belowRatioThreshold_isNotPersisted() throws Exception {
        Path zip = zipWith("mostly-text.zip", 3, 7);

        try (ArchiveBatchProcessor p = processor(settings(false, 10_000))) {
            Outcome outcome = p.process(zip, new AtomicBoolean(false));

            assertEquals(Status.BELOW_THRESHOLD, outcome.status());
            assertFalse(outcome.persisted());
            assertTrue(gateway.findArchiveByPath(zip.toString()).isEmpty());
            assertEquals(1, p.metrics().archivesSkipped.sum());
        }
    }

    @Test
    void process_aboveRatioThreshold_persistsArchiveAndEntries() throws Exception {
        Path zip = zipWith("comic.zip", 6, 4);

        try (ArchiveBatchProcessor p = processor(settings(false, 10_000))) {
            Outcome first = p.process(zip, new AtomicBoolean(false));
            Outcome second = p.process(zip, new AtomicBoolean(false));

            assertEquals(Status.PERSISTED, first.status());
            assertTrue(first.inserted());
            assertFalse(second.inserted());

            ArchiveRecord stored = gateway.findArchiveByPath(zip.toString()).orElseThrow();
            assertEquals(10, stored.totalFiles());
            assertEquals(6, stored.imageFiles());
            assertEquals(0.6, stored.imageRatio(), 1e-9);
            assertEquals("ZIP", stored.archiveType());
            assertEquals(zip.getParent().toString(), stored.directory());
            assertEquals(6, stored.entries().size());
            assertNotNull(stored.thumbnailPath());
            assertTrue(Files.exists(Path.of(stored.thumbnailPath())));
            for (ArchiveEntryRecord e : stored.entries()) {
                assertEquals(0, e.width());
                assertEquals("JPG", e.imageFormat());
                assertEquals(stored.thumbnailPath(), e.thumbnailPath());
                assertEquals(0.6, e.imageRatio(), 1e-9);
            }
        }
    }

    @Test
    void process_ordersEntriesByPath_andThumbnailComesFromFirst() throws Exception {
        Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put("b.jpg", TestFixtures.jpeg(200, 200, Color.BLUE));
        entries.put("a.png", TestFixtures.png(300, 300, Color.RED));
        entries.put("c.jpg", TestFixtures.jpeg(200, 200, Color.GREEN));
        Path zip = TestFixtures.zip(root.resolve("library").resolve("ordered.zip"), entries);

        try (ArchiveBatchProcessor p = processor(settings(false, 10_000))) {
            ArchiveRecord record = p.processArchive(zip).orElseThrow();

            List<String> order = record.entries().stream().map(ArchiveEntryRecord::internalPath).toList();
            assertEquals(List.of("a.png", "b.jpg", "c.jpg"), order);
            assertEquals(List.of(0, 1, 2), record.entries().stream().map(ArchiveEntryRecord::sortOrder).toList());

            Color c = TestFixtures.dominantColor(Path.of(record.thumbnailPath()));
            assertTrue(c.getRed() > 200 && c.getGreen() < 60 && c.getBlue() < 60, "Expected red, got " + c);
        }
    }

    @Test
    void process_withDimensionExtraction_readsEntryHeaders() throws Exception {
        Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put("wide.png", TestFixtures.noisyPng(64, 32, 7));
        entries.put("tall.jpg", TestFixtures.jpeg(90, 160, Color.YELLOW));
        Path zip = TestFixtures.zip(root.resolve("library").resolve("dims.zip"), entries);

        try (ArchiveBatchProcessor p = processor(settings(true, 10_000))) {
            ArchiveRecord record = p.processArchive(zip).orElseThrow();

            ArchiveEntryRecord tall = record.entries().get(0);
            ArchiveEntryRecord wide = record.entries().get(1);
            assertEquals("tall.jpg", tall.internalPath());
            assertEquals(90, tall.width());
            assertEquals(160, tall.height());
            assertEquals("JPEG", tall.imageFormat());
            assertEquals(64, wide.width());
            assertEquals(32, wide.height());
            assertEquals(2, cache.size());
        }
    }

    @Test
    void process_tooManyEntries_isSkipped() throws Exception {
        Path zip = zipWith("huge.zip", 6, 0);

        try (ArchiveBatchProcessor p = processor(settings(false, 5))) {
            assertEquals(Status.TOO_MANY_ENTRIES, p.process(zip, new AtomicBoolean(false)).status());
        }
    }

    @Test
    void process_noImagesOrCorruptFile_areNotPersisted() throws Exception {
        Path textOnly = zipWith("text.zip", 0, 5);
        Path corrupt = Files.write(root.resolve("library").resolve("broken.zip"), TestFixtures.filler(4096, 3));

        try (ArchiveBatchProcessor p = processor(settings(false, 10_000))) {
            assertEquals(Status.NO_IMAGES, p.process(textOnly, new AtomicBoolean(false)).status());
            assertEquals(Status.FAILED, p.process(corrupt, new AtomicBoolean(false)).status());
            assertEquals(1, p.metrics().archivesFailed.sum());
            assertTrue(gateway.findArchiveByPath(corrupt.toString()).isEmpty());
        }
    }

    @Test
    void process_cancelled_throwsAndWritesNothing() throws Exception {
        Path zip = zipWith("cancelled.zip", 6, 0);

        try (ArchiveBatchProcessor p = processor(settings(false, 10_000))) {
            assertThrows(CancellationException.class, () -> p.process(zip, new AtomicBoolean(true)));
            assertTrue(gateway.findArchiveByPath(zip.toString()).isEmpty());
        }
    }

    @Test
    void process_repeatedEntryNames_persistsEachPathOnce() throws Exception {
        byte[] page = TestFixtures.jpeg(120, 90, Color.DARK_GRAY);
        Path zip = TestFixtures.zip(root.resolve("library").resolve("repeated.zip"), List.of(
                Map.entry("page.jpg", page),
                Map.entry("cover.jpg", page),
                Map.entry("page.jpg", page)));

        try (ArchiveBatchProcessor p = processor(settings(false, 10_000))) {
            Outcome outcome = p.process(zip, new AtomicBoolean(false));

            assertEquals(Status.PERSISTED, outcome.status());
            ArchiveRecord stored = gateway.findArchiveByPath(zip.toString()).orElseThrow();
            assertEquals(3, stored.totalFiles());
            assertEquals(2, stored.imageFiles());
            assertEquals(List.of("cover.jpg", "page.jpg"),
                    stored.entries().stream().map(ArchiveEntryRecord::internalPath).toList());
        }
    }

    @Test
    void process_uncheckedFailureInsideArchive_isReportedAsFailed() throws Exception {
        Path zip = zipWith("unlucky.zip", 6, 0);
        // sem serviço de miniaturas: NullPointerException no meio do processamento
        try (ArchiveBatchProcessor p = new ArchiveBatchProcessor(settings(false, 10_000), EntryValidator.defaults(),
                new MetadataExtractor(), cache, null, gateway, 4)) {
            Outcome outcome = assertDoesNotThrow(() -> p.process(zip, new AtomicBoolean(false)));

            assertEquals(Status.FAILED, outcome.status());
            assertEquals(1, p.metrics().archivesFailed.sum());
            assertTrue(gateway.findArchiveByPath(zip.toString()).isEmpty());
        }
    }

    @Test
    void process_stuckEntries_fallBackToDefaultsWithinTimeout() throws Exception {
        Path zip = zipWith("stuck.zip", 4, 0);
        CountDownLatch unblock = new CountDownLatch(1);
        // ignora interrupção: simula uma leitura travada no decoder
        MetadataExtractor stuck = new MetadataExtractor() {
            @Override
            public ImageMetadata extract(byte[] data, String fileNameHint) {
                while (unblock.getCount() > 0) {
                    try {
                        unblock.await();
                    } catch (InterruptedException ignored) {
                        // continua travado
                    }
                }
                return super.extract(data, fileNameHint);
            }
        };
        ScanSettings oneSecond = new ScanSettings(null, 128, 0.5, 2, 100, 24, true, false, 10_000, 2, 1,
                true, 30, ScanSettings.StorageProfile.SSD, null, null);

        // processors=1: orçamento de 2 entradas em voo, menor que o número de entradas
        try (ArchiveBatchProcessor p = new ArchiveBatchProcessor(oneSecond, EntryValidator.from(oneSecond), stuck,
                cache, thumbnails, gateway, 1)) {
            Outcome outcome;
            try {
                outcome = assertTimeoutPreemptively(Duration.ofSeconds(20),
                        () -> p.process(zip, new AtomicBoolean(false)));
            } finally {
                unblock.countDown();
            }

            assertEquals(Status.PERSISTED, outcome.status());
            List<ArchiveEntryRecord> entries = outcome.record().orElseThrow().entries();
            assertEquals(4, entries.size());
            for (ArchiveEntryRecord e : entries) {
                assertEquals(0, e.width());
                assertEquals(0, e.height());
                assertEquals("JPG", e.imageFormat());
            }
            assertEquals(4, p.metrics().entryTimeouts.sum());
        }
    }
}
