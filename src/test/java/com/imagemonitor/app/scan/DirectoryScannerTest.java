package com.imagemonitor.app.scan;

import static org.junit.jupiter.api.Assertions.*;

import java.awt.Color;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.imagemonitor.app.Pipeline;
import com.imagemonitor.app.TestClock;
import com.imagemonitor.app.TestFixtures;
import com.imagemonitor.app.config.ScanSettings;
import com.imagemonitor.app.database.Database;
import com.imagemonitor.app.database.Database.ScanHistoryRecord;
import com.imagemonitor.app.database.JdbiPersistenceGateway;
import com.imagemonitor.app.database.PersistenceGateway;
import com.imagemonitor.app.scan.DirectoryScanner.ScanProgress;

public class DirectoryScannerTest {

    private Path root;
    private Path library;
    private PersistenceGateway gateway;
    private TestClock clock;
    private final List<Pipeline> opened = new ArrayList<>();

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createTempDirectory("imagemonitor-scan-").toAbsolutePath().normalize();
        library = root.resolve("library");
        Database.init();
        gateway = new JdbiPersistenceGateway(Database.jdbi());
        clock = new TestClock(1_700_000_000_000L);
    }

    @AfterEach
    void tearDown() {
        opened.forEach(Pipeline::close);
        Database.shutdown();
    }

    private Pipeline pipeline(boolean archivesOnly) {
        ScanSettings settings = new ScanSettings(null, 128, 0.5, 2, 100, 24, archivesOnly, true, 10_000, 2, 10,
                false, 30, ScanSettings.StorageProfile.SSD, null, null);
        Pipeline p = new Pipeline(settings, gateway, root.resolve("thumbs"), clock);
        opened.add(p);
        return p;
    }

    private void populateLibrary() throws Exception {
        TestFixtures.zip(library.resolve("vol1.zip"), pages(6, 0));
        TestFixtures.zip(library.resolve("nested").resolve("vol2.zip"), pages(5, 1));
        TestFixtures.zip(library.resolve("docs.zip"), pages(2, 6));
        TestFixtures.writeImage(library, "cover.jpg", TestFixtures.jpeg(200, 150, Color.RED));
        TestFixtures.writeImage(library.resolve("nested"), "back.png", TestFixtures.noisyPng(40, 40, 1));
        TestFixtures.writeImage(library, "scan.jpeg", TestFixtures.jpeg(150, 200, Color.BLUE));
        // abaixo dos mínimos: fora da descoberta
        Files.write(library.resolve("tiny.jpg"), new byte[50]);
        Files.write(library.resolve("tiny.zip"), new byte[200]);
        Files.writeString(library.resolve("readme.txt"), "not an image");
    }

    private static Map<String, byte[]> pages(int images, int others) {
        Map<String, byte[]> entries = new LinkedHashMap<>();
        for (int i = 0; i < images; i++) {
            entries.put(String.format("p%03d.jpg", i), TestFixtures.jpeg(120, 90, Color.LIGHT_GRAY));
        }
        for (int i = 0; i < others; i++) {
            entries.put("info" + i + ".nfo", TestFixtures.filler(400, i));
        }
        return entries;
    }

    @Test
    void scan_persistsArchivesAndImages_andAppendsHistory() throws Exception {
        populateLibrary();
        List<ScanProgress> events = new CopyOnWriteArrayList<>();

        int processed = pipeline(false).scanner().scan(List.of(library), Database.SCAN_FULL, events::add, new AtomicBoolean(false));

        assertEquals(6, processed);
        assertEquals(2, gateway.countArchivesUnder(library.toString()));
        assertEquals(3, gateway.countImagesUnder(library.toString()));
        assertTrue(gateway.findArchiveByPath(library.resolve("docs.zip").toString()).isEmpty());

        ScanProgress last = events.get(events.size() - 1);
        assertTrue(last.isCompleted());
        assertEquals(6, events.stream().filter(e -> !e.isCompleted()).count());
        assertTrue(events.stream().filter(e -> !e.isCompleted()).allMatch(e -> e.totalCount() == 6));

        ScanHistoryRecord h = gateway.getLastScanHistory(library.toString()).orElseThrow();
        assertEquals(clock.millis(), h.scanMillis());
        assertEquals(6, h.fileCount());
        assertEquals(6, h.processedCount());
        assertEquals(5, h.insertedCount());
        assertEquals(Database.SCAN_FULL, h.scanType());
    }

    @Test
    void scan_twice_isIdempotent() throws Exception {
        populateLibrary();
        Pipeline p = pipeline(false);

        p.scanner().scan(List.of(library), Database.SCAN_FULL, null, new AtomicBoolean(false));
        clock.advance(Duration.ofMinutes(5));
        int second = p.scanner().scan(List.of(library), Database.SCAN_FULL, null, new AtomicBoolean(false));

        assertEquals(6, second);
        assertEquals(0, p.scanner().lastMetrics().itemsInserted.sum());
        assertEquals(2, p.scanner().lastMetrics().archivesProcessed.sum());
        assertEquals(2, gateway.countArchivesUnder(library.toString()));
        assertEquals(3, gateway.countImagesUnder(library.toString()));

        List<ScanHistoryRecord> history = gateway.getScanHistory(library.toString(), 10);
        assertEquals(2, history.size());
        assertEquals(0, history.get(0).insertedCount());
        assertEquals(5, history.get(1).insertedCount());
    }

    @Test
    void scan_archivesOnly_reportsImagesWithoutStoringThem() throws Exception {
        populateLibrary();
        List<ScanProgress> events = new CopyOnWriteArrayList<>();

        int processed = pipeline(true).scanner().scan(List.of(library), Database.SCAN_FULL, events::add, new AtomicBoolean(false));

        assertEquals(6, processed);
        assertEquals(0, gateway.countImagesUnder(library.toString()));
        assertEquals(2, gateway.countArchivesUnder(library.toString()));
        assertEquals(3, events.stream().filter(e -> "Skipped (archives only)".equals(e.message())).count());
    }

    @Test
    void scan_cancelled_throwsAndWritesNoHistory() throws Exception {
        populateLibrary();

        assertThrows(CancellationException.class, () -> pipeline(false).scanner()
                .scan(List.of(library), Database.SCAN_FULL, null, new AtomicBoolean(true)));
        assertTrue(gateway.getLastScanHistory(library.toString()).isEmpty());
        assertEquals(0, gateway.countArchivesUnder(library.toString()));
    }

    @Test
    void scan_missingDirectory_isSkipped() {
        List<ScanProgress> events = new CopyOnWriteArrayList<>();
        Path missing = root.resolve("does-not-exist");

        int processed = pipeline(false).scanner().scan(List.of(missing), Database.SCAN_FULL, events::add, new AtomicBoolean(false));

        assertEquals(0, processed);
        assertEquals(1, events.size());
        assertTrue(events.get(0).isCompleted());
        assertTrue(gateway.getLastScanHistory(missing.toString()).isEmpty());
    }

    @Test
    void scan_manyArchivesInParallel_persistsEveryArchive() throws Exception {
        for (int i = 0; i < 12; i++) {
            TestFixtures.zip(library.resolve(String.format("book%02d.zip", i)), pages(30, 0));
        }
        Pipeline p = pipeline(true);
        assertEquals(2, p.settings().maxConcurrentScans());

        int processed = p.scanner().scan(List.of(library), Database.SCAN_FULL, null, new AtomicBoolean(false));

        assertEquals(12, processed);
        assertEquals(12, gateway.countArchivesUnder(library.toString()));
        assertEquals(0, p.scanner().lastMetrics().errors.sum());
        ScanHistoryRecord h = gateway.getLastScanHistory(library.toString()).orElseThrow();
        assertEquals(12, h.processedCount());
        assertEquals(12, h.insertedCount());
    }

    @Test
    void scan_archiveWithRepeatedEntryNames_doesNotAbortOtherArchives() throws Exception {
        byte[] page = TestFixtures.noisyPng(40, 40, 5);
        TestFixtures.zip(library.resolve("repeated.zip"), List.of(
                Map.entry("page.png", page),
                Map.entry("page.png", page)));
        TestFixtures.zip(library.resolve("fine.zip"), pages(4, 0));
        Files.write(library.resolve("broken.zip"), TestFixtures.filler(4096, 9));

        int processed = pipeline(true).scanner().scan(List.of(library), Database.SCAN_FULL, null, new AtomicBoolean(false));

        assertEquals(3, processed);
        assertTrue(gateway.findArchiveByPath(library.resolve("fine.zip").toString()).isPresent());
        assertEquals(1, gateway.findArchiveByPath(library.resolve("repeated.zip").toString()).orElseThrow().entries().size());
        assertTrue(gateway.findArchiveByPath(library.resolve("broken.zip").toString()).isEmpty());
        ScanHistoryRecord h = gateway.getLastScanHistory(library.toString()).orElseThrow();
        assertEquals(3, h.processedCount());
        assertEquals(2, h.insertedCount());
    }
}
