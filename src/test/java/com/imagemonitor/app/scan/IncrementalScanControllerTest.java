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
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.imagemonitor.app.Pipeline;
import com.imagemonitor.app.TestClock;
import com.imagemonitor.app.TestFixtures;
import com.imagemonitor.app.config.ScanSettings;
import com.imagemonitor.app.database.Database;
import com.imagemonitor.app.database.Database.ScanHistoryRecord;
import com.imagemonitor.app.database.ItemIds;
import com.imagemonitor.app.database.JdbiPersistenceGateway;
import com.imagemonitor.app.database.PersistenceGateway;
import com.imagemonitor.app.scan.DirectoryScanner.ScanProgress;
import com.imagemonitor.app.scan.IncrementalScanController.IncrementalResult;
import com.imagemonitor.app.scan.IncrementalScanController.ScanPlan;

public class IncrementalScanControllerTest {

    private static final long NOW = 1_700_000_000_000L;

    private Path root;
    private PersistenceGateway gateway;
    private TestClock clock;
    private Pipeline pipeline;

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createTempDirectory("imagemonitor-incremental-").toAbsolutePath().normalize();
        Database.init();
        gateway = new JdbiPersistenceGateway(Database.jdbi());
        clock = new TestClock(NOW);
        ScanSettings settings = new ScanSettings(null, 128, 0.5, 2, 100, 24, false, true, 10_000, 2, 10,
                false, 30, ScanSettings.StorageProfile.SSD, null, null);
        pipeline = new Pipeline(settings, gateway, root.resolve("thumbs"), clock);
    }

    @AfterEach
    void tearDown() {
        pipeline.close();
        Database.shutdown();
    }

    private IncrementalScanController controller() {
        return pipeline.incremental();
    }

    private void recordScan(Path dir, long millis) {
        gateway.insertScanHistory(new ScanHistoryRecord(ItemIds.scanHistoryId(dir.toString(), millis), dir.toString(),
                millis, 1, 1, 1, 5L, Database.SCAN_FULL));
    }

    private static Path populate(Path dir) throws Exception {
        Map<String, byte[]> entries = new LinkedHashMap<>();
        for (int i = 0; i < 4; i++) {
            entries.put("page" + i + ".jpg", TestFixtures.jpeg(120, 90, Color.ORANGE));
        }
        TestFixtures.zip(dir.resolve("book.zip"), entries);
        TestFixtures.writeImage(dir, "photo.jpg", TestFixtures.jpeg(160, 120, Color.GREEN));
        return dir;
    }

    @Test
    void planScan_selectsNewAndStaleDirectories_only() throws Exception {
        Path stale = Files.createDirectories(root.resolve("stale"));
        Path fresh = Files.createDirectories(root.resolve("fresh"));
        Path unseen = Files.createDirectories(root.resolve("unseen"));
        recordScan(stale, NOW - Duration.ofHours(25).toMillis());
        recordScan(fresh, NOW - Duration.ofHours(1).toMillis());

        ScanPlan plan = controller().planScan(List.of(stale, fresh, unseen));

        assertTrue(plan.toScan().contains(stale));
        assertTrue(plan.toScan().contains(unseen));
        assertFalse(plan.toScan().contains(fresh));
        assertFalse(plan.toPurge().contains(stale));
        assertFalse(plan.toPurge().contains(fresh));
    }

    @Test
    void planScan_freshDirectoryBecomesStaleAsClockAdvances() throws Exception {
        Path dir = Files.createDirectories(root.resolve("ageing"));
        recordScan(dir, NOW);

        assertFalse(controller().planScan(List.of(dir)).toScan().contains(dir));
        clock.advance(Duration.ofHours(24).plusMinutes(1));
        assertTrue(controller().planScan(List.of(dir)).toScan().contains(dir));
    }

    @Test
    void runIncremental_purgesDeconfiguredDirectory_withThumbnailsAndHistory() throws Exception {
        Path keep = populate(root.resolve("keep"));
        Path drop = populate(root.resolve("drop"));
        pipeline.scanner().scan(List.of(keep, drop), Database.SCAN_FULL, null, new AtomicBoolean(false));
        List<String> dropThumbs = gateway.getThumbnailPathsUnder(drop.toString());
        assertEquals(2, dropThumbs.size());
        dropThumbs.forEach(t -> assertTrue(Files.exists(Path.of(t))));

        IncrementalResult result = controller().runIncremental(List.of(keep), null, new AtomicBoolean(false));

        assertTrue(result.plan().toPurge().contains(drop));
        assertFalse(result.plan().toScan().contains(keep));
        assertTrue(result.itemsPurged() >= 2);
        assertEquals(0, gateway.countArchivesUnder(drop.toString()));
        assertEquals(0, gateway.countImagesUnder(drop.toString()));
        assertTrue(gateway.getLastScanHistory(drop.toString()).isEmpty());
        dropThumbs.forEach(t -> assertFalse(Files.exists(Path.of(t)), "Thumbnail should be gone: " + t));

        assertEquals(1, gateway.countArchivesUnder(keep.toString()));
        assertEquals(1, gateway.countImagesUnder(keep.toString()));
    }

    @Test
    void runIncremental_purgesDirectoryMissingFromDisk_andScansNewOne() throws Exception {
        Path gone = populate(root.resolve("gone"));
        pipeline.scanner().scan(List.of(gone), Database.SCAN_FULL, null, new AtomicBoolean(false));
        FileUtils.deleteDirectory(gone.toFile());
        Path added = populate(root.resolve("added"));

        IncrementalResult result = controller().runIncremental(List.of(gone, added), null, new AtomicBoolean(false));

        assertTrue(result.plan().toPurge().contains(gone));
        assertEquals(List.of(added), result.plan().toScan());
        assertEquals(2, result.filesProcessed());
        assertEquals(0, gateway.countArchivesUnder(gone.toString()));
        assertEquals(1, gateway.countArchivesUnder(added.toString()));
        assertEquals(Database.SCAN_INCREMENTAL, gateway.getLastScanHistory(added.toString()).orElseThrow().scanType());
    }

    @Test
    void planScan_configuredChildOfPurgedAncestor_isRescanned() throws Exception {
        Path parent = populate(root.resolve("parent"));
        Path child = populate(parent.resolve("child"));
        pipeline.scanner().scan(List.of(parent), Database.SCAN_FULL, null, new AtomicBoolean(false));
        recordScan(child, NOW);

        ScanPlan plan = controller().planScan(List.of(child));

        assertTrue(plan.toPurge().contains(parent));
        assertTrue(plan.toScan().contains(child));
    }

    @Test
    void runIncremental_nothingStale_reportsCompletion() throws Exception {
        Path dir = Files.createDirectories(root.resolve("idle"));
        recordScan(dir, NOW);
        List<ScanProgress> events = new CopyOnWriteArrayList<>();

        IncrementalResult result = controller().runIncremental(List.of(dir), events::add, new AtomicBoolean(false));

        assertTrue(result.plan().toScan().isEmpty());
        assertEquals(0, result.filesProcessed());
        assertEquals(1, events.size());
        assertTrue(events.get(0).isCompleted());
    }

    @Test
    void isCovered_matchesSelfAndDescendants_notSiblings() {
        Path a = Path.of("/data/photos");
        List<Path> configured = new ArrayList<>(List.of(a));

        assertTrue(IncrementalScanController.isCovered(a, configured));
        assertTrue(IncrementalScanController.isCovered(a.resolve("2021"), configured));
        assertFalse(IncrementalScanController.isCovered(Path.of("/data/photos2"), configured));
        assertFalse(IncrementalScanController.isCovered(Path.of("/data"), configured));
    }
}
