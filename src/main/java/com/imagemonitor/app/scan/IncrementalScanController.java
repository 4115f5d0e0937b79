package com.imagemonitor.app.scan;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.imagemonitor.app.database.Database;
import com.imagemonitor.app.database.Database.ScanHistoryRecord;
import com.imagemonitor.app.database.PersistenceGateway;
import com.imagemonitor.app.scan.DirectoryScanner.ScanProgress;
import com.imagemonitor.app.thumbnail.ThumbnailService;

/**
 * Decide o que re-escanear e o que remover comparando a configuração atual com o
 * histórico gravado.
 *
 * <p>Por diretório: desconhecido → (scan) → fresco → (idade &gt; limite) → velho → (scan) → fresco.
 * Um diretório fora da configuração ou ausente do disco é removido: registros sob ele,
 * miniaturas (melhor esforço) e o histórico.
 */
public final class IncrementalScanController {

    private static final Logger logger = LoggerFactory.getLogger(IncrementalScanController.class);

    public record ScanPlan(List<Path> toScan, List<Path> toPurge) {
        public ScanPlan {
            toScan = List.copyOf(toScan);
            toPurge = List.copyOf(toPurge);
        }

        public boolean isEmpty() {
            return toScan.isEmpty() && toPurge.isEmpty();
        }
    }

    public record IncrementalResult(ScanPlan plan, int itemsPurged, int filesProcessed) {}

    private final PersistenceGateway gateway;
    private final ThumbnailService thumbnails;
    private final DirectoryScanner scanner;
    private final Duration freshness;
    private final Clock clock;

    public IncrementalScanController(
            PersistenceGateway gateway,
            ThumbnailService thumbnails,
            DirectoryScanner scanner,
            Duration freshness,
            Clock clock
    ) {
        this.gateway = gateway;
        this.thumbnails = thumbnails;
        this.scanner = scanner;
        this.freshness = freshness;
        this.clock = clock;
    }

    public ScanPlan planScan(List<Path> configuredDirectories) {
        List<Path> configured = normalize(configuredDirectories);
        long cutoff = clock.millis() - freshness.toMillis();

        List<Path> toScan = new ArrayList<>();
        for (Path dir : configured) {
            if (!Files.isDirectory(dir)) continue;
            Optional<ScanHistoryRecord> last = gateway.getLastScanHistory(dir.toString());
            if (last.isEmpty()) {
                logger.debug("{}: never scanned", dir);
                toScan.add(dir);
            } else if (last.get().scanMillis() < cutoff) {
                logger.debug("{}: stale, last scan at {}", dir, last.get().scanMillis());
                toScan.add(dir);
            }
        }

        Set<String> known = new TreeSet<>();
        known.addAll(gateway.getImageDirectories());
        known.addAll(gateway.getArchiveDirectories());
        known.addAll(gateway.getScannedDirectories());

        Set<Path> toPurge = new LinkedHashSet<>();
        for (String d : known) {
            Path dir = Path.of(d);
            if (!Files.isDirectory(dir)) {
                toPurge.add(dir);
            } else if (!isCovered(dir, configured)) {
                toPurge.add(dir);
            }
        }

        // remover um ancestral apaga os itens do diretório configurado abaixo dele
        for (Path dir : configured) {
            if (!Files.isDirectory(dir) || toScan.contains(dir)) continue;
            for (Path purged : toPurge) {
                if (dir.startsWith(purged)) {
                    toScan.add(dir);
                    break;
                }
            }
        }

        ScanPlan plan = new ScanPlan(toScan, new ArrayList<>(toPurge));
        logger.info("Incremental plan: {} to scan, {} to purge", plan.toScan().size(), plan.toPurge().size());
        return plan;
    }

    /**
     * Removes everything rooted under each directory, its thumbnails and its history.
     *
     * @return number of archive and image records removed
     */
    public int purge(List<Path> directories) {
        int removed = 0;
        for (Path dir : directories) {
            String d = dir.toString();
            List<String> thumbs = gateway.getThumbnailPathsUnder(d);
            int deletedThumbs = thumbnails.deleteThumbnails(thumbs);
            int items = gateway.cleanupItemsByDirectory(d);
            int history = gateway.deleteScanHistory(d);
            removed += items;
            logger.info("Purged {}: {} items, {}/{} thumbnails, {} history rows", d, items, deletedThumbs, thumbs.size(), history);
        }
        return removed;
    }

    /**
     * Plan, purge, then scan what is new or stale.
     */
    public IncrementalResult runIncremental(List<Path> configuredDirectories, Consumer<ScanProgress> progress, AtomicBoolean cancel) {
        ScanPlan plan = planScan(configuredDirectories);
        int purged = plan.toPurge().isEmpty() ? 0 : purge(plan.toPurge());

        int processed = 0;
        if (!plan.toScan().isEmpty()) {
            processed = scanner.scan(plan.toScan(), Database.SCAN_INCREMENTAL, progress, cancel);
        } else if (progress != null) {
            progress.accept(new ScanProgress("", 0, 0, "Nothing to scan: all directories are fresh", true));
        }
        return new IncrementalResult(plan, purged, processed);
    }

    /** Igual a um diretório configurado ou abaixo dele. */
    static boolean isCovered(Path dir, List<Path> configured) {
        for (Path root : configured) {
            if (dir.equals(root) || dir.startsWith(root)) return true;
        }
        return false;
    }

    private static List<Path> normalize(List<Path> dirs) {
        Set<Path> out = new LinkedHashSet<>();
        for (Path p : dirs) out.add(p.toAbsolutePath().normalize());
        return new ArrayList<>(out);
    }
}
