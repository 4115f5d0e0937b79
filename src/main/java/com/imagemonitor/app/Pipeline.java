package com.imagemonitor.app;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.imagemonitor.app.archive.ArchiveBatchProcessor;
import com.imagemonitor.app.config.Config;
import com.imagemonitor.app.config.ScanSettings;
import com.imagemonitor.app.database.Database;
import com.imagemonitor.app.database.JdbiPersistenceGateway;
import com.imagemonitor.app.database.PersistenceGateway;
import com.imagemonitor.app.metadata.MetadataCache;
import com.imagemonitor.app.metadata.MetadataExtractor;
import com.imagemonitor.app.scan.DirectoryScanner;
import com.imagemonitor.app.scan.EntryValidator;
import com.imagemonitor.app.scan.IncrementalScanController;
import com.imagemonitor.app.thumbnail.ThumbnailService;

/**
 * Monta os componentes de uma sessão de scan a partir das configurações lidas uma vez.
 * Os limites de concorrência ficam fixos até o {@link #close()}.
 */
public final class Pipeline implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Pipeline.class);

    private final ScanSettings settings;
    private final PersistenceGateway gateway;
    private final MetadataCache cache;
    private final ThumbnailService thumbnails;
    private final ArchiveBatchProcessor archives;
    private final DirectoryScanner scanner;
    private final IncrementalScanController incremental;

    public Pipeline(ScanSettings settings, PersistenceGateway gateway, Path thumbnailDir, Clock clock) {
        this.settings = settings;
        this.gateway = gateway;

        EntryValidator validator = EntryValidator.from(settings);
        MetadataExtractor extractor = new MetadataExtractor();
        this.cache = new MetadataCache(settings.metadataCacheCapacity());
        this.thumbnails = new ThumbnailService(thumbnailDir, settings.thumbnailConcurrency(), validator);
        this.archives = new ArchiveBatchProcessor(settings, validator, extractor, cache, thumbnails, gateway);
        this.scanner = new DirectoryScanner(settings, validator, extractor, cache, thumbnails, archives, gateway, clock);
        this.incremental = new IncrementalScanController(
                gateway, thumbnails, scanner, Duration.ofHours(settings.freshnessHours()), clock);
    }

    /** SQLite from {@link Config}, thumbnails under the configured cache directory. */
    public static Pipeline open(ScanSettings settings) {
        Database.init();
        return new Pipeline(settings, new JdbiPersistenceGateway(Database.jdbi()), Config.getThumbnailCacheDir(),
                Clock.systemDefaultZone());
    }

    public ScanSettings settings() {
        return settings;
    }

    public PersistenceGateway gateway() {
        return gateway;
    }

    public MetadataCache cache() {
        return cache;
    }

    public ThumbnailService thumbnails() {
        return thumbnails;
    }

    public ArchiveBatchProcessor archives() {
        return archives;
    }

    public DirectoryScanner scanner() {
        return scanner;
    }

    public IncrementalScanController incremental() {
        return incremental;
    }

    @Override
    public void close() {
        archives.close();
        thumbnails.close();
        MetadataCache.Stats s = cache.stats();
        logger.info("Metadata cache: {} entries, {} hits, {} misses, {} evictions", s.size(), s.hits(), s.misses(), s.evictions());
    }
}
