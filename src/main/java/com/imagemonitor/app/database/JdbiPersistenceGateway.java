package com.imagemonitor.app.database;

import java.io.File;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.imagemonitor.app.database.Database.ArchiveRecord;
import com.imagemonitor.app.database.Database.ImageRecord;
import com.imagemonitor.app.database.Database.ScanHistoryRecord;

/**
 * Gateway sobre SQLite/Jdbi. Cada lote roda na sua própria transação; um lote que falha
 * sofre rollback e é repetido uma vez a partir do início do lote. Escritas (upsert, lotes,
 * histórico, limpeza) passam por uma trava única; leituras não.
 */
public final class JdbiPersistenceGateway implements PersistenceGateway {

    private static final Logger logger = LoggerFactory.getLogger(JdbiPersistenceGateway.class);

    public static final int BULK_BATCH_SIZE = 250;
    public static final int STREAM_BATCH_SIZE = 50;

    // um único escritor por processo: o arquivo SQLite aceita só uma transação de escrita por vez
    private static final ReentrantLock WRITE_LOCK = new ReentrantLock(true);

    private final Jdbi jdbi;

    public JdbiPersistenceGateway(Jdbi jdbi) {
        this.jdbi = jdbi;
    }

    @Override
    public boolean upsertArchive(ArchiveRecord record) {
        boolean inserted;
        try {
            inserted = writing(() -> jdbi.withExtension(CatalogDao.class, dao -> dao.upsertArchive(record)));
        } catch (JdbiException first) {
            logger.warn("Upsert of archive {} failed, retrying once", record.filePath(), first);
            try {
                inserted = writing(() -> jdbi.withExtension(CatalogDao.class, dao -> dao.upsertArchive(record)));
            } catch (JdbiException second) {
                second.addSuppressed(first);
                throw new IllegalStateException("Persistence unavailable: archive upsert failed twice", second);
            }
        }
        logger.debug("Upserted archive {} ({} entries, new={})", record.filePath(), record.entries().size(), inserted);
        return inserted;
    }

    @Override
    public int bulkInsertImages(List<ImageRecord> records) {
        long started = System.nanoTime();
        int inserted = 0;
        for (int i = 0; i < records.size(); i += BULK_BATCH_SIZE) {
            List<ImageRecord> batch = records.subList(i, Math.min(records.size(), i + BULK_BATCH_SIZE));
            inserted += insertBatch(batch);
        }
        long ms = (System.nanoTime() - started) / 1_000_000;
        logger.info("Bulk insert completed: {}/{} images in {}ms", inserted, records.size(), ms);
        return inserted;
    }

    @Override
    public int streamInsertImages(Iterator<ImageRecord> records) {
        int inserted = 0;
        int seen = 0;
        List<ImageRecord> batch = new ArrayList<>(STREAM_BATCH_SIZE);
        while (records.hasNext()) {
            batch.add(records.next());
            seen++;
            if (batch.size() >= STREAM_BATCH_SIZE) {
                inserted += insertBatch(batch);
                batch.clear();
            }
        }
        if (!batch.isEmpty()) {
            inserted += insertBatch(batch);
        }
        logger.debug("Stream insert finished: {} inserted of {} received", inserted, seen);
        return inserted;
    }

    private int insertBatch(List<ImageRecord> batch) {
        try {
            return insertBatchOnce(batch);
        } catch (JdbiException first) {
            logger.warn("Batch of {} images failed, retrying once", batch.size(), first);
            try {
                return insertBatchOnce(batch);
            } catch (JdbiException second) {
                second.addSuppressed(first);
                throw new IllegalStateException("Persistence unavailable: batch insert failed twice", second);
            }
        }
    }

    private int insertBatchOnce(List<ImageRecord> batch) {
        return writing(() -> jdbi.inTransaction(handle -> {
            CatalogDao dao = handle.attach(CatalogDao.class);
            List<ImageRecord> fresh = new ArrayList<>(batch.size());
            for (ImageRecord r : batch) {
                if (!dao.imageExists(r.id())) fresh.add(r);
            }
            int duplicates = batch.size() - fresh.size();
            if (duplicates > 0) {
                logger.debug("Skipping {} duplicate images in batch", duplicates);
            }
            if (fresh.isEmpty()) return 0;

            int count = 0;
            for (int n : dao.insertImages(fresh)) {
                if (n > 0) count++;
            }
            return count;
        }));
    }

    @Override
    public boolean existsById(String id) {
        return jdbi.withExtension(CatalogDao.class, dao -> dao.archiveExists(id) || dao.imageExists(id));
    }

    @Override
    public List<String> getImageDirectories() {
        return jdbi.withExtension(CatalogDao.class, CatalogDao::imageDirectories);
    }

    @Override
    public List<String> getArchiveDirectories() {
        return jdbi.withExtension(CatalogDao.class, CatalogDao::archiveDirectories);
    }

    @Override
    public Optional<ScanHistoryRecord> getLastScanHistory(String directory) {
        List<ScanHistoryRecord> rows = getScanHistory(directory, 1);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public List<ScanHistoryRecord> getScanHistory(String directory, int limit) {
        return jdbi.withExtension(CatalogDao.class, dao -> dao.scanHistory(directory, Math.max(1, limit)));
    }

    @Override
    public List<String> getScannedDirectories() {
        return jdbi.withExtension(CatalogDao.class, CatalogDao::scannedDirectories);
    }

    @Override
    public void insertScanHistory(ScanHistoryRecord record) {
        writing(() -> {
            jdbi.useExtension(CatalogDao.class, dao -> dao.insertScanHistory(record));
            return null;
        });
        logger.debug("Scan history: {} {} scan in {}ms", record.directoryPath(), record.scanType(), record.elapsedMs());
    }

    @Override
    public int deleteScanHistory(String directory) {
        return writing(() -> jdbi.withExtension(CatalogDao.class, dao -> dao.deleteScanHistory(directory)));
    }

    @Override
    public int cleanupItemsByDirectory(String directory) {
        CatalogDao.CleanupResult r = writing(() -> jdbi.withExtension(CatalogDao.class,
                dao -> dao.cleanupDirectory(directory, prefixOf(directory))));
        logger.info("Cleaned up {} items from directory {} ({} archives, {} images)",
                r.total(), directory, r.archivesRemoved, r.imagesRemoved);
        return r.total();
    }

    @Override
    public List<String> getThumbnailPathsUnder(String directory) {
        return jdbi.withExtension(CatalogDao.class, dao -> dao.thumbnailPathsUnder(directory, prefixOf(directory)));
    }

    @Override
    public List<String> getAllThumbnailPaths() {
        return jdbi.withExtension(CatalogDao.class, CatalogDao::allThumbnailPaths);
    }

    @Override
    public Optional<ArchiveRecord> findArchiveByPath(String filePath) {
        return jdbi.withExtension(CatalogDao.class, dao -> dao.findArchiveRowByPath(filePath)
                .map(row -> row.withEntries(dao.findEntries(row.id()))));
    }

    @Override
    public List<ArchiveRecord> searchArchives(String query, int limit) {
        String q = query == null ? "" : query.trim();
        return jdbi.withExtension(CatalogDao.class, dao -> {
            List<ArchiveRecord> out = new ArrayList<>();
            for (Database.ArchiveRow row : dao.searchArchives(q, Math.max(1, limit))) {
                out.add(row.withEntries(List.of()));
            }
            return out;
        });
    }

    @Override
    public long countArchivesUnder(String directory) {
        return jdbi.withExtension(CatalogDao.class, dao -> dao.countArchivesUnder(directory, prefixOf(directory)));
    }

    @Override
    public long countImagesUnder(String directory) {
        return jdbi.withExtension(CatalogDao.class, dao -> dao.countImagesUnder(directory, prefixOf(directory)));
    }

    private static <T> T writing(Supplier<T> write) {
        WRITE_LOCK.lock();
        try {
            return write.get();
        } finally {
            WRITE_LOCK.unlock();
        }
    }

    static String prefixOf(String directory) {
        if (directory.endsWith(File.separator) || directory.endsWith("/")) return directory;
        return directory + File.separator;
    }
}
