package com.imagemonitor.app.database;

import java.util.Iterator;
import java.util.List;
import java.util.Optional;

import com.imagemonitor.app.database.Database.ArchiveRecord;
import com.imagemonitor.app.database.Database.ImageRecord;
import com.imagemonitor.app.database.Database.ScanHistoryRecord;

/**
 * Contrato que o pipeline de scan exige do armazenamento. O pipeline produz, o gateway grava.
 */
public interface PersistenceGateway {

    /** @return true when the archive did not exist before */
    boolean upsertArchive(ArchiveRecord record);

    /** Batches of 250; duplicate keys count as already present. */
    int bulkInsertImages(List<ImageRecord> records);

    /** Consumes the iterator in batches of 50 until it is exhausted. */
    int streamInsertImages(Iterator<ImageRecord> records);

    boolean existsById(String id);

    List<String> getImageDirectories();

    List<String> getArchiveDirectories();

    Optional<ScanHistoryRecord> getLastScanHistory(String directory);

    List<ScanHistoryRecord> getScanHistory(String directory, int limit);

    List<String> getScannedDirectories();

    void insertScanHistory(ScanHistoryRecord record);

    int deleteScanHistory(String directory);

    /** Removes archives, their entries and images rooted under the directory. */
    int cleanupItemsByDirectory(String directory);

    List<String> getThumbnailPathsUnder(String directory);

    List<String> getAllThumbnailPaths();

    Optional<ArchiveRecord> findArchiveByPath(String filePath);

    List<ArchiveRecord> searchArchives(String query, int limit);

    long countArchivesUnder(String directory);

    long countImagesUnder(String directory);
}
