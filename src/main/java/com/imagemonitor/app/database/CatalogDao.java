package com.imagemonitor.app.database;

import java.util.List;
import java.util.Optional;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.statement.SqlBatch;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;
import org.jdbi.v3.sqlobject.transaction.Transaction;

import com.imagemonitor.app.database.Database.ArchiveEntryRecord;
import com.imagemonitor.app.database.Database.ArchiveRecord;
import com.imagemonitor.app.database.Database.ArchiveRow;
import com.imagemonitor.app.database.Database.ImageRecord;
import com.imagemonitor.app.database.Database.ScanHistoryRecord;

public interface CatalogDao {

    // "sob o diretório" = igual ao diretório ou com prefixo dir + separador
    String UNDER_DIR = "(directory = :dir OR substr(directory, 1, length(:prefix)) = :prefix)";

    // --- Archives --------------------------------------------------------------

    @SqlQuery("SELECT EXISTS(SELECT 1 FROM archives WHERE id = :id)")
    boolean archiveExists(@Bind("id") String id);

    @SqlUpdate("""
        INSERT INTO archives
            (id, file_path, directory, file_name, file_size, created_millis, modified_millis, scan_millis,
             archive_type, total_files, image_files, image_ratio, thumbnail_path)
        VALUES
            (:a.id, :a.filePath, :a.directory, :a.fileName, :a.fileSize, :a.createdMillis, :a.modifiedMillis,
             :a.scanMillis, :a.archiveType, :a.totalFiles, :a.imageFiles, :a.imageRatio, :a.thumbnailPath)
        ON CONFLICT(id) DO UPDATE SET
            file_path = excluded.file_path,
            directory = excluded.directory,
            file_name = excluded.file_name,
            file_size = excluded.file_size,
            created_millis = excluded.created_millis,
            modified_millis = excluded.modified_millis,
            scan_millis = excluded.scan_millis,
            archive_type = excluded.archive_type,
            total_files = excluded.total_files,
            image_files = excluded.image_files,
            image_ratio = excluded.image_ratio,
            thumbnail_path = excluded.thumbnail_path
        """)
    int upsertArchiveRow(@BindMethods("a") ArchiveRecord archive);

    @SqlUpdate("DELETE FROM archive_entries WHERE archive_id = :archiveId")
    int deleteEntries(@Bind("archiveId") String archiveId);

    @SqlBatch("""
        INSERT INTO archive_entries
            (id, archive_id, internal_path, file_name, file_size, width, height, image_format,
             thumbnail_path, image_ratio, sort_order)
        VALUES
            (:e.id, :e.archiveId, :e.internalPath, :e.fileName, :e.fileSize, :e.width, :e.height, :e.imageFormat,
             :e.thumbnailPath, :e.imageRatio, :e.sortOrder)
        """)
    int[] insertEntries(@BindMethods("e") List<ArchiveEntryRecord> entries);

    /**
     * Substitui o arquivo e todas as entradas numa transação. Retorna true se o arquivo era novo.
     */
    @Transaction
    default boolean upsertArchive(ArchiveRecord archive) {
        boolean existed = archiveExists(archive.id());
        upsertArchiveRow(archive);
        deleteEntries(archive.id());
        if (!archive.entries().isEmpty()) {
            insertEntries(archive.entries());
        }
        return !existed;
    }

    @SqlQuery("""
        SELECT id, file_path AS filePath, directory, file_name AS fileName, file_size AS fileSize,
               created_millis AS createdMillis, modified_millis AS modifiedMillis, scan_millis AS scanMillis,
               archive_type AS archiveType, total_files AS totalFiles, image_files AS imageFiles,
               image_ratio AS imageRatio, thumbnail_path AS thumbnailPath
          FROM archives
         WHERE file_path = :path
        """)
    @RegisterConstructorMapper(ArchiveRow.class)
    Optional<ArchiveRow> findArchiveRowByPath(@Bind("path") String path);

    @SqlQuery("""
        SELECT id, archive_id AS archiveId, internal_path AS internalPath, file_name AS fileName,
               file_size AS fileSize, width, height, image_format AS imageFormat,
               thumbnail_path AS thumbnailPath, image_ratio AS imageRatio, sort_order AS sortOrder
          FROM archive_entries
         WHERE archive_id = :archiveId
         ORDER BY sort_order
        """)
    @RegisterConstructorMapper(ArchiveEntryRecord.class)
    List<ArchiveEntryRecord> findEntries(@Bind("archiveId") String archiveId);

    @SqlQuery("""
        SELECT id, file_path AS filePath, directory, file_name AS fileName, file_size AS fileSize,
               created_millis AS createdMillis, modified_millis AS modifiedMillis, scan_millis AS scanMillis,
               archive_type AS archiveType, total_files AS totalFiles, image_files AS imageFiles,
               image_ratio AS imageRatio, thumbnail_path AS thumbnailPath
          FROM archives
         WHERE file_name LIKE '%' || :query || '%'
         ORDER BY file_name COLLATE NOCASE
         LIMIT :limit
        """)
    @RegisterConstructorMapper(ArchiveRow.class)
    List<ArchiveRow> searchArchives(@Bind("query") String query, @Bind("limit") int limit);

    @SqlQuery("SELECT DISTINCT directory FROM archives ORDER BY directory")
    List<String> archiveDirectories();

    @SqlQuery("SELECT COUNT(*) FROM archives WHERE " + UNDER_DIR)
    long countArchivesUnder(@Bind("dir") String dir, @Bind("prefix") String prefix);

    // --- Images ----------------------------------------------------------------

    @SqlQuery("SELECT EXISTS(SELECT 1 FROM images WHERE id = :id)")
    boolean imageExists(@Bind("id") String id);

    @SqlBatch("""
        INSERT INTO images
            (id, file_path, directory, file_name, file_size, width, height, image_format, has_exif,
             date_taken_millis, thumbnail_path, created_millis, modified_millis, scan_millis)
        VALUES
            (:i.id, :i.filePath, :i.directory, :i.fileName, :i.fileSize, :i.width, :i.height, :i.imageFormat,
             :i.hasExif, :i.dateTakenMillis, :i.thumbnailPath, :i.createdMillis, :i.modifiedMillis, :i.scanMillis)
        ON CONFLICT DO NOTHING
        """)
    int[] insertImages(@BindMethods("i") List<ImageRecord> images);

    @SqlQuery("SELECT DISTINCT directory FROM images ORDER BY directory")
    List<String> imageDirectories();

    @SqlQuery("SELECT COUNT(*) FROM images WHERE " + UNDER_DIR)
    long countImagesUnder(@Bind("dir") String dir, @Bind("prefix") String prefix);

    // --- Thumbnails ------------------------------------------------------------

    @SqlQuery("SELECT thumbnail_path FROM archives WHERE thumbnail_path IS NOT NULL AND " + UNDER_DIR
            + " UNION SELECT thumbnail_path FROM images WHERE thumbnail_path IS NOT NULL AND " + UNDER_DIR)
    List<String> thumbnailPathsUnder(@Bind("dir") String dir, @Bind("prefix") String prefix);

    @SqlQuery("""
        SELECT thumbnail_path FROM archives WHERE thumbnail_path IS NOT NULL
        UNION
        SELECT thumbnail_path FROM archive_entries WHERE thumbnail_path IS NOT NULL
        UNION
        SELECT thumbnail_path FROM images WHERE thumbnail_path IS NOT NULL
        """)
    List<String> allThumbnailPaths();

    // --- Cleanup ---------------------------------------------------------------

    @SqlUpdate("DELETE FROM archive_entries WHERE archive_id IN (SELECT id FROM archives WHERE " + UNDER_DIR + ")")
    int deleteEntriesUnder(@Bind("dir") String dir, @Bind("prefix") String prefix);

    @SqlUpdate("DELETE FROM archives WHERE " + UNDER_DIR)
    int deleteArchivesUnder(@Bind("dir") String dir, @Bind("prefix") String prefix);

    @SqlUpdate("DELETE FROM images WHERE " + UNDER_DIR)
    int deleteImagesUnder(@Bind("dir") String dir, @Bind("prefix") String prefix);

    @Transaction
    default CleanupResult cleanupDirectory(String dir, String prefix) {
        deleteEntriesUnder(dir, prefix);
        int archives = deleteArchivesUnder(dir, prefix);
        int images = deleteImagesUnder(dir, prefix);
        return new CleanupResult(archives, images);
    }

    final class CleanupResult {
        public final int archivesRemoved;
        public final int imagesRemoved;

        public CleanupResult(int archivesRemoved, int imagesRemoved) {
            this.archivesRemoved = archivesRemoved;
            this.imagesRemoved = imagesRemoved;
        }

        public int total() {
            return archivesRemoved + imagesRemoved;
        }
    }

    // --- Scan history ----------------------------------------------------------

    @SqlUpdate("""
        INSERT INTO scan_history
            (id, directory_path, scan_millis, file_count, processed_count, inserted_count, elapsed_ms, scan_type)
        VALUES
            (:h.id, :h.directoryPath, :h.scanMillis, :h.fileCount, :h.processedCount, :h.insertedCount,
             :h.elapsedMs, :h.scanType)
        ON CONFLICT(id) DO NOTHING
        """)
    int insertScanHistory(@BindMethods("h") ScanHistoryRecord history);

    @SqlQuery("""
        SELECT id, directory_path AS directoryPath, scan_millis AS scanMillis, file_count AS fileCount,
               processed_count AS processedCount, inserted_count AS insertedCount, elapsed_ms AS elapsedMs,
               scan_type AS scanType
          FROM scan_history
         WHERE directory_path = :dir
         ORDER BY scan_millis DESC
         LIMIT :limit
        """)
    @RegisterConstructorMapper(ScanHistoryRecord.class)
    List<ScanHistoryRecord> scanHistory(@Bind("dir") String dir, @Bind("limit") int limit);

    @SqlQuery("SELECT DISTINCT directory_path FROM scan_history ORDER BY directory_path")
    List<String> scannedDirectories();

    @SqlUpdate("DELETE FROM scan_history WHERE directory_path = :dir")
    int deleteScanHistory(@Bind("dir") String dir);
}
