package com.imagemonitor.app.database;

import java.util.List;

import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.exception.FlywayValidateException;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.imagemonitor.app.config.Config;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * Pool SQLite (Hikari), Jdbi e migrações Flyway.
 */
public final class Database {

    private static final Logger logger = LoggerFactory.getLogger(Database.class);

    private Database() {}

    // --- RECORDS (Modelos de Dados) ---

    public static final String SCAN_FULL = "Full";
    public static final String SCAN_INCREMENTAL = "Incremental";

    public record ArchiveEntryRecord(
            String id,
            String archiveId,
            String internalPath,
            String fileName,
            long fileSize,
            int width,
            int height,
            String imageFormat,
            String thumbnailPath,
            double imageRatio,
            int sortOrder
    ) {
        public ArchiveEntryRecord withThumbnail(String thumbnail, double ratio) {
            return new ArchiveEntryRecord(id, archiveId, internalPath, fileName, fileSize, width, height,
                    imageFormat, thumbnail, ratio, sortOrder);
        }
    }

    public record ArchiveRecord(
            String id,
            String filePath,
            String directory,
            String fileName,
            long fileSize,
            long createdMillis,
            long modifiedMillis,
            long scanMillis,
            String archiveType,
            int totalFiles,
            int imageFiles,
            double imageRatio,
            String thumbnailPath,
            List<ArchiveEntryRecord> entries
    ) {
        public ArchiveRecord {
            entries = entries == null ? List.of() : List.copyOf(entries);
        }
    }

    /** Linha da tabela archives, sem as entradas. */
    public record ArchiveRow(
            String id,
            String filePath,
            String directory,
            String fileName,
            long fileSize,
            long createdMillis,
            long modifiedMillis,
            long scanMillis,
            String archiveType,
            int totalFiles,
            int imageFiles,
            double imageRatio,
            String thumbnailPath
    ) {
        public ArchiveRecord withEntries(List<ArchiveEntryRecord> entries) {
            return new ArchiveRecord(id, filePath, directory, fileName, fileSize, createdMillis, modifiedMillis,
                    scanMillis, archiveType, totalFiles, imageFiles, imageRatio, thumbnailPath, entries);
        }
    }

    public record ImageRecord(
            String id,
            String filePath,
            String directory,
            String fileName,
            long fileSize,
            int width,
            int height,
            String imageFormat,
            boolean hasExif,
            Long dateTakenMillis,
            String thumbnailPath,
            long createdMillis,
            long modifiedMillis,
            long scanMillis
    ) {}

    public record ScanHistoryRecord(
            String id,
            String directoryPath,
            long scanMillis,
            int fileCount,
            int processedCount,
            int insertedCount,
            long elapsedMs,
            String scanType
    ) {}

    // --- CONNECTION POOL ---

    private static HikariDataSource dataSource;
    private static Jdbi jdbi;
    private static boolean migrated = false;

    private static synchronized void createDataSource() {
        if (dataSource != null) return;
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(Config.getDbUrl());
        config.setPoolName("imagemonitor-sqlite");
        config.setConnectionTestQuery("SELECT 1");
        config.setMaximumPoolSize(8);
        // WAL + NORMAL: leituras concorrentes enquanto o writer grava em lote.
        // Passados como propriedades do driver para valer em toda conexão nova do pool.
        config.addDataSourceProperty("journal_mode", "WAL");
        config.addDataSourceProperty("synchronous", "NORMAL");
        config.addDataSourceProperty("busy_timeout", "10000");
        config.addDataSourceProperty("foreign_keys", "true");
        // BEGIN IMMEDIATE: a trava de escrita é pega no início (respeitando busy_timeout),
        // sem upgrade leitura->escrita que falha na hora com SQLITE_BUSY.
        config.addDataSourceProperty("transaction_mode", "IMMEDIATE");

        dataSource = new HikariDataSource(config);
    }

    public static synchronized void init() {
        if (dataSource == null) {
            createDataSource();
        }
        if (jdbi == null) {
            jdbi = Jdbi.create(dataSource);
            jdbi.installPlugin(new SqlObjectPlugin());
        }
        migrateIfNeeded();
    }

    private static synchronized void migrateIfNeeded() {
        if (migrated) return;
        Flyway flyway = Flyway.configure()
                .dataSource(dataSource)
                .locations("classpath:db/migration")
                .baselineOnMigrate(true)
                .baselineVersion("0")
                .load();
        try {
            try {
                flyway.migrate();
            } catch (FlywayValidateException e) {
                logger.warn("Flyway validation failed; attempting repair.", e);
                flyway.repair();
                flyway.migrate();
            }
            migrated = true;
        } catch (RuntimeException e) {
            logger.error("Flyway migration failed", e);
            throw new IllegalStateException("Flyway migration failed", e);
        }
    }

    public static synchronized void shutdown() {
        if (dataSource != null) {
            try {
                dataSource.close();
            } catch (RuntimeException e) {
                logger.warn("Failed to close SQLite pool", e);
            }
            dataSource = null;
        }
        jdbi = null;
        migrated = false;
    }

    public static synchronized Jdbi jdbi() {
        init();
        return jdbi;
    }
}
