package db.migration;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

import org.flywaydb.core.api.migration.BaseJavaMigration;
import org.flywaydb.core.api.migration.Context;

public final class V1__catalog_schema extends BaseJavaMigration {

    @Override
    public void migrate(Context context) throws Exception {
        Connection conn = context.getConnection();

        try (Statement st = conn.createStatement()) {
            st.execute("PRAGMA foreign_keys=ON");
            st.execute("PRAGMA busy_timeout=5000");
        }

        // idempotente: DBs criados à mão antes do Flyway também passam
        ensureTables(conn);
        ensureIndexes(conn);
    }

    private void ensureTables(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                CREATE TABLE IF NOT EXISTS archives (
                    id TEXT PRIMARY KEY,
                    file_path TEXT NOT NULL UNIQUE,
                    directory TEXT NOT NULL,
                    file_name TEXT NOT NULL,
                    file_size INTEGER NOT NULL,
                    created_millis INTEGER NOT NULL DEFAULT 0,
                    modified_millis INTEGER NOT NULL DEFAULT 0,
                    scan_millis INTEGER NOT NULL DEFAULT 0,
                    archive_type TEXT,
                    total_files INTEGER NOT NULL DEFAULT 0,
                    image_files INTEGER NOT NULL DEFAULT 0,
                    image_ratio REAL NOT NULL DEFAULT 0,
                    thumbnail_path TEXT
                )
                """);

            st.execute("""
                CREATE TABLE IF NOT EXISTS archive_entries (
                    id TEXT PRIMARY KEY,
                    archive_id TEXT NOT NULL REFERENCES archives(id) ON DELETE CASCADE,
                    internal_path TEXT NOT NULL,
                    file_name TEXT NOT NULL,
                    file_size INTEGER NOT NULL,
                    width INTEGER NOT NULL DEFAULT 0,
                    height INTEGER NOT NULL DEFAULT 0,
                    image_format TEXT,
                    thumbnail_path TEXT,
                    image_ratio REAL NOT NULL DEFAULT 0,
                    sort_order INTEGER NOT NULL DEFAULT 0
                )
                """);

            st.execute("""
                CREATE TABLE IF NOT EXISTS images (
                    id TEXT PRIMARY KEY,
                    file_path TEXT NOT NULL UNIQUE,
                    directory TEXT NOT NULL,
                    file_name TEXT NOT NULL,
                    file_size INTEGER NOT NULL,
                    width INTEGER NOT NULL DEFAULT 0,
                    height INTEGER NOT NULL DEFAULT 0,
                    image_format TEXT,
                    has_exif INTEGER NOT NULL DEFAULT 0,
                    date_taken_millis INTEGER,
                    thumbnail_path TEXT,
                    created_millis INTEGER NOT NULL DEFAULT 0,
                    modified_millis INTEGER NOT NULL DEFAULT 0,
                    scan_millis INTEGER NOT NULL DEFAULT 0
                )
                """);

            st.execute("""
                CREATE TABLE IF NOT EXISTS scan_history (
                    id TEXT PRIMARY KEY,
                    directory_path TEXT NOT NULL,
                    scan_millis INTEGER NOT NULL,
                    file_count INTEGER NOT NULL DEFAULT 0,
                    processed_count INTEGER NOT NULL DEFAULT 0,
                    inserted_count INTEGER NOT NULL DEFAULT 0,
                    elapsed_ms INTEGER NOT NULL DEFAULT 0,
                    scan_type TEXT NOT NULL
                )
                """);
        }
    }

    private void ensureIndexes(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("CREATE INDEX IF NOT EXISTS idx_archives_directory ON archives(directory)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_archives_file_name ON archives(file_name)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_entries_archive ON archive_entries(archive_id, sort_order)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_images_directory ON images(directory)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_scan_history_dir_date ON scan_history(directory_path, scan_millis DESC)");
        }
    }
}
