package com.imagemonitor.app.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigTest {

    @Test
    void testPathsFollowSystemPropertyOverrides() {
        // Definidos pelo Surefire no pom.xml.
        Path dataDir = Config.getDataDir();
        assertTrue(dataDir.isAbsolute());
        assertTrue(dataDir.endsWith(Path.of("target", "test-data")), "Unexpected data dir: " + dataDir);

        Path db = Config.getDbFilePath();
        assertEquals("imageMonitor-test.db", db.getFileName().toString());
        assertTrue(Config.getDbUrl().startsWith("jdbc:sqlite:"));
        assertTrue(Config.getDbUrl().contains(db.toAbsolutePath().toString()));

        assertEquals(dataDir.resolve("settings.json"), Config.getSettingsFilePath());
        assertTrue(Config.getThumbnailCacheDir().endsWith(Path.of("test-data", "Thumbnails")));
    }

    @Test
    void testEnvKeyLookupPrefersSystemProperty() {
        assertEquals("imageMonitor-test.db", Config.getEnvOrDotenv("IMAGEMONITOR_DB_NAME"));
        assertNull(Config.getEnvOrDotenv("IMAGEMONITOR_NO_SUCH_KEY_" + System.nanoTime()));
    }
}
