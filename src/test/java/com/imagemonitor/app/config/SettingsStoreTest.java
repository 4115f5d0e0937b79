package com.imagemonitor.app.config;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.imagemonitor.app.config.ScanSettings.StorageProfile;

public class SettingsStoreTest {

    @Test
    void load_missingFile_returnsDefaults() throws Exception {
        Path dir = Files.createTempDirectory("imagemonitor-settings-");
        SettingsStore store = new SettingsStore(dir.resolve("settings.json"));

        ScanSettings s = store.load();

        assertEquals(ScanSettings.defaults(), s);
        assertEquals(128, s.thumbnailSize());
        assertEquals(0.5, s.imageRatioThreshold());
        assertEquals(24, s.freshnessHours());
        assertTrue(s.archivesOnly());
        assertFalse(s.extractArchiveDimensions());
        assertEquals(StorageProfile.HDD, s.storageProfile());
        assertTrue(s.scanDirectories().isEmpty());
    }

    @Test
    void saveThenLoad_preservesDirectoriesAndOverrides() throws Exception {
        Path dir = Files.createTempDirectory("imagemonitor-settings-");
        SettingsStore store = new SettingsStore(dir.resolve("nested").resolve("settings.json"));

        ScanSettings s = ScanSettings.defaults()
                .withScanDirectories(List.of("/data/comics", "/data/photos", "/data/comics"))
                .withArchivesOnly(false)
                .withImageRatioThreshold(0.8);
        store.save(s);
        ScanSettings loaded = store.load();

        assertEquals(List.of("/data/comics", "/data/photos"), loaded.scanDirectories());
        assertFalse(loaded.archivesOnly());
        assertEquals(0.8, loaded.imageRatioThreshold());
        assertEquals(s, loaded);
        assertFalse(Files.exists(dir.resolve("nested").resolve("settings.json.tmp")));
    }

    @Test
    void load_partialJson_fillsMissingFieldsWithDefaults() throws Exception {
        Path dir = Files.createTempDirectory("imagemonitor-settings-");
        Path file = dir.resolve("settings.json");
        Files.writeString(file, """
                {"thumbnailSize": 256, "imageRatioThreshold": 1.5, "storageProfile": "SSD",
                 "supportedImageExtensions": [".JPG", "png"], "somethingElse": true}
                """);

        ScanSettings s = new SettingsStore(file).load();

        assertEquals(256, s.thumbnailSize());
        assertEquals(0.5, s.imageRatioThreshold());
        assertEquals(StorageProfile.SSD, s.storageProfile());
        assertEquals(List.of("jpg", "png"), s.supportedImageExtensions());
        assertEquals(ScanSettings.DEFAULT_ARCHIVE_EXTENSIONS, s.supportedArchiveExtensions());
        assertEquals(4, s.maxConcurrentScans());
    }

    @Test
    void load_malformedJson_returnsDefaults() throws Exception {
        Path dir = Files.createTempDirectory("imagemonitor-settings-");
        Path file = dir.resolve("settings.json");
        Files.writeString(file, "{ not json");

        assertEquals(ScanSettings.defaults(), new SettingsStore(file).load());
    }
}
