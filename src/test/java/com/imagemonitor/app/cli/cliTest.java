package com.imagemonitor.app.cli;

import static org.junit.jupiter.api.Assertions.*;

import java.awt.Color;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.imagemonitor.app.TestFixtures;
import com.imagemonitor.app.config.SettingsStore;
import com.imagemonitor.app.database.Database;
import com.imagemonitor.app.database.JdbiPersistenceGateway;

public class cliTest {

    @AfterEach
    void tearDown() {
        Database.shutdown();
    }

    @Test
    void execute_helpAndUnknownCommand() {
        assertEquals(0, cli.execute(new String[] {}));
        assertEquals(0, cli.execute(new String[] {"help"}));
        assertEquals(0, cli.execute(new String[] {"scan", "--help"}));
        assertEquals(2, cli.execute(new String[] {"frobnicate"}));
    }

    @Test
    void execute_invalidArguments_returnTwo() throws Exception {
        Path missing = Files.createTempDirectory("imagemonitor-cli-").resolve("missing");

        assertEquals(2, cli.execute(new String[] {"scan", "--dir", missing.toString()}));
        assertEquals(2, cli.execute(new String[] {"scan", "--bogus"}));
        assertEquals(2, cli.execute(new String[] {"scan", "--dir"}));
        assertEquals(2, cli.execute(new String[] {"history"}));
        assertEquals(2, cli.execute(new String[] {"history", "--dir", "/x", "--limit", "abc"}));
        assertEquals(2, cli.execute(new String[] {"thumbnails", "--cleanup-days", "x"}));
    }

    @Test
    void execute_scanThenSearchAndHistory() throws Exception {
        Path root = Files.createTempDirectory("imagemonitor-cli-").toAbsolutePath().normalize();
        String name = "cli-book-" + System.nanoTime() + ".zip";
        Map<String, byte[]> entries = new LinkedHashMap<>();
        for (int i = 0; i < 3; i++) {
            entries.put("p" + i + ".jpg", TestFixtures.jpeg(120, 90, Color.PINK));
        }
        Path zip = TestFixtures.zip(root.resolve(name), entries);

        assertEquals(0, cli.execute(new String[] {"scan", "--dir", root.toString()}));
        assertEquals(0, cli.execute(new String[] {"search", "--query", "cli-book"}));
        assertEquals(0, cli.execute(new String[] {"history", "--dir", root.toString(), "--limit", "5"}));

        JdbiPersistenceGateway gateway = new JdbiPersistenceGateway(Database.jdbi());
        assertTrue(gateway.findArchiveByPath(zip.toString()).isPresent());
        assertTrue(gateway.getLastScanHistory(root.toString()).isPresent());
    }

    @Test
    void execute_settingsAddAndRemoveDirectory() throws Exception {
        Path dir = Files.createTempDirectory("imagemonitor-cli-").toAbsolutePath().normalize();
        SettingsStore store = new SettingsStore();

        try {
            assertEquals(0, cli.execute(new String[] {"settings", "--add-dir", dir.toString()}));
            assertTrue(store.load().scanDirectories().contains(dir.toString()));
        } finally {
            assertEquals(0, cli.execute(new String[] {"settings", "--remove-dir", dir.toString()}));
        }
        assertFalse(store.load().scanDirectories().contains(dir.toString()));
    }
}
