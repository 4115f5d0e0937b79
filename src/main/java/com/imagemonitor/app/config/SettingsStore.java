package com.imagemonitor.app.config;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Lê e grava o settings.json com Jackson.
 */
public final class SettingsStore {

    private static final Logger logger = LoggerFactory.getLogger(SettingsStore.class);

    private final Path file;
    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public SettingsStore() {
        this(Config.getSettingsFilePath());
    }

    public SettingsStore(Path file) {
        this.file = file;
    }

    public Path file() {
        return file;
    }

    public ScanSettings load() {
        if (!Files.exists(file)) {
            logger.debug("Settings file not found, using defaults: {}", file);
            return ScanSettings.defaults();
        }
        try {
            ScanSettings loaded = mapper.readValue(file.toFile(), ScanSettings.class);
            return loaded == null ? ScanSettings.defaults() : loaded;
        } catch (IOException e) {
            logger.error("Failed to read settings file {}, using defaults", file, e);
            return ScanSettings.defaults();
        }
    }

    public void save(ScanSettings settings) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);

        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        mapper.writeValue(tmp.toFile(), settings);
        try {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }
        logger.debug("Settings saved: {}", file);
    }
}
