package com.imagemonitor.app.archive;

import java.io.IOException;
import java.nio.file.Path;

import com.imagemonitor.app.scan.EntryValidator;

/**
 * Escolhe o decoder pela extensão.
 */
public final class ArchiveReaders {

    private ArchiveReaders() {}

    public static ArchiveReader open(Path archive) throws IOException {
        String ext = EntryValidator.extensionOf(archive.getFileName().toString());
        return switch (ext) {
            case "zip", "cbz" -> new ZipArchiveReader(archive);
            case "rar", "cbr" -> new RarArchiveReader(archive);
            default -> throw new IOException("Unsupported archive type: " + archive);
        };
    }
}
