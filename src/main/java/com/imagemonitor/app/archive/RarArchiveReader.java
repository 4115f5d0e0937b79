package com.imagemonitor.app.archive;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.junrar.Archive;
import com.github.junrar.exception.RarException;
import com.github.junrar.rarfile.FileHeader;

/**
 * RAR via junrar. O extrator do junrar não é thread-safe, então as leituras são serializadas.
 */
final class RarArchiveReader implements ArchiveReader {

    private static final Logger logger = LoggerFactory.getLogger(RarArchiveReader.class);

    private final Path path;
    private final Archive archive;
    private final Map<ArchiveEntry, FileHeader> headers = new IdentityHashMap<>();

    RarArchiveReader(Path path) throws IOException {
        this.path = path;
        try {
            this.archive = new Archive(path.toFile());
        } catch (RarException e) {
            throw new IOException("Failed to open RAR " + path, e);
        }
        boolean encrypted;
        try {
            encrypted = archive.isEncrypted();
        } catch (RarException e) {
            closeQuietly();
            throw new IOException("Failed to read RAR header " + path, e);
        }
        if (encrypted) {
            closeQuietly();
            throw new IOException("Encrypted RAR not supported: " + path);
        }
    }

    @Override
    public Path path() {
        return path;
    }

    @Override
    public String type() {
        return "RAR";
    }

    @Override
    public synchronized List<ArchiveEntry> entries() {
        List<ArchiveEntry> out = new ArrayList<>();
        headers.clear();
        for (FileHeader fh : archive.getFileHeaders()) {
            long mtime = fh.getMTime() == null ? 0L : fh.getMTime().getTime();
            ArchiveEntry entry = new ArchiveEntry(fh.getFileName(), fh.getFullUnpackSize(), mtime, fh.isDirectory());
            headers.put(entry, fh);
            out.add(entry);
        }
        return out;
    }

    @Override
    public synchronized byte[] read(ArchiveEntry entry) throws IOException {
        FileHeader fh = headers.get(entry);
        if (fh == null) {
            fh = findHeader(entry.internalPath());
        }
        if (fh == null) throw new IOException("Entry not found: " + entry.internalPath());

        int hint = (int) Math.max(0, Math.min(fh.getFullUnpackSize(), Integer.MAX_VALUE - 8));
        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(32, hint));
        try {
            archive.extractFile(fh, out);
        } catch (RarException e) {
            throw new IOException("Failed to extract " + entry.internalPath() + " from " + path, e);
        }
        return out.toByteArray();
    }

    private FileHeader findHeader(String name) {
        for (FileHeader fh : archive.getFileHeaders()) {
            if (name.equals(fh.getFileName())) return fh;
        }
        return null;
    }

    @Override
    public void close() throws IOException {
        archive.close();
    }

    private void closeQuietly() {
        try {
            archive.close();
        } catch (IOException e) {
            logger.debug("Failed to close RAR {}: {}", path, e.toString());
        }
    }
}
