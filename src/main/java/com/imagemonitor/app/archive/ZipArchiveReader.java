package com.imagemonitor.app.archive;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.apache.commons.io.IOUtils;

final class ZipArchiveReader implements ArchiveReader {

    private final Path path;
    private final ZipFile zip;

    ZipArchiveReader(Path path) throws IOException {
        this.path = path;
        this.zip = ZipFile.builder().setPath(path).get();
    }

    @Override
    public Path path() {
        return path;
    }

    @Override
    public String type() {
        return "ZIP";
    }

    @Override
    public List<ArchiveEntry> entries() {
        List<ArchiveEntry> out = new ArrayList<>();
        for (ZipArchiveEntry e : Collections.list(zip.getEntries())) {
            out.add(new ArchiveEntry(e.getName(), e.getSize(), e.getTime(), e.isDirectory()));
        }
        return out;
    }

    @Override
    public byte[] read(ArchiveEntry entry) throws IOException {
        ZipArchiveEntry e = zip.getEntry(entry.internalPath());
        if (e == null) throw new IOException("Entry not found: " + entry.internalPath());
        if (!zip.canReadEntryData(e)) throw new IOException("Unsupported entry data: " + entry.internalPath());
        try (InputStream in = zip.getInputStream(e)) {
            return IOUtils.toByteArray(in);
        }
    }

    @Override
    public void close() throws IOException {
        zip.close();
    }
}
