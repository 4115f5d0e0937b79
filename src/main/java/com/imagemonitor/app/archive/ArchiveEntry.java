package com.imagemonitor.app.archive;

/**
 * One entry listed from an archive container. {@code size} is the uncompressed size, -1 when unknown.
 */
public record ArchiveEntry(String internalPath, long size, long modifiedMillis, boolean directory) {

    public String fileName() {
        String p = internalPath;
        int cut = Math.max(p.lastIndexOf('/'), p.lastIndexOf('\\'));
        return cut >= 0 ? p.substring(cut + 1) : p;
    }
}
