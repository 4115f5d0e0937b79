package com.imagemonitor.app.scan;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;

import com.imagemonitor.app.archive.ArchiveEntry;
import com.imagemonitor.app.config.ScanSettings;

/**
 * Checks done before any expensive I/O. Only strings and sizes are inspected.
 */
public final class EntryValidator {

    public static final long MIN_IMAGE_BYTES = 100L;
    public static final long MAX_ARCHIVE_ENTRY_BYTES = 50L * 1024 * 1024;
    public static final long MAX_IMAGE_FILE_BYTES = 100L * 1024 * 1024;
    public static final long MIN_ARCHIVE_FILE_BYTES = 1024L;
    public static final long MAX_ARCHIVE_FILE_BYTES = 2L * 1024 * 1024 * 1024;

    /** Ordem estável da "primeira imagem": caminho interno sem caixa, depois com caixa. */
    public static final Comparator<ArchiveEntry> ENTRY_ORDER =
            Comparator.comparing(ArchiveEntry::internalPath, String.CASE_INSENSITIVE_ORDER)
                    .thenComparing(ArchiveEntry::internalPath);

    private static final String[] JUNK_PREFIXES = {".", "__MACOSX"};
    private static final Set<String> JUNK_NAMES = Set.of("thumbs.db", "desktop.ini");

    private final Set<String> imageExtensions;
    private final Set<String> archiveExtensions;

    public EntryValidator(Collection<String> imageExtensions, Collection<String> archiveExtensions) {
        this.imageExtensions = Set.copyOf(imageExtensions);
        this.archiveExtensions = Set.copyOf(archiveExtensions);
    }

    public static EntryValidator from(ScanSettings settings) {
        return new EntryValidator(settings.supportedImageExtensions(), settings.supportedArchiveExtensions());
    }

    public static EntryValidator defaults() {
        return new EntryValidator(ScanSettings.DEFAULT_IMAGE_EXTENSIONS, ScanSettings.DEFAULT_ARCHIVE_EXTENSIONS);
    }

    /**
     * Image entry inside an archive: 100B..50MB, supported extension, no traversal, no junk.
     */
    public boolean isValidEntry(String path, long size) {
        if (size < MIN_IMAGE_BYTES || size > MAX_ARCHIVE_ENTRY_BYTES) return false;
        return isSafeImagePath(path);
    }

    /**
     * Qualifying image entries of an archive listing, sorted by {@link #ENTRY_ORDER}.
     */
    public List<ArchiveEntry> imageEntries(List<ArchiveEntry> listing) {
        List<ArchiveEntry> images = new ArrayList<>();
        for (ArchiveEntry e : listing) {
            if (!e.directory() && isValidEntry(e.internalPath(), e.size())) {
                images.add(e);
            }
        }
        images.sort(ENTRY_ORDER);
        // nomes repetidos no zip: fica a primeira ocorrência
        Set<String> seen = new HashSet<>();
        images.removeIf(e -> !seen.add(e.internalPath()));
        return images;
    }

    /** Stand-alone image file: 100B..100MB. */
    public boolean isValidImageFile(String path, long size) {
        if (size < MIN_IMAGE_BYTES || size > MAX_IMAGE_FILE_BYTES) return false;
        return isSafeImagePath(path);
    }

    /** Archive container: 1KB..2GB. */
    public boolean isValidArchiveFile(String path, long size) {
        if (size < MIN_ARCHIVE_FILE_BYTES || size > MAX_ARCHIVE_FILE_BYTES) return false;
        if (StringUtils.isEmpty(path) || path.indexOf('\0') >= 0) return false;
        return isArchivePath(path) && !isJunkName(fileName(path));
    }

    public boolean isImagePath(String path) {
        return imageExtensions.contains(extensionOf(path));
    }

    public boolean isArchivePath(String path) {
        return archiveExtensions.contains(extensionOf(path));
    }

    private boolean isSafeImagePath(String path) {
        if (StringUtils.isEmpty(path)) return false;
        if (path.indexOf('\0') >= 0) return false;
        if (path.startsWith("/") || path.startsWith("\\")) return false;
        if (path.contains("..")) return false;
        if (path.contains("__MACOSX")) return false;
        if (!isImagePath(path)) return false;
        return !isJunkName(fileName(path));
    }

    static boolean isJunkName(String name) {
        if (name.isEmpty()) return true;
        for (String p : JUNK_PREFIXES) {
            if (name.startsWith(p)) return true;
        }
        return JUNK_NAMES.contains(name.toLowerCase(Locale.ROOT));
    }

    /** Lowercase extension without the dot, or "" when there is none. */
    public static String extensionOf(String path) {
        if (path == null) return "";
        return FilenameUtils.getExtension(fileName(path)).toLowerCase(Locale.ROOT);
    }

    public static String fileName(String path) {
        if (path == null) return "";
        int cut = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        return cut >= 0 ? path.substring(cut + 1) : path;
    }
}
