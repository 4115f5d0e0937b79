package com.imagemonitor.app.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Settings consumed by the scan pipeline. Every field has a default, so a partial
 * or hand-edited settings.json still yields a usable configuration.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ScanSettings(
        List<String> scanDirectories,
        Integer thumbnailSize,
        Double imageRatioThreshold,
        Integer maxConcurrentScans,
        Integer metadataCacheCapacity,
        Integer freshnessHours,
        Boolean archivesOnly,
        Boolean generateArchiveThumbnails,
        Integer maxArchiveEntries,
        Integer thumbnailConcurrency,
        Integer entryTimeoutSeconds,
        Boolean extractArchiveDimensions,
        Integer thumbnailRetentionDays,
        StorageProfile storageProfile,
        List<String> supportedImageExtensions,
        List<String> supportedArchiveExtensions
) {

    public enum StorageProfile { HDD, SSD }

    public static final List<String> DEFAULT_IMAGE_EXTENSIONS = List.of("jpg", "jpeg", "png", "bmp", "gif", "webp");
    public static final List<String> DEFAULT_ARCHIVE_EXTENSIONS = List.of("zip", "rar");

    public ScanSettings {
        scanDirectories = scanDirectories == null ? List.of() : List.copyOf(distinctNonBlank(scanDirectories));
        thumbnailSize = positiveOr(thumbnailSize, 128);
        imageRatioThreshold = (imageRatioThreshold == null || imageRatioThreshold < 0 || imageRatioThreshold > 1)
                ? 0.5 : imageRatioThreshold;
        maxConcurrentScans = positiveOr(maxConcurrentScans, 4);
        metadataCacheCapacity = positiveOr(metadataCacheCapacity, 1000);
        freshnessHours = positiveOr(freshnessHours, 24);
        archivesOnly = archivesOnly == null || archivesOnly;
        generateArchiveThumbnails = generateArchiveThumbnails == null || generateArchiveThumbnails;
        maxArchiveEntries = positiveOr(maxArchiveEntries, 10_000);
        thumbnailConcurrency = positiveOr(thumbnailConcurrency, 4);
        entryTimeoutSeconds = positiveOr(entryTimeoutSeconds, 10);
        extractArchiveDimensions = extractArchiveDimensions != null && extractArchiveDimensions;
        thumbnailRetentionDays = positiveOr(thumbnailRetentionDays, 30);
        storageProfile = storageProfile == null ? StorageProfile.HDD : storageProfile;
        supportedImageExtensions = normalizeExtensions(supportedImageExtensions, DEFAULT_IMAGE_EXTENSIONS);
        supportedArchiveExtensions = normalizeExtensions(supportedArchiveExtensions, DEFAULT_ARCHIVE_EXTENSIONS);
    }

    public static ScanSettings defaults() {
        return new ScanSettings(null, null, null, null, null, null, null, null,
                null, null, null, null, null, null, null, null);
    }

    @JsonIgnore
    public List<Path> scanDirectoryPaths() {
        List<Path> out = new ArrayList<>(scanDirectories.size());
        for (String d : scanDirectories) {
            out.add(Paths.get(d).toAbsolutePath().normalize());
        }
        return out;
    }

    public ScanSettings withScanDirectories(List<String> dirs) {
        return new ScanSettings(dirs, thumbnailSize, imageRatioThreshold, maxConcurrentScans,
                metadataCacheCapacity, freshnessHours, archivesOnly, generateArchiveThumbnails,
                maxArchiveEntries, thumbnailConcurrency, entryTimeoutSeconds, extractArchiveDimensions,
                thumbnailRetentionDays, storageProfile, supportedImageExtensions, supportedArchiveExtensions);
    }

    public ScanSettings withArchivesOnly(boolean value) {
        return new ScanSettings(scanDirectories, thumbnailSize, imageRatioThreshold, maxConcurrentScans,
                metadataCacheCapacity, freshnessHours, value, generateArchiveThumbnails,
                maxArchiveEntries, thumbnailConcurrency, entryTimeoutSeconds, extractArchiveDimensions,
                thumbnailRetentionDays, storageProfile, supportedImageExtensions, supportedArchiveExtensions);
    }

    public ScanSettings withImageRatioThreshold(double value) {
        return new ScanSettings(scanDirectories, thumbnailSize, value, maxConcurrentScans,
                metadataCacheCapacity, freshnessHours, archivesOnly, generateArchiveThumbnails,
                maxArchiveEntries, thumbnailConcurrency, entryTimeoutSeconds, extractArchiveDimensions,
                thumbnailRetentionDays, storageProfile, supportedImageExtensions, supportedArchiveExtensions);
    }

    private static Integer positiveOr(Integer v, int fallback) {
        return (v == null || v <= 0) ? fallback : v;
    }

    private static List<String> distinctNonBlank(List<String> values) {
        Set<String> out = new LinkedHashSet<>();
        for (String v : values) {
            if (v != null && !v.isBlank()) out.add(v.trim());
        }
        return new ArrayList<>(out);
    }

    private static List<String> normalizeExtensions(List<String> values, List<String> fallback) {
        if (values == null || values.isEmpty()) return fallback;
        Set<String> out = new LinkedHashSet<>();
        for (String v : values) {
            if (v == null || v.isBlank()) continue;
            String ext = v.trim().toLowerCase(Locale.ROOT);
            out.add(ext.startsWith(".") ? ext.substring(1) : ext);
        }
        return out.isEmpty() ? fallback : List.copyOf(out);
    }
}
