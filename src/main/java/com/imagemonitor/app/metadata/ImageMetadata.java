package com.imagemonitor.app.metadata;

import java.time.LocalDateTime;
import java.util.Locale;

import com.imagemonitor.app.scan.EntryValidator;

public record ImageMetadata(int width, int height, String format, boolean hasCaptureDate, LocalDateTime captureDate) {

    public static final int MAX_DIMENSION = 50_000;

    /** Zero size, format taken from the file extension, no capture date. */
    public static ImageMetadata defaults(String fileNameHint) {
        return new ImageMetadata(0, 0, EntryValidator.extensionOf(fileNameHint).toUpperCase(Locale.ROOT), false, null);
    }

    public static boolean validDimensions(int width, int height) {
        return width > 0 && height > 0 && width <= MAX_DIMENSION && height <= MAX_DIMENSION;
    }

    public boolean hasDimensions() {
        return validDimensions(width, height);
    }
}
