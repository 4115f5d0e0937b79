package com.imagemonitor.app.metadata;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Reads the capture date from the EXIF APP1 segment of a JPEG.
 * DateTimeOriginal (0x9003) wins over DateTime (0x0132). Malformed data yields empty.
 */
final class ExifDateReader {

    private static final int TAG_DATE_TIME = 0x0132;
    private static final int TAG_EXIF_IFD = 0x8769;
    private static final int TAG_DATE_TIME_ORIGINAL = 0x9003;
    private static final int TYPE_ASCII = 2;
    private static final int MAX_IFD_ENTRIES = 512;

    private static final DateTimeFormatter EXIF_DATE = DateTimeFormatter.ofPattern("yyyy:MM:dd HH:mm:ss");

    private ExifDateReader() {}

    static Optional<LocalDateTime> readCaptureDate(byte[] data, int length) {
        int limit = Math.min(length, data.length);
        if (limit < 4 || u8(data, 0) != 0xFF || u8(data, 1) != 0xD8) return Optional.empty();

        int pos = 2;
        while (pos + 4 <= limit) {
            if (u8(data, pos) != 0xFF) return Optional.empty();
            int marker = u8(data, pos + 1);
            if (marker == 0xFF) { pos++; continue; }
            if (marker == 0xD9 || marker == 0xDA) return Optional.empty();
            if (marker == 0x01 || (marker >= 0xD0 && marker <= 0xD7)) { pos += 2; continue; }

            int segLen = (u8(data, pos + 2) << 8) | u8(data, pos + 3);
            if (segLen < 2) return Optional.empty();
            int segStart = pos + 4;
            int segEnd = pos + 2 + segLen;
            if (segEnd > limit) return Optional.empty();

            if (marker == 0xE1 && segEnd - segStart >= 14 && isExifHeader(data, segStart)) {
                return new Tiff(data, segStart + 6, segEnd).captureDate();
            }
            pos = segEnd;
        }
        return Optional.empty();
    }

    private static boolean isExifHeader(byte[] d, int p) {
        return d[p] == 'E' && d[p + 1] == 'x' && d[p + 2] == 'i' && d[p + 3] == 'f' && d[p + 4] == 0 && d[p + 5] == 0;
    }

    private static int u8(byte[] d, int p) {
        return d[p] & 0xFF;
    }

    private static final class Tiff {
        private final byte[] d;
        private final int base;
        private final int end;
        private boolean little;

        Tiff(byte[] d, int base, int end) {
            this.d = d;
            this.base = base;
            this.end = end;
        }

        Optional<LocalDateTime> captureDate() {
            if (base + 8 > end) return Optional.empty();
            if (d[base] == 'I' && d[base + 1] == 'I') little = true;
            else if (d[base] == 'M' && d[base + 1] == 'M') little = false;
            else return Optional.empty();
            if (u16(base + 2) != 42) return Optional.empty();

            long ifd0 = u32(base + 4);
            LocalDateTime dateTime = null;
            LocalDateTime original = null;
            long exifIfd = -1;

            int count = entryCount(ifd0);
            for (int i = 0; i < count; i++) {
                int e = (int) (base + ifd0 + 2 + 12L * i);
                int tag = u16(e);
                if (tag == TAG_DATE_TIME) dateTime = asciiDate(e);
                else if (tag == TAG_EXIF_IFD) exifIfd = u32(e + 8);
            }

            if (exifIfd > 0) {
                int exifCount = entryCount(exifIfd);
                for (int i = 0; i < exifCount; i++) {
                    int e = (int) (base + exifIfd + 2 + 12L * i);
                    if (u16(e) == TAG_DATE_TIME_ORIGINAL) {
                        original = asciiDate(e);
                        break;
                    }
                }
            }
            return Optional.ofNullable(original != null ? original : dateTime);
        }

        private int entryCount(long ifdOffset) {
            if (ifdOffset < 8 || base + ifdOffset + 2 > end) return 0;
            int n = u16((int) (base + ifdOffset));
            if (n > MAX_IFD_ENTRIES) return 0;
            // trunca se a tabela passar do fim do segmento
            long room = (end - (base + ifdOffset + 2)) / 12;
            return (int) Math.min(n, room);
        }

        private LocalDateTime asciiDate(int entry) {
            if (u16(entry + 2) != TYPE_ASCII) return null;
            long count = u32(entry + 4);
            if (count < 19) return null;
            long offset = u32(entry + 8);
            long start = base + offset;
            if (start < base || start + 19 > end) return null;
            String raw = new String(d, (int) start, 19, StandardCharsets.US_ASCII);
            try {
                return LocalDateTime.parse(raw, EXIF_DATE);
            } catch (DateTimeParseException e) {
                return null;
            }
        }

        private int u16(int p) {
            int a = d[p] & 0xFF;
            int b = d[p + 1] & 0xFF;
            return little ? (b << 8) | a : (a << 8) | b;
        }

        private long u32(int p) {
            long a = d[p] & 0xFF;
            long b = d[p + 1] & 0xFF;
            long c = d[p + 2] & 0xFF;
            long e = d[p + 3] & 0xFF;
            return little ? (e << 24) | (c << 16) | (b << 8) | a : (a << 24) | (b << 16) | (c << 8) | e;
        }
    }
}
