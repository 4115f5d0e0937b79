package com.imagemonitor.app.metadata;

import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Iterator;
import java.util.Locale;
import java.util.Optional;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;

import org.apache.commons.io.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extrai dimensões, formato e data de captura de uma imagem.
 *
 * <p>Streams com mark/reset passam primeiro pelo caminho rápido: só os primeiros 8KB são lidos
 * e os marcadores JPEG (SOF0/1/2) ou o chunk IHDR do PNG são interpretados direto.
 * Se isso falhar o stream inteiro é bufferizado e entregue ao ImageIO.
 * Nunca lança exceção: no pior caso devolve {@link ImageMetadata#defaults(String)}.
 */
public class MetadataExtractor {

    private static final Logger logger = LoggerFactory.getLogger(MetadataExtractor.class);

    static final int HEADER_BYTES = 8 * 1024;
    static final int MIN_FULL_BYTES = 100;

    private static final byte[] PNG_SIGNATURE = {(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n'};

    public ImageMetadata extract(Path file) {
        String hint = file.getFileName() == null ? "" : file.getFileName().toString();
        try (InputStream in = new BufferedInputStream(Files.newInputStream(file), HEADER_BYTES)) {
            return extract(in, hint);
        } catch (IOException e) {
            logger.warn("Cannot open image {}: {}", file, e.getMessage());
            return ImageMetadata.defaults(hint);
        }
    }

    public ImageMetadata extract(byte[] data, String fileNameHint) {
        return extract(new ByteArrayInputStream(data), fileNameHint);
    }

    public ImageMetadata extract(InputStream in, String fileNameHint) {
        try {
            if (in.markSupported()) {
                Optional<ImageMetadata> fast = tryFastPath(in);
                if (fast.isPresent()) return fast.get();
            }
            return fullPath(in, fileNameHint);
        } catch (Exception e) {
            logger.warn("Metadata unavailable for {}: {}", fileNameHint, e.toString());
            return ImageMetadata.defaults(fileNameHint);
        }
    }

    // --- caminho rápido ---

    private Optional<ImageMetadata> tryFastPath(InputStream in) throws IOException {
        in.mark(HEADER_BYTES + 1);
        byte[] header;
        try {
            header = in.readNBytes(HEADER_BYTES);
        } finally {
            in.reset();
        }
        Optional<ImageMetadata> jpeg = parseJpegHeader(header, header.length);
        if (jpeg.isPresent()) return jpeg;
        return parsePngHeader(header, header.length);
    }

    static Optional<ImageMetadata> parseJpegHeader(byte[] h, int len) {
        if (len < 4 || (h[0] & 0xFF) != 0xFF || (h[1] & 0xFF) != 0xD8) return Optional.empty();

        int pos = 2;
        while (pos + 4 <= len) {
            if ((h[pos] & 0xFF) != 0xFF) return Optional.empty();
            int marker = h[pos + 1] & 0xFF;
            if (marker == 0xFF) { pos++; continue; }
            if (marker == 0xD9 || marker == 0xDA) return Optional.empty();
            if (marker == 0x01 || (marker >= 0xD0 && marker <= 0xD7)) { pos += 2; continue; }

            int segLen = ((h[pos + 2] & 0xFF) << 8) | (h[pos + 3] & 0xFF);
            if (segLen < 2) return Optional.empty();

            if (marker == 0xC0 || marker == 0xC1 || marker == 0xC2) {
                // length(2) precision(1) height(2) width(2)
                if (pos + 9 > len || segLen < 7) return Optional.empty();
                int height = ((h[pos + 5] & 0xFF) << 8) | (h[pos + 6] & 0xFF);
                int width = ((h[pos + 7] & 0xFF) << 8) | (h[pos + 8] & 0xFF);
                if (!ImageMetadata.validDimensions(width, height)) return Optional.empty();

                Optional<LocalDateTime> taken = ExifDateReader.readCaptureDate(h, len);
                return Optional.of(new ImageMetadata(width, height, "JPEG", taken.isPresent(), taken.orElse(null)));
            }
            pos += 2 + segLen;
        }
        return Optional.empty();
    }

    static Optional<ImageMetadata> parsePngHeader(byte[] h, int len) {
        if (len < 24) return Optional.empty();
        for (int i = 0; i < PNG_SIGNATURE.length; i++) {
            if (h[i] != PNG_SIGNATURE[i]) return Optional.empty();
        }
        if (h[12] != 'I' || h[13] != 'H' || h[14] != 'D' || h[15] != 'R') return Optional.empty();

        long width = readIntBE(h, 16);
        long height = readIntBE(h, 20);
        if (width > Integer.MAX_VALUE || height > Integer.MAX_VALUE) return Optional.empty();
        if (!ImageMetadata.validDimensions((int) width, (int) height)) return Optional.empty();
        return Optional.of(new ImageMetadata((int) width, (int) height, "PNG", false, null));
    }

    private static long readIntBE(byte[] h, int p) {
        return ((long) (h[p] & 0xFF) << 24) | ((h[p + 1] & 0xFF) << 16) | ((h[p + 2] & 0xFF) << 8) | (h[p + 3] & 0xFF);
    }

    // --- caminho completo ---

    private ImageMetadata fullPath(InputStream in, String hint) throws IOException {
        // bufferiza tudo: decoders não lidam bem com streams parciais
        byte[] data = IOUtils.toByteArray(in);
        if (data.length < MIN_FULL_BYTES) {
            logger.debug("Image too small ({} bytes): {}", data.length, hint);
            return ImageMetadata.defaults(hint);
        }

        try (ImageInputStream iis = ImageIO.createImageInputStream(new ByteArrayInputStream(data))) {
            if (iis == null) return ImageMetadata.defaults(hint);
            Iterator<ImageReader> readers = ImageIO.getImageReaders(iis);
            if (!readers.hasNext()) {
                logger.debug("No decoder for {}", hint);
                return ImageMetadata.defaults(hint);
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(iis, true, true);
                int width = reader.getWidth(0);
                int height = reader.getHeight(0);
                if (!ImageMetadata.validDimensions(width, height)) {
                    logger.warn("Invalid dimensions {}x{} in {}", width, height, hint);
                    return ImageMetadata.defaults(hint);
                }
                String format = normalizeFormat(reader.getFormatName());
                Optional<LocalDateTime> taken = ExifDateReader.readCaptureDate(data, data.length);
                return new ImageMetadata(width, height, format, taken.isPresent(), taken.orElse(null));
            } finally {
                reader.dispose();
            }
        }
    }

    private static String normalizeFormat(String name) {
        String f = name == null ? "" : name.toUpperCase(Locale.ROOT);
        return f.equals("JPG") ? "JPEG" : f;
    }
}
