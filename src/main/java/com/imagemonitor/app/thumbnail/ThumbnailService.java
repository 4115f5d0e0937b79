package com.imagemonitor.app.thumbnail;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import javax.imageio.ImageIO;

import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.imagemonitor.app.archive.ArchiveEntry;
import com.imagemonitor.app.archive.ArchiveReader;
import com.imagemonitor.app.archive.ArchiveReaders;
import com.imagemonitor.app.scan.EntryValidator;

import net.coobird.thumbnailator.Thumbnails;

/**
 * Cache de miniaturas em disco: {@code <cacheDir>/size_<N>/<hash>_<N>[_archive].jpg}.
 *
 * <p>Um artefato é reutilizado enquanto o seu mtime for {@code >=} o mtime da origem.
 * Pedidos concorrentes para a mesma (origem, tamanho) esperam a mesma geração, e um
 * semáforo limita quantas gerações rodam ao mesmo tempo no processo.
 *
 * <p>Falhas de decodificação nunca passam daqui: o chamador recebe {@code Optional.empty()}.
 */
public final class ThumbnailService implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ThumbnailService.class);

    public static final int MAX_ARCHIVE_ATTEMPTS = 5;
    public static final int MIN_BASE_SIZE = 512;
    public static final float JPEG_QUALITY = 0.95f;

    private static final long SLOW_GENERATION_MS = 1000;
    private static final HexFormat HEX = HexFormat.of();

    public record Stats(long requests, long cacheHits, long generations, long failures, double averageMillis) {
        public double hitRate() {
            return requests == 0 ? 0.0 : (double) cacheHits / requests;
        }
    }

    private final Path cacheDir;
    private final EntryValidator validator;
    private final Semaphore permits;
    private final ConcurrentHashMap<String, CompletableFuture<Optional<Path>>> pending = new ConcurrentHashMap<>();

    private final AtomicLong requests = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong generations = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private final AtomicLong generationNanos = new AtomicLong();

    public ThumbnailService(Path cacheDir, int concurrency, EntryValidator validator) {
        this.cacheDir = cacheDir.toAbsolutePath().normalize();
        this.validator = validator;
        this.permits = new Semaphore(Math.max(1, concurrency));
    }

    public Path cacheDir() {
        return cacheDir;
    }

    /**
     * Deterministic artifact path. The hash covers the lowercased absolute source path only,
     * never the content.
     */
    public Path thumbnailPath(Path source, int size, boolean isArchive) {
        String normalized = source.toAbsolutePath().normalize().toString().toLowerCase(Locale.ROOT);
        String name = hash16(normalized) + "_" + size + (isArchive ? "_archive" : "") + ".jpg";
        return cacheDir.resolve("size_" + size).resolve(name);
    }

    public Optional<Path> getOrCreate(Path source, int size, boolean isArchive) {
        requests.incrementAndGet();
        if (source == null || !Files.isRegularFile(source)) {
            logger.warn("Thumbnail source not found: {}", source);
            return Optional.empty();
        }

        Path target = thumbnailPath(source, size, isArchive);
        if (isFresh(target, source)) {
            cacheHits.incrementAndGet();
            logger.debug("Using cached thumbnail {}", target);
            return Optional.of(target);
        }

        String key = target.toString();
        CompletableFuture<Optional<Path>> mine = new CompletableFuture<>();
        CompletableFuture<Optional<Path>> inFlight = pending.putIfAbsent(key, mine);
        if (inFlight != null) {
            logger.debug("Waiting for pending thumbnail generation: {}", source);
            return inFlight.join();
        }

        Optional<Path> result = Optional.empty();
        try {
            result = generateWithPermit(source, target, size, isArchive);
        } finally {
            mine.complete(result);
            pending.remove(key, mine);
        }
        return result;
    }

    public boolean thumbnailExists(Path source, int size, boolean isArchive) {
        return Files.isRegularFile(thumbnailPath(source, size, isArchive));
    }

    // --- geração ---

    private Optional<Path> generateWithPermit(Path source, Path target, int size, boolean isArchive) {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
        try {
            // outro pedido pode ter gerado enquanto esperávamos o semáforo
            if (isFresh(target, source)) {
                cacheHits.incrementAndGet();
                return Optional.of(target);
            }

            long started = System.nanoTime();
            boolean ok = isArchive ? generateFromArchive(source, target, size) : generateFromImage(source, target, size);
            long elapsed = System.nanoTime() - started;

            if (!ok) {
                failures.incrementAndGet();
                return Optional.empty();
            }
            generations.incrementAndGet();
            generationNanos.addAndGet(elapsed);

            long ms = TimeUnit.NANOSECONDS.toMillis(elapsed);
            if (ms > SLOW_GENERATION_MS) {
                logger.warn("Slow thumbnail generation: {} in {}ms", source, ms);
            } else {
                logger.debug("Generated thumbnail {} in {}ms", target, ms);
            }
            return Optional.of(target);
        } finally {
            permits.release();
        }
    }

    private boolean generateFromImage(Path source, Path target, int size) {
        try {
            BufferedImage img = ImageIO.read(source.toFile());
            if (img == null) {
                logger.warn("No decoder for image {}", source);
                return false;
            }
            writeThumbnail(img, target, size);
            return true;
        } catch (IOException | RuntimeException e) {
            logger.warn("Failed to generate thumbnail for {}: {}", source, e.toString());
            return false;
        }
    }

    private boolean generateFromArchive(Path archive, Path target, int size) {
        try (ArchiveReader reader = ArchiveReaders.open(archive)) {
            List<ArchiveEntry> candidates = validator.imageEntries(reader.entries());
            if (candidates.isEmpty()) {
                logger.debug("No image entries found in archive {}", archive);
                return false;
            }

            int attempts = Math.min(MAX_ARCHIVE_ATTEMPTS, candidates.size());
            for (int i = 0; i < attempts; i++) {
                ArchiveEntry entry = candidates.get(i);
                try {
                    BufferedImage img = ImageIO.read(new ByteArrayInputStream(reader.read(entry)));
                    if (img == null) {
                        logger.debug("No decoder for {} in {}, trying next image", entry.internalPath(), archive);
                        continue;
                    }
                    writeThumbnail(img, target, size);
                    logger.debug("Archive thumbnail from image {} ({}) in {}", i + 1, entry.internalPath(), archive);
                    return true;
                } catch (IOException | RuntimeException e) {
                    // inclui overflow de contagem de pixels vindo de cabeçalhos corrompidos
                    logger.debug("Failed thumbnail from {} in {}, trying next image: {}",
                            entry.internalPath(), archive, e.toString());
                }
            }
            logger.warn("Failed to generate thumbnail from any of {} images in archive {}", attempts, archive);
            return false;
        } catch (IOException | RuntimeException e) {
            logger.warn("Failed to open archive for thumbnail {}: {}", archive, e.toString());
            return false;
        }
    }

    private void writeThumbnail(BufferedImage img, Path target, int size) throws IOException {
        int base = Math.max(MIN_BASE_SIZE, size * 2);
        Files.createDirectories(target.getParent());
        Path tmp = Files.createTempFile(target.getParent(), ".thumb-", ".tmp");
        try {
            try (OutputStream out = Files.newOutputStream(tmp)) {
                Thumbnails.of(img)
                        .size(base, base)
                        .keepAspectRatio(true)
                        .imageType(BufferedImage.TYPE_INT_RGB)
                        .outputFormat("jpg")
                        .outputQuality(JPEG_QUALITY)
                        .toOutputStream(out);
            }
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private static boolean isFresh(Path target, Path source) {
        try {
            if (!Files.isRegularFile(target)) return false;
            FileTime thumb = Files.getLastModifiedTime(target);
            FileTime src = Files.getLastModifiedTime(source);
            return thumb.compareTo(src) >= 0;
        } catch (IOException e) {
            return false;
        }
    }

    static String hash16(String value) {
        try {
            byte[] digest = MessageDigest.getInstance("MD5").digest(value.getBytes(StandardCharsets.UTF_8));
            return HEX.formatHex(digest).substring(0, 16);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    // --- manutenção ---

    /** @return bytes on disk under the cache directory */
    public long getCacheSize() {
        if (!Files.isDirectory(cacheDir)) return 0L;
        try {
            return FileUtils.sizeOfDirectory(cacheDir.toFile());
        } catch (RuntimeException e) {
            logger.warn("Failed to measure thumbnail cache {}: {}", cacheDir, e.toString());
            return 0L;
        }
    }

    public void clearCache() throws IOException {
        if (!Files.isDirectory(cacheDir)) return;
        FileUtils.cleanDirectory(cacheDir.toFile());
        logger.info("Thumbnail cache cleared: {}", cacheDir);
    }

    /** Deletes artifacts whose last-modified time is older than {@code days}. */
    public int cleanupOldThumbnails(int days) {
        long cutoff = System.currentTimeMillis() - TimeUnit.DAYS.toMillis(Math.max(0, days));
        int deleted = deleteMatching(path -> Files.getLastModifiedTime(path).toMillis() < cutoff);
        logger.info("Cleaned up {} thumbnails older than {} days", deleted, days);
        return deleted;
    }

    /** Deletes artifacts that none of {@code referenced} points at. */
    public int deleteOrphans(Collection<String> referenced) {
        Set<Path> keep = new HashSet<>();
        for (String p : referenced) {
            if (p != null && !p.isBlank()) keep.add(Path.of(p).toAbsolutePath().normalize());
        }
        int deleted = deleteMatching(path -> !keep.contains(path.toAbsolutePath().normalize()));
        logger.info("Deleted {} orphan thumbnails", deleted);
        return deleted;
    }

    /** Best effort; returns how many files were actually removed. */
    public int deleteThumbnails(Collection<String> paths) {
        int deleted = 0;
        for (String p : paths) {
            if (p == null || p.isBlank()) continue;
            try {
                if (Files.deleteIfExists(Path.of(p))) deleted++;
            } catch (IOException | RuntimeException e) {
                logger.warn("Failed to delete thumbnail {}: {}", p, e.toString());
            }
        }
        return deleted;
    }

    @FunctionalInterface
    private interface PathTest {
        boolean test(Path path) throws IOException;
    }

    private int deleteMatching(PathTest test) {
        if (!Files.isDirectory(cacheDir)) return 0;
        int[] deleted = {0};
        try {
            Files.walkFileTree(cacheDir, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (!file.getFileName().toString().endsWith(".jpg")) return FileVisitResult.CONTINUE;
                    try {
                        if (test.test(file) && Files.deleteIfExists(file)) deleted[0]++;
                    } catch (IOException e) {
                        logger.warn("Failed to delete thumbnail {}: {}", file, e.getMessage());
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                    if (!dir.equals(cacheDir) && isEmptyDir(dir)) Files.deleteIfExists(dir);
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            logger.warn("Thumbnail cache walk failed in {}: {}", cacheDir, e.getMessage());
        }
        return deleted[0];
    }

    private static boolean isEmptyDir(Path dir) throws IOException {
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(dir)) {
            return !ds.iterator().hasNext();
        }
    }

    // --- estatísticas ---

    public Stats stats() {
        long gen = generations.get();
        double avg = gen == 0 ? 0.0 : TimeUnit.NANOSECONDS.toMicros(generationNanos.get()) / 1000.0 / gen;
        return new Stats(requests.get(), cacheHits.get(), gen, failures.get(), avg);
    }

    @Override
    public void close() {
        Stats s = stats();
        logger.info("Thumbnail stats: requests={}, hits={} ({}%), generations={}, failures={}, avg={}ms",
                s.requests(), s.cacheHits(), Math.round(s.hitRate() * 100), s.generations(), s.failures(),
                Math.round(s.averageMillis()));
    }
}
