package com.imagemonitor.app.metadata;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cache LRU em memória de metadados, chaveado por caminho + tamanho + mtime (segundos).
 * Quando passa da capacidade, remove os menos acessados até {@code capacity - margin}.
 */
public final class MetadataCache {

    private static final Logger logger = LoggerFactory.getLogger(MetadataCache.class);

    private static final class Entry {
        final ImageMetadata metadata;
        volatile long lastAccess;

        Entry(ImageMetadata metadata, long lastAccess) {
            this.metadata = metadata;
            this.lastAccess = lastAccess;
        }
    }

    private record Candidate(String key, Entry entry, long access) {}

    public record Stats(long hits, long misses, long evictions, int size) {}

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    // relógio lógico: ordem de acesso estável mesmo com chamadas no mesmo nanossegundo
    private final AtomicLong clock = new AtomicLong();
    private final Object evictLock = new Object();
    private final int capacity;
    private final int margin;

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder evictions = new LongAdder();

    public MetadataCache(int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0");
        this.capacity = capacity;
        this.margin = Math.max(1, Math.min(100, capacity / 10));
    }

    public static String key(String path, long size, long modifiedMillis) {
        return path + "|" + size + "|" + Math.floorDiv(modifiedMillis, 1000L);
    }

    public static String entryKey(String archivePath, String internalPath, long size, long modifiedMillis) {
        return key(archivePath + "!" + internalPath, size, modifiedMillis);
    }

    public Optional<ImageMetadata> get(String key) {
        Entry e = entries.get(key);
        if (e == null) {
            misses.increment();
            return Optional.empty();
        }
        e.lastAccess = clock.incrementAndGet();
        hits.increment();
        return Optional.of(e.metadata);
    }

    public void put(String key, ImageMetadata metadata) {
        entries.put(key, new Entry(metadata, clock.incrementAndGet()));
        if (entries.size() > capacity) {
            evict();
        }
    }

    public ImageMetadata getOrCompute(String key, Supplier<ImageMetadata> loader) {
        Optional<ImageMetadata> cached = get(key);
        if (cached.isPresent()) return cached.get();
        ImageMetadata computed = loader.get();
        put(key, computed);
        return computed;
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }

    public Stats stats() {
        return new Stats(hits.sum(), misses.sum(), evictions.sum(), entries.size());
    }

    private void evict() {
        synchronized (evictLock) {
            int size = entries.size();
            if (size <= capacity) return;

            int target = capacity - margin;
            int toRemove = size - target;

            // lastAccess muda em paralelo: copia antes de ordenar
            List<Candidate> snapshot = new ArrayList<>(size);
            for (var en : entries.entrySet()) {
                snapshot.add(new Candidate(en.getKey(), en.getValue(), en.getValue().lastAccess));
            }
            snapshot.sort(Comparator.comparingLong(Candidate::access));

            int removed = 0;
            for (int i = 0; i < snapshot.size() && removed < toRemove; i++) {
                Candidate c = snapshot.get(i);
                if (entries.remove(c.key(), c.entry())) removed++;
            }
            evictions.add(removed);
            logger.debug("Metadata cache evicted {} entries (size now {})", removed, entries.size());
        }
    }
}
