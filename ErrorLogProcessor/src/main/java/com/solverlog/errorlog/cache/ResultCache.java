package com.solverlog.errorlog.cache;

import com.solverlog.errorlog.exception.ErrorKind;
import com.solverlog.errorlog.exception.ErrorLogException;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Bounded job id to payload store holding gzip-compressed bytes.
 *
 * Eviction is first-in first-out: once full, inserting a new key drops the
 * oldest inserted one, no matter how often it was read. Entries are never
 * overwritten.
 *
 * Not thread safe, see {@link SharedResultCache}.
 */
@Slf4j
public class ResultCache {

    public static final int DEFAULT_CAPACITY = 8;

    private final int capacity;
    // insertion order, reads do not reorder
    private final LinkedHashMap<Long, byte[]> entries;

    public ResultCache() {
        this(DEFAULT_CAPACITY);
    }

    public ResultCache(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Cache capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.entries = new LinkedHashMap<>(capacity * 2, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<Long, byte[]> eldest) {
                boolean evict = size() > ResultCache.this.capacity;
                if (evict) {
                    log.debug("Evicting cached aggregate for job {}", eldest.getKey());
                }
                return evict;
            }
        };
    }

    public boolean has(long key) {
        return entries.containsKey(key);
    }

    /**
     * Returns the decompressed payload, or empty if absent or unreadable.
     */
    public Optional<byte[]> get(long key) {
        byte[] compressed = entries.get(key);
        if (compressed == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(decompress(compressed));
        } catch (IOException e) {
            log.warn("Cached aggregate for job {} is unreadable, treating as miss: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Stores the payload unless the key is already present.
     *
     * @throws ErrorLogException (STORAGE) if the payload cannot be compressed
     */
    public void set(long key, byte[] value) {
        if (has(key)) {
            return;
        }
        byte[] compressed;
        try {
            compressed = compress(value);
        } catch (IOException e) {
            throw new ErrorLogException(ErrorKind.STORAGE, "Cannot compress aggregate for job " + key, e);
        }
        entries.put(key, compressed);
        log.debug("Cached aggregate for job {}: {} bytes ({} compressed)", key, value.length, compressed.length);
    }

    public void remove(long key) {
        entries.remove(key);
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    public int getCapacity() {
        return capacity;
    }

    byte[] compress(byte[] value) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(Math.max(32, value.length / 4));
        try (GZIPOutputStream out = new GZIPOutputStream(buffer)) {
            out.write(value);
        }
        return buffer.toByteArray();
    }

    byte[] decompress(byte[] compressed) throws IOException {
        try (GZIPInputStream in = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            return in.readAllBytes();
        }
    }
}
