package com.solverlog.errorlog.cache;

import com.solverlog.errorlog.config.ErrorLogProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Process-wide {@link ResultCache} guarded by a read/write lock:
 * lookups share the lock, mutations take it exclusively.
 *
 * Every removal or clear advances a generation counter. A fill computed
 * before that point is dropped by {@link #setIfCurrent}, so an evicted
 * aggregate cannot come back from a fill that was already running.
 */
@Slf4j
@Component
public class SharedResultCache {

    private final ResultCache cache;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private long generation;

    @Autowired
    public SharedResultCache(ErrorLogProperties properties) {
        this(new ResultCache(properties.getCache().getCapacity()));
    }

    public SharedResultCache(ResultCache cache) {
        this.cache = cache;
        log.info("Aggregate cache ready, capacity {}", cache.getCapacity());
    }

    public boolean has(long jobId) {
        lock.readLock().lock();
        try {
            return cache.has(jobId);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<byte[]> get(long jobId) {
        lock.readLock().lock();
        try {
            return cache.get(jobId);
        } finally {
            lock.readLock().unlock();
        }
    }

    public void set(long jobId, byte[] payload) {
        lock.writeLock().lock();
        try {
            cache.set(jobId, payload);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Token to capture before reading the data a later {@link #setIfCurrent} stores.
     */
    public long generation() {
        lock.readLock().lock();
        try {
            return generation;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Stores the payload unless a removal or clear happened since {@code expectedGeneration}.
     *
     * @return true if the cache was left holding an entry for the job
     */
    public boolean setIfCurrent(long jobId, byte[] payload, long expectedGeneration) {
        lock.writeLock().lock();
        try {
            if (generation != expectedGeneration) {
                log.debug("Dropped stale cache fill for job {}", jobId);
                return false;
            }
            cache.set(jobId, payload);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void remove(long jobId) {
        lock.writeLock().lock();
        try {
            generation++;
            cache.remove(jobId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            generation++;
            cache.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return cache.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
