package com.keyco.assist.service.cache;

import com.keyco.assist.domain.Fingerprint;
import com.keyco.assist.domain.Mode;
import com.keyco.assist.domain.Usage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide, fixed-capacity mapping from fingerprint to last known result.
 *
 * <p>Eviction is least-recently-<em>stored</em>: a lookup does not refresh an entry's position, a
 * store does. Invalidation happens only on explicit user action ({@link #invalidate},
 * {@link #clear}), never implicitly.
 *
 * <p><b>Thread Safety:</b> all access is serialized by one lock; entries are immutable.
 */
public class ResponseCache {

    private static final Logger LOG = LogManager.getLogger(ResponseCache.class);

    private final int capacity;
    private final Clock clock;
    private final Lock lock = new ReentrantLock();
    // Insertion order == store order; re-stores are removed first so they move to the tail
    private final LinkedHashMap<Fingerprint, CacheEntry> entries = new LinkedHashMap<>();

    public ResponseCache(int capacity, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got: " + capacity);
        }
        this.capacity = capacity;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Optional<CacheEntry> lookup(Fingerprint fingerprint) {
        if (fingerprint == null) {
            return Optional.empty();
        }
        lock.lock();
        try {
            return Optional.ofNullable(entries.get(fingerprint));
        } finally {
            lock.unlock();
        }
    }

    public CacheEntry store(Fingerprint fingerprint, String text, Usage usage) {
        Objects.requireNonNull(fingerprint, "fingerprint");
        CacheEntry entry = new CacheEntry(fingerprint, text, usage, clock.instant());
        lock.lock();
        try {
            entries.remove(fingerprint);
            entries.put(fingerprint, entry);
            evictLocked();
        } finally {
            lock.unlock();
        }
        return entry;
    }

    public boolean invalidate(Fingerprint fingerprint) {
        lock.lock();
        try {
            return entries.remove(fingerprint) != null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops every entry stored for a mode.
     *
     * @return number of entries removed
     */
    public int invalidateMode(Mode mode) {
        lock.lock();
        try {
            int removed = 0;
            Iterator<Fingerprint> it = entries.keySet().iterator();
            while (it.hasNext()) {
                if (it.next().mode() == mode) {
                    it.remove();
                    removed++;
                }
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            int size = entries.size();
            entries.clear();
            LOG.info("Response cache cleared ({} entries)", size);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    private void evictLocked() {
        Iterator<Map.Entry<Fingerprint, CacheEntry>> it = entries.entrySet().iterator();
        while (entries.size() > capacity && it.hasNext()) {
            Map.Entry<Fingerprint, CacheEntry> eldest = it.next();
            it.remove();
            LOG.debug("Evicted cache entry {}", eldest.getKey());
        }
    }
}
