package com.boqregistry.classification.override;

import com.boqregistry.classification.ClassificationException;
import com.boqregistry.common.TextNormalizer;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * User-confirmed code → category lookup table of one project. Keys are normalized codes.
 * Reads (lookup, count, snapshot) share a read lock; record and clear take the write lock. A batch should work on
 * {@link #snapshot()} so concurrent records do not change its decisions halfway.
 */
public class OverrideStore {

    private final Map<String, String> categoryByCode;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public OverrideStore() {
        this(new HashMap<>());
    }

    private OverrideStore(Map<String, String> categoryByCode) {
        this.categoryByCode = categoryByCode;
    }

    /**
     * Store seeded from already-normalized entries (e.g. loaded from persistence).
     */
    public static OverrideStore of(Map<String, String> entries) {
        OverrideStore store = new OverrideStore();
        entries.forEach(store::record);
        return store;
    }

    /**
     * Category remembered for the code, if any. Blank codes never match.
     */
    public Optional<String> lookup(String code) {
        String key = TextNormalizer.normalizeCode(code);
        if (key.isEmpty()) {
            return Optional.empty();
        }
        lock.readLock().lock();
        try {
            return Optional.ofNullable(categoryByCode.get(key));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Store or overwrite the mapping. Callers must only invoke this for a decision the user explicitly asked to be
     * remembered.
     *
     * @throws ClassificationException INVALID_OVERRIDE for blank code or category
     */
    public void record(String code, String category) {
        String key = TextNormalizer.normalizeCode(code);
        if (key.isEmpty()) {
            throw new ClassificationException(ClassificationException.INVALID_OVERRIDE, "Override code must not be blank");
        }
        if (category == null || category.isBlank()) {
            throw new ClassificationException(ClassificationException.INVALID_OVERRIDE, "Override category must not be blank");
        }
        lock.writeLock().lock();
        try {
            categoryByCode.put(key, category.strip());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            categoryByCode.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int count() {
        lock.readLock().lock();
        try {
            return categoryByCode.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Detached copy for one classification run; later records do not affect it.
     */
    public OverrideStore snapshot() {
        lock.readLock().lock();
        try {
            return new OverrideStore(new HashMap<>(categoryByCode));
        } finally {
            lock.readLock().unlock();
        }
    }
}
