package com.contract.extractor.cache;

import com.contract.extractor.model.ContractSet;
import com.contract.extractor.model.Fingerprint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Content-addressable cache of extracted contract sets, keyed by method fingerprint.
 *
 * A fingerprint, once written, maps to one contract set for the life of the cache: a repeated
 * put of an equal set is a no-op and a put of a different set raises
 * {@link CacheInconsistencyException}. Writes to the same fingerprint are serialized by a lock
 * for that fingerprint only; lookups take no lock. A key's lock lives only while some thread
 * holds or waits for it.
 *
 * The cache does not evict. Callers remove entries with {@link #invalidate}.
 */
public class ContractCache {

    private static final Logger logger = LoggerFactory.getLogger(ContractCache.class);

    private final CacheStore store;
    private final ContractSetSerializer serializer;
    private final ConcurrentMap<Fingerprint, KeyLock> keyLocks = new ConcurrentHashMap<>();
    private final Set<Fingerprint> staleKeys = ConcurrentHashMap.newKeySet();

    public ContractCache(CacheStore store, ContractSetSerializer serializer) {
        this.store = store;
        this.serializer = serializer;
    }

    public ContractCache(CacheStore store) {
        this(store, new ContractSetSerializer());
    }

    /**
     * Creates a cache over a fresh in-memory store.
     */
    public static ContractCache inMemory() {
        return new ContractCache(new InMemoryCacheStore());
    }

    /**
     * Looks up the contract set stored for a fingerprint. An entry written in an unreadable or
     * outdated format counts as a miss and is remembered in {@link #staleKeys()}.
     *
     * @param fingerprint the method fingerprint
     * @return the cached contract set, or empty when the method must be extracted
     */
    public Optional<ContractSet> get(Fingerprint fingerprint) {
        try {
            return read(fingerprint);
        } catch (CacheFormatException e) {
            markStale(fingerprint, e);
            return Optional.empty();
        }
    }

    /**
     * Records that the entry for a fingerprint could not be decoded, so that
     * {@link #purgeStale()} removes it.
     */
    public void markStale(Fingerprint fingerprint, CacheFormatException cause) {
        staleKeys.add(fingerprint);
        logger.warn("Ignoring unreadable cache entry {}: {}", fingerprint.toHex(), cause.getMessage());
    }

    /**
     * Like {@link #get} but reports unreadable entries instead of treating them as misses.
     *
     * @throws CacheFormatException if the stored bytes do not decode under the current format
     */
    public Optional<ContractSet> read(Fingerprint fingerprint) {
        Optional<CacheRecord> record = store.read(fingerprint);
        if (record.isEmpty()) {
            logger.debug("Cache miss for {}", fingerprint);
            return Optional.empty();
        }
        ContractSet contracts = serializer.deserialize(record.get().getValue());
        logger.debug("Cache hit for {} ({} clauses)", fingerprint, contracts.size());
        return Optional.of(contracts);
    }

    /**
     * Stores the contract set for a fingerprint unless one is already present.
     *
     * @param fingerprint the method fingerprint
     * @param contracts   the validated contract set
     * @return true if the entry was written, false if an equal set was already stored
     * @throws CacheInconsistencyException if a different set is already stored under the fingerprint
     */
    public boolean put(Fingerprint fingerprint, ContractSet contracts) throws CacheInconsistencyException {
        KeyLock lock = acquire(fingerprint);
        try {
            Optional<ContractSet> existing;
            try {
                existing = read(fingerprint);
            } catch (CacheFormatException e) {
                logger.warn("Replacing unreadable cache entry {}: {}", fingerprint.toHex(), e.getMessage());
                existing = Optional.empty();
            }

            if (existing.isPresent()) {
                if (existing.get().equals(contracts)) {
                    logger.debug("Entry for {} already present", fingerprint);
                    return false;
                }
                throw new CacheInconsistencyException(fingerprint);
            }

            store.write(new CacheRecord(fingerprint, serializer.serialize(contracts)));
            staleKeys.remove(fingerprint);
            logger.debug("Cached {} clauses for {}", contracts.size(), fingerprint);
            return true;
        } finally {
            release(fingerprint, lock);
        }
    }

    /**
     * Removes the entry for a fingerprint.
     *
     * @return true if an entry was removed
     */
    public boolean invalidate(Fingerprint fingerprint) {
        KeyLock lock = acquire(fingerprint);
        try {
            boolean removed = store.delete(fingerprint);
            staleKeys.remove(fingerprint);
            if (removed) {
                logger.debug("Invalidated {}", fingerprint);
            }
            return removed;
        } finally {
            release(fingerprint, lock);
        }
    }

    private KeyLock acquire(Fingerprint fingerprint) {
        // register as a holder before blocking so release never drops a lock someone waits on
        KeyLock lock = keyLocks.compute(fingerprint, (key, existing) -> {
            KeyLock registered = existing != null ? existing : new KeyLock();
            registered.holders++;
            return registered;
        });
        lock.mutex.lock();
        return lock;
    }

    private void release(Fingerprint fingerprint, KeyLock lock) {
        lock.mutex.unlock();
        keyLocks.computeIfPresent(fingerprint, (key, existing) -> --existing.holders == 0 ? null : existing);
    }

    /**
     * Number of fingerprints that currently have a write lock registered.
     */
    int lockedKeyCount() {
        return keyLocks.size();
    }

    /**
     * Fingerprints whose entries could not be decoded by {@link #get}.
     */
    public Set<Fingerprint> staleKeys() {
        return Collections.unmodifiableSet(new HashSet<>(staleKeys));
    }

    /**
     * Scans every stored entry and invalidates the ones that no longer decode.
     *
     * @return the number of entries removed
     */
    public int purgeStale() {
        for (Fingerprint key : store.keys()) {
            get(key);
        }
        int removed = 0;
        for (Fingerprint key : staleKeys()) {
            if (invalidate(key)) {
                removed++;
            }
        }
        if (removed > 0) {
            logger.info("Purged {} stale cache entries", removed);
        }
        return removed;
    }

    public CacheStore getStore() {
        return store;
    }

    /**
     * Write lock of one fingerprint. {@code holders} is only touched inside map compute calls.
     */
    private static final class KeyLock {
        private final ReentrantLock mutex = new ReentrantLock();
        private int holders;
    }
}
