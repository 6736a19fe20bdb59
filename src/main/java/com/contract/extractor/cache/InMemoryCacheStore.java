package com.contract.extractor.cache;

import com.contract.extractor.model.Fingerprint;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local store backed by a concurrent map.
 */
public class InMemoryCacheStore implements CacheStore {

    private final ConcurrentMap<Fingerprint, CacheRecord> records = new ConcurrentHashMap<>();

    @Override
    public Optional<CacheRecord> read(Fingerprint key) {
        return Optional.ofNullable(records.get(key));
    }

    @Override
    public void write(CacheRecord record) {
        records.put(record.getKey(), record);
    }

    @Override
    public boolean delete(Fingerprint key) {
        return records.remove(key) != null;
    }

    @Override
    public Set<Fingerprint> keys() {
        return new HashSet<>(records.keySet());
    }

    public int size() {
        return records.size();
    }
}
