package com.contract.extractor.cache;

import com.contract.extractor.model.Fingerprint;

import java.util.Objects;

/**
 * One stored entry: fingerprint key and the opaque serialized contract set.
 */
public final class CacheRecord {

    private final Fingerprint key;
    private final byte[] value;

    public CacheRecord(Fingerprint key, byte[] value) {
        this.key = Objects.requireNonNull(key, "key");
        this.value = Objects.requireNonNull(value, "value").clone();
    }

    public Fingerprint getKey() {
        return key;
    }

    public byte[] getValue() {
        return value.clone();
    }

    public int size() {
        return value.length;
    }
}
