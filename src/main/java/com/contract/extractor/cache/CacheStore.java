package com.contract.extractor.cache;

import com.contract.extractor.model.Fingerprint;

import java.util.Optional;
import java.util.Set;

/**
 * Backing storage for {@link ContractCache}. Implementations only store bytes; the
 * first-writer-wins and consistency rules live in {@link ContractCache}.
 *
 * Implementations must be safe for concurrent use, and report storage failures as
 * {@link CacheStoreException}.
 */
public interface CacheStore {

    Optional<CacheRecord> read(Fingerprint key);

    /**
     * Stores a record, replacing any previous one with the same key.
     */
    void write(CacheRecord record);

    /**
     * @return true if a record was removed
     */
    boolean delete(Fingerprint key);

    Set<Fingerprint> keys();
}
