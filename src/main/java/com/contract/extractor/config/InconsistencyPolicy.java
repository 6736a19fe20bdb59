package com.contract.extractor.config;

/**
 * What a batch does when the cache reports a different contract set for a fingerprint.
 */
public enum InconsistencyPolicy {
    /** Rethrow and stop the batch. */
    ABORT,
    /** Drop the key, refuse further writes to it and mark the method failed. */
    FENCE_KEY
}
