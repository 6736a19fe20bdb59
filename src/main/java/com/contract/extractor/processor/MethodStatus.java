package com.contract.extractor.processor;

/**
 * Outcome of analyzing one method.
 */
public enum MethodStatus {
    /** Served from the cache without running extraction. */
    CACHED,
    /** Extracted with every candidate clause accepted. */
    EXTRACTED,
    /** Extracted, but at least one candidate clause was rejected. */
    PARTIAL,
    /** Extraction was abandoned; the contract set is empty. */
    FAILED
}
