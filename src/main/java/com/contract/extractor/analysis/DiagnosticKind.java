package com.contract.extractor.analysis;

/**
 * Kinds of non-fatal findings recorded while analyzing a method.
 */
public enum DiagnosticKind {
    /** A candidate clause failed stack-balance validation and was discarded. */
    UNEXTRACTABLE_CLAUSE,
    /** The method's tree held a node kind with no traversal rule; extraction was abandoned. */
    MALFORMED_TREE,
    /** A cached entry could not be decoded under the current format and was treated as a miss. */
    CACHE_FORMAT,
    /** The cache already held a different contract set for the method's fingerprint. */
    CACHE_INCONSISTENCY,
    /** The cache store failed to read or write the method's entry; the method was still analyzed. */
    CACHE_STORE
}
