package com.contract.extractor.model;

/**
 * Kind of an extracted contract clause.
 */
public enum ClauseKind {
    /** Checked at method entry. */
    REQUIRES,
    /** Checked at normal return. */
    ENSURES,
    /** Checked at every observable state boundary. */
    INVARIANT
}
