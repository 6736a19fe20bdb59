package com.contract.extractor.model;

/**
 * How a clause was written in the method body.
 */
public enum ClauseOrigin {
    /** A call to a registered contract operation, e.g. {@code Contract.requires(x > 0)}. */
    CONTRACT_CALL,
    /** An {@code if (!cond) throw ...} statement. */
    LEGACY_IF_THROW
}
