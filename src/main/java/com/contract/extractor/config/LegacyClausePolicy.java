package com.contract.extractor.config;

/**
 * How an {@code if (test) throw} statement is classified as a contract clause.
 */
public enum LegacyClausePolicy {

    /**
     * Ensures when the statement sits in the method epilogue (ordinary code before it, only
     * contract statements or a return after it); requires otherwise.
     */
    POSITIONAL,

    /** Every legacy clause is a precondition. */
    ALWAYS_REQUIRES,

    /**
     * Only statements in the contract prologue count, as preconditions. The prologue ends at the
     * end-contract-block marker, or at the first ordinary statement when the method has none.
     */
    CONTRACT_BLOCK_ONLY
}
