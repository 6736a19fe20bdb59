package com.contract.extractor.config;

import com.contract.extractor.model.ClauseKind;

import java.util.Objects;

/**
 * A callee recognized as declaring a contract clause, e.g. {@code Contract.requires}.
 */
public final class ContractOperation {

    private final String callee;
    private final ClauseKind kind;
    private final boolean allowsMessage;

    /**
     * @param callee        callee identity as carried by CALL nodes
     * @param kind          kind of clause the call declares
     * @param allowsMessage whether a literal message may follow the condition argument
     */
    public ContractOperation(String callee, ClauseKind kind, boolean allowsMessage) {
        this.callee = Objects.requireNonNull(callee, "callee");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.allowsMessage = allowsMessage;
    }

    public String getCallee() {
        return callee;
    }

    public ClauseKind getKind() {
        return kind;
    }

    public boolean allowsMessage() {
        return allowsMessage;
    }

    /**
     * Whether a call with this many arguments fits the operation.
     */
    public boolean acceptsArgumentCount(int count) {
        return count == 1 || (allowsMessage && count == 2);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ContractOperation)) return false;
        ContractOperation that = (ContractOperation) o;
        return allowsMessage == that.allowsMessage && callee.equals(that.callee) && kind == that.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(callee, kind, allowsMessage);
    }

    @Override
    public String toString() {
        return callee + " -> " + kind;
    }
}
