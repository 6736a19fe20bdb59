package com.contract.extractor.model;

import java.util.Objects;

/**
 * One extracted precondition, postcondition or invariant.
 * The condition is an isolated sub-tree that can be evaluated on its own.
 */
public final class ContractClause {

    private final ClauseKind kind;
    private final ExpressionNode condition;
    private final SourcePosition position;
    private final ClauseOrigin origin;
    private final String userMessage;

    public ContractClause(ClauseKind kind, ExpressionNode condition, SourcePosition position,
                          ClauseOrigin origin, String userMessage) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.condition = Objects.requireNonNull(condition, "condition");
        this.position = Objects.requireNonNull(position, "position");
        this.origin = Objects.requireNonNull(origin, "origin");
        this.userMessage = userMessage;
    }

    public ContractClause(ClauseKind kind, ExpressionNode condition, SourcePosition position, ClauseOrigin origin) {
        this(kind, condition, position, origin, null);
    }

    public ClauseKind getKind() {
        return kind;
    }

    public ExpressionNode getCondition() {
        return condition;
    }

    public SourcePosition getPosition() {
        return position;
    }

    public ClauseOrigin getOrigin() {
        return origin;
    }

    /**
     * The message passed alongside the condition, or null.
     */
    public String getUserMessage() {
        return userMessage;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ContractClause)) return false;
        ContractClause that = (ContractClause) o;
        return kind == that.kind
                && condition.equals(that.condition)
                && position.equals(that.position)
                && origin == that.origin
                && Objects.equals(userMessage, that.userMessage);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, condition, position, origin, userMessage);
    }

    @Override
    public String toString() {
        String text = kind.name().toLowerCase() + " " + condition;
        return userMessage != null ? text + " : \"" + userMessage + "\"" : text;
    }
}
