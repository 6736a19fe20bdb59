package com.contract.extractor.model;

/**
 * The closed set of expression node kinds.
 *
 * Each kind fixes the shape of its children:
 * - positional kinds always hold exactly {@link #getMinChildren()} slots, some of which may be absent
 * - variadic kinds hold any number of present children
 */
public enum NodeKind {
    LITERAL(0, 0, false),
    VARIABLE_REF(0, 0, false),
    BINARY_OP(2, 2, false),
    UNARY_OP(1, 1, false),
    CALL(0, Integer.MAX_VALUE, false),
    NEW_OBJECT(0, Integer.MAX_VALUE, false),

    /**
     * A value left on the evaluation stack by an earlier instruction (the "Pop" marker).
     */
    STACK_DUPLICATE(0, 0, false),

    BLOCK(0, Integer.MAX_VALUE, false),

    /** test, then, else; else may be absent. */
    CONDITIONAL(3, 3, true),

    /** thrown value; absent for a rethrow. */
    THROW(1, 1, true),

    /** returned value; absent for a void return. */
    RETURN(1, 1, true),

    /** target, value. */
    ASSIGN(2, 2, false),

    /**
     * A construct the front end could not map. It has no traversal rule.
     */
    UNRECOGNIZED(0, Integer.MAX_VALUE, false);

    private final int minChildren;
    private final int maxChildren;
    private final boolean allowsAbsentChildren;

    NodeKind(int minChildren, int maxChildren, boolean allowsAbsentChildren) {
        this.minChildren = minChildren;
        this.maxChildren = maxChildren;
        this.allowsAbsentChildren = allowsAbsentChildren;
    }

    public int getMinChildren() {
        return minChildren;
    }

    public int getMaxChildren() {
        return maxChildren;
    }

    public boolean allowsAbsentChildren() {
        return allowsAbsentChildren;
    }

    /**
     * Whether nodes of this kind carry a non-empty payload.
     */
    public boolean requiresPayload() {
        switch (this) {
            case LITERAL:
            case VARIABLE_REF:
            case BINARY_OP:
            case UNARY_OP:
            case CALL:
            case NEW_OBJECT:
            case UNRECOGNIZED:
                return true;
            default:
                return false;
        }
    }
}
