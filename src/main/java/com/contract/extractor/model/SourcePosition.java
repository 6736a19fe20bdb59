package com.contract.extractor.model;

import java.util.Objects;

/**
 * Location of a top-level statement within a method, for diagnostics.
 * Line and column are -1 when the front end did not supply them.
 */
public final class SourcePosition {

    public static final int UNKNOWN = -1;

    private final int statementIndex;
    private final int line;
    private final int column;

    public SourcePosition(int statementIndex, int line, int column) {
        if (statementIndex < 0) {
            throw new IllegalArgumentException("statementIndex must be non-negative: " + statementIndex);
        }
        this.statementIndex = statementIndex;
        this.line = line;
        this.column = column;
    }

    public static SourcePosition ofStatement(int statementIndex) {
        return new SourcePosition(statementIndex, UNKNOWN, UNKNOWN);
    }

    public int getStatementIndex() {
        return statementIndex;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public boolean hasLine() {
        return line != UNKNOWN;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourcePosition)) return false;
        SourcePosition that = (SourcePosition) o;
        return statementIndex == that.statementIndex && line == that.line && column == that.column;
    }

    @Override
    public int hashCode() {
        return Objects.hash(statementIndex, line, column);
    }

    @Override
    public String toString() {
        if (hasLine()) {
            return "statement " + statementIndex + " (line " + line + ", column " + column + ")";
        }
        return "statement " + statementIndex;
    }
}
