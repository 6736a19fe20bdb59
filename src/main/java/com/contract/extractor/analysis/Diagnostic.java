package com.contract.extractor.analysis;

import com.contract.extractor.model.SourcePosition;

import java.util.Objects;

/**
 * A finding about one method, reported alongside its contract set.
 */
public final class Diagnostic {

    private final DiagnosticKind kind;
    private final String method;
    private final SourcePosition position;
    private final String message;

    public Diagnostic(DiagnosticKind kind, String method, SourcePosition position, String message) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.method = Objects.requireNonNull(method, "method");
        this.position = position;
        this.message = Objects.requireNonNull(message, "message");
    }

    public DiagnosticKind getKind() {
        return kind;
    }

    public String getMethod() {
        return method;
    }

    /**
     * Statement the finding is about, or null when it concerns the whole method.
     */
    public SourcePosition getPosition() {
        return position;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Diagnostic)) return false;
        Diagnostic that = (Diagnostic) o;
        return kind == that.kind
                && method.equals(that.method)
                && Objects.equals(position, that.position)
                && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, method, position, message);
    }

    @Override
    public String toString() {
        return kind + " " + method + (position != null ? " at " + position : "") + ": " + message;
    }
}
