package com.contract.extractor.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One parsed method: its root block plus identity metadata.
 * Never mutated after the front end builds it.
 */
public final class MethodBody {

    private final String declaringType;
    private final String signature;
    private final Fingerprint fingerprint;
    private final ExpressionNode root;
    private final List<SourcePosition> statementPositions;

    public MethodBody(String declaringType, String signature, Fingerprint fingerprint,
                      ExpressionNode root, List<SourcePosition> statementPositions) {
        this.declaringType = Objects.requireNonNull(declaringType, "declaringType");
        this.signature = Objects.requireNonNull(signature, "signature");
        this.fingerprint = Objects.requireNonNull(fingerprint, "fingerprint");
        this.root = Objects.requireNonNull(root, "root");
        if (!root.is(NodeKind.BLOCK)) {
            throw new IllegalArgumentException("Method root must be a BLOCK, got " + root.getKind());
        }
        this.statementPositions = Collections.unmodifiableList(new ArrayList<>(statementPositions));
    }

    public MethodBody(String declaringType, String signature, Fingerprint fingerprint, ExpressionNode root) {
        this(declaringType, signature, fingerprint, root, List.of());
    }

    public String getDeclaringType() {
        return declaringType;
    }

    public String getSignature() {
        return signature;
    }

    /**
     * e.g. {@code Account.withdraw(int)}
     */
    public String getQualifiedName() {
        return declaringType + "." + signature;
    }

    public Fingerprint getFingerprint() {
        return fingerprint;
    }

    public ExpressionNode getRoot() {
        return root;
    }

    public List<ExpressionNode> getStatements() {
        return root.getChildren();
    }

    /**
     * Position of a top-level statement. Falls back to the bare index when the front end
     * supplied no positions.
     */
    public SourcePosition getStatementPosition(int statementIndex) {
        if (statementIndex < statementPositions.size()) {
            return statementPositions.get(statementIndex);
        }
        return SourcePosition.ofStatement(statementIndex);
    }

    @Override
    public String toString() {
        return getQualifiedName() + " [" + fingerprint + "]";
    }
}
