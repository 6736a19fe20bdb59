package com.contract.extractor.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Immutable node of a method body's expression tree.
 *
 * A node is a kind tag, its kind-specific payload (literal text, variable name, operator
 * symbol, callee identity) and its children in fixed positional order. Rewrites build new
 * nodes; unchanged subtrees may be shared between trees.
 */
public final class ExpressionNode {

    private final NodeKind kind;
    private final String payload;
    private final List<ExpressionNode> children;

    private ExpressionNode(NodeKind kind, String payload, List<ExpressionNode> children) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.payload = payload;
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
        validate();
    }

    private void validate() {
        int count = children.size();
        if (count < kind.getMinChildren() || count > kind.getMaxChildren()) {
            throw new IllegalArgumentException(kind + " cannot have " + count + " children");
        }
        if (!kind.allowsAbsentChildren() && children.contains(null)) {
            throw new IllegalArgumentException(kind + " cannot have absent children");
        }
        if (kind == NodeKind.CONDITIONAL && children.get(0) == null) {
            throw new IllegalArgumentException("CONDITIONAL requires a test");
        }
        if (kind.requiresPayload() && (payload == null || payload.isEmpty())) {
            throw new IllegalArgumentException(kind + " requires a payload");
        }
        if (!kind.requiresPayload() && payload != null) {
            throw new IllegalArgumentException(kind + " does not take a payload");
        }
    }

    /**
     * Creates a node of any kind. Shape is checked against the kind.
     *
     * @throws IllegalArgumentException if the children or payload do not fit the kind
     */
    public static ExpressionNode of(NodeKind kind, String payload, List<ExpressionNode> children) {
        return new ExpressionNode(kind, payload, children);
    }

    public static ExpressionNode literal(String text) {
        return new ExpressionNode(NodeKind.LITERAL, text, List.of());
    }

    public static ExpressionNode variable(String name) {
        return new ExpressionNode(NodeKind.VARIABLE_REF, name, List.of());
    }

    public static ExpressionNode binary(String operator, ExpressionNode left, ExpressionNode right) {
        return new ExpressionNode(NodeKind.BINARY_OP, operator, Arrays.asList(left, right));
    }

    public static ExpressionNode unary(String operator, ExpressionNode operand) {
        return new ExpressionNode(NodeKind.UNARY_OP, operator, Collections.singletonList(operand));
    }

    public static ExpressionNode not(ExpressionNode operand) {
        return unary("!", operand);
    }

    public static ExpressionNode call(String callee, ExpressionNode... arguments) {
        return new ExpressionNode(NodeKind.CALL, callee, Arrays.asList(arguments));
    }

    public static ExpressionNode call(String callee, List<ExpressionNode> arguments) {
        return new ExpressionNode(NodeKind.CALL, callee, arguments);
    }

    public static ExpressionNode newObject(String type, ExpressionNode... arguments) {
        return new ExpressionNode(NodeKind.NEW_OBJECT, type, Arrays.asList(arguments));
    }

    public static ExpressionNode stackDuplicate() {
        return new ExpressionNode(NodeKind.STACK_DUPLICATE, null, List.of());
    }

    public static ExpressionNode block(ExpressionNode... statements) {
        return new ExpressionNode(NodeKind.BLOCK, null, Arrays.asList(statements));
    }

    public static ExpressionNode block(List<ExpressionNode> statements) {
        return new ExpressionNode(NodeKind.BLOCK, null, statements);
    }

    public static ExpressionNode conditional(ExpressionNode test, ExpressionNode thenBranch, ExpressionNode elseBranch) {
        return new ExpressionNode(NodeKind.CONDITIONAL, null, Arrays.asList(test, thenBranch, elseBranch));
    }

    public static ExpressionNode throwing(ExpressionNode thrown) {
        return new ExpressionNode(NodeKind.THROW, null, Collections.singletonList(thrown));
    }

    public static ExpressionNode returning(ExpressionNode value) {
        return new ExpressionNode(NodeKind.RETURN, null, Collections.singletonList(value));
    }

    public static ExpressionNode assign(ExpressionNode target, ExpressionNode value) {
        return new ExpressionNode(NodeKind.ASSIGN, null, Arrays.asList(target, value));
    }

    public static ExpressionNode unrecognized(String construct, ExpressionNode... children) {
        return new ExpressionNode(NodeKind.UNRECOGNIZED, construct, Arrays.asList(children));
    }

    public NodeKind getKind() {
        return kind;
    }

    public boolean is(NodeKind expected) {
        return kind == expected;
    }

    /**
     * Kind-specific payload, or null for kinds that carry none.
     */
    public String getPayload() {
        return payload;
    }

    /**
     * Children in positional order. Absent optional children are null.
     */
    public List<ExpressionNode> getChildren() {
        return children;
    }

    public ExpressionNode getChild(int index) {
        return children.get(index);
    }

    public int getChildCount() {
        return children.size();
    }

    /**
     * Returns a node of the same kind and payload with new children, or this node when every
     * child is the same instance.
     */
    public ExpressionNode withChildren(List<ExpressionNode> newChildren) {
        if (newChildren.size() == children.size()) {
            boolean same = true;
            for (int i = 0; i < children.size(); i++) {
                if (newChildren.get(i) != children.get(i)) {
                    same = false;
                    break;
                }
            }
            if (same) {
                return this;
            }
        }
        return new ExpressionNode(kind, payload, newChildren);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ExpressionNode)) {
            return false;
        }
        ExpressionNode other = (ExpressionNode) o;
        return kind == other.kind
                && Objects.equals(payload, other.payload)
                && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, payload, children);
    }

    /**
     * Renders the node as readable pseudo-source. Used in diagnostics and logs.
     */
    @Override
    public String toString() {
        switch (kind) {
            case LITERAL:
            case VARIABLE_REF:
                return payload;
            case BINARY_OP:
                return "(" + children.get(0) + " " + payload + " " + children.get(1) + ")";
            case UNARY_OP:
                return payload + children.get(0);
            case CALL:
                return payload + "(" + joinChildren(", ") + ")";
            case NEW_OBJECT:
                return "new " + payload + "(" + joinChildren(", ") + ")";
            case STACK_DUPLICATE:
                return "<pop>";
            case BLOCK:
                return "{ " + joinChildren("; ") + " }";
            case CONDITIONAL:
                return "if " + children.get(0) + " then " + children.get(1)
                        + (children.get(2) != null ? " else " + children.get(2) : "");
            case THROW:
                return children.get(0) != null ? "throw " + children.get(0) : "throw";
            case RETURN:
                return children.get(0) != null ? "return " + children.get(0) : "return";
            case ASSIGN:
                return children.get(0) + " = " + children.get(1);
            default:
                return "<" + payload + ">";
        }
    }

    private String joinChildren(String separator) {
        return children.stream().map(String::valueOf).collect(Collectors.joining(separator));
    }
}
