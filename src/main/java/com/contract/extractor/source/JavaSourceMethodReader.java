package com.contract.extractor.source;

import com.contract.extractor.ContractExtractionException;
import com.contract.extractor.model.Assembly;
import com.contract.extractor.model.ExpressionNode;
import com.contract.extractor.model.Fingerprint;
import com.contract.extractor.model.MethodBody;
import com.contract.extractor.model.NodeKind;
import com.contract.extractor.model.SourcePosition;
import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.*;
import com.github.javaparser.ast.stmt.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds {@link MethodBody} trees from Java source with JavaParser.
 *
 * Mapping rules:
 * - {@code Contract.requires(...)} style calls keep their qualified callee as the CALL payload
 * - an assignment or increment whose value is used becomes {@code BLOCK[ASSIGN, STACK_DUPLICATE]},
 *   the leftover value a stack machine would duplicate
 * - constructs with no mapping (lambdas, loops, switch expressions, ...) become UNRECOGNIZED
 *
 * Fingerprints cover the declaring type, the signature, the printed method source and where the
 * method begins, since clause positions are absolute file positions.
 */
public class JavaSourceMethodReader {

    private static final Logger logger = LoggerFactory.getLogger(JavaSourceMethodReader.class);

    private final JavaParser javaParser;

    public JavaSourceMethodReader() {
        ParserConfiguration parserConfig = new ParserConfiguration();
        parserConfig.setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        this.javaParser = new JavaParser(parserConfig);
    }

    /**
     * Parses source text and reads every method and constructor with a body.
     *
     * @param name   assembly name, usually the file name
     * @param source Java source text
     * @throws SourceReadException if the source does not parse
     */
    public Assembly readSource(String name, String source) {
        return new Assembly(name, readMethods(requireUnit(javaParser.parse(source), name)));
    }

    /**
     * @throws SourceReadException if the file cannot be read or does not parse
     */
    public Assembly readFile(Path javaFile) {
        try {
            CompilationUnit cu = requireUnit(javaParser.parse(javaFile), javaFile.toString());
            return new Assembly(javaFile.toString(), readMethods(cu));
        } catch (IOException e) {
            throw new SourceReadException("Failed to read " + javaFile, e);
        }
    }

    private CompilationUnit requireUnit(ParseResult<CompilationUnit> result, String name) {
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            throw new SourceReadException("Failed to parse " + name + ": " + result.getProblems());
        }
        return result.getResult().get();
    }

    /**
     * Reads every non-abstract method and constructor of a compilation unit, in source order.
     */
    public List<MethodBody> readMethods(CompilationUnit cu) {
        List<MethodBody> methods = new ArrayList<>();
        cu.walk(Node.TreeTraversal.PREORDER, node -> {
            if (node instanceof MethodDeclaration) {
                MethodDeclaration method = (MethodDeclaration) node;
                method.getBody().ifPresent(body -> methods.add(readMethod(method, body)));
            } else if (node instanceof ConstructorDeclaration) {
                ConstructorDeclaration constructor = (ConstructorDeclaration) node;
                methods.add(readMethod(constructor, constructor.getBody()));
            }
        });
        logger.debug("Read {} methods", methods.size());
        return methods;
    }

    private MethodBody readMethod(CallableDeclaration<?> callable, BlockStmt body) {
        String declaringType = declaringTypeOf(callable);
        String signature = callable.getSignature().asString();

        List<ExpressionNode> statements = new ArrayList<>();
        List<SourcePosition> positions = new ArrayList<>();
        for (Statement statement : body.getStatements()) {
            Optional<ExpressionNode> mapped = mapStatement(statement);
            if (mapped.isEmpty()) {
                continue;
            }
            int index = statements.size();
            statements.add(mapped.get());
            positions.add(statement.getBegin()
                    .map(begin -> new SourcePosition(index, begin.line, begin.column))
                    .orElse(SourcePosition.ofStatement(index)));
        }

        // positions are absolute, so the start of the method is part of the key
        String begin = callable.getBegin()
                .map(position -> position.line + ":" + position.column)
                .orElse("");
        Fingerprint fingerprint = Fingerprint.sha256(declaringType, signature, begin, callable.toString());
        return new MethodBody(declaringType, signature, fingerprint, ExpressionNode.block(statements), positions);
    }

    private String declaringTypeOf(Node node) {
        Optional<Node> parent = node.getParentNode();
        while (parent.isPresent()) {
            if (parent.get() instanceof TypeDeclaration) {
                TypeDeclaration<?> type = (TypeDeclaration<?>) parent.get();
                return type.getFullyQualifiedName().orElse(type.getNameAsString());
            }
            parent = parent.get().getParentNode();
        }
        return "<unknown>";
    }

    private Optional<ExpressionNode> mapStatement(Statement statement) {
        if (statement instanceof EmptyStmt) {
            return Optional.empty();
        }
        if (statement instanceof ExpressionStmt) {
            return mapExpressionStatement(((ExpressionStmt) statement).getExpression());
        }
        if (statement instanceof BlockStmt) {
            return Optional.of(mapBlock((BlockStmt) statement));
        }
        if (statement instanceof IfStmt) {
            IfStmt ifStmt = (IfStmt) statement;
            return Optional.of(ExpressionNode.conditional(
                    mapExpression(ifStmt.getCondition()),
                    mapStatement(ifStmt.getThenStmt()).orElse(ExpressionNode.block()),
                    ifStmt.getElseStmt().flatMap(this::mapStatement).orElse(null)));
        }
        if (statement instanceof ThrowStmt) {
            return Optional.of(ExpressionNode.throwing(mapExpression(((ThrowStmt) statement).getExpression())));
        }
        if (statement instanceof ReturnStmt) {
            return Optional.of(ExpressionNode.returning(
                    ((ReturnStmt) statement).getExpression().map(this::mapExpression).orElse(null)));
        }
        return Optional.of(ExpressionNode.unrecognized(statement.getClass().getSimpleName()));
    }

    private ExpressionNode mapBlock(BlockStmt block) {
        List<ExpressionNode> statements = new ArrayList<>();
        for (Statement statement : block.getStatements()) {
            mapStatement(statement).ifPresent(statements::add);
        }
        return ExpressionNode.block(statements);
    }

    /**
     * At statement level an assignment's value is discarded, so no stack marker is needed.
     */
    private Optional<ExpressionNode> mapExpressionStatement(Expression expression) {
        if (expression instanceof AssignExpr) {
            return Optional.of(mapAssignment((AssignExpr) expression));
        }
        if (expression instanceof UnaryExpr && isIncrementOrDecrement((UnaryExpr) expression)) {
            return Optional.of(mapIncrement((UnaryExpr) expression));
        }
        if (expression instanceof VariableDeclarationExpr) {
            List<ExpressionNode> assignments = new ArrayList<>();
            for (VariableDeclarator variable : ((VariableDeclarationExpr) expression).getVariables()) {
                variable.getInitializer().ifPresent(initializer -> assignments.add(ExpressionNode.assign(
                        ExpressionNode.variable(variable.getNameAsString()), mapExpression(initializer))));
            }
            if (assignments.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(assignments.size() == 1 ? assignments.get(0) : ExpressionNode.block(assignments));
        }
        return Optional.of(mapExpression(expression));
    }

    private ExpressionNode mapExpression(Expression expression) {
        if (expression instanceof EnclosedExpr) {
            return mapExpression(((EnclosedExpr) expression).getInner());
        }
        if (expression instanceof LiteralExpr) {
            return ExpressionNode.literal(expression.toString());
        }
        if (expression instanceof NameExpr) {
            return ExpressionNode.variable(((NameExpr) expression).getNameAsString());
        }
        if (expression instanceof ThisExpr || expression instanceof FieldAccessExpr) {
            return ExpressionNode.variable(expression.toString());
        }
        if (expression instanceof BinaryExpr) {
            BinaryExpr binary = (BinaryExpr) expression;
            return ExpressionNode.binary(binary.getOperator().asString(),
                    mapExpression(binary.getLeft()), mapExpression(binary.getRight()));
        }
        if (expression instanceof UnaryExpr) {
            UnaryExpr unary = (UnaryExpr) expression;
            if (isIncrementOrDecrement(unary)) {
                return leftoverValue(mapIncrement(unary));
            }
            return ExpressionNode.unary(unary.getOperator().asString(), mapExpression(unary.getExpression()));
        }
        if (expression instanceof AssignExpr) {
            return leftoverValue(mapAssignment((AssignExpr) expression));
        }
        if (expression instanceof MethodCallExpr) {
            return mapCall((MethodCallExpr) expression);
        }
        if (expression instanceof ObjectCreationExpr) {
            ObjectCreationExpr creation = (ObjectCreationExpr) expression;
            return ExpressionNode.of(NodeKind.NEW_OBJECT, creation.getType().asString(),
                    mapArguments(creation.getArguments()));
        }
        if (expression instanceof ConditionalExpr) {
            ConditionalExpr conditional = (ConditionalExpr) expression;
            return ExpressionNode.conditional(mapExpression(conditional.getCondition()),
                    mapExpression(conditional.getThenExpr()), mapExpression(conditional.getElseExpr()));
        }
        if (expression instanceof CastExpr) {
            CastExpr cast = (CastExpr) expression;
            return ExpressionNode.unary("(" + cast.getType().asString() + ")", mapExpression(cast.getExpression()));
        }
        if (expression instanceof InstanceOfExpr) {
            InstanceOfExpr instanceOf = (InstanceOfExpr) expression;
            return ExpressionNode.binary("instanceof", mapExpression(instanceOf.getExpression()),
                    ExpressionNode.literal(instanceOf.getType().asString()));
        }
        if (expression instanceof ArrayAccessExpr) {
            ArrayAccessExpr access = (ArrayAccessExpr) expression;
            return ExpressionNode.binary("[]", mapExpression(access.getName()), mapExpression(access.getIndex()));
        }
        return ExpressionNode.unrecognized(expression.getClass().getSimpleName());
    }

    /**
     * Static calls ({@code Contract.requires}, {@code System.Diagnostics.Contracts.Contract.Requires})
     * keep the qualified name as callee. Instance calls use the method name as callee and the
     * receiver as first child.
     */
    private ExpressionNode mapCall(MethodCallExpr call) {
        List<ExpressionNode> arguments = new ArrayList<>();
        String callee = call.getNameAsString();
        Optional<Expression> scope = call.getScope();
        if (scope.isPresent()) {
            if (isTypeName(scope.get())) {
                callee = scope.get() + "." + callee;
            } else {
                arguments.add(mapExpression(scope.get()));
            }
        }
        arguments.addAll(mapArguments(call.getArguments()));
        return ExpressionNode.call(callee, arguments);
    }

    private boolean isTypeName(Expression scope) {
        String simpleName;
        if (scope instanceof NameExpr) {
            simpleName = ((NameExpr) scope).getNameAsString();
        } else if (scope instanceof FieldAccessExpr) {
            simpleName = ((FieldAccessExpr) scope).getNameAsString();
        } else {
            return false;
        }
        return !simpleName.isEmpty() && Character.isUpperCase(simpleName.charAt(0));
    }

    private List<ExpressionNode> mapArguments(List<Expression> arguments) {
        List<ExpressionNode> mapped = new ArrayList<>(arguments.size());
        for (Expression argument : arguments) {
            mapped.add(mapExpression(argument));
        }
        return mapped;
    }

    private ExpressionNode mapAssignment(AssignExpr assign) {
        ExpressionNode target = mapExpression(assign.getTarget());
        ExpressionNode value = mapExpression(assign.getValue());
        Optional<BinaryExpr.Operator> compound = assign.getOperator().toBinaryOperator();
        if (compound.isPresent()) {
            value = ExpressionNode.binary(compound.get().asString(), target, value);
        }
        return ExpressionNode.assign(target, value);
    }

    private boolean isIncrementOrDecrement(UnaryExpr unary) {
        switch (unary.getOperator()) {
            case PREFIX_INCREMENT:
            case PREFIX_DECREMENT:
            case POSTFIX_INCREMENT:
            case POSTFIX_DECREMENT:
                return true;
            default:
                return false;
        }
    }

    private ExpressionNode mapIncrement(UnaryExpr unary) {
        ExpressionNode target = mapExpression(unary.getExpression());
        boolean increment = unary.getOperator() == UnaryExpr.Operator.PREFIX_INCREMENT
                || unary.getOperator() == UnaryExpr.Operator.POSTFIX_INCREMENT;
        return ExpressionNode.assign(target,
                ExpressionNode.binary(increment ? "+" : "-", target, ExpressionNode.literal("1")));
    }

    private ExpressionNode leftoverValue(ExpressionNode sideEffect) {
        return ExpressionNode.block(sideEffect, ExpressionNode.stackDuplicate());
    }

    /**
     * Source that cannot be read or parsed.
     */
    public static class SourceReadException extends ContractExtractionException {
        public SourceReadException(String message) { super(message); }
        public SourceReadException(String message, Throwable cause) { super(message, cause); }
    }
}
