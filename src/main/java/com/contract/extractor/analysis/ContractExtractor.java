package com.contract.extractor.analysis;

import com.contract.extractor.config.ContractOperation;
import com.contract.extractor.config.ExtractorConfiguration;
import com.contract.extractor.config.LegacyClausePolicy;
import com.contract.extractor.model.ClauseKind;
import com.contract.extractor.model.ClauseOrigin;
import com.contract.extractor.model.ContractClause;
import com.contract.extractor.model.ContractSet;
import com.contract.extractor.model.ExpressionNode;
import com.contract.extractor.model.MethodBody;
import com.contract.extractor.model.NodeKind;
import com.contract.extractor.model.SourcePosition;
import com.contract.extractor.visitor.ConditionNegator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Extracts the contract clauses of a method from its top-level statements.
 *
 * Two statement shapes declare a clause:
 * - a call to a registered contract operation, e.g. {@code Contract.requires(x > 0)}
 * - a legacy guard {@code if (!(x > 0)) throw new IllegalArgumentException()}
 *
 * Each candidate condition is checked with {@link StackBalanceValidator} before it is accepted.
 * Rejected candidates become {@link DiagnosticKind#UNEXTRACTABLE_CLAUSE} diagnostics and
 * extraction moves on to the next statement.
 */
public class ContractExtractor {

    private static final Logger logger = LoggerFactory.getLogger(ContractExtractor.class);

    private final ExtractorConfiguration configuration;

    public ContractExtractor(ExtractorConfiguration configuration) {
        this.configuration = configuration;
    }

    public ContractExtractor() {
        this(ExtractorConfiguration.defaults());
    }

    /**
     * Extracts the contract set of a method. The method body is not modified and repeated calls
     * return equal results.
     *
     * @param method the method to analyze
     * @return the accepted clauses in encounter order and the diagnostics for rejected ones
     * @throws com.contract.extractor.visitor.MalformedTreeException if a candidate condition holds
     *         a node kind with no traversal rule
     */
    public ExtractionResult extract(MethodBody method) {
        List<ExpressionNode> statements = method.getStatements();
        List<ContractClause> accepted = new ArrayList<>();
        List<Diagnostic> diagnostics = new ArrayList<>();

        if (statements.isEmpty()) {
            logger.debug("Method {} has no statements", method.getQualifiedName());
            return new ExtractionResult(ContractSet.empty(), diagnostics);
        }

        // Locate the contract prologue and the trailing epilogue once per method
        int prologueEnd = findPrologueEnd(statements);
        int epilogueStart = findEpilogueStart(statements);

        for (int i = 0; i < statements.size(); i++) {
            ExpressionNode statement = statements.get(i);
            SourcePosition position = method.getStatementPosition(i);

            // Contract calls first, then legacy if-throw guards
            Optional<ContractClause> candidate = matchContractCall(statement, position);
            if (candidate.isEmpty()) {
                candidate = matchLegacyGuard(statements, i, position, prologueEnd, epilogueStart);
            }
            if (candidate.isEmpty()) {
                continue;
            }

            // Validate
            ContractClause clause = candidate.get();
            int stackMarkers = StackBalanceValidator.countStackMarkers(clause.getCondition());
            if (stackMarkers == 0) {
                accepted.add(clause);
                logger.debug("Extracted {} from {} at {}", clause, method.getQualifiedName(), position);
            } else {
                String message = clause.getKind() + " condition " + clause.getCondition()
                        + " depends on " + stackMarkers + " value(s) left on the evaluation stack";
                diagnostics.add(new Diagnostic(DiagnosticKind.UNEXTRACTABLE_CLAUSE,
                        method.getQualifiedName(), position, message));
                logger.warn("Rejected clause in {} at {}: {}", method.getQualifiedName(), position, message);
            }
        }

        return new ExtractionResult(new ContractSet(accepted), diagnostics);
    }

    /**
     * Matches {@code Contract.requires(cond)} and friends. A call with an argument count the
     * operation does not accept is not a match.
     */
    private Optional<ContractClause> matchContractCall(ExpressionNode statement, SourcePosition position) {
        if (!statement.is(NodeKind.CALL)) {
            return Optional.empty();
        }
        Optional<ContractOperation> operation = configuration.findOperation(statement.getPayload());
        if (operation.isEmpty() || !operation.get().acceptsArgumentCount(statement.getChildCount())) {
            return Optional.empty();
        }

        String userMessage = null;
        if (statement.getChildCount() == 2) {
            ExpressionNode message = statement.getChild(1);
            if (!message.is(NodeKind.LITERAL)) {
                return Optional.empty();
            }
            userMessage = unquote(message.getPayload());
        }

        return Optional.of(new ContractClause(operation.get().getKind(), statement.getChild(0), position,
                ClauseOrigin.CONTRACT_CALL, userMessage));
    }

    private Optional<ContractClause> matchLegacyGuard(List<ExpressionNode> statements, int index,
                                                      SourcePosition position, int prologueEnd, int epilogueStart) {
        ExpressionNode statement = statements.get(index);
        if (!isLegacyGuard(statement)) {
            return Optional.empty();
        }

        ClauseKind kind;
        switch (configuration.getLegacyClausePolicy()) {
            case ALWAYS_REQUIRES:
                kind = ClauseKind.REQUIRES;
                break;
            case CONTRACT_BLOCK_ONLY:
                if (index >= prologueEnd) {
                    return Optional.empty();
                }
                kind = ClauseKind.REQUIRES;
                break;
            case POSITIONAL:
            default:
                boolean inEpilogue = index >= epilogueStart && hasOrdinaryStatementBefore(statements, index);
                kind = inEpilogue ? ClauseKind.ENSURES : ClauseKind.REQUIRES;
                break;
        }

        ExpressionNode condition = ConditionNegator.negate(statement.getChild(0));
        return Optional.of(new ContractClause(kind, condition, position, ClauseOrigin.LEGACY_IF_THROW));
    }

    /**
     * {@code if (test) throw ...} with no else branch; the then branch is the throw itself or a
     * block holding only the throw.
     */
    static boolean isLegacyGuard(ExpressionNode statement) {
        if (!statement.is(NodeKind.CONDITIONAL) || statement.getChild(2) != null) {
            return false;
        }
        ExpressionNode thenBranch = statement.getChild(1);
        if (thenBranch == null) {
            return false;
        }
        if (thenBranch.is(NodeKind.THROW)) {
            return true;
        }
        return thenBranch.is(NodeKind.BLOCK)
                && thenBranch.getChildCount() == 1
                && thenBranch.getChild(0).is(NodeKind.THROW);
    }

    private boolean isContractStatement(ExpressionNode statement) {
        if (isLegacyGuard(statement)) {
            return true;
        }
        return statement.is(NodeKind.CALL)
                && (configuration.findOperation(statement.getPayload()).isPresent()
                    || configuration.isEndContractBlock(statement.getPayload()));
    }

    /**
     * Index of the first statement past the contract prologue: the end-contract-block marker if
     * present, otherwise the first ordinary statement.
     */
    private int findPrologueEnd(List<ExpressionNode> statements) {
        for (int i = 0; i < statements.size(); i++) {
            ExpressionNode statement = statements.get(i);
            if (statement.is(NodeKind.CALL) && configuration.isEndContractBlock(statement.getPayload())) {
                return i;
            }
        }
        for (int i = 0; i < statements.size(); i++) {
            if (!isContractStatement(statements.get(i))) {
                return i;
            }
        }
        return statements.size();
    }

    /**
     * Index of the first statement of the trailing run of contract statements, ignoring a final
     * return.
     */
    private int findEpilogueStart(List<ExpressionNode> statements) {
        int end = statements.size();
        if (end > 0 && statements.get(end - 1).is(NodeKind.RETURN)) {
            end--;
        }
        int start = end;
        while (start > 0 && isContractStatement(statements.get(start - 1))) {
            start--;
        }
        return start;
    }

    private boolean hasOrdinaryStatementBefore(List<ExpressionNode> statements, int index) {
        for (int i = 0; i < index; i++) {
            if (!isContractStatement(statements.get(i))) {
                return true;
            }
        }
        return false;
    }

    private static String unquote(String literal) {
        if (literal.length() >= 2 && literal.startsWith("\"") && literal.endsWith("\"")) {
            return literal.substring(1, literal.length() - 1);
        }
        return literal;
    }

    public ExtractorConfiguration getConfiguration() {
        return configuration;
    }
}
