package com.contract.extractor.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Ordered, immutable clauses of one method, in extraction order.
 * Every clause has passed stack-balance validation.
 */
public final class ContractSet {

    private static final ContractSet EMPTY = new ContractSet(List.of());

    private final List<ContractClause> clauses;

    public ContractSet(List<ContractClause> clauses) {
        this.clauses = Collections.unmodifiableList(new ArrayList<>(clauses));
    }

    public static ContractSet empty() {
        return EMPTY;
    }

    public List<ContractClause> getClauses() {
        return clauses;
    }

    public List<ContractClause> getClauses(ClauseKind kind) {
        return clauses.stream()
                .filter(clause -> clause.getKind() == kind)
                .collect(Collectors.toList());
    }

    public List<ContractClause> getPreconditions() {
        return getClauses(ClauseKind.REQUIRES);
    }

    public List<ContractClause> getPostconditions() {
        return getClauses(ClauseKind.ENSURES);
    }

    public List<ContractClause> getInvariants() {
        return getClauses(ClauseKind.INVARIANT);
    }

    public int size() {
        return clauses.size();
    }

    public boolean isEmpty() {
        return clauses.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ContractSet)) return false;
        return clauses.equals(((ContractSet) o).clauses);
    }

    @Override
    public int hashCode() {
        return Objects.hash(clauses);
    }

    @Override
    public String toString() {
        return clauses.toString();
    }
}
