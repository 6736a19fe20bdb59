package com.contract.extractor.analysis;

import com.contract.extractor.model.ContractSet;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Contract set of one method plus the diagnostics recorded while extracting it.
 */
public final class ExtractionResult {

    private final ContractSet contracts;
    private final List<Diagnostic> diagnostics;

    public ExtractionResult(ContractSet contracts, List<Diagnostic> diagnostics) {
        this.contracts = Objects.requireNonNull(contracts, "contracts");
        this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }

    public ContractSet getContracts() {
        return contracts;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    /**
     * True when at least one candidate clause was rejected.
     */
    public boolean isPartial() {
        return diagnostics.stream().anyMatch(d -> d.getKind() == DiagnosticKind.UNEXTRACTABLE_CLAUSE);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExtractionResult)) return false;
        ExtractionResult that = (ExtractionResult) o;
        return contracts.equals(that.contracts) && diagnostics.equals(that.diagnostics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(contracts, diagnostics);
    }
}
