package com.contract.extractor.processor;

import com.contract.extractor.analysis.Diagnostic;
import com.contract.extractor.model.ContractSet;
import com.contract.extractor.model.MethodBody;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of analyzing one method within a batch.
 */
public final class MethodAnalysis {

    private final MethodBody method;
    private final MethodStatus status;
    private final ContractSet contracts;
    private final List<Diagnostic> diagnostics;

    public MethodAnalysis(MethodBody method, MethodStatus status, ContractSet contracts, List<Diagnostic> diagnostics) {
        this.method = method;
        this.status = status;
        this.contracts = contracts;
        this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }

    public MethodBody getMethod() {
        return method;
    }

    public MethodStatus getStatus() {
        return status;
    }

    public ContractSet getContracts() {
        return contracts;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    @Override
    public String toString() {
        return method.getQualifiedName() + ": " + status + " " + contracts;
    }
}
