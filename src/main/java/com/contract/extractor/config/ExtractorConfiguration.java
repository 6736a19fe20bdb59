package com.contract.extractor.config;

import com.contract.extractor.model.ClauseKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Settings for contract extraction and batch analysis. Immutable; the {@code with...} methods
 * return modified copies.
 */
public final class ExtractorConfiguration {

    private static final String CONTRACT = "Contract.";
    private static final String QUALIFIED_CONTRACT = "System.Diagnostics.Contracts.Contract.";

    private final Map<String, ContractOperation> operations;
    private final Set<String> endContractBlockMarkers;
    private final LegacyClausePolicy legacyClausePolicy;
    private final int workerThreads;
    private final InconsistencyPolicy inconsistencyPolicy;

    public ExtractorConfiguration(List<ContractOperation> operations,
                                  Set<String> endContractBlockMarkers,
                                  LegacyClausePolicy legacyClausePolicy,
                                  int workerThreads,
                                  InconsistencyPolicy inconsistencyPolicy) {
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be at least 1: " + workerThreads);
        }
        Map<String, ContractOperation> byCallee = new LinkedHashMap<>();
        for (ContractOperation operation : operations) {
            byCallee.put(operation.getCallee(), operation);
        }
        this.operations = Collections.unmodifiableMap(byCallee);
        this.endContractBlockMarkers = Collections.unmodifiableSet(new LinkedHashSet<>(endContractBlockMarkers));
        this.legacyClausePolicy = legacyClausePolicy;
        this.workerThreads = workerThreads;
        this.inconsistencyPolicy = inconsistencyPolicy;
    }

    public static ExtractorConfiguration defaults() {
        return new ExtractorConfiguration(
                defaultOperations(),
                defaultEndContractBlockMarkers(),
                LegacyClausePolicy.POSITIONAL,
                Math.max(1, Runtime.getRuntime().availableProcessors()),
                InconsistencyPolicy.ABORT);
    }

    /**
     * The contract operations recognized out of the box, in camelCase, PascalCase and fully
     * qualified spellings.
     */
    public static List<ContractOperation> defaultOperations() {
        List<ContractOperation> operations = new ArrayList<>();
        addSpellings(operations, "requires", ClauseKind.REQUIRES);
        addSpellings(operations, "ensures", ClauseKind.ENSURES);
        addSpellings(operations, "ensuresOnThrow", ClauseKind.ENSURES);
        addSpellings(operations, "invariant", ClauseKind.INVARIANT);
        return operations;
    }

    public static Set<String> defaultEndContractBlockMarkers() {
        Set<String> markers = new LinkedHashSet<>();
        markers.add(CONTRACT + "endContractBlock");
        markers.add(CONTRACT + "EndContractBlock");
        markers.add(QUALIFIED_CONTRACT + "EndContractBlock");
        return markers;
    }

    private static void addSpellings(List<ContractOperation> operations, String name, ClauseKind kind) {
        String pascal = Character.toUpperCase(name.charAt(0)) + name.substring(1);
        operations.add(new ContractOperation(CONTRACT + name, kind, true));
        operations.add(new ContractOperation(CONTRACT + pascal, kind, true));
        operations.add(new ContractOperation(QUALIFIED_CONTRACT + pascal, kind, true));
    }

    public Optional<ContractOperation> findOperation(String callee) {
        return Optional.ofNullable(operations.get(callee));
    }

    public boolean isEndContractBlock(String callee) {
        return endContractBlockMarkers.contains(callee);
    }

    public List<ContractOperation> getOperations() {
        return new ArrayList<>(operations.values());
    }

    public Set<String> getEndContractBlockMarkers() {
        return endContractBlockMarkers;
    }

    public LegacyClausePolicy getLegacyClausePolicy() {
        return legacyClausePolicy;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public InconsistencyPolicy getInconsistencyPolicy() {
        return inconsistencyPolicy;
    }

    public ExtractorConfiguration withOperations(List<ContractOperation> newOperations) {
        return new ExtractorConfiguration(newOperations, endContractBlockMarkers, legacyClausePolicy,
                workerThreads, inconsistencyPolicy);
    }

    public ExtractorConfiguration withLegacyClausePolicy(LegacyClausePolicy policy) {
        return new ExtractorConfiguration(getOperations(), endContractBlockMarkers, policy,
                workerThreads, inconsistencyPolicy);
    }

    public ExtractorConfiguration withWorkerThreads(int threads) {
        return new ExtractorConfiguration(getOperations(), endContractBlockMarkers, legacyClausePolicy,
                threads, inconsistencyPolicy);
    }

    public ExtractorConfiguration withInconsistencyPolicy(InconsistencyPolicy policy) {
        return new ExtractorConfiguration(getOperations(), endContractBlockMarkers, legacyClausePolicy,
                workerThreads, policy);
    }
}
