package com.contract.extractor.processor;

import com.contract.extractor.analysis.Diagnostic;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Per-method outcomes of one batch, in the order the methods were supplied.
 */
public final class AnalysisReport {

    private final String assemblyName;
    private final List<MethodAnalysis> methods;
    private final Duration elapsed;

    public AnalysisReport(String assemblyName, List<MethodAnalysis> methods, Duration elapsed) {
        this.assemblyName = assemblyName;
        this.methods = Collections.unmodifiableList(new ArrayList<>(methods));
        this.elapsed = elapsed;
    }

    public String getAssemblyName() {
        return assemblyName;
    }

    public List<MethodAnalysis> getMethods() {
        return methods;
    }

    public Duration getElapsed() {
        return elapsed;
    }

    public List<Diagnostic> getDiagnostics() {
        return methods.stream()
                .flatMap(method -> method.getDiagnostics().stream())
                .collect(Collectors.toList());
    }

    public Map<MethodStatus, Integer> getStatusCounts() {
        Map<MethodStatus, Integer> counts = new EnumMap<>(MethodStatus.class);
        for (MethodAnalysis method : methods) {
            counts.merge(method.getStatus(), 1, Integer::sum);
        }
        return counts;
    }

    public int count(MethodStatus status) {
        return getStatusCounts().getOrDefault(status, 0);
    }

    /**
     * True when no method failed.
     */
    public boolean isSuccessful() {
        return count(MethodStatus.FAILED) == 0;
    }

    @Override
    public String toString() {
        return assemblyName + " " + getStatusCounts() + " in " + elapsed.toMillis() + "ms";
    }
}
