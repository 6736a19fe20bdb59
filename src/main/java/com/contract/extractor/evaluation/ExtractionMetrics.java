package com.contract.extractor.evaluation;

import com.contract.extractor.model.ClauseKind;
import com.contract.extractor.model.ContractClause;
import com.contract.extractor.model.ContractSet;
import com.google.gson.GsonBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Collects counters across extraction runs: methods analyzed, cache behavior and clause
 * outcomes. Safe to update from worker threads.
 */
public class ExtractionMetrics {

    private static final Logger logger = LoggerFactory.getLogger(ExtractionMetrics.class);

    // Timing
    private volatile Instant startTime;
    private final AtomicLong totalAnalysisTimeMs = new AtomicLong();

    // Volume
    private final AtomicInteger totalAssemblies = new AtomicInteger();
    private final AtomicInteger totalMethods = new AtomicInteger();

    // Cache behavior
    private final AtomicInteger cacheHits = new AtomicInteger();
    private final AtomicInteger cacheMisses = new AtomicInteger();
    private final AtomicInteger staleEntries = new AtomicInteger();
    private final AtomicInteger inconsistencies = new AtomicInteger();
    private final AtomicInteger storeFailures = new AtomicInteger();

    // Outcomes
    private final AtomicInteger partialMethods = new AtomicInteger();
    private final AtomicInteger malformedMethods = new AtomicInteger();
    private final AtomicInteger rejectedClauses = new AtomicInteger();
    private final Map<ClauseKind, AtomicInteger> acceptedClauses = new EnumMap<>(ClauseKind.class);

    public ExtractionMetrics() {
        for (ClauseKind kind : ClauseKind.values()) {
            acceptedClauses.put(kind, new AtomicInteger());
        }
    }

    /**
     * Start timing a batch.
     */
    public void startAnalysis() {
        this.startTime = Instant.now();
    }

    /**
     * End timing a batch. Batches accumulate.
     */
    public void endAnalysis() {
        if (startTime == null) {
            return;
        }
        long elapsed = Duration.between(startTime, Instant.now()).toMillis();
        totalAnalysisTimeMs.addAndGet(elapsed);
        totalAssemblies.incrementAndGet();
        startTime = null;
    }

    public void recordCacheHit() {
        totalMethods.incrementAndGet();
        cacheHits.incrementAndGet();
    }

    /**
     * Record a method that went through extraction.
     */
    public void recordExtraction(ContractSet contracts, int rejected) {
        totalMethods.incrementAndGet();
        cacheMisses.incrementAndGet();
        for (ContractClause clause : contracts.getClauses()) {
            acceptedClauses.get(clause.getKind()).incrementAndGet();
        }
        if (rejected > 0) {
            partialMethods.incrementAndGet();
            rejectedClauses.addAndGet(rejected);
        }
    }

    public void recordMalformed() {
        totalMethods.incrementAndGet();
        cacheMisses.incrementAndGet();
        malformedMethods.incrementAndGet();
    }

    public void recordStaleEntry() {
        staleEntries.incrementAndGet();
    }

    public void recordInconsistency() {
        inconsistencies.incrementAndGet();
    }

    public void recordStoreFailure() {
        storeFailures.incrementAndGet();
    }

    public int getStoreFailures() {
        return storeFailures.get();
    }

    public int getCacheHits() {
        return cacheHits.get();
    }

    public int getCacheMisses() {
        return cacheMisses.get();
    }

    public int getTotalMethods() {
        return totalMethods.get();
    }

    public int getRejectedClauses() {
        return rejectedClauses.get();
    }

    public int getMalformedMethods() {
        return malformedMethods.get();
    }

    public int getAcceptedClauses(ClauseKind kind) {
        return acceptedClauses.get(kind).get();
    }

    /**
     * Snapshot of all counters.
     */
    public MetricsReport generateReport() {
        MetricsReport report = new MetricsReport();

        report.totalAnalysisTimeMs = totalAnalysisTimeMs.get();
        report.totalAssemblies = totalAssemblies.get();
        report.totalMethods = totalMethods.get();
        report.averageTimePerMethod = report.totalMethods > 0
                ? (double) report.totalAnalysisTimeMs / report.totalMethods : 0;

        report.cacheHits = cacheHits.get();
        report.cacheMisses = cacheMisses.get();
        report.cacheHitRate = calculatePercentage(report.cacheHits, report.totalMethods);
        report.staleEntries = staleEntries.get();
        report.inconsistencies = inconsistencies.get();
        report.storeFailures = storeFailures.get();

        report.partialMethods = partialMethods.get();
        report.malformedMethods = malformedMethods.get();
        report.rejectedClauses = rejectedClauses.get();
        report.acceptedClauses = new LinkedHashMap<>();
        for (Map.Entry<ClauseKind, AtomicInteger> entry : acceptedClauses.entrySet()) {
            report.acceptedClauses.put(entry.getKey().name(), entry.getValue().get());
        }

        return report;
    }

    /**
     * Export metrics to JSON.
     */
    public void exportJson(Path outputPath) throws IOException {
        try (Writer writer = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8)) {
            new GsonBuilder().setPrettyPrinting().create().toJson(generateReport(), writer);
        }
        logger.info("Extraction metrics exported to: {}", outputPath);
    }

    /**
     * Log a human-readable summary.
     */
    public void printReport() {
        MetricsReport report = generateReport();

        logger.info("Contract extraction: {} methods in {} batches, {} ms",
                report.totalMethods, report.totalAssemblies, report.totalAnalysisTimeMs);
        logger.info("  Cache: {} hits, {} misses ({}% hit rate), {} stale entries, {} inconsistencies",
                report.cacheHits, report.cacheMisses, String.format("%.1f", report.cacheHitRate),
                report.staleEntries, report.inconsistencies);
        if (report.storeFailures > 0) {
            logger.warn("  Cache store failed {} times", report.storeFailures);
        }
        logger.info("  Clauses accepted: {}", report.acceptedClauses);
        logger.info("  Clauses rejected: {} across {} partial methods; {} malformed methods",
                report.rejectedClauses, report.partialMethods, report.malformedMethods);
    }

    private double calculatePercentage(int part, int total) {
        return total > 0 ? (100.0 * part / total) : 0.0;
    }

    /**
     * Data class holding all metrics for reporting.
     */
    public static class MetricsReport {
        // Timing
        public long totalAnalysisTimeMs;
        public double averageTimePerMethod;

        // Volume
        public int totalAssemblies;
        public int totalMethods;

        // Cache
        public int cacheHits;
        public int cacheMisses;
        public double cacheHitRate;
        public int staleEntries;
        public int inconsistencies;
        public int storeFailures;

        // Outcomes
        public int partialMethods;
        public int malformedMethods;
        public int rejectedClauses;
        public Map<String, Integer> acceptedClauses;
    }
}
