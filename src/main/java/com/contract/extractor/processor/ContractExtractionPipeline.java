package com.contract.extractor.processor;

import com.contract.extractor.analysis.ContractExtractor;
import com.contract.extractor.analysis.Diagnostic;
import com.contract.extractor.analysis.DiagnosticKind;
import com.contract.extractor.analysis.ExtractionResult;
import com.contract.extractor.cache.CacheFormatException;
import com.contract.extractor.cache.CacheInconsistencyException;
import com.contract.extractor.cache.CacheStoreException;
import com.contract.extractor.cache.ContractCache;
import com.contract.extractor.config.ExtractorConfiguration;
import com.contract.extractor.config.InconsistencyPolicy;
import com.contract.extractor.evaluation.ExtractionMetrics;
import com.contract.extractor.model.ContractSet;
import com.contract.extractor.model.Fingerprint;
import com.contract.extractor.model.MethodBody;
import com.contract.extractor.visitor.MalformedTreeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Analyzes one method at a time: cache lookup first, extraction on a miss, then a cache write.
 *
 * The cache handle is passed in, so independent pipelines can run side by side. Instances are
 * safe to share between worker threads.
 */
public class ContractExtractionPipeline {

    private static final Logger logger = LoggerFactory.getLogger(ContractExtractionPipeline.class);

    private final ContractExtractor extractor;
    private final ContractCache cache;
    private final ExtractionMetrics metrics;
    private final InconsistencyPolicy inconsistencyPolicy;
    private final Set<Fingerprint> fencedKeys = ConcurrentHashMap.newKeySet();

    public ContractExtractionPipeline(ContractExtractor extractor, ContractCache cache, ExtractionMetrics metrics) {
        this.extractor = extractor;
        this.cache = cache;
        this.metrics = metrics;
        this.inconsistencyPolicy = extractor.getConfiguration().getInconsistencyPolicy();
    }

    public ContractExtractionPipeline(ExtractorConfiguration configuration, ContractCache cache) {
        this(new ContractExtractor(configuration), cache, new ExtractionMetrics());
    }

    /**
     * Produces the contract set of a method, from the cache when its fingerprint is known.
     *
     * @param method the method to analyze
     * @return the outcome for the method; never null
     * @throws CacheInconsistencyException if the cache holds a different set for the fingerprint
     *         and the policy is {@link InconsistencyPolicy#ABORT}
     */
    public MethodAnalysis analyze(MethodBody method) {
        Fingerprint fingerprint = method.getFingerprint();
        List<Diagnostic> diagnostics = new ArrayList<>();
        boolean fenced = fencedKeys.contains(fingerprint);

        // Try the cache first, unless this key was fenced off
        if (!fenced) {
            Optional<ContractSet> cached = lookup(method, diagnostics);
            if (cached.isPresent()) {
                metrics.recordCacheHit();
                logger.debug("Served {} from cache", method.getQualifiedName());
                return new MethodAnalysis(method, MethodStatus.CACHED, cached.get(), diagnostics);
            }
        }

        // Cache miss: run extraction
        ExtractionResult result;
        try {
            result = extractor.extract(method);
        } catch (MalformedTreeException e) {
            metrics.recordMalformed();
            logger.error("Abandoned extraction of {}: {}", method.getQualifiedName(), e.getMessage());
            diagnostics.add(new Diagnostic(DiagnosticKind.MALFORMED_TREE, method.getQualifiedName(), null,
                    e.getMessage()));
            return new MethodAnalysis(method, MethodStatus.FAILED, ContractSet.empty(), diagnostics);
        }

        diagnostics.addAll(result.getDiagnostics());
        int rejected = (int) result.getDiagnostics().stream()
                .filter(d -> d.getKind() == DiagnosticKind.UNEXTRACTABLE_CLAUSE)
                .count();
        metrics.recordExtraction(result.getContracts(), rejected);

        // Publish the result for later runs
        if (!fenced) {
            store(method, result.getContracts(), diagnostics);
        }

        MethodStatus status = result.isPartial() ? MethodStatus.PARTIAL : MethodStatus.EXTRACTED;
        return new MethodAnalysis(method, status, result.getContracts(), diagnostics);
    }

    private Optional<ContractSet> lookup(MethodBody method, List<Diagnostic> diagnostics) {
        try {
            return cache.read(method.getFingerprint());
        } catch (CacheFormatException e) {
            cache.markStale(method.getFingerprint(), e);
            metrics.recordStaleEntry();
            diagnostics.add(new Diagnostic(DiagnosticKind.CACHE_FORMAT, method.getQualifiedName(), null,
                    e.getMessage()));
            return Optional.empty();
        } catch (CacheStoreException e) {
            storeFailed(method, "read", e, diagnostics);
            return Optional.empty();
        }
    }

    private void store(MethodBody method, ContractSet contracts, List<Diagnostic> diagnostics) {
        Fingerprint fingerprint = method.getFingerprint();
        try {
            cache.put(fingerprint, contracts);
        } catch (CacheInconsistencyException e) {
            metrics.recordInconsistency();
            if (inconsistencyPolicy == InconsistencyPolicy.ABORT) {
                logger.error("Cache inconsistency for {}: {}", method.getQualifiedName(), e.getMessage());
                throw e;
            }
            fencedKeys.add(fingerprint);
            cache.invalidate(fingerprint);
            logger.warn("Fenced off fingerprint {} after inconsistency in {}",
                    fingerprint.toHex(), method.getQualifiedName());
            diagnostics.add(new Diagnostic(DiagnosticKind.CACHE_INCONSISTENCY, method.getQualifiedName(), null,
                    e.getMessage()));
        } catch (CacheStoreException e) {
            storeFailed(method, "write", e, diagnostics);
        }
    }

    // a failing store costs the cache hit, never the method's result
    private void storeFailed(MethodBody method, String operation, CacheStoreException e, List<Diagnostic> diagnostics) {
        metrics.recordStoreFailure();
        logger.warn("Cache {} failed for {}", operation, method.getQualifiedName(), e);
        diagnostics.add(new Diagnostic(DiagnosticKind.CACHE_STORE, method.getQualifiedName(), null,
                e.getMessage()));
    }

    /**
     * Fingerprints excluded from caching after an inconsistency.
     */
    public Set<Fingerprint> getFencedKeys() {
        return Collections.unmodifiableSet(new HashSet<>(fencedKeys));
    }

    public ContractCache getCache() {
        return cache;
    }

    public ExtractionMetrics getMetrics() {
        return metrics;
    }

    public ExtractorConfiguration getConfiguration() {
        return extractor.getConfiguration();
    }
}
