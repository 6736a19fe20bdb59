package com.contract.extractor.processor;

import com.contract.extractor.analysis.DiagnosticKind;
import com.contract.extractor.cache.CacheInconsistencyException;
import com.contract.extractor.cache.CacheRecord;
import com.contract.extractor.cache.ContractCache;
import com.contract.extractor.cache.InMemoryCacheStore;
import com.contract.extractor.config.ExtractorConfiguration;
import com.contract.extractor.config.InconsistencyPolicy;
import com.contract.extractor.model.ContractSet;
import com.contract.extractor.model.ExpressionNode;
import com.contract.extractor.model.Fingerprint;
import com.contract.extractor.model.MethodBody;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class ContractExtractionPipelineTest {

    private static final Fingerprint SHARED = Fingerprint.sha256("Account", "withdraw(int)");

    /** Store that can hide one read, as if another worker had not yet written the entry. */
    private static class RacingStore extends InMemoryCacheStore {
        final AtomicBoolean hideNextRead = new AtomicBoolean();

        @Override
        public Optional<CacheRecord> read(Fingerprint key) {
            if (hideNextRead.getAndSet(false)) {
                return Optional.empty();
            }
            return super.read(key);
        }
    }

    private static MethodBody requiresMethod(Fingerprint fingerprint, String variable) {
        return new MethodBody("Account", "withdraw(int)", fingerprint, ExpressionNode.block(
                ExpressionNode.call("Contract.requires",
                        ExpressionNode.binary(">", ExpressionNode.variable(variable), ExpressionNode.literal("0"))),
                ExpressionNode.returning(ExpressionNode.variable(variable))));
    }

    private static ExtractorConfiguration singleThreaded(InconsistencyPolicy policy) {
        return ExtractorConfiguration.defaults().withWorkerThreads(1).withInconsistencyPolicy(policy);
    }

    @Test
    void secondAnalysisIsServedFromCache() {
        ContractExtractionPipeline pipeline = new ContractExtractionPipeline(
                ExtractorConfiguration.defaults(), ContractCache.inMemory());
        MethodBody method = requiresMethod(SHARED, "amount");

        MethodAnalysis first = pipeline.analyze(method);
        MethodAnalysis second = pipeline.analyze(method);

        assertEquals(MethodStatus.EXTRACTED, first.getStatus());
        assertEquals(MethodStatus.CACHED, second.getStatus());
        assertEquals(first.getContracts(), second.getContracts());
        assertEquals(1, pipeline.getMetrics().getCacheHits());
        assertEquals(1, pipeline.getMetrics().getCacheMisses());
    }

    @Test
    void malformedMethodFailsWithoutCaching() {
        ContractCache cache = ContractCache.inMemory();
        ContractExtractionPipeline pipeline = new ContractExtractionPipeline(ExtractorConfiguration.defaults(), cache);
        MethodBody method = new MethodBody("Account", "filter(List)", SHARED, ExpressionNode.block(
                ExpressionNode.call("Contract.requires", ExpressionNode.unrecognized("LambdaExpr"))));

        MethodAnalysis analysis = pipeline.analyze(method);

        assertEquals(MethodStatus.FAILED, analysis.getStatus());
        assertTrue(analysis.getContracts().isEmpty());
        assertEquals(DiagnosticKind.MALFORMED_TREE, analysis.getDiagnostics().get(0).getKind());
        assertTrue(cache.get(SHARED).isEmpty());
        assertEquals(1, pipeline.getMetrics().getMalformedMethods());
    }

    @Test
    void partialResultIsCached() {
        ContractCache cache = ContractCache.inMemory();
        ContractExtractionPipeline pipeline = new ContractExtractionPipeline(ExtractorConfiguration.defaults(), cache);
        MethodBody method = new MethodBody("Account", "withdraw(int)", SHARED, ExpressionNode.block(
                ExpressionNode.call("Contract.requires", ExpressionNode.stackDuplicate()),
                ExpressionNode.call("Contract.requires", ExpressionNode.variable("open"))));

        MethodAnalysis analysis = pipeline.analyze(method);

        assertEquals(MethodStatus.PARTIAL, analysis.getStatus());
        assertEquals(1, analysis.getContracts().size());
        assertEquals(Optional.of(analysis.getContracts()), cache.get(SHARED));
        assertEquals(1, pipeline.getMetrics().getRejectedClauses());
    }

    @Test
    void unreadableEntryIsReplacedWithDiagnostic() {
        InMemoryCacheStore store = new InMemoryCacheStore();
        store.write(new CacheRecord(SHARED, "{\"format\":\"contract-set\",\"version\":0}".getBytes(StandardCharsets.UTF_8)));
        ContractCache cache = new ContractCache(store);
        ContractExtractionPipeline pipeline = new ContractExtractionPipeline(ExtractorConfiguration.defaults(), cache);

        MethodAnalysis analysis = pipeline.analyze(requiresMethod(SHARED, "amount"));

        assertEquals(MethodStatus.EXTRACTED, analysis.getStatus());
        assertEquals(DiagnosticKind.CACHE_FORMAT, analysis.getDiagnostics().get(0).getKind());
        assertEquals(Optional.of(analysis.getContracts()), cache.get(SHARED));
    }

    @Test
    void inconsistencyAbortsByDefault() {
        RacingStore store = new RacingStore();
        ContractExtractionPipeline pipeline = new ContractExtractionPipeline(
                singleThreaded(InconsistencyPolicy.ABORT), new ContractCache(store));
        pipeline.analyze(requiresMethod(SHARED, "amount"));

        store.hideNextRead.set(true);
        assertThrows(CacheInconsistencyException.class, () -> pipeline.analyze(requiresMethod(SHARED, "balance")));
    }

    @Test
    void inconsistencyFencesKeyWhenConfigured() {
        RacingStore store = new RacingStore();
        ContractCache cache = new ContractCache(store);
        ContractExtractionPipeline pipeline = new ContractExtractionPipeline(
                singleThreaded(InconsistencyPolicy.FENCE_KEY), cache);
        pipeline.analyze(requiresMethod(SHARED, "amount"));

        store.hideNextRead.set(true);
        MethodAnalysis conflicting = pipeline.analyze(requiresMethod(SHARED, "balance"));

        assertEquals(MethodStatus.EXTRACTED, conflicting.getStatus());
        assertEquals(DiagnosticKind.CACHE_INCONSISTENCY, conflicting.getDiagnostics().get(0).getKind());
        assertTrue(pipeline.getFencedKeys().contains(SHARED));
        assertTrue(cache.get(SHARED).isEmpty());

        MethodAnalysis again = pipeline.analyze(requiresMethod(SHARED, "amount"));
        assertEquals(MethodStatus.EXTRACTED, again.getStatus());
        assertTrue(cache.get(SHARED).isEmpty());
    }

    @Test
    void emptyMethodIsExtractedAndCached() {
        ContractCache cache = ContractCache.inMemory();
        ContractExtractionPipeline pipeline = new ContractExtractionPipeline(ExtractorConfiguration.defaults(), cache);
        MethodBody empty = new MethodBody("Account", "close()", SHARED, ExpressionNode.block());

        MethodAnalysis analysis = pipeline.analyze(empty);

        assertEquals(MethodStatus.EXTRACTED, analysis.getStatus());
        assertTrue(analysis.getDiagnostics().isEmpty());
        assertEquals(Optional.of(ContractSet.empty()), cache.get(SHARED));
    }
}
