package com.contract.extractor.processor;

import com.contract.extractor.analysis.DiagnosticKind;
import com.contract.extractor.cache.CacheInconsistencyException;
import com.contract.extractor.cache.CacheRecord;
import com.contract.extractor.cache.CacheStoreException;
import com.contract.extractor.cache.ContractCache;
import com.contract.extractor.cache.InMemoryCacheStore;
import com.contract.extractor.config.ExtractorConfiguration;
import com.contract.extractor.model.Assembly;
import com.contract.extractor.model.ClauseKind;
import com.contract.extractor.model.ExpressionNode;
import com.contract.extractor.model.Fingerprint;
import com.contract.extractor.model.MethodBody;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AssemblyAnalyzerTest {

    private static MethodBody method(String name, ExpressionNode... statements) {
        return new MethodBody("Ledger", name + "()", Fingerprint.sha256("Ledger", name),
                ExpressionNode.block(statements));
    }

    private static Assembly ledger(int methods) {
        List<MethodBody> bodies = new ArrayList<>();
        for (int i = 0; i < methods; i++) {
            ExpressionNode count = ExpressionNode.variable("count" + i);
            bodies.add(method("post" + i,
                    ExpressionNode.call("Contract.requires",
                            ExpressionNode.binary(">=", count, ExpressionNode.literal("0"))),
                    ExpressionNode.assign(count, ExpressionNode.binary("+", count, ExpressionNode.literal("1"))),
                    ExpressionNode.call("Contract.ensures",
                            ExpressionNode.binary(">", count, ExpressionNode.literal("0")))));
        }
        return new Assembly("ledger", bodies);
    }

    @Test
    void secondRunIsServedEntirelyFromCache() {
        ContractExtractionPipeline pipeline = new ContractExtractionPipeline(
                ExtractorConfiguration.defaults().withWorkerThreads(4), ContractCache.inMemory());
        AssemblyAnalyzer analyzer = new AssemblyAnalyzer(pipeline);
        Assembly assembly = ledger(20);

        AnalysisReport first = analyzer.analyze(assembly);
        AnalysisReport second = analyzer.analyze(assembly);

        assertEquals(20, first.count(MethodStatus.EXTRACTED));
        assertEquals(20, second.count(MethodStatus.CACHED));
        assertEquals(20, pipeline.getMetrics().getCacheHits());
        assertEquals(20, pipeline.getMetrics().getAcceptedClauses(ClauseKind.ENSURES));
        for (int i = 0; i < 20; i++) {
            assertEquals(first.getMethods().get(i).getContracts(), second.getMethods().get(i).getContracts());
        }
    }

    @Test
    void resultsKeepMethodOrder() {
        AssemblyAnalyzer analyzer = new AssemblyAnalyzer(new ContractExtractionPipeline(
                ExtractorConfiguration.defaults().withWorkerThreads(3), ContractCache.inMemory()));
        Assembly assembly = ledger(10);

        AnalysisReport report = analyzer.analyze(assembly);

        assertEquals("ledger", report.getAssemblyName());
        for (int i = 0; i < 10; i++) {
            assertSame(assembly.getMethods().get(i), report.getMethods().get(i).getMethod());
        }
    }

    @Test
    void malformedMethodDoesNotStopTheBatch() {
        AssemblyAnalyzer analyzer = new AssemblyAnalyzer(new ContractExtractionPipeline(
                ExtractorConfiguration.defaults().withWorkerThreads(2), ContractCache.inMemory()));
        List<MethodBody> methods = new ArrayList<>(ledger(3).getMethods());
        methods.add(1, method("broken",
                ExpressionNode.call("Contract.requires", ExpressionNode.unrecognized("SwitchExpr"))));

        AnalysisReport report = analyzer.analyze(new Assembly("ledger", methods));

        assertEquals(MethodStatus.FAILED, report.getMethods().get(1).getStatus());
        assertEquals(3, report.count(MethodStatus.EXTRACTED));
        assertFalse(report.isSuccessful());
        assertEquals(1, report.getDiagnostics().size());
    }

    @Test
    void emptyAssemblyProducesEmptyReport() {
        AssemblyAnalyzer analyzer = new AssemblyAnalyzer(new ContractExtractionPipeline(
                ExtractorConfiguration.defaults(), ContractCache.inMemory()));

        AnalysisReport report = analyzer.analyze(new Assembly("empty", List.of()));

        assertTrue(report.getMethods().isEmpty());
        assertTrue(report.isSuccessful());
    }

    @Test
    void cacheInconsistencyAbortsTheBatch() {
        MethodBody conflicting = method("conflicting");
        ContractExtractionPipeline pipeline = new ContractExtractionPipeline(
                ExtractorConfiguration.defaults().withWorkerThreads(2), ContractCache.inMemory()) {
            @Override
            public MethodAnalysis analyze(MethodBody method) {
                if (method == conflicting) {
                    throw new CacheInconsistencyException(method.getFingerprint());
                }
                return super.analyze(method);
            }
        };
        List<MethodBody> methods = new ArrayList<>(ledger(2).getMethods());
        methods.add(conflicting);

        assertThrows(CacheInconsistencyException.class,
                () -> new AssemblyAnalyzer(pipeline).analyze(new Assembly("ledger", methods)));
    }

    @Test
    void failingCacheWriteIsReportedPerMethod() {
        Assembly assembly = ledger(4);
        MethodBody unlucky = assembly.getMethods().get(2);
        InMemoryCacheStore store = new InMemoryCacheStore() {
            @Override
            public void write(CacheRecord record) {
                if (record.getKey().equals(unlucky.getFingerprint())) {
                    throw new CacheStoreException("Failed to write cache record", new IOException("disk full"));
                }
                super.write(record);
            }
        };
        ContractExtractionPipeline pipeline = new ContractExtractionPipeline(
                ExtractorConfiguration.defaults().withWorkerThreads(2), new ContractCache(store));
        AssemblyAnalyzer analyzer = new AssemblyAnalyzer(pipeline);

        AnalysisReport first = analyzer.analyze(assembly);

        assertEquals(4, first.count(MethodStatus.EXTRACTED));
        assertTrue(first.isSuccessful());
        MethodAnalysis failedWrite = first.getMethods().get(2);
        assertEquals(1, failedWrite.getContracts().getPreconditions().size());
        assertEquals(DiagnosticKind.CACHE_STORE, failedWrite.getDiagnostics().get(0).getKind());
        assertEquals(1, pipeline.getMetrics().getStoreFailures());
        assertEquals(3, store.size());

        AnalysisReport second = analyzer.analyze(assembly);
        assertEquals(3, second.count(MethodStatus.CACHED));
        assertEquals(MethodStatus.EXTRACTED, second.getMethods().get(2).getStatus());
    }
}
