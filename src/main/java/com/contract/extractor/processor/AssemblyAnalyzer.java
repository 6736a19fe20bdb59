package com.contract.extractor.processor;

import com.contract.extractor.ContractExtractionException;
import com.contract.extractor.model.Assembly;
import com.contract.extractor.model.MethodBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the pipeline over every method of an assembly on a pool of worker threads.
 *
 * Failures are contained per method: a malformed method is reported as
 * {@link MethodStatus#FAILED} and the rest of the assembly is still analyzed. Only errors that
 * make the cache itself untrustworthy stop the batch.
 */
public class AssemblyAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(AssemblyAnalyzer.class);

    private final ContractExtractionPipeline pipeline;
    private final int workerThreads;

    public AssemblyAnalyzer(ContractExtractionPipeline pipeline) {
        this.pipeline = pipeline;
        this.workerThreads = pipeline.getConfiguration().getWorkerThreads();
    }

    /**
     * Analyzes every method of the assembly.
     *
     * @param assembly the methods to analyze
     * @return per-method outcomes in the assembly's method order
     * @throws com.contract.extractor.cache.CacheInconsistencyException if the cache reports an
     *         inconsistency and the pipeline's policy is to abort
     */
    public AnalysisReport analyze(Assembly assembly) {
        List<MethodBody> methods = assembly.getMethods();
        logger.info("Analyzing {} with {} worker threads", assembly, workerThreads);
        Instant start = Instant.now();
        pipeline.getMetrics().startAnalysis();

        AtomicInteger threadCounter = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(workerThreads, runnable -> {
            Thread thread = new Thread(runnable, "contract-extractor-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });

        List<MethodAnalysis> results = new ArrayList<>(methods.size());
        try {
            List<Future<MethodAnalysis>> futures = new ArrayList<>(methods.size());
            // Submit every method, then collect results in method order
            for (MethodBody method : methods) {
                futures.add(executor.submit(() -> pipeline.analyze(method)));
            }
            for (Future<MethodAnalysis> future : futures) {
                results.add(await(future));
            }
        } finally {
            executor.shutdownNow();
            pipeline.getMetrics().endAnalysis();
        }

        AnalysisReport report = new AnalysisReport(assembly.getName(), results, Duration.between(start, Instant.now()));
        logger.info("Finished {}: {}", assembly.getName(), report.getStatusCounts());
        if (!report.isSuccessful()) {
            logger.warn("{} of {} methods in {} failed", report.count(MethodStatus.FAILED),
                    methods.size(), assembly.getName());
        }
        return report;
    }

    private MethodAnalysis await(Future<MethodAnalysis> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ContractExtractionException("Interrupted while waiting for extraction results", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new ContractExtractionException("Extraction worker failed", cause);
        }
    }

    public ContractExtractionPipeline getPipeline() {
        return pipeline;
    }
}
