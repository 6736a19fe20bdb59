package com.contract.extractor.processor;

import com.contract.extractor.cache.ContractCache;
import com.contract.extractor.config.ExtractorConfiguration;
import com.contract.extractor.evaluation.ExtractionMetrics;
import com.contract.extractor.model.Assembly;
import com.contract.extractor.source.JavaSourceMethodReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Extracts contracts from every Java source file under a directory.
 * Each file is read as one assembly and analyzed with a shared pipeline and cache.
 */
public class CodebaseContractProcessor {

    private static final Logger logger = LoggerFactory.getLogger(CodebaseContractProcessor.class);

    private final JavaSourceMethodReader reader;
    private final AssemblyAnalyzer analyzer;

    public CodebaseContractProcessor(ExtractorConfiguration configuration, ContractCache cache) {
        this(new JavaSourceMethodReader(),
                new AssemblyAnalyzer(new ContractExtractionPipeline(configuration, cache)));
    }

    public CodebaseContractProcessor(JavaSourceMethodReader reader, AssemblyAnalyzer analyzer) {
        this.reader = reader;
        this.analyzer = analyzer;
    }

    /**
     * Processes all Java files in the given codebase path.
     * Files that fail to parse are logged and skipped.
     *
     * @param codebasePath Path to the root directory of the Java codebase
     * @return one report per file that was read, in path order
     * @throws IOException If the directory cannot be walked
     */
    public List<AnalysisReport> processCodebase(Path codebasePath) throws IOException {
        if (!Files.exists(codebasePath)) {
            throw new IOException("Path does not exist: " + codebasePath);
        }

        // Collect all Java files first
        List<Path> javaFiles;
        try (Stream<Path> paths = Files.walk(codebasePath)) {
            javaFiles = paths.filter(Files::isRegularFile)
                    .filter(path -> path.toString().endsWith(".java"))
                    .sorted()
                    .collect(Collectors.toList());
        }
        logger.info("Found {} Java files under {}", javaFiles.size(), codebasePath);

        // Read and analyze each file as its own assembly
        List<AnalysisReport> reports = new ArrayList<>();
        for (Path javaFile : javaFiles) {
            Assembly assembly;
            try {
                assembly = reader.readFile(javaFile);
            } catch (JavaSourceMethodReader.SourceReadException e) {
                logger.error("Error reading file: {}", javaFile, e);
                continue;
            }
            reports.add(analyzer.analyze(assembly));
        }

        logger.info("Processed {} of {} files", reports.size(), javaFiles.size());
        return reports;
    }

    /**
     * Get the metrics shared by every file processed so far.
     */
    public ExtractionMetrics getMetrics() {
        return analyzer.getPipeline().getMetrics();
    }
}
