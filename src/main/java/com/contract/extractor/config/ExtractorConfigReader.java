package com.contract.extractor.config;

import com.contract.extractor.ContractExtractionException;
import com.contract.extractor.model.ClauseKind;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads an {@link ExtractorConfiguration} from a JSON file. Fields missing from the file keep
 * their default values.
 *
 * <pre>
 * {
 *   "contract_operations": [{"callee": "Check.argument", "kind": "REQUIRES", "allows_message": true}],
 *   "include_default_operations": true,
 *   "end_contract_block_markers": ["Check.endOfChecks"],
 *   "legacy_clause_policy": "POSITIONAL",
 *   "worker_threads": 4,
 *   "inconsistency_policy": "FENCE_KEY"
 * }
 * </pre>
 */
public class ExtractorConfigReader {

    private static final Logger logger = LoggerFactory.getLogger(ExtractorConfigReader.class);
    private static final Gson GSON = new Gson();

    /**
     * @throws ConfigReadException if the file is missing, unreadable or malformed
     */
    public ExtractorConfiguration read(Path configPath) {
        if (!Files.isRegularFile(configPath)) {
            throw new ConfigReadException("Configuration file not found: " + configPath);
        }
        try (Reader reader = Files.newBufferedReader(configPath, StandardCharsets.UTF_8)) {
            ConfigFile file = GSON.fromJson(reader, ConfigFile.class);
            if (file == null) {
                throw new ConfigReadException("Configuration file is empty: " + configPath);
            }
            ExtractorConfiguration configuration = file.toConfiguration();
            logger.info("Loaded extractor configuration from {} ({} contract operations, {} policy)",
                    configPath, configuration.getOperations().size(), configuration.getLegacyClausePolicy());
            return configuration;
        } catch (JsonParseException e) {
            throw new ConfigReadException("Malformed configuration file " + configPath + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ConfigReadException("Failed to read configuration file " + configPath, e);
        }
    }

    public static class ConfigReadException extends ContractExtractionException {
        public ConfigReadException(String message) { super(message); }
        public ConfigReadException(String message, Throwable cause) { super(message, cause); }
    }

    /** Deserialized form of the configuration file. */
    private static class ConfigFile {

        @SerializedName("contract_operations")
        private List<OperationEntry> contractOperations;

        @SerializedName("include_default_operations")
        private Boolean includeDefaultOperations;

        @SerializedName("end_contract_block_markers")
        private List<String> endContractBlockMarkers;

        @SerializedName("legacy_clause_policy")
        private LegacyClausePolicy legacyClausePolicy;

        @SerializedName("worker_threads")
        private Integer workerThreads;

        @SerializedName("inconsistency_policy")
        private InconsistencyPolicy inconsistencyPolicy;

        ExtractorConfiguration toConfiguration() {
            ExtractorConfiguration defaults = ExtractorConfiguration.defaults();

            List<ContractOperation> operations = new ArrayList<>();
            if (includeDefaultOperations == null || includeDefaultOperations) {
                operations.addAll(defaults.getOperations());
            }
            if (contractOperations != null) {
                for (OperationEntry entry : contractOperations) {
                    operations.add(entry.toOperation());
                }
            }

            Set<String> markers = new LinkedHashSet<>(defaults.getEndContractBlockMarkers());
            if (endContractBlockMarkers != null) {
                markers.addAll(endContractBlockMarkers);
            }

            try {
                return new ExtractorConfiguration(
                        operations,
                        markers,
                        legacyClausePolicy != null ? legacyClausePolicy : defaults.getLegacyClausePolicy(),
                        workerThreads != null ? workerThreads : defaults.getWorkerThreads(),
                        inconsistencyPolicy != null ? inconsistencyPolicy : defaults.getInconsistencyPolicy());
            } catch (IllegalArgumentException e) {
                throw new ConfigReadException("Invalid configuration: " + e.getMessage(), e);
            }
        }
    }

    private static class OperationEntry {

        @SerializedName("callee")
        private String callee;

        @SerializedName("kind")
        private ClauseKind kind;

        @SerializedName("allows_message")
        private Boolean allowsMessage;

        ContractOperation toOperation() {
            if (callee == null || callee.isEmpty() || kind == null) {
                throw new ConfigReadException("Contract operation needs a callee and a kind");
            }
            return new ContractOperation(callee, kind, allowsMessage != null && allowsMessage);
        }
    }
}
