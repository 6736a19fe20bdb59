package com.contract.extractor.config;

import com.contract.extractor.model.ClauseKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ExtractorConfigReaderTest {

    private final ExtractorConfigReader reader = new ExtractorConfigReader();

    @Test
    void readsAllFields(@TempDir Path tmp) throws IOException {
        String json = """
            {
              "contract_operations": [
                {"callee": "Preconditions.checkArgument", "kind": "REQUIRES", "allows_message": true},
                {"callee": "Check.state", "kind": "INVARIANT"}
              ],
              "include_default_operations": false,
              "end_contract_block_markers": ["Check.endOfChecks"],
              "legacy_clause_policy": "CONTRACT_BLOCK_ONLY",
              "worker_threads": 3,
              "inconsistency_policy": "FENCE_KEY"
            }
            """;
        Path config = tmp.resolve("extractor.json");
        Files.writeString(config, json);

        ExtractorConfiguration configuration = reader.read(config);

        assertEquals(2, configuration.getOperations().size());
        ContractOperation checkArgument = configuration.findOperation("Preconditions.checkArgument").orElseThrow();
        assertEquals(ClauseKind.REQUIRES, checkArgument.getKind());
        assertTrue(checkArgument.acceptsArgumentCount(2));
        assertFalse(configuration.findOperation("Check.state").orElseThrow().acceptsArgumentCount(2));
        assertTrue(configuration.findOperation("Contract.requires").isEmpty());
        assertTrue(configuration.isEndContractBlock("Check.endOfChecks"));
        assertTrue(configuration.isEndContractBlock("Contract.EndContractBlock"));
        assertEquals(LegacyClausePolicy.CONTRACT_BLOCK_ONLY, configuration.getLegacyClausePolicy());
        assertEquals(3, configuration.getWorkerThreads());
        assertEquals(InconsistencyPolicy.FENCE_KEY, configuration.getInconsistencyPolicy());
    }

    @Test
    void missingFieldsKeepDefaults(@TempDir Path tmp) throws IOException {
        Path config = tmp.resolve("extractor.json");
        Files.writeString(config, """
            {
              "contract_operations": [{"callee": "Guard.notNull", "kind": "REQUIRES"}]
            }
            """);

        ExtractorConfiguration configuration = reader.read(config);
        ExtractorConfiguration defaults = ExtractorConfiguration.defaults();

        assertEquals(defaults.getOperations().size() + 1, configuration.getOperations().size());
        assertTrue(configuration.findOperation("Contract.Requires").isPresent());
        assertEquals(LegacyClausePolicy.POSITIONAL, configuration.getLegacyClausePolicy());
        assertEquals(InconsistencyPolicy.ABORT, configuration.getInconsistencyPolicy());
        assertEquals(defaults.getWorkerThreads(), configuration.getWorkerThreads());
    }

    @Test
    void fileNotFoundThrowsConfigReadException() {
        Path missing = Path.of("/tmp/does-not-exist-extractor.json");
        assertThrows(ExtractorConfigReader.ConfigReadException.class, () -> reader.read(missing));
    }

    @Test
    void emptyFileThrowsConfigReadException(@TempDir Path tmp) throws IOException {
        Path empty = tmp.resolve("empty.json");
        Files.writeString(empty, "");
        assertThrows(ExtractorConfigReader.ConfigReadException.class, () -> reader.read(empty));
    }

    @Test
    void malformedJsonThrowsConfigReadException(@TempDir Path tmp) throws IOException {
        Path config = tmp.resolve("broken.json");
        Files.writeString(config, "{\"worker_threads\": [1, 2");
        assertThrows(ExtractorConfigReader.ConfigReadException.class, () -> reader.read(config));
    }

    @Test
    void invalidValuesThrowConfigReadException(@TempDir Path tmp) throws IOException {
        Path zeroThreads = tmp.resolve("zero.json");
        Files.writeString(zeroThreads, "{\"worker_threads\": 0}");
        assertThrows(ExtractorConfigReader.ConfigReadException.class, () -> reader.read(zeroThreads));

        Path noKind = tmp.resolve("nokind.json");
        Files.writeString(noKind, "{\"contract_operations\": [{\"callee\": \"Guard.check\"}]}");
        assertThrows(ExtractorConfigReader.ConfigReadException.class, () -> reader.read(noKind));
    }

    @Test
    void withCopiesLeaveOriginalUntouched() {
        ExtractorConfiguration defaults = ExtractorConfiguration.defaults();
        ExtractorConfiguration single = defaults.withWorkerThreads(1)
                .withInconsistencyPolicy(InconsistencyPolicy.FENCE_KEY);

        assertEquals(1, single.getWorkerThreads());
        assertEquals(InconsistencyPolicy.FENCE_KEY, single.getInconsistencyPolicy());
        assertEquals(InconsistencyPolicy.ABORT, defaults.getInconsistencyPolicy());
        assertEquals(defaults.getOperations(), single.getOperations());
        assertThrows(IllegalArgumentException.class, () -> defaults.withWorkerThreads(0));
    }
}
