package com.contract.extractor.cache;

import com.contract.extractor.model.ClauseKind;
import com.contract.extractor.model.ClauseOrigin;
import com.contract.extractor.model.ContractClause;
import com.contract.extractor.model.ContractSet;
import com.contract.extractor.model.ExpressionNode;
import com.contract.extractor.model.SourcePosition;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContractSetSerializerTest {

    private final ContractSetSerializer serializer = new ContractSetSerializer();

    static ContractSet sampleContracts() {
        ExpressionNode x = ExpressionNode.variable("x");
        ContractClause requires = new ContractClause(ClauseKind.REQUIRES,
                ExpressionNode.binary("&&",
                        ExpressionNode.binary(">", x, ExpressionNode.literal("0")),
                        ExpressionNode.not(ExpressionNode.call("isEmpty", ExpressionNode.variable("items")))),
                new SourcePosition(0, 12, 9), ClauseOrigin.CONTRACT_CALL, "x must be <positive> & \"set\"");
        ContractClause ensures = new ContractClause(ClauseKind.ENSURES,
                ExpressionNode.conditional(ExpressionNode.variable("flag"),
                        ExpressionNode.literal("true"), null),
                SourcePosition.ofStatement(3), ClauseOrigin.LEGACY_IF_THROW);
        return new ContractSet(List.of(requires, ensures));
    }

    @Test
    void roundTripPreservesClausesAndOrder() {
        ContractSet contracts = sampleContracts();

        ContractSet decoded = serializer.deserialize(serializer.serialize(contracts));

        assertEquals(contracts, decoded);
        assertNull(decoded.getClauses().get(1).getCondition().getChild(2));
        assertEquals("x must be <positive> & \"set\"", decoded.getClauses().get(0).getUserMessage());
    }

    @Test
    void emptySetRoundTrips() {
        assertEquals(ContractSet.empty(), serializer.deserialize(serializer.serialize(ContractSet.empty())));
    }

    @Test
    void envelopeNamesFormatAndVersion() {
        String json = new String(serializer.serialize(ContractSet.empty()), StandardCharsets.UTF_8);

        assertTrue(json.contains("\"format\":\"contract-set\""));
        assertTrue(json.contains("\"version\":1"));
    }

    @Test
    void rejectsOtherVersion() {
        byte[] bytes = "{\"format\":\"contract-set\",\"version\":0,\"clauses\":[]}".getBytes(StandardCharsets.UTF_8);
        assertThrows(CacheFormatException.class, () -> serializer.deserialize(bytes));
    }

    @Test
    void rejectsOtherFormat() {
        byte[] bytes = "{\"format\":\"rule-set\",\"version\":1,\"clauses\":[]}".getBytes(StandardCharsets.UTF_8);
        assertThrows(CacheFormatException.class, () -> serializer.deserialize(bytes));
    }

    @Test
    void rejectsGarbageAndEmptyInput() {
        assertThrows(CacheFormatException.class,
                () -> serializer.deserialize("{not json".getBytes(StandardCharsets.UTF_8)));
        assertThrows(CacheFormatException.class, () -> serializer.deserialize(new byte[0]));
    }

    @Test
    void rejectsInvalidTree() {
        String json = "{\"format\":\"contract-set\",\"version\":1,\"clauses\":[{\"kind\":\"REQUIRES\","
                + "\"origin\":\"CONTRACT_CALL\",\"statement\":0,\"line\":-1,\"column\":-1,"
                + "\"condition\":{\"kind\":\"BINARY_OP\",\"payload\":\">\",\"children\":[]}}]}";
        assertThrows(CacheFormatException.class,
                () -> serializer.deserialize(json.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void rejectsUnknownKind() {
        String json = "{\"format\":\"contract-set\",\"version\":1,\"clauses\":[{\"kind\":\"ASSUMES\","
                + "\"origin\":\"CONTRACT_CALL\",\"statement\":0,\"line\":-1,\"column\":-1,"
                + "\"condition\":{\"kind\":\"VARIABLE_REF\",\"payload\":\"x\"}}]}";
        assertThrows(CacheFormatException.class,
                () -> serializer.deserialize(json.getBytes(StandardCharsets.UTF_8)));
    }
}
