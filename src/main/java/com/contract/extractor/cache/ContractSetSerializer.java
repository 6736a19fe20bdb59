package com.contract.extractor.cache;

import com.contract.extractor.model.ClauseKind;
import com.contract.extractor.model.ClauseOrigin;
import com.contract.extractor.model.ContractClause;
import com.contract.extractor.model.ContractSet;
import com.contract.extractor.model.ExpressionNode;
import com.contract.extractor.model.NodeKind;
import com.contract.extractor.model.SourcePosition;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Encodes contract sets as UTF-8 JSON for the cache.
 *
 * The envelope names its format and version; decoding anything else raises
 * {@link CacheFormatException} rather than guessing.
 */
public class ContractSetSerializer {

    public static final String FORMAT = "contract-set";
    public static final int VERSION = 1;

    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

    public byte[] serialize(ContractSet contracts) {
        Envelope envelope = new Envelope();
        envelope.format = FORMAT;
        envelope.version = VERSION;
        envelope.clauses = new ArrayList<>();
        for (ContractClause clause : contracts.getClauses()) {
            envelope.clauses.add(toJson(clause));
        }
        return GSON.toJson(envelope).getBytes(StandardCharsets.UTF_8);
    }

    /**
     * @throws CacheFormatException if the bytes are not a contract set of the current version
     */
    public ContractSet deserialize(byte[] bytes) {
        Envelope envelope;
        try {
            envelope = GSON.fromJson(new String(bytes, StandardCharsets.UTF_8), Envelope.class);
        } catch (JsonParseException e) {
            throw new CacheFormatException("Cached entry is not valid JSON: " + e.getMessage(), e);
        }
        if (envelope == null) {
            throw new CacheFormatException("Cached entry is empty");
        }
        if (!FORMAT.equals(envelope.format)) {
            throw new CacheFormatException("Unknown cache entry format: " + envelope.format);
        }
        if (envelope.version != VERSION) {
            throw new CacheFormatException("Cache entry version " + envelope.version
                    + " does not match current version " + VERSION);
        }
        if (envelope.clauses == null) {
            throw new CacheFormatException("Cache entry has no clause list");
        }

        List<ContractClause> clauses = new ArrayList<>();
        try {
            for (ClauseJson clause : envelope.clauses) {
                clauses.add(fromJson(clause));
            }
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new CacheFormatException("Cache entry holds an invalid clause: " + e.getMessage(), e);
        }
        return new ContractSet(clauses);
    }

    private ClauseJson toJson(ContractClause clause) {
        ClauseJson json = new ClauseJson();
        json.kind = clause.getKind().name();
        json.origin = clause.getOrigin().name();
        json.message = clause.getUserMessage();
        json.statement = clause.getPosition().getStatementIndex();
        json.line = clause.getPosition().getLine();
        json.column = clause.getPosition().getColumn();
        json.condition = toJson(clause.getCondition());
        return json;
    }

    private NodeJson toJson(ExpressionNode node) {
        if (node == null) {
            return null;
        }
        NodeJson json = new NodeJson();
        json.kind = node.getKind().name();
        json.payload = node.getPayload();
        if (node.getChildCount() > 0) {
            json.children = new ArrayList<>(node.getChildCount());
            for (ExpressionNode child : node.getChildren()) {
                json.children.add(toJson(child));
            }
        }
        return json;
    }

    private ContractClause fromJson(ClauseJson json) {
        if (json == null || json.kind == null || json.origin == null || json.condition == null) {
            throw new IllegalArgumentException("clause is missing required fields");
        }
        SourcePosition position = new SourcePosition(json.statement, json.line, json.column);
        return new ContractClause(ClauseKind.valueOf(json.kind), fromJson(json.condition), position,
                ClauseOrigin.valueOf(json.origin), json.message);
    }

    private ExpressionNode fromJson(NodeJson json) {
        if (json == null) {
            return null;
        }
        if (json.kind == null) {
            throw new IllegalArgumentException("node has no kind");
        }
        List<ExpressionNode> children = new ArrayList<>();
        if (json.children != null) {
            for (NodeJson child : json.children) {
                children.add(fromJson(child));
            }
        }
        return ExpressionNode.of(NodeKind.valueOf(json.kind), json.payload, children);
    }

    private static class Envelope {
        @SerializedName("format")  String format;
        @SerializedName("version") int version;
        @SerializedName("clauses") List<ClauseJson> clauses;
    }

    private static class ClauseJson {
        @SerializedName("kind")      String kind;
        @SerializedName("origin")    String origin;
        @SerializedName("message")   String message;
        @SerializedName("statement") int statement;
        @SerializedName("line")      int line;
        @SerializedName("column")    int column;
        @SerializedName("condition") NodeJson condition;
    }

    private static class NodeJson {
        @SerializedName("kind")     String kind;
        @SerializedName("payload")  String payload;
        @SerializedName("children") List<NodeJson> children;
    }
}
