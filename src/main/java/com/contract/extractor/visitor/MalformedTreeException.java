package com.contract.extractor.visitor;

import com.contract.extractor.ContractExtractionException;
import com.contract.extractor.model.ExpressionNode;

/**
 * Thrown when traversal meets a node kind with no visitation rule.
 * Fatal for the extraction of the method being visited, not for the batch.
 */
public class MalformedTreeException extends ContractExtractionException {

    private final transient ExpressionNode node;

    public MalformedTreeException(ExpressionNode node) {
        super("No traversal rule for node kind " + node.getKind()
                + (node.getPayload() != null ? " (" + node.getPayload() + ")" : ""));
        this.node = node;
    }

    public ExpressionNode getNode() {
        return node;
    }
}
