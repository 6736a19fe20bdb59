package com.contract.extractor;

/**
 * Base type of all failures raised by contract extraction and its cache.
 */
public class ContractExtractionException extends RuntimeException {

    public ContractExtractionException(String message) {
        super(message);
    }

    public ContractExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
