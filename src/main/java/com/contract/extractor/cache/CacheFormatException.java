package com.contract.extractor.cache;

import com.contract.extractor.ContractExtractionException;

/**
 * Stored bytes do not decode to a contract set under the current format version.
 */
public class CacheFormatException extends ContractExtractionException {

    public CacheFormatException(String message) {
        super(message);
    }

    public CacheFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
