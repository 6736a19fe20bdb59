package com.contract.extractor.cache;

import com.contract.extractor.ContractExtractionException;

/**
 * A {@link CacheStore} could not reach its backing storage.
 */
public class CacheStoreException extends ContractExtractionException {

    public CacheStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
