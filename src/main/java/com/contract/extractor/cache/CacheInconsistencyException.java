package com.contract.extractor.cache;

import com.contract.extractor.ContractExtractionException;
import com.contract.extractor.model.Fingerprint;

/**
 * A put observed a different contract set already stored under the same fingerprint.
 * The content-addressing assumption is broken (a fingerprint collision or a fingerprint
 * that does not cover everything affecting extraction); callers must not ignore it.
 */
public class CacheInconsistencyException extends ContractExtractionException {

    private final Fingerprint fingerprint;

    public CacheInconsistencyException(Fingerprint fingerprint) {
        super("Fingerprint " + fingerprint.toHex() + " already maps to a different contract set");
        this.fingerprint = fingerprint;
    }

    public Fingerprint getFingerprint() {
        return fingerprint;
    }
}
