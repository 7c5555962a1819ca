package com.lynx.anomaly.exception;

/**
 * Raised when a bundle's stored feature order hash does not match the order the
 * caller will supply features in. Scoring with misaligned scaler parameters would
 * silently produce wrong results, so the bundle is rejected instead.
 */
public class FeatureOrderMismatchException extends RuntimeException {

    private final String expectedHash;
    private final String actualHash;

    public FeatureOrderMismatchException(String document, String expectedHash, String actualHash) {
        super(String.format("Feature order hash mismatch in %s: bundle=%s, caller=%s",
                document, expectedHash, actualHash));
        this.expectedHash = expectedHash;
        this.actualHash = actualHash;
    }

    public String getExpectedHash() {
        return expectedHash;
    }

    public String getActualHash() {
        return actualHash;
    }
}
