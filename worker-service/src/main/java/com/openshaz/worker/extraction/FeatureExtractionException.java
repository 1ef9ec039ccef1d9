package com.openshaz.worker.extraction;

/**
 * The extractor service failed or answered with something unusable. Treated as transient.
 */
public class FeatureExtractionException extends RuntimeException {

    public FeatureExtractionException(String message) {
        super(message);
    }

    public FeatureExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
