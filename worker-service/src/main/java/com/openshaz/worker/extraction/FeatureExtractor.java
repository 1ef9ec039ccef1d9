package com.openshaz.worker.extraction;

import java.nio.file.Path;

/**
 * Turns a local audio file into a fixed-length feature vector.
 */
public interface FeatureExtractor {

    double[] extract(Path audioFile);

    /**
     * Expected vector length, or 0 when not checked.
     */
    int getDimensions();
}
