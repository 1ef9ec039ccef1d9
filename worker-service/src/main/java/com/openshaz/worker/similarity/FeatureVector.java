package com.openshaz.worker.similarity;

/**
 * A stored song's feature vector as read from persistence.
 */
public record FeatureVector(
        int id,
        String name,
        double[] vector
) {
    public int dimensions() {
        return vector.length;
    }
}
