package com.openshaz.worker.similarity;

import java.util.Locale;

/**
 * Scoring functions for ranking reference songs against a query. Every metric yields a
 * similarity where higher means closer.
 */
public enum SimilarityMetric {

    /**
     * Cosine of the angle between the vectors, in [-1, 1]. A zero vector scores 0.
     */
    COSINE,

    /**
     * {@code 1 / (1 + L2 distance)}, in (0, 1].
     */
    EUCLIDEAN,

    /**
     * {@code 1 / (1 + L1 distance)}, in (0, 1].
     */
    MANHATTAN;

    public double score(double[] query, double[] reference) {
        if (query.length != reference.length) {
            throw new IllegalArgumentException("Vectors must be of the same dimension: "
                    + query.length + " vs " + reference.length);
        }
        switch (this) {
            case COSINE:
                return cosine(query, reference);
            case EUCLIDEAN:
                return 1.0 / (1.0 + euclideanDistance(query, reference));
            case MANHATTAN:
                return 1.0 / (1.0 + manhattanDistance(query, reference));
            default:
                throw new IllegalArgumentException("Unknown metric: " + this);
        }
    }

    public static SimilarityMetric fromName(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Metric name must not be blank");
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown metric: " + raw + " (expected cosine, euclidean or manhattan)", e);
        }
    }

    private static double cosine(double[] a, double[] b) {
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    private static double euclideanDistance(double[] a, double[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            double diff = a[i] - b[i];
            sum += diff * diff;
        }
        return Math.sqrt(sum);
    }

    private static double manhattanDistance(double[] a, double[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += Math.abs(a[i] - b[i]);
        }
        return sum;
    }
}
