package com.openshaz.worker.similarity;

import com.openshaz.common.message.SimilarSong;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * In-memory nearest-neighbour search over the reference feature vectors.
 *
 * <p>{@link #fit(List)} builds an immutable index (optionally standardized) and swaps it in
 * whole, so a failed refit leaves the previous index usable and readers never see a
 * half-built one.
 */
@Slf4j
public class SimilarityEngine {

    private final boolean normalize;
    private volatile Index index;

    public SimilarityEngine(boolean normalize) {
        this.normalize = normalize;
    }

    public void fit(List<FeatureVector> references) {
        if (references == null || references.isEmpty()) {
            throw new IllegalArgumentException("Cannot fit on an empty reference set");
        }
        int dimensions = references.get(0).dimensions();
        if (dimensions == 0) {
            throw new IllegalArgumentException("Reference vectors must not be empty");
        }

        int rows = references.size();
        double[][] matrix = new double[rows][];
        int[] ids = new int[rows];
        String[] names = new String[rows];
        for (int i = 0; i < rows; i++) {
            FeatureVector reference = references.get(i);
            if (reference.dimensions() != dimensions) {
                throw new IllegalArgumentException("Reference '" + reference.name() + "' has "
                        + reference.dimensions() + " features, expected " + dimensions);
            }
            matrix[i] = reference.vector().clone();
            ids[i] = reference.id();
            names[i] = reference.name();
        }

        StandardScaler scaler = null;
        if (normalize) {
            scaler = StandardScaler.fit(matrix);
            scaler.transformInPlace(matrix);
        }

        this.index = new Index(matrix, ids, names, scaler);
        log.info("Fitted similarity engine on {} songs ({} dimensions, normalize={})", rows, dimensions, normalize);
    }

    /**
     * Rank the reference songs against {@code query}, best first. Equal scores keep reference
     * order.
     */
    public List<SimilarSong> findSimilar(double[] query, int topK, SimilarityMetric metric) {
        Index current = this.index;
        if (current == null) {
            throw new IllegalStateException("Similarity engine has not been fitted");
        }
        if (topK < 1) {
            throw new IllegalArgumentException("top_k must be at least 1, got: " + topK);
        }
        if (query.length != current.dimensions()) {
            throw new IllegalArgumentException("Query has " + query.length + " features, expected "
                    + current.dimensions());
        }

        double[] scaledQuery = current.scaler() == null ? query : current.scaler().transform(query);

        List<Scored> scored = new ArrayList<>(current.size());
        for (int row = 0; row < current.size(); row++) {
            scored.add(new Scored(row, metric.score(scaledQuery, current.matrix()[row])));
        }
        // List.sort is stable, so ties stay in row order
        scored.sort(Comparator.comparingDouble(Scored::similarity).reversed());

        int limit = Math.min(topK, scored.size());
        List<SimilarSong> results = new ArrayList<>(limit);
        for (int i = 0; i < limit; i++) {
            Scored s = scored.get(i);
            results.add(new SimilarSong(current.ids()[s.row()], current.names()[s.row()], s.similarity()));
        }
        return results;
    }

    public boolean isFitted() {
        return index != null;
    }

    public boolean isNormalized() {
        return normalize;
    }

    public int size() {
        Index current = this.index;
        return current == null ? 0 : current.size();
    }

    public int dimensions() {
        Index current = this.index;
        return current == null ? 0 : current.dimensions();
    }

    private record Scored(int row, double similarity) {
    }

    private record Index(double[][] matrix, int[] ids, String[] names, StandardScaler scaler) {

        int size() {
            return ids.length;
        }

        int dimensions() {
            return matrix[0].length;
        }
    }
}
