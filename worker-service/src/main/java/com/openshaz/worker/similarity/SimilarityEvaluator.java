package com.openshaz.worker.similarity;

import com.openshaz.common.message.SimilarSong;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;

/**
 * Offline quality check for the similarity engine: hold out part of the reference set, query
 * with it, and count how often a result of the same genre shows up in the top-k. The genre
 * of a song is the part of its name before the first dot ({@code blues.00042.wav} is "blues").
 */
@Slf4j
public class SimilarityEvaluator {

    public static final long DEFAULT_SEED = 42L;

    private final boolean normalize;

    public SimilarityEvaluator(boolean normalize) {
        this.normalize = normalize;
    }

    public static String genreOf(String name) {
        int dot = name.indexOf('.');
        return dot < 0 ? name : name.substring(0, dot);
    }

    /**
     * Seeded shuffle then split; the test part gets {@code ceil(size * testSize)} songs.
     */
    public Split split(List<FeatureVector> dataset, double testSize, long seed) {
        if (testSize <= 0.0 || testSize >= 1.0) {
            throw new IllegalArgumentException("test_size must be between 0 and 1 (exclusive), got: " + testSize);
        }
        if (dataset.size() < 2) {
            throw new IllegalArgumentException("Need at least 2 songs to evaluate, got: " + dataset.size());
        }
        List<FeatureVector> shuffled = new ArrayList<>(dataset);
        Collections.shuffle(shuffled, new Random(seed));

        int testCount = (int) Math.ceil(shuffled.size() * testSize);
        testCount = Math.min(testCount, shuffled.size() - 1);
        return new Split(
                List.copyOf(shuffled.subList(testCount, shuffled.size())),
                List.copyOf(shuffled.subList(0, testCount)));
    }

    /**
     * Top-k genre accuracy of {@code engine} over {@code testSet}.
     */
    public EvaluationReport evaluate(SimilarityEngine engine, List<FeatureVector> testSet,
            int topK, SimilarityMetric metric) {
        int correct = 0;
        Map<String, int[]> perGenre = new TreeMap<>();

        for (FeatureVector query : testSet) {
            String genre = genreOf(query.name());
            List<SimilarSong> results = engine.findSimilar(query.vector(), topK, metric);
            boolean hit = results.stream().anyMatch(song -> genre.equals(genreOf(song.name())));

            int[] counts = perGenre.computeIfAbsent(genre, g -> new int[2]);
            counts[1]++;
            if (hit) {
                counts[0]++;
                correct++;
            }
        }

        Map<String, GenreAccuracy> genres = new TreeMap<>();
        perGenre.forEach((genre, counts) ->
                genres.put(genre, new GenreAccuracy(counts[0], counts[1], ratio(counts[0], counts[1]))));

        return new EvaluationReport(metric, topK, engine.size(), testSet.size(), correct,
                ratio(correct, testSet.size()), genres);
    }

    /**
     * Fit on a seeded train split once and evaluate every metric on the same test split.
     */
    public List<EvaluationReport> compareMetrics(List<FeatureVector> dataset, double testSize, int topK, long seed) {
        Split split = split(dataset, testSize, seed);
        SimilarityEngine engine = new SimilarityEngine(normalize);
        engine.fit(split.train());

        List<EvaluationReport> reports = new ArrayList<>();
        for (SimilarityMetric metric : SimilarityMetric.values()) {
            EvaluationReport report = evaluate(engine, split.test(), topK, metric);
            log.info("Evaluation {} top-{}: {}/{} correct ({})", metric, topK,
                    report.correct(), report.testSize(), String.format("%.2f%%", report.accuracy() * 100));
            reports.add(report);
        }
        return reports;
    }

    private static double ratio(int part, int total) {
        return total == 0 ? 0.0 : (double) part / total;
    }

    public record Split(List<FeatureVector> train, List<FeatureVector> test) {
    }

    public record GenreAccuracy(int correct, int total, double accuracy) {
    }

    public record EvaluationReport(
            SimilarityMetric metric,
            int topK,
            int trainSize,
            int testSize,
            int correct,
            double accuracy,
            Map<String, GenreAccuracy> genres
    ) {
    }
}
