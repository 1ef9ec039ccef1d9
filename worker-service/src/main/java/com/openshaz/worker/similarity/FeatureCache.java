package com.openshaz.worker.similarity;

import com.openshaz.worker.entity.SongKind;
import com.openshaz.worker.service.FeatureVectorStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Lazily loaded reference set plus the engine fitted on it.
 *
 * <p>The first similarity job loads every reference vector and fits once; later jobs reuse the
 * fitted engine. Songs stored after that are not seen until {@link #invalidate()} or
 * {@link #refit()} is called. An empty reference set is not cached, so the next call checks
 * the database again.
 */
@Slf4j
public class FeatureCache {

    private final FeatureVectorStore featureVectorStore;
    private final boolean normalize;

    private SimilarityEngine engine;
    private List<FeatureVector> references = List.of();
    private Instant loadedAt;

    public FeatureCache(FeatureVectorStore featureVectorStore, boolean normalize) {
        this.featureVectorStore = featureVectorStore;
        this.normalize = normalize;
    }

    /**
     * The fitted engine, loading it on first use. Empty when there are no reference songs.
     */
    public synchronized Optional<SimilarityEngine> engine() {
        if (engine == null) {
            load();
        }
        return Optional.ofNullable(engine);
    }

    /**
     * Reference vectors behind the current engine, loading them on first use.
     */
    public synchronized List<FeatureVector> references() {
        if (engine == null) {
            load();
        }
        return references;
    }

    /**
     * Reload and refit now. If loading or fitting fails the previous engine stays in place.
     */
    public synchronized Optional<SimilarityEngine> refit() {
        log.info("Refitting feature cache");
        load();
        return Optional.ofNullable(engine);
    }

    public synchronized void invalidate() {
        clear();
        log.info("Feature cache invalidated");
    }

    public synchronized CacheStatus status() {
        if (engine == null) {
            return new CacheStatus(false, 0, 0, normalize, null);
        }
        return new CacheStatus(true, engine.size(), engine.dimensions(), normalize, loadedAt);
    }

    private void load() {
        List<FeatureVector> loaded = featureVectorStore.fetchAll(SongKind.OPENSOURCE);
        if (loaded.isEmpty()) {
            log.warn("No opensource songs in database for comparison");
            clear();
            return;
        }
        SimilarityEngine fresh = new SimilarityEngine(normalize);
        fresh.fit(loaded);
        this.engine = fresh;
        this.references = List.copyOf(loaded);
        this.loadedAt = Instant.now();
        log.info("Loaded {} reference songs into feature cache", loaded.size());
    }

    private void clear() {
        engine = null;
        references = List.of();
        loadedAt = null;
    }

    public record CacheStatus(
            boolean loaded,
            int size,
            int dimensions,
            boolean normalized,
            Instant loadedAt
    ) {
    }
}
