package com.openshaz.worker.similarity;

import com.openshaz.worker.entity.SongKind;
import com.openshaz.worker.service.FeatureVectorStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for FeatureCache: lazy single load, explicit invalidation and empty reference sets.
 */
@ExtendWith(MockitoExtension.class)
class FeatureCacheTest {

    private static final List<FeatureVector> REFERENCES = List.of(
            new FeatureVector(1, "00001.wav", new double[] {1, 0}),
            new FeatureVector(2, "00002.wav", new double[] {0, 1}));

    @Mock
    private FeatureVectorStore featureVectorStore;

    private FeatureCache cache;

    @BeforeEach
    void setUp() {
        cache = new FeatureCache(featureVectorStore, false);
    }

    @Test
    @DisplayName("Should load and fit once, then reuse the engine")
    void engine_shouldLoadOnce() {
        when(featureVectorStore.fetchAll(SongKind.OPENSOURCE)).thenReturn(REFERENCES);

        SimilarityEngine first = cache.engine().orElseThrow();
        SimilarityEngine second = cache.engine().orElseThrow();

        assertSame(first, second);
        assertEquals(2, first.size());
        verify(featureVectorStore, times(1)).fetchAll(SongKind.OPENSOURCE);
    }

    @Test
    @DisplayName("Should not cache an empty reference set")
    void engine_shouldRetryWhenEmpty() {
        when(featureVectorStore.fetchAll(SongKind.OPENSOURCE)).thenReturn(List.of(), REFERENCES);

        assertEquals(Optional.empty(), cache.engine());
        assertFalse(cache.status().loaded());
        assertTrue(cache.engine().isPresent());
        verify(featureVectorStore, times(2)).fetchAll(SongKind.OPENSOURCE);
    }

    @Test
    @DisplayName("Should reload after invalidate")
    void invalidate_shouldForceReload() {
        when(featureVectorStore.fetchAll(SongKind.OPENSOURCE)).thenReturn(REFERENCES);
        cache.engine();

        cache.invalidate();

        assertFalse(cache.status().loaded());
        cache.engine();
        verify(featureVectorStore, times(2)).fetchAll(SongKind.OPENSOURCE);
    }

    @Test
    @DisplayName("Should pick up new songs on refit")
    void refit_shouldSeeNewReferences() {
        List<FeatureVector> grown = List.of(REFERENCES.get(0), REFERENCES.get(1),
                new FeatureVector(3, "00003.wav", new double[] {1, 1}));
        when(featureVectorStore.fetchAll(SongKind.OPENSOURCE)).thenReturn(REFERENCES, grown);
        cache.engine();

        SimilarityEngine refitted = cache.refit().orElseThrow();

        assertEquals(3, refitted.size());
        FeatureCache.CacheStatus status = cache.status();
        assertTrue(status.loaded());
        assertEquals(3, status.size());
        assertEquals(2, status.dimensions());
        assertNotNull(status.loadedAt());
        assertEquals(3, cache.references().size());
    }

    @Test
    @DisplayName("Should keep the fitted engine when a refit fails to load")
    void refit_shouldKeepEngineWhenLoadFails() {
        when(featureVectorStore.fetchAll(SongKind.OPENSOURCE))
                .thenReturn(REFERENCES)
                .thenThrow(new IllegalStateException("database unavailable"));
        SimilarityEngine fitted = cache.engine().orElseThrow();

        assertThrows(IllegalStateException.class, () -> cache.refit());

        assertTrue(cache.status().loaded());
        assertEquals(2, cache.status().size());
        assertSame(fitted, cache.engine().orElseThrow());
        assertEquals(REFERENCES, cache.references());
        verify(featureVectorStore, times(2)).fetchAll(SongKind.OPENSOURCE);
    }

    @Test
    @DisplayName("Should keep the fitted engine when the new snapshot cannot be fitted")
    void refit_shouldKeepEngineWhenFitFails() {
        List<FeatureVector> ragged = List.of(
                new FeatureVector(1, "00001.wav", new double[] {1, 0}),
                new FeatureVector(2, "00002.wav", new double[] {0, 1, 1}));
        when(featureVectorStore.fetchAll(SongKind.OPENSOURCE)).thenReturn(REFERENCES, ragged);
        SimilarityEngine fitted = cache.engine().orElseThrow();

        assertThrows(IllegalArgumentException.class, () -> cache.refit());

        assertSame(fitted, cache.engine().orElseThrow());
        assertEquals(2, cache.status().dimensions());
    }
}
