package com.openshaz.worker.dispatch;

import com.openshaz.common.exception.JobValidationException;
import com.openshaz.common.message.JobMessageCodec;
import com.openshaz.common.message.JobStatus;
import com.openshaz.common.message.SimilarityResult;
import com.openshaz.common.messaging.QueueMessage;
import com.openshaz.common.service.ObjectStorageService;
import com.openshaz.worker.entity.SongKind;
import com.openshaz.worker.extraction.FeatureExtractor;
import com.openshaz.worker.service.FeatureVectorStore;
import com.openshaz.worker.similarity.FeatureCache;
import com.openshaz.worker.similarity.FeatureVector;
import com.openshaz.worker.similarity.SimilarityMetric;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for SimilarityTaskHandler: query feature reuse, ranking through the feature cache
 * and empty reference sets.
 */
@ExtendWith(MockitoExtension.class)
class SimilarityTaskHandlerTest {

    private static final String URL = "http://storage:9000/query-songs/00007.wav";
    private static final Path LOCAL = Path.of("/tmp/openshaz/audio-2-00007.wav");
    private static final List<FeatureVector> REFERENCES = List.of(
            new FeatureVector(1, "A", new double[] {1, 0}),
            new FeatureVector(2, "B", new double[] {0, 1}),
            new FeatureVector(3, "C", new double[] {1, 1}));

    @Mock
    private ObjectStorageService storageService;

    @Mock
    private FeatureExtractor featureExtractor;

    @Mock
    private FeatureVectorStore featureVectorStore;

    @Spy
    private JobMessageCodec codec = new JobMessageCodec();

    @InjectMocks
    private SimilarityTaskHandler handler;

    private FeatureCache featureCache;

    @BeforeEach
    void setUp() {
        handler.setMetric("euclidean");
        ReflectionTestUtils.setField(handler, "defaultTopK", 5);
        featureCache = new FeatureCache(featureVectorStore, false);
    }

    private static QueueMessage task(String musicName, Integer topK) {
        String json = "{\"job_id\":\"s1\",\"type\":\"similarity\",\"music_name\":\"" + musicName
                + "\",\"bucket_url\":\"" + URL + "\"" + (topK == null ? "" : ",\"top_k\":" + topK) + "}";
        return QueueMessage.request(json.getBytes(StandardCharsets.UTF_8), "corr", "amq.gen");
    }

    @Test
    @DisplayName("Should reuse stored query features and rank the reference set")
    void handle_shouldReuseStoredQueryFeatures() {
        when(featureVectorStore.findByName(SongKind.QUERY, "00007.wav"))
                .thenReturn(Optional.of(new FeatureVector(7, "00007.wav", new double[] {1, 0})));
        when(featureVectorStore.fetchAll(SongKind.OPENSOURCE)).thenReturn(REFERENCES);

        SimilarityResult result = handler.handle(task("00007.wav", 2), new HandlerContext(featureCache, 0));

        assertEquals(JobStatus.COMPLETED, result.status());
        assertEquals("00007.wav", result.querySong());
        assertEquals(2, result.similar().size());
        assertEquals("A", result.similar().get(0).name());
        assertEquals("C", result.similar().get(1).name());
        verifyNoInteractions(storageService, featureExtractor);
    }

    @Test
    @DisplayName("Should extract, store and clean up a new query song")
    void handle_shouldExtractNewQuerySong() {
        double[] features = {0, 1};
        when(featureVectorStore.findByName(SongKind.QUERY, "00007.wav")).thenReturn(Optional.empty());
        when(storageService.download(URL)).thenReturn(LOCAL);
        when(featureExtractor.extract(LOCAL)).thenReturn(features);
        when(featureVectorStore.fetchAll(SongKind.OPENSOURCE)).thenReturn(REFERENCES);

        SimilarityResult result = handler.handle(task("00007.wav", null), new HandlerContext(featureCache, 0));

        assertEquals(3, result.similar().size());
        assertEquals("B", result.similar().get(0).name());
        verify(featureVectorStore).storeOne(SongKind.QUERY, "00007.wav", URL, features);
        verify(storageService).cleanup(LOCAL);
    }

    @Test
    @DisplayName("Should rank but not store a query song without a numeric id")
    void handle_shouldNotStoreUnnumberedQuerySong() {
        when(featureVectorStore.findByName(SongKind.QUERY, "my-song.wav")).thenReturn(Optional.empty());
        when(storageService.download(URL)).thenReturn(LOCAL);
        when(featureExtractor.extract(LOCAL)).thenReturn(new double[] {1, 1});
        when(featureVectorStore.fetchAll(SongKind.OPENSOURCE)).thenReturn(REFERENCES);

        SimilarityResult result = handler.handle(task("my-song.wav", 1), new HandlerContext(featureCache, 0));

        assertEquals("C", result.similar().get(0).name());
        verify(featureVectorStore, never()).storeOne(any(), anyString(), anyString(), any());
    }

    @Test
    @DisplayName("Should answer with an empty list when there are no reference songs")
    void handle_shouldReturnEmptyWithoutReferences() {
        when(featureVectorStore.findByName(SongKind.QUERY, "00007.wav"))
                .thenReturn(Optional.of(new FeatureVector(7, "00007.wav", new double[] {1, 0})));
        when(featureVectorStore.fetchAll(SongKind.OPENSOURCE)).thenReturn(List.of());

        SimilarityResult result = handler.handle(task("00007.wav", 5), new HandlerContext(featureCache, 0));

        assertEquals(JobStatus.COMPLETED, result.status());
        assertTrue(result.similar().isEmpty());
    }

    @Test
    @DisplayName("Should fit the reference set only once across jobs")
    void handle_shouldReuseFeatureCache() {
        when(featureVectorStore.findByName(eq(SongKind.QUERY), anyString()))
                .thenReturn(Optional.of(new FeatureVector(7, "00007.wav", new double[] {1, 0})));
        when(featureVectorStore.fetchAll(SongKind.OPENSOURCE)).thenReturn(REFERENCES);
        HandlerContext context = new HandlerContext(featureCache, 0);

        handler.handle(task("00007.wav", 1), context);
        handler.handle(task("00007.wav", 1), context);

        verify(featureVectorStore, times(1)).fetchAll(SongKind.OPENSOURCE);
    }

    @Test
    @DisplayName("Should reject top_k below 1")
    void handle_shouldRejectInvalidTopK() {
        assertThrows(JobValidationException.class,
                () -> handler.handle(task("00007.wav", 0), new HandlerContext(featureCache, 0)));
        verifyNoInteractions(featureVectorStore);
    }

    @Test
    @DisplayName("Should reject an unknown metric name when configured")
    void setMetric_shouldRejectUnknownName() {
        assertThrows(IllegalArgumentException.class, () -> handler.setMetric("cosin"));
        assertEquals(SimilarityMetric.EUCLIDEAN, handler.getMetric());
    }

    @Test
    @DisplayName("Should accept metric names in any case")
    void setMetric_shouldParseName() {
        handler.setMetric(" Manhattan ");

        assertEquals(SimilarityMetric.MANHATTAN, handler.getMetric());
    }
}
