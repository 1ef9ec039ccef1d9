package com.openshaz.worker.dispatch;

import com.openshaz.common.config.RabbitMQConfig;
import com.openshaz.common.exception.JobValidationException;
import com.openshaz.common.message.JobMessageCodec;
import com.openshaz.common.message.JobStatus;
import com.openshaz.common.message.SimilarSong;
import com.openshaz.common.message.SimilarityResult;
import com.openshaz.common.message.SimilarityTask;
import com.openshaz.common.messaging.QueueMessage;
import com.openshaz.common.service.ObjectStorageService;
import com.openshaz.worker.entity.SongKind;
import com.openshaz.worker.extraction.FeatureExtractor;
import com.openshaz.worker.service.FeatureVectorStore;
import com.openshaz.worker.similarity.FeatureVector;
import com.openshaz.worker.similarity.SimilarityEngine;
import com.openshaz.worker.similarity.SimilarityMetric;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Ranks the reference set against a query song.
 *
 * <p>Query features are reused from {@code query_songs} when the same file name was searched
 * before; otherwise the file is downloaded, extracted and stored. Names without a numeric id
 * prefix are ranked but not stored.
 */
@Slf4j
@Service
public class SimilarityTaskHandler implements TaskHandler {

    @Autowired
    private ObjectStorageService storageService;

    @Autowired
    private FeatureExtractor featureExtractor;

    @Autowired
    private FeatureVectorStore featureVectorStore;

    @Autowired
    private JobMessageCodec codec;

    private SimilarityMetric metric = SimilarityMetric.COSINE;

    @Value("${openshaz.similarity.default-top-k:5}")
    private int defaultTopK;

    /**
     * Parsed at bean creation so that an unknown metric name fails start-up.
     */
    @Value("${openshaz.similarity.metric:cosine}")
    public void setMetric(String metricName) {
        this.metric = SimilarityMetric.fromName(metricName);
        log.info("Similarity metric: {}", metric);
    }

    public SimilarityMetric getMetric() {
        return metric;
    }

    @Override
    public String queueName() {
        return RabbitMQConfig.AUDIO_SIMILARITY_QUEUE;
    }

    @Override
    public SimilarityResult handle(QueueMessage message, HandlerContext context) {
        SimilarityTask task = codec.read(message.body(), SimilarityTask.class);
        String musicName = TaskHandler.requireText(task.musicName(), "music_name");
        String bucketUrl = TaskHandler.requireText(task.bucketUrl(), "bucket_url");
        int topK = task.topK() == null ? defaultTopK : task.topK();
        if (topK < 1) {
            throw new JobValidationException("top_k must be at least 1, got: " + topK);
        }

        log.info("Received similarity task {} for {} (top_k={}, retry {})",
                task.jobId(), musicName, topK, context.retryCount());

        double[] query = queryFeatures(musicName, bucketUrl);

        Optional<SimilarityEngine> engine = context.featureCache().engine();
        List<SimilarSong> similar;
        if (engine.isPresent()) {
            similar = engine.get().findSimilar(query, topK, metric);
        } else {
            log.warn("No reference songs available, returning empty result for {}", musicName);
            similar = List.of();
        }

        log.info("Found {} similar songs for {}", similar.size(), musicName);
        return new SimilarityResult(task.jobId(), musicName, bucketUrl, JobStatus.COMPLETED, similar);
    }

    private double[] queryFeatures(String musicName, String bucketUrl) {
        Optional<FeatureVector> known = featureVectorStore.findByName(SongKind.QUERY, musicName);
        if (known.isPresent()) {
            log.info("Reusing stored features for query song {}", musicName);
            return known.get().vector();
        }

        Path audioFile = storageService.download(bucketUrl);
        try {
            double[] features = featureExtractor.extract(audioFile);
            if (FeatureVectorStore.idFromName(musicName).isPresent()) {
                featureVectorStore.storeOne(SongKind.QUERY, musicName, bucketUrl, features);
            } else {
                log.warn("Query song {} has no numeric id prefix, features not stored", musicName);
            }
            return features;
        } finally {
            storageService.cleanup(audioFile);
        }
    }
}
