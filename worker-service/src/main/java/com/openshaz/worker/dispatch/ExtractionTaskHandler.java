package com.openshaz.worker.dispatch;

import com.openshaz.common.config.RabbitMQConfig;
import com.openshaz.common.message.ExtractionResult;
import com.openshaz.common.message.ExtractionTask;
import com.openshaz.common.message.JobMessageCodec;
import com.openshaz.common.message.JobStatus;
import com.openshaz.common.messaging.QueueMessage;
import com.openshaz.common.service.ObjectStorageService;
import com.openshaz.worker.entity.SongKind;
import com.openshaz.worker.extraction.FeatureExtractor;
import com.openshaz.worker.service.FeatureVectorStore;
import com.openshaz.worker.similarity.FeatureVector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Adds a song to the reference set: download, extract, store.
 */
@Slf4j
@Service
public class ExtractionTaskHandler implements TaskHandler {

    @Autowired
    private ObjectStorageService storageService;

    @Autowired
    private FeatureExtractor featureExtractor;

    @Autowired
    private FeatureVectorStore featureVectorStore;

    @Autowired
    private JobMessageCodec codec;

    @Override
    public String queueName() {
        return RabbitMQConfig.AUDIO_EXTRACTION_QUEUE;
    }

    @Override
    public ExtractionResult handle(QueueMessage message, HandlerContext context) {
        ExtractionTask task = codec.read(message.body(), ExtractionTask.class);
        String musicName = TaskHandler.requireText(task.musicName(), "music_name");
        String bucketUrl = TaskHandler.requireText(task.bucketUrl(), "bucket_url");

        log.info("Received extraction task {} for {} (retry {})", task.jobId(), musicName, context.retryCount());

        Path audioFile = storageService.download(bucketUrl);
        try {
            double[] features = featureExtractor.extract(audioFile);
            FeatureVector stored = featureVectorStore.storeOne(SongKind.OPENSOURCE, musicName, bucketUrl, features);
            log.info("Extraction complete for {} (id={}, {} features)", musicName, stored.id(), features.length);

            return new ExtractionResult(task.jobId(), musicName, bucketUrl, JobStatus.EXTRACTED,
                    Arrays.stream(features).boxed().collect(Collectors.toList()));
        } finally {
            storageService.cleanup(audioFile);
        }
    }
}
