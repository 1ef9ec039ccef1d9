package com.openshaz.api.service;

import com.openshaz.common.config.RabbitMQConfig;
import com.openshaz.common.exception.JobFailedException;
import com.openshaz.common.exception.StorageException;
import com.openshaz.common.message.ExtractionTask;
import com.openshaz.common.message.JobResult;
import com.openshaz.common.message.SimilarityTask;
import com.openshaz.common.messaging.FireAndForgetSubmitter;
import com.openshaz.common.messaging.RpcClient;
import com.openshaz.common.service.ObjectStorageService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.time.Duration;

/**
 * Uploads audio to object storage and submits the matching worker job.
 * The HTTP layer never touches the broker directly.
 */
@Slf4j
@Service
public class AudioJobService {

    @Autowired
    private ObjectStorageService storageService;

    @Autowired
    private RpcClient rpcClient;

    @Autowired
    private FireAndForgetSubmitter submitter;

    @Value("${openshaz.buckets.opensource:opensource-songs}")
    private String opensourceBucket;

    @Value("${openshaz.buckets.query:query-songs}")
    private String queryBucket;

    @Value("${openshaz.rpc.extraction-timeout:45s}")
    private Duration extractionTimeout;

    @Value("${openshaz.rpc.similarity-timeout:60s}")
    private Duration similarityTimeout;

    public String uploadReferenceSong(MultipartFile file) {
        return upload(file, opensourceBucket);
    }

    public String uploadQuerySong(MultipartFile file) {
        return upload(file, queryBucket);
    }

    /**
     * Extraction over RPC; blocks until the worker has stored the features.
     */
    public JobResult sendExtractionTask(String musicName, String bucketUrl) {
        ExtractionTask task = ExtractionTask.create(musicName, bucketUrl);
        log.info("Sending extraction task {} for {} (waiting up to {})", task.jobId(), musicName, extractionTimeout);
        return requireSuccess(rpcClient.call(RabbitMQConfig.AUDIO_EXTRACTION_QUEUE, task, extractionTimeout));
    }

    /**
     * Fire-and-forget extraction, used for bulk loading.
     *
     * @return the job id
     */
    public String sendExtractionTaskAsync(String musicName, String bucketUrl) {
        ExtractionTask task = ExtractionTask.create(musicName, bucketUrl);
        String jobId = submitter.submitAsync(RabbitMQConfig.AUDIO_EXTRACTION_QUEUE, task);
        log.info("Queued extraction task {} for {}", jobId, musicName);
        return jobId;
    }

    public JobResult sendSimilarityTask(String musicName, String bucketUrl, int topK) {
        SimilarityTask task = SimilarityTask.create(musicName, bucketUrl, topK);
        log.info("Sending similarity task {} for {} (top_k={})", task.jobId(), musicName, topK);
        return requireSuccess(rpcClient.call(RabbitMQConfig.AUDIO_SIMILARITY_QUEUE, task, similarityTimeout));
    }

    private String upload(MultipartFile file, String bucket) {
        validateFile(file);
        try {
            return storageService.upload(file.getBytes(), file.getOriginalFilename(), bucket);
        } catch (IOException e) {
            throw new StorageException("Failed to read uploaded file " + file.getOriginalFilename(), e);
        }
    }

    private void validateFile(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("File is empty");
        }
        String name = file.getOriginalFilename();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("File name is required");
        }
        if (name.contains("/") || name.contains("\\")) {
            throw new IllegalArgumentException("File name must not contain path separators: " + name);
        }
    }

    private JobResult requireSuccess(JobResult result) {
        if (result.isError()) {
            throw new JobFailedException(result.jobId(), result.errorMessage());
        }
        return result;
    }
}
