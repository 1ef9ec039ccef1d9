package com.openshaz.common.message;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.UUID;

/**
 * Body of a message on the similarity queue. {@code topK} may be absent,
 * in which case the worker falls back to its default.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SimilarityTask(
        String jobId,
        JobType type,
        String musicName,
        String bucketUrl,
        Integer topK
) {
    public static SimilarityTask create(String musicName, String bucketUrl, int topK) {
        return new SimilarityTask(UUID.randomUUID().toString(), JobType.SIMILARITY, musicName, bucketUrl, topK);
    }
}
