package com.openshaz.common.message;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.UUID;

/**
 * Body of a message on the extraction queue: download {@code bucketUrl},
 * extract its features and store them under {@code musicName}.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ExtractionTask(
        String jobId,
        JobType type,
        String musicName,
        String bucketUrl
) {
    public static ExtractionTask create(String musicName, String bucketUrl) {
        return new ExtractionTask(UUID.randomUUID().toString(), JobType.EXTRACTION, musicName, bucketUrl);
    }
}
