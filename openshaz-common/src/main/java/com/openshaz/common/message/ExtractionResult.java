package com.openshaz.common.message;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ExtractionResult(
        String jobId,
        String musicName,
        String bucketUrl,
        JobStatus status,
        List<Double> features
) {
}
