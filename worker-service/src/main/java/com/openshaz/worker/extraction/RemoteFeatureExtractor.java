package com.openshaz.worker.extraction;

import com.fasterxml.jackson.databind.JsonNode;
import com.openshaz.common.exception.JobValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * {@link FeatureExtractor} backed by the audio feature extraction service.
 *
 * <p>Posts the raw audio to {@code {baseUrl}/extract} and reads {@code {"features": [...]}}.
 * No @Service annotation: created in WorkerConfig from the {@code openshaz.extractor.*} settings.
 */
@Slf4j
public class RemoteFeatureExtractor implements FeatureExtractor {

    public static final String FILE_NAME_HEADER = "X-File-Name";

    private final WebClient webClient;
    private final String baseUrl;
    private final int dimensions;
    private final Duration timeout;

    public RemoteFeatureExtractor(WebClient.Builder webClientBuilder, String baseUrl, int dimensions, Duration timeout) {
        this.webClient = webClientBuilder
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(5 * 1024 * 1024))
                .build();
        this.baseUrl = baseUrl;
        this.dimensions = dimensions;
        this.timeout = timeout;
    }

    @Override
    public int getDimensions() {
        return dimensions;
    }

    @Override
    public double[] extract(Path audioFile) {
        byte[] audio;
        try {
            audio = Files.readAllBytes(audioFile);
        } catch (IOException e) {
            throw new FeatureExtractionException("Cannot read audio file " + audioFile, e);
        }

        log.info("Extracting features from {} ({} bytes)", audioFile.getFileName(), audio.length);
        JsonNode response;
        try {
            response = webClient.post()
                    .uri(baseUrl + "/extract")
                    .contentType(MediaType.APPLICATION_OCTET_STREAM)
                    .header(FILE_NAME_HEADER, audioFile.getFileName().toString())
                    .bodyValue(audio)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block(timeout);
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().value() == 400 || e.getStatusCode().value() == 422) {
                // the extractor could not decode this file; retrying will not help
                throw new JobValidationException("Audio file rejected by extractor: " + e.getResponseBodyAsString(), e);
            }
            throw new FeatureExtractionException("Feature extractor returned " + e.getStatusCode(), e);
        } catch (WebClientException e) {
            throw new FeatureExtractionException("Feature extractor unreachable: " + e.getMessage(), e);
        } catch (IllegalStateException e) {
            // block(timeout) expired
            throw new FeatureExtractionException("Feature extractor did not answer within " + timeout, e);
        }

        return parseFeatures(response);
    }

    double[] parseFeatures(JsonNode response) {
        JsonNode features = response == null ? null : response.get("features");
        if (features == null || !features.isArray() || features.isEmpty()) {
            throw new FeatureExtractionException("No features in extractor response");
        }

        double[] vector = new double[features.size()];
        for (int i = 0; i < vector.length; i++) {
            JsonNode value = features.get(i);
            if (!value.isNumber()) {
                throw new FeatureExtractionException("Non-numeric feature at index " + i + ": " + value);
            }
            vector[i] = value.asDouble();
            if (!Double.isFinite(vector[i])) {
                throw new JobValidationException("Non-finite feature at index " + i + ": " + value);
            }
        }

        if (dimensions > 0 && vector.length != dimensions) {
            throw new JobValidationException("Extractor produced " + vector.length
                    + " features, expected " + dimensions);
        }
        log.info("Extracted {} features", vector.length);
        return vector;
    }
}
