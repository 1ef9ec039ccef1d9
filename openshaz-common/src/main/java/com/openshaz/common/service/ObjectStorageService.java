package com.openshaz.common.service;

import com.openshaz.common.exception.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Client for the S3-style object store holding the audio files.
 * Objects are addressed path-style as {@code <storage.url>/<bucket>/<name>}; that URL is what
 * travels in job bodies as {@code bucket_url}.
 */
@Slf4j
@Service
public class ObjectStorageService {

    private final WebClient webClient;

    @Value("${storage.url}")
    private String storageUrl;

    @Value("${storage.service-key:}")
    private String serviceKey;

    @Value("${storage.download-dir:${java.io.tmpdir}/openshaz}")
    private String downloadDir;

    public ObjectStorageService() {
        this.webClient = WebClient.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(50 * 1024 * 1024)) // 50MB
                .build();
    }

    /**
     * Upload audio bytes under {@code fileName} in {@code bucket}.
     * An object that already exists is not uploaded again; its URL is returned as is.
     */
    public String upload(byte[] content, String fileName, String bucket) {
        String objectUrl = objectUrl(bucket, fileName);
        try {
            ensureBucket(bucket);

            if (exists(objectUrl)) {
                log.info("File already exists in storage: {}", objectUrl);
                return objectUrl;
            }

            log.info("Uploading {} to bucket {}", fileName, bucket);
            webClient.put()
                    .uri(objectUrl)
                    .headers(this::authorize)
                    .contentType(MediaType.APPLICATION_OCTET_STREAM)
                    .bodyValue(content)
                    .retrieve()
                    .toBodilessEntity()
                    .block();

            log.info("File uploaded successfully: {}", objectUrl);
            return objectUrl;
        } catch (WebClientException e) {
            throw new StorageException("Failed to upload " + fileName + " to " + bucket + ": " + e.getMessage(), e);
        }
    }

    /**
     * Download an object to a local file for processing. The caller removes it with {@link #cleanup(Path)}.
     */
    public Path download(String objectUrl) {
        try {
            byte[] content = webClient.get()
                    .uri(objectUrl)
                    .headers(this::authorize)
                    .retrieve()
                    .bodyToMono(byte[].class)
                    .block();
            if (content == null) {
                throw new StorageException("Empty object at " + objectUrl);
            }

            Path dir = Files.createDirectories(Paths.get(downloadDir));
            Path target = Files.createTempFile(dir, "audio-", "-" + fileNameOf(objectUrl));
            Files.write(target, content);
            log.info("Downloaded {} ({} bytes) to {}", objectUrl, content.length, target);
            return target;
        } catch (WebClientException e) {
            throw new StorageException("Failed to download " + objectUrl + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new StorageException("Failed to write downloaded file for " + objectUrl, e);
        }
    }

    /**
     * Remove a file created by {@link #download(String)}.
     */
    public boolean cleanup(Path localFile) {
        if (localFile == null) {
            return false;
        }
        try {
            return Files.deleteIfExists(localFile);
        } catch (IOException e) {
            log.error("Failed to delete downloaded file: {}", localFile, e);
            return false;
        }
    }

    /**
     * Health probe against the storage endpoint.
     */
    public boolean checkConnection() {
        try {
            webClient.get()
                    .uri(storageUrl + "/minio/health/live")
                    .retrieve()
                    .toBodilessEntity()
                    .block();
            return true;
        } catch (WebClientException e) {
            log.warn("Object storage health check failed: {}", e.getMessage());
            return false;
        }
    }

    public String objectUrl(String bucket, String fileName) {
        return storageUrl + "/" + bucket + "/" + fileName;
    }

    private void ensureBucket(String bucket) {
        if (exists(storageUrl + "/" + bucket)) {
            return;
        }
        log.info("Bucket {} doesn't exist, creating it", bucket);
        webClient.put()
                .uri(storageUrl + "/" + bucket)
                .headers(this::authorize)
                .retrieve()
                .toBodilessEntity()
                .block();
    }

    private boolean exists(String url) {
        try {
            webClient.head()
                    .uri(url)
                    .headers(this::authorize)
                    .retrieve()
                    .toBodilessEntity()
                    .block();
            return true;
        } catch (WebClientResponseException.NotFound e) {
            return false;
        }
    }

    private void authorize(HttpHeaders headers) {
        if (serviceKey != null && !serviceKey.isBlank()) {
            headers.setBearerAuth(serviceKey);
        }
    }

    static String fileNameOf(String objectUrl) {
        String path = objectUrl;
        int query = path.indexOf('?');
        if (query >= 0) {
            path = path.substring(0, query);
        }
        String name = path.substring(path.lastIndexOf('/') + 1);
        return name.isBlank() ? "object" : name;
    }
}
