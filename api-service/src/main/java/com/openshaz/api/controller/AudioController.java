package com.openshaz.api.controller;

import com.openshaz.api.service.AudioJobService;
import com.openshaz.common.dto.ApiResponse;
import com.openshaz.common.message.JobResult;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestController
public class AudioController {

    @Autowired
    private AudioJobService audioJobService;

    /**
     * Liveness probe
     */
    @GetMapping("/health")
    public ResponseEntity<ApiResponse<Map<String, String>>> health() {
        return ResponseEntity.ok(ApiResponse.success(Map.of("status", "healthy"), "OK"));
    }

    /**
     * Readiness probe
     */
    @GetMapping("/ready")
    public ResponseEntity<ApiResponse<Map<String, String>>> ready() {
        return ResponseEntity.ok(ApiResponse.success(Map.of("status", "ready"), "OK"));
    }

    /**
     * Add a song to the reference set. With wait=true the call returns once the worker has
     * extracted and stored its features; otherwise the job is only queued.
     */
    @PostMapping("/add-song")
    public ResponseEntity<ApiResponse<Map<String, Object>>> addSong(
            @RequestParam("file") MultipartFile file,
            @RequestParam(name = "wait", defaultValue = "false") boolean wait) {

        String musicName = file.getOriginalFilename();
        String bucketUrl = audioJobService.uploadReferenceSong(file);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("music_name", musicName);
        data.put("bucket_url", bucketUrl);

        if (wait) {
            JobResult result = audioJobService.sendExtractionTask(musicName, bucketUrl);
            data.put("status", "success");
            data.put("result", result.payload());
            return ResponseEntity.ok(ApiResponse.success(data, "Song added successfully"));
        }

        String jobId = audioJobService.sendExtractionTaskAsync(musicName, bucketUrl);
        data.put("status", "queued");
        data.put("result", Map.of("job_id", jobId, "status", "queued"));
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(ApiResponse.accepted(data, "Song queued for extraction"));
    }

    /**
     * Rank the reference set against an uploaded query song.
     */
    @PostMapping("/get-similar")
    public ResponseEntity<ApiResponse<Map<String, Object>>> getSimilar(
            @RequestParam("file") MultipartFile file,
            @RequestParam(name = "top_k", defaultValue = "5") @Min(1) @Max(100) int topK) {

        String musicName = file.getOriginalFilename();
        String bucketUrl = audioJobService.uploadQuerySong(file);
        JobResult result = audioJobService.sendSimilarityTask(musicName, bucketUrl, topK);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("status", "completed");
        data.put("query_song", musicName);
        data.put("bucket_url", bucketUrl);
        data.put("top_k", topK);
        data.put("similar_songs", result.payload().path("similar"));
        data.put("result", result.payload());

        log.info("Similarity search for {} returned {} songs", musicName, result.payload().path("similar").size());
        return ResponseEntity.ok(ApiResponse.success(data, "Similar songs found"));
    }
}
