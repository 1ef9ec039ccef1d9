package com.openshaz.worker.controller;

import com.openshaz.common.dto.ApiResponse;
import com.openshaz.worker.dispatch.WorkerDispatcher;
import com.openshaz.worker.similarity.FeatureCache;
import com.openshaz.worker.similarity.FeatureVector;
import com.openshaz.worker.similarity.SimilarityEvaluator;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Operational endpoints of the worker: health, feature cache control and an offline
 * evaluation of the similarity metrics over the reference set.
 */
@Slf4j
@RestController
public class WorkerAdminController {

    @Autowired
    private WorkerDispatcher workerDispatcher;

    @Autowired
    private SimilarityEvaluator similarityEvaluator;

    @GetMapping("/health")
    public ResponseEntity<ApiResponse<Map<String, Object>>> health() {
        Map<String, Object> status = Map.of(
                "status", workerDispatcher.isRunning() ? "healthy" : "stopped",
                "queues", workerDispatcher.getQueueNames());
        return ResponseEntity.ok(ApiResponse.success(status, "Worker status"));
    }

    @GetMapping("/feature-cache")
    public ResponseEntity<ApiResponse<FeatureCache.CacheStatus>> cacheStatus() {
        return ResponseEntity.ok(ApiResponse.success(cache().status(), "Feature cache status"));
    }

    @PostMapping("/feature-cache/refresh")
    public ResponseEntity<ApiResponse<FeatureCache.CacheStatus>> refreshCache() {
        log.info("Feature cache refresh requested");
        cache().refit();
        return ResponseEntity.ok(ApiResponse.success(cache().status(), "Feature cache refitted"));
    }

    @DeleteMapping("/feature-cache")
    public ResponseEntity<ApiResponse<FeatureCache.CacheStatus>> invalidateCache() {
        cache().invalidate();
        return ResponseEntity.ok(ApiResponse.success(cache().status(), "Feature cache invalidated"));
    }

    @GetMapping("/similarity/evaluation")
    public ResponseEntity<ApiResponse<List<SimilarityEvaluator.EvaluationReport>>> evaluate(
            @RequestParam(name = "top_k", defaultValue = "5") @Min(1) int topK,
            @RequestParam(name = "test_size", defaultValue = "0.2")
            @DecimalMin(value = "0.0", inclusive = false) @DecimalMax(value = "1.0", inclusive = false) double testSize) {

        List<FeatureVector> references = cache().references();
        List<SimilarityEvaluator.EvaluationReport> reports = similarityEvaluator.compareMetrics(
                references, testSize, topK, SimilarityEvaluator.DEFAULT_SEED);
        return ResponseEntity.ok(ApiResponse.success(reports,
                "Evaluated " + reports.size() + " metrics on " + references.size() + " songs"));
    }

    private FeatureCache cache() {
        return workerDispatcher.getFeatureCache();
    }
}
