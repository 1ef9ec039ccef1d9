package com.openshaz.worker.config;

import com.openshaz.common.service.ObjectStorageService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator HealthIndicator for object storage connectivity.
 * Included in GET /actuator/health.
 */
@Slf4j
@Component
public class ObjectStorageHealthIndicator implements HealthIndicator {

    @Autowired
    private ObjectStorageService storageService;

    @Override
    public Health health() {
        try {
            if (storageService.checkConnection()) {
                return Health.up().build();
            }
            return Health.down()
                    .withDetail("error", "Unable to reach object storage")
                    .build();
        } catch (Exception e) {
            log.error("Object storage health check failed: {}", e.getMessage());
            return Health.down()
                    .withDetail("error", e.getMessage())
                    .build();
        }
    }
}
