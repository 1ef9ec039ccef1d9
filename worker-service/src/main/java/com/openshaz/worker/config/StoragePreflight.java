package com.openshaz.worker.config;

import com.openshaz.common.exception.StorageException;
import com.openshaz.common.service.ObjectStorageService;
import com.openshaz.common.util.StartupRetry;
import lombok.extern.slf4j.Slf4j;

/**
 * Blocks worker start-up until object storage answers, failing after the configured attempts.
 */
@Slf4j
public class StoragePreflight implements Runnable {

    private final ObjectStorageService storageService;
    private final StartupRetry startupRetry;

    public StoragePreflight(ObjectStorageService storageService, StartupRetry startupRetry) {
        this.storageService = storageService;
        this.startupRetry = startupRetry;
    }

    @Override
    public void run() {
        try {
            startupRetry.call("object storage", () -> {
                if (!storageService.checkConnection()) {
                    throw new StorageException("Object storage health check failed");
                }
                return Boolean.TRUE;
            });
        } catch (StorageException e) {
            throw e;
        } catch (Exception e) {
            throw new StorageException("Object storage unavailable: " + e.getMessage(), e);
        }
    }
}
