package com.openshaz.common.message;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum JobStatus {

    EXTRACTED("extracted"), // extraction job finished, features stored
    COMPLETED("completed"), // similarity job finished, ranking attached
    ERROR("error"); // job discarded by the worker

    private final String wireName;

    JobStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static JobStatus fromWire(String raw) {
        for (JobStatus status : values()) {
            if (status.wireName.equalsIgnoreCase(raw)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown job status: " + raw);
    }
}
