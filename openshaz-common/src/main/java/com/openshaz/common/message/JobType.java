package com.openshaz.common.message;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of work a job asks for. Serialized as the lower-case "type" field of the task body.
 */
public enum JobType {

    EXTRACTION("extraction"),
    SIMILARITY("similarity");

    private final String wireName;

    JobType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static JobType fromWire(String raw) {
        for (JobType type : values()) {
            if (type.wireName.equalsIgnoreCase(raw)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown job type: " + raw);
    }
}
