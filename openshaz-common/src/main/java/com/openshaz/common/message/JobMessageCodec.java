package com.openshaz.common.message;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openshaz.common.exception.JobValidationException;

import java.io.IOException;

/**
 * JSON encoding of job bodies and replies. Decoding failures are reported as
 * {@link JobValidationException} because a body that does not parse will never parse.
 */
public class JobMessageCodec {

    private final ObjectMapper objectMapper;

    public JobMessageCodec() {
        this(new ObjectMapper());
    }

    public JobMessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public byte[] write(Object value) {
        try {
            return objectMapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    public <T> T read(byte[] body, Class<T> type) {
        try {
            return objectMapper.readValue(body, type);
        } catch (IOException e) {
            throw new JobValidationException("Malformed " + type.getSimpleName() + " body: " + e.getMessage(), e);
        }
    }

    public JsonNode readTree(byte[] body) {
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            throw new JobValidationException("Malformed JSON body", e);
        }
    }

    public JsonNode toTree(Object value) {
        return objectMapper.valueToTree(value);
    }
}
