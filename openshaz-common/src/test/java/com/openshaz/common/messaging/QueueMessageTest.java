package com.openshaz.common.messaging;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class QueueMessageTest {

    private static final byte[] BODY = "{\"job_id\":\"1\"}".getBytes();

    private static QueueMessage withHeader(Object value) {
        Map<String, Object> headers = new HashMap<>();
        headers.put(QueueMessage.RETRY_COUNT_HEADER, value);
        return new QueueMessage(BODY, "c", "r", headers, true, null);
    }

    @Test
    @DisplayName("Should treat a missing retry header as zero")
    void retryCount_shouldDefaultToZero() {
        assertEquals(0, QueueMessage.of(BODY).retryCount());
    }

    @Test
    @DisplayName("Should read numeric and textual retry headers")
    void retryCount_shouldReadNumbersAndStrings() {
        assertEquals(2, withHeader(2).retryCount());
        assertEquals(3, withHeader(3L).retryCount());
        assertEquals(1, withHeader(" 1 ").retryCount());
        assertEquals(0, withHeader("many").retryCount());
    }

    @Test
    @DisplayName("Should keep body, correlation id and reply queue when bumping the retry count")
    void withRetryCount_shouldPreserveRequestMetadata() {
        QueueMessage original = QueueMessage.request(BODY, "corr-1", "amq.gen-1");

        QueueMessage retried = original.withRetryCount(1);

        assertArrayEquals(BODY, retried.body());
        assertEquals("corr-1", retried.correlationId());
        assertEquals("amq.gen-1", retried.replyTo());
        assertTrue(retried.persistent());
        assertEquals(1, retried.retryCount());
        assertEquals(0, original.retryCount());
    }

    @Test
    @DisplayName("Should drop broker dead-letter history when bumping the retry count")
    void withRetryCount_shouldDropDeathHeader() {
        Map<String, Object> headers = new HashMap<>();
        headers.put(QueueMessage.DEATH_HEADER, List.of(Map.of("queue", "audio_extraction_tasks.retry")));
        headers.put("x-custom", "kept");
        QueueMessage delivered = new QueueMessage(BODY, null, null, headers, true, null);

        QueueMessage retried = delivered.withRetryCount(2);

        assertFalse(retried.headers().containsKey(QueueMessage.DEATH_HEADER));
        assertEquals("kept", retried.headers().get("x-custom"));
    }

    @Test
    @DisplayName("Should expose headers as an unmodifiable copy")
    void headers_shouldBeImmutable() {
        QueueMessage message = withHeader(1);
        assertThrows(UnsupportedOperationException.class, () -> message.headers().put("x", 1));
    }
}
