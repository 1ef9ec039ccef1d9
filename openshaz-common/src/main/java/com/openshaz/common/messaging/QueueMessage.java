package com.openshaz.common.messaging;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wire unit exchanged with the broker: JSON body plus the AMQP properties this system uses.
 * The routing key is carried by the {@link Delivery} envelope on the consuming side and
 * passed explicitly on the publishing side.
 *
 * @param body          JSON bytes
 * @param correlationId set on RPC requests and echoed on their replies
 * @param replyTo       private reply queue of an RPC caller, null for fire-and-forget jobs
 * @param headers       application headers, notably {@value #RETRY_COUNT_HEADER}
 * @param persistent    delivery mode 2, survives a broker restart
 * @param expirationMs  per-message TTL, only set on delay-queue publishes
 */
public record QueueMessage(
        byte[] body,
        String correlationId,
        String replyTo,
        Map<String, Object> headers,
        boolean persistent,
        Long expirationMs
) {

    public static final String RETRY_COUNT_HEADER = "x-retry-count";

    // Set by the broker when a message passes through a delay queue
    static final String DEATH_HEADER = "x-death";

    public QueueMessage {
        headers = headers == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    /**
     * Persistent message without a reply channel.
     */
    public static QueueMessage of(byte[] body) {
        return new QueueMessage(body, null, null, null, true, null);
    }

    /**
     * Persistent RPC request that expects its reply on {@code replyTo}.
     */
    public static QueueMessage request(byte[] body, String correlationId, String replyTo) {
        return new QueueMessage(body, correlationId, replyTo, null, true, null);
    }

    public static QueueMessage reply(byte[] body, String correlationId) {
        return new QueueMessage(body, correlationId, null, null, true, null);
    }

    public boolean hasReplyTo() {
        return replyTo != null && !replyTo.isBlank();
    }

    /**
     * Retry counter from the headers; absent or unreadable means first delivery.
     */
    public int retryCount() {
        Object raw = headers.get(RETRY_COUNT_HEADER);
        if (raw instanceof Number number) {
            return number.intValue();
        }
        if (raw != null) {
            try {
                return Integer.parseInt(raw.toString().trim());
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return 0;
    }

    /**
     * Same body, correlation id and reply queue, with the retry counter replaced.
     * Broker dead-letter bookkeeping is dropped so it does not pile up across retries.
     */
    public QueueMessage withRetryCount(int retryCount) {
        Map<String, Object> updated = new LinkedHashMap<>(headers);
        updated.remove(DEATH_HEADER);
        updated.put(RETRY_COUNT_HEADER, retryCount);
        return new QueueMessage(body, correlationId, replyTo, updated, true, expirationMs);
    }

    public QueueMessage withExpiration(long expirationMs) {
        return new QueueMessage(body, correlationId, replyTo, headers, persistent, expirationMs);
    }
}
