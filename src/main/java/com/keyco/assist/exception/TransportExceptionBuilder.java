package com.keyco.assist.exception;

import com.keyco.assist.domain.FailureKind;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for constructing {@link TransportException} with contextual information.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * throw TransportExceptionBuilder.create(FailureKind.RATE_LIMITED, "Backend throttled request")
 *         .endpoint("compose")
 *         .statusCode(429)
 *         .retryAfter(Duration.ofSeconds(2))
 *         .build();
 *
 * throw TransportExceptionBuilder.create(FailureKind.NETWORK, "Connection refused")
 *         .endpoint("conversational")
 *         .cause(ioException)
 *         .durationMs(120)
 *         .metadata("path", "/api/chat")
 *         .build();
 * </pre>
 */
public final class TransportExceptionBuilder {

    private final FailureKind kind;
    private final String message;
    private String endpoint;
    private Throwable cause;
    private int statusCode;
    private Duration retryAfter;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private TransportExceptionBuilder(FailureKind kind, String message) {
        this.kind = kind;
        this.message = message;
    }

    /**
     * Creates a new builder with the failure classification and base message.
     *
     * @param kind failure classification (must not be null)
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static TransportExceptionBuilder create(FailureKind kind, String message) {
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new TransportExceptionBuilder(kind, message);
    }

    public TransportExceptionBuilder endpoint(String endpoint) {
        this.endpoint = endpoint;
        return this;
    }

    public TransportExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public TransportExceptionBuilder statusCode(int statusCode) {
        this.statusCode = statusCode;
        return this;
    }

    public TransportExceptionBuilder retryAfter(Duration retryAfter) {
        this.retryAfter = retryAfter;
        return this;
    }

    public TransportExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Never pass user text here.
     *
     * @param key metadata key
     * @param value metadata value
     * @return this builder for chaining
     */
    public TransportExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. Message format:
     * <pre>
     * {message} (status={code}, durationMs={ms}, {key1}={val1}, ...)
     * </pre>
     *
     * @return constructed TransportException
     */
    public TransportException build() {
        return new TransportException(kind, buildDetailedMessage(), endpoint, statusCode, retryAfter, cause);
    }

    private String buildDetailedMessage() {
        boolean hasDetails = statusCode > 0 || durationMs != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;

        if (statusCode > 0) {
            sb.append("status=").append(statusCode);
            first = false;
        }

        if (durationMs != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("durationMs=").append(durationMs);
            first = false;
        }

        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }

        sb.append(")");
        return sb.toString();
    }
}
