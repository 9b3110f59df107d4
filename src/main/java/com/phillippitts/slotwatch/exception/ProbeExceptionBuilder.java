package com.phillippitts.slotwatch.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link ProbeException} with contextual details about the failed page operation.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * throw ProbeExceptionBuilder.create("Refresh recovery failed")
 *         .operation("refresh")
 *         .url(loginUrl)
 *         .cause(e)
 *         .build();
 *
 * throw ProbeExceptionBuilder.create("Page fetch failed")
 *         .operation("open")
 *         .statusCode(503)
 *         .durationMs(812)
 *         .metadata("userAgent", userAgent)
 *         .build();
 * </pre>
 *
 * <p>The final message format is:
 * <pre>
 * {message} (url={url}, statusCode={code}, durationMs={ms}, {key1}={val1}, ...)
 * </pre>
 */
public final class ProbeExceptionBuilder {

    private final String message;
    private String operation;
    private Throwable cause;
    private String url;
    private Integer statusCode;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private ProbeExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null)
     * @return new builder instance
     */
    public static ProbeExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new ProbeExceptionBuilder(message);
    }

    /**
     * Sets the probe operation that failed (e.g., "open", "refresh", "login").
     */
    public ProbeExceptionBuilder operation(String operation) {
        this.operation = operation;
        return this;
    }

    public ProbeExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public ProbeExceptionBuilder url(String url) {
        this.url = url;
        return this;
    }

    /**
     * Sets the HTTP status code returned by the target, when there was one.
     */
    public ProbeExceptionBuilder statusCode(int statusCode) {
        this.statusCode = statusCode;
        return this;
    }

    public ProbeExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     */
    public ProbeExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    public ProbeException build() {
        String detailedMessage = buildDetailedMessage();
        String op = operation != null ? operation : "unknown";

        if (cause != null) {
            return new ProbeException(detailedMessage, op, cause);
        } else {
            return new ProbeException(detailedMessage, op);
        }
    }

    private String buildDetailedMessage() {
        Map<String, String> details = new LinkedHashMap<>();
        if (url != null) {
            details.put("url", url);
        }
        if (statusCode != null) {
            details.put("statusCode", String.valueOf(statusCode));
        }
        if (durationMs != null) {
            details.put("durationMs", String.valueOf(durationMs));
        }
        details.putAll(metadata);

        if (details.isEmpty()) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        for (Map.Entry<String, String> entry : details.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
