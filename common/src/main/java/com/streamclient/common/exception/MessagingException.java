package com.streamclient.common.exception;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Base exception of the messaging client.
 * The error code decides category and retriability; the context map carries the record or option involved.
 */
public class MessagingException extends Exception {

    private final ErrorCode errorCode;
    private final Map<String, Object> context = new LinkedHashMap<>();

    public MessagingException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public MessagingException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public MessagingException withContext(String key, Object value) {
        context.put(key, value);
        return this;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public Map<String, Object> getContext() {
        return new LinkedHashMap<>(context);
    }

    public boolean isRetriable() {
        return errorCode.isRetriable();
    }

    /**
     * Single line form used by {@link ExceptionLogger}:
     * {@code [CODE] category=.., code=.., retriable=.., message=.., context={k=v, ..}}
     */
    public String getStructuredMessage() {
        String summary = String.format("[%s] category=%s, code=%d, retriable=%s, message=%s",
                errorCode.name(), errorCode.getCategory(), errorCode.getCode(), isRetriable(), getMessage());
        if (context.isEmpty()) {
            return summary;
        }
        StringJoiner entries = new StringJoiner(", ", ", context={", "}");
        context.forEach((key, value) -> entries.add(key + "=" + value));
        return summary + entries;
    }

    @Override
    public String toString() {
        return getStructuredMessage();
    }
}
