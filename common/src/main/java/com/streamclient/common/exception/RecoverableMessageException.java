package com.streamclient.common.exception;

/**
 * Transient processing failure. The consumer retries the message with capped exponential backoff.
 */
public class RecoverableMessageException extends MessagingException {

    public RecoverableMessageException(String message) {
        super(ErrorCode.CONSUMER_MESSAGE_RECOVERABLE, message);
    }

    public RecoverableMessageException(String message, Throwable cause) {
        super(ErrorCode.CONSUMER_MESSAGE_RECOVERABLE, message, cause);
    }
}
