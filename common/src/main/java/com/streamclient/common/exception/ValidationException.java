package com.streamclient.common.exception;

/**
 * Permanent rejection of a message. The message is never retried.
 */
public class ValidationException extends MessagingException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_INVALID_MESSAGE, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorCode.VALIDATION_INVALID_MESSAGE, message, cause);
    }

    public ValidationException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    public static ValidationException decodingFailed(String decoder, String topic, long offset, Throwable cause) {
        ValidationException ex = new ValidationException(
                ErrorCode.VALIDATION_DECODING_FAILED,
                String.format("Decoder '%s' could not decode message %s@%d", decoder, topic, offset),
                cause);
        ex.withContext("decoder", decoder);
        ex.withContext("topic", topic);
        ex.withContext("offset", offset);
        return ex;
    }

    public static ValidationException brokerError(String topic, String errorMessage) {
        ValidationException ex = new ValidationException(
                ErrorCode.VALIDATION_BROKER_ERROR_RECORD,
                "Broker returned an error record: " + errorMessage,
                null);
        ex.withContext("topic", topic);
        return ex;
    }
}
