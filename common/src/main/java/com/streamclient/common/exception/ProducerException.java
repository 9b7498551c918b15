package com.streamclient.common.exception;

/**
 * Exception for producer errors (publish, flush, producer lookup)
 */
public class ProducerException extends MessagingException {

    public ProducerException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public ProducerException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    public ProducerException withProducer(String producer) {
        withContext("producer", producer);
        return this;
    }

    public static ProducerException publishFailed(String topic, Throwable cause) {
        ProducerException ex = new ProducerException(
                ErrorCode.PRODUCER_PUBLISH_FAILED,
                "Failed to publish message to topic " + topic,
                cause);
        ex.withContext("topic", topic);
        return ex;
    }

    public static ProducerException flushFailed(String producer, long timeoutMs) {
        ProducerException ex = new ProducerException(
                ErrorCode.PRODUCER_FLUSH_FAILED,
                String.format("Producer %s could not flush pending messages within %d ms", producer, timeoutMs))
                .withProducer(producer);
        ex.withContext("timeoutMs", timeoutMs);
        return ex;
    }

    public static ProducerException notFound(Object data) {
        return new ProducerException(
                ErrorCode.PRODUCER_NOT_FOUND,
                "No producer supports data of type " + (data == null ? "null" : data.getClass().getName()));
    }
}
