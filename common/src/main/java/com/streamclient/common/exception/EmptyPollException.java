package com.streamclient.common.exception;

/**
 * Signals that a poll cycle produced nothing to process.
 * Reported to the consumer's exception hook, never retried and never counted as consumed.
 */
public class EmptyPollException extends MessagingException {

    public EmptyPollException(String message) {
        super(ErrorCode.CONSUMER_EMPTY_POLL, message);
    }

    public static EmptyPollException noRecord() {
        return new EmptyPollException("Currently, there are no more messages.");
    }

    public static EmptyPollException partitionEof(String topic, int partition) {
        EmptyPollException ex = new EmptyPollException(
                String.format("Reached end of partition %s-%d, no more messages.", topic, partition));
        ex.withContext("topic", topic);
        ex.withContext("partition", partition);
        return ex;
    }

    public static EmptyPollException timedOut() {
        return new EmptyPollException(
                "Broker poll timed out or there are no messages. Unable to differentiate the reason.");
    }

    public static EmptyPollException emptyPayload(String topic, int partition, long offset) {
        EmptyPollException ex = new EmptyPollException("Empty payload received in message.");
        ex.withContext("topic", topic);
        ex.withContext("partition", partition);
        ex.withContext("offset", offset);
        return ex;
    }
}
