package com.streamclient.common.exception;

/**
 * Exception for consumer adapter errors (subscribe, poll, commit)
 */
public class ConsumerException extends MessagingException {

    public ConsumerException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public ConsumerException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    public ConsumerException withTopic(String topic) {
        withContext("topic", topic);
        return this;
    }

    public static ConsumerException subscriptionFailed(String topics, Throwable cause) {
        return new ConsumerException(
                ErrorCode.CONSUMER_SUBSCRIPTION_FAILED,
                "Subscription failed for topics: " + topics,
                cause)
                .withTopic(topics);
    }

    public static ConsumerException pollFailed(Throwable cause) {
        return new ConsumerException(ErrorCode.CONSUMER_POLL_FAILED, "Poll failed: " + cause.getMessage(), cause);
    }

    public static ConsumerException offsetCommitFailed(String topic, int partition, long offset, Throwable cause) {
        ConsumerException ex = new ConsumerException(
                ErrorCode.CONSUMER_OFFSET_COMMIT_FAILED,
                String.format("Offset commit failed: topic=%s partition=%d offset=%d", topic, partition, offset),
                cause)
                .withTopic(topic);
        ex.withContext("partition", partition);
        ex.withContext("offset", offset);
        return ex;
    }
}
