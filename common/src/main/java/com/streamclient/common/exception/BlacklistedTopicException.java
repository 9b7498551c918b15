package com.streamclient.common.exception;

/**
 * Raised when a producer is configured to publish to a blacklisted topic.
 */
public class BlacklistedTopicException extends MessagingException {

    private final String topic;

    public BlacklistedTopicException(String topic) {
        super(ErrorCode.PRODUCER_TOPIC_BLACKLISTED, "Topic " + topic + " is blacklisted.");
        this.topic = topic;
        withContext("topic", topic);
    }

    public String getTopic() {
        return topic;
    }
}
