package com.streamclient.common.exception;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MessagingExceptionTest {

    @Test
    void testStructuredMessage() {
        ValidationException ex = ValidationException.decodingFailed("json", "orders", 42L,
                new IllegalStateException("bad json"));

        String message = ex.getStructuredMessage();
        assertTrue(message.startsWith("[VALIDATION_DECODING_FAILED] category=VALIDATION, code=8002"));
        assertTrue(message.contains("retriable=false"));
        assertTrue(message.contains("topic=orders"));
        assertTrue(message.contains("offset=42"));
        assertInstanceOf(IllegalStateException.class, ex.getCause());
    }

    @Test
    void testRetriableFlagFollowsErrorCode() {
        assertTrue(EmptyPollException.timedOut().isRetriable());
        assertTrue(new RecoverableMessageException("database unavailable").isRetriable());
        assertFalse(new ValidationException("missing id").isRetriable());
    }

    @Test
    void testBlacklistedTopicContext() {
        BlacklistedTopicException ex = new BlacklistedTopicException("__consumer_offsets");

        assertEquals(ErrorCode.PRODUCER_TOPIC_BLACKLISTED, ex.getErrorCode());
        assertFalse(ex.isRetriable());
        assertTrue(ex.getStructuredMessage().endsWith("context={topic=__consumer_offsets}"));
        assertEquals("__consumer_offsets", ex.getTopic());
        assertEquals("__consumer_offsets", ex.getContext().get("topic"));
    }

    @Test
    void testFromCode() {
        assertEquals(ErrorCode.CONSUMER_EMPTY_POLL, ErrorCode.fromCode(3001));
        assertEquals(ErrorCode.UNKNOWN_ERROR, ErrorCode.fromCode(1));
        assertTrue(ErrorCode.PRODUCER_FLUSH_FAILED.isCategory("producer"));
    }
}
