package com.streamclient.common.api;

import com.streamclient.common.exception.MessagingException;
import com.streamclient.common.model.Context;
import com.streamclient.common.model.Message;

/**
 * Application code consuming the messages of one named consumer.
 */
public interface ConsumerHandler {

    /**
     * Name of the consumer, used to resolve its configuration
     */
    String getName();

    /**
     * Process one message.
     *
     * Throw {@link com.streamclient.common.exception.ValidationException} to reject the message for good,
     * {@link com.streamclient.common.exception.RecoverableMessageException} to have it retried.
     * Any other exception stops the consumer.
     */
    void consume(Message message, Context context) throws MessagingException;

    /**
     * Called for empty polls, rejected messages and failed attempts
     *
     * @param exception EmptyPollException, ValidationException or RecoverableMessageException
     * @param context Attempt the failure belongs to
     */
    void handleException(MessagingException exception, Context context);
}
