package com.streamclient.client.consumer;

import com.streamclient.common.api.ConsumerHandler;
import com.streamclient.common.exception.MessagingException;
import com.streamclient.common.model.Context;
import com.streamclient.common.model.Message;

import java.util.ArrayList;
import java.util.List;

/**
 * Consumer whose behavior is scripted per invocation. Records every call it receives.
 */
class RecordingHandler implements ConsumerHandler {

    @FunctionalInterface
    interface Behavior {
        void apply(Message message, Context context) throws MessagingException;
    }

    private final String name;
    private final Behavior behavior;
    private final List<Message> messages = new ArrayList<>();
    private final List<Integer> attempts = new ArrayList<>();
    private final List<MessagingException> exceptions = new ArrayList<>();
    private final List<Integer> exceptionRetries = new ArrayList<>();

    RecordingHandler(String name, Behavior behavior) {
        this.name = name;
        this.behavior = behavior;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void consume(Message message, Context context) throws MessagingException {
        messages.add(message);
        attempts.add(context.getRetryNumber());
        behavior.apply(message, context);
    }

    @Override
    public void handleException(MessagingException exception, Context context) {
        exceptions.add(exception);
        exceptionRetries.add(context.getRetryNumber());
    }

    List<Message> getMessages() {
        return messages;
    }

    List<Integer> getAttempts() {
        return attempts;
    }

    List<MessagingException> getExceptions() {
        return exceptions;
    }

    List<Integer> getExceptionRetries() {
        return exceptionRetries;
    }
}
