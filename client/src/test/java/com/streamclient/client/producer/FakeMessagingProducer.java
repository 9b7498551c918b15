package com.streamclient.client.producer;

import com.streamclient.common.api.DestinationHandle;
import com.streamclient.common.api.MessagingProducer;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

class FakeMessagingProducer implements MessagingProducer {
    private final List<String> requestedTopics = new ArrayList<>();
    private final List<String> published = new ArrayList<>();
    private final List<Long> flushes = new ArrayList<>();
    private boolean flushResult = true;
    private boolean closed = false;

    @Override
    public DestinationHandle newDestinationHandle(String topic) {
        requestedTopics.add(topic);
        return () -> topic;
    }

    @Override
    public void publish(DestinationHandle destination, int partition, byte[] payload, byte[] key) {
        published.add(destination.getTopic() + "/" + partition + "/"
                + (key == null ? "-" : new String(key, StandardCharsets.UTF_8)) + "/"
                + new String(payload, StandardCharsets.UTF_8));
    }

    @Override
    public boolean flush(long timeoutMs) {
        flushes.add(timeoutMs);
        return flushResult;
    }

    @Override
    public void close() {
        closed = true;
    }

    void setFlushResult(boolean flushResult) {
        this.flushResult = flushResult;
    }

    List<String> getRequestedTopics() {
        return requestedTopics;
    }

    List<String> getPublished() {
        return published;
    }

    List<Long> getFlushes() {
        return flushes;
    }

    boolean isClosed() {
        return closed;
    }
}
