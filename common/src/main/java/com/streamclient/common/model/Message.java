package com.streamclient.common.model;

import java.nio.charset.StandardCharsets;

/**
 * Decoded message handed to a consumer.
 * Owned by a single retry sequence and never mutated.
 */
public final class Message {
    private final byte[] payload;
    private final byte[] key;
    private final Object value;
    private final String topic;
    private final int partition;
    private final long offset;
    private final long timestamp;

    public Message(RawRecord record, Object value) {
        this.payload = record.getPayload();
        this.key = record.getKey();
        this.value = value;
        this.topic = record.getTopic();
        this.partition = record.getPartition();
        this.offset = record.getOffset();
        this.timestamp = record.getTimestamp();
    }

    public byte[] getPayload() {
        return payload == null ? null : payload.clone();
    }

    public String getPayloadAsString() {
        return payload == null ? null : new String(payload, StandardCharsets.UTF_8);
    }

    public byte[] getKey() {
        return key == null ? null : key.clone();
    }

    public String getKeyAsString() {
        return key == null ? null : new String(key, StandardCharsets.UTF_8);
    }

    /**
     * Value produced by the decoder; its type depends on the configured decoder.
     */
    public Object getValue() {
        return value;
    }

    public <T> T getValue(Class<T> type) {
        return type.cast(value);
    }

    public String getTopic() {
        return topic;
    }

    public int getPartition() {
        return partition;
    }

    public long getOffset() {
        return offset;
    }

    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "Message{" +
               "topic='" + topic + '\'' +
               ", partition=" + partition +
               ", offset=" + offset +
               ", key=" + getKeyAsString() +
               ", value=" + (value != null ? value.getClass().getSimpleName() : "null") +
               '}';
    }
}
