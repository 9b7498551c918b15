package com.streamclient.common.model;

import java.util.Arrays;

/**
 * Record as returned by a poll, before decoding.
 * Byte arrays are copied on the way in and out.
 */
public final class RawRecord {
    private final RecordStatus status;
    private final String topic;
    private final int partition;
    private final long offset;
    private final byte[] key;
    private final byte[] payload;
    private final long timestamp;
    private final String errorMessage;

    private RawRecord(RecordStatus status, String topic, int partition, long offset,
                      byte[] key, byte[] payload, long timestamp, String errorMessage) {
        this.status = status;
        this.topic = topic;
        this.partition = partition;
        this.offset = offset;
        this.key = key == null ? null : key.clone();
        this.payload = payload == null ? null : payload.clone();
        this.timestamp = timestamp;
        this.errorMessage = errorMessage;
    }

    public static RawRecord of(String topic, int partition, long offset, byte[] key, byte[] payload, long timestamp) {
        return new RawRecord(RecordStatus.NO_ERROR, topic, partition, offset, key, payload, timestamp, null);
    }

    public static RawRecord timedOut() {
        return new RawRecord(RecordStatus.TIMED_OUT, null, -1, -1L, null, null, 0L, null);
    }

    public static RawRecord partitionEof(String topic, int partition, long offset) {
        return new RawRecord(RecordStatus.PARTITION_EOF, topic, partition, offset, null, null, 0L, null);
    }

    public static RawRecord error(String topic, int partition, String errorMessage) {
        return new RawRecord(RecordStatus.ERROR, topic, partition, -1L, null, null, 0L, errorMessage);
    }

    public RecordStatus getStatus() {
        return status;
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

    public byte[] getKey() {
        return key == null ? null : key.clone();
    }

    public byte[] getPayload() {
        return payload == null ? null : payload.clone();
    }

    public boolean hasPayload() {
        return payload != null && payload.length > 0;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    @Override
    public String toString() {
        return "RawRecord{" +
               "status=" + status +
               ", topic='" + topic + '\'' +
               ", partition=" + partition +
               ", offset=" + offset +
               ", key=" + (key != null ? Arrays.toString(key) : "null") +
               ", payload=" + (payload != null ? payload.length + " bytes" : "null") +
               '}';
    }
}
