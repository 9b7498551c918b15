package com.streamclient.common.model;

/**
 * Status attached by the messaging client adapter to every polled record
 */
public enum RecordStatus {
    /**
     * A regular record carrying a payload
     */
    NO_ERROR,

    /**
     * The consumer reached the end of a partition
     */
    PARTITION_EOF,

    /**
     * The poll timed out without a record
     */
    TIMED_OUT,

    /**
     * The broker reported an error for this record
     */
    ERROR;

    /**
     * Statuses that never carry a message to process
     */
    public boolean isEmptyPoll() {
        return this == PARTITION_EOF || this == TIMED_OUT;
    }
}
