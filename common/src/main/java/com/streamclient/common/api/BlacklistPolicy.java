package com.streamclient.common.api;

/**
 * Decides which topics producers must never publish to
 */
public interface BlacklistPolicy {

    boolean isBlacklisted(String topic);
}
