package com.streamclient.common.api;

/**
 * Handle on one topic, bound to the producer that created it
 */
public interface DestinationHandle {

    String getTopic();
}
