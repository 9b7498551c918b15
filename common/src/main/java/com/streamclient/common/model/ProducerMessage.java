package com.streamclient.common.model;

import java.nio.charset.StandardCharsets;

/**
 * Payload and optional key to publish
 */
public final class ProducerMessage {
    private final byte[] payload;
    private final byte[] key;

    public ProducerMessage(byte[] payload, byte[] key) {
        this.payload = payload.clone();
        this.key = key == null ? null : key.clone();
    }

    public static ProducerMessage of(String payload, String key) {
        return new ProducerMessage(
                payload.getBytes(StandardCharsets.UTF_8),
                key == null ? null : key.getBytes(StandardCharsets.UTF_8));
    }

    public byte[] getPayload() {
        return payload.clone();
    }

    public byte[] getKey() {
        return key == null ? null : key.clone();
    }
}
