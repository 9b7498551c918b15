package com.streamclient.client.decoder;

import com.streamclient.common.api.Decoder;
import com.streamclient.common.configuration.ResolvedConfiguration;
import com.streamclient.common.model.Message;
import com.streamclient.common.model.RawRecord;
import jakarta.inject.Singleton;

import java.nio.charset.StandardCharsets;

/**
 * Exposes the payload as a UTF-8 string
 */
@Singleton
public class PlainDecoder implements Decoder {
    public static final String NAME = "plain";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Message decode(RawRecord record, ResolvedConfiguration configuration) {
        byte[] payload = record.getPayload();
        return new Message(record, payload == null ? null : new String(payload, StandardCharsets.UTF_8));
    }
}
