package com.streamclient.client.decoder;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.streamclient.common.api.Decoder;
import com.streamclient.common.configuration.ResolvedConfiguration;
import com.streamclient.common.exception.ValidationException;
import com.streamclient.common.model.Message;
import com.streamclient.common.model.RawRecord;
import jakarta.inject.Singleton;

import java.io.IOException;

/**
 * Parses the payload into a Jackson tree. Malformed JSON rejects the message.
 */
@Singleton
public class JsonDecoder implements Decoder {
    public static final String NAME = "json";

    private final ObjectMapper objectMapper;

    public JsonDecoder() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.findAndRegisterModules();
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Message decode(RawRecord record, ResolvedConfiguration configuration) throws ValidationException {
        try {
            JsonNode value = objectMapper.readTree(record.getPayload());
            if (value == null || value.isMissingNode()) {
                throw new IOException("No JSON content");
            }
            return new Message(record, value);
        } catch (IOException e) {
            throw ValidationException.decodingFailed(NAME, record.getTopic(), record.getOffset(), e);
        }
    }
}
