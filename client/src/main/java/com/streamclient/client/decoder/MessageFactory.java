package com.streamclient.client.decoder;

import com.streamclient.common.api.Decoder;
import com.streamclient.common.configuration.ConfigurationOption;
import com.streamclient.common.configuration.ResolvedConfiguration;
import com.streamclient.common.exception.ConfigurationException;
import com.streamclient.common.exception.ValidationException;
import com.streamclient.common.model.Message;
import com.streamclient.common.model.RawRecord;
import com.streamclient.common.model.RecordStatus;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Creates messages from raw records with the decoder named in the configuration
 */
@Singleton
public class MessageFactory {
    private static final Logger log = LoggerFactory.getLogger(MessageFactory.class);

    private final Map<String, Decoder> decoders = new HashMap<>();

    public MessageFactory(List<Decoder> decoders) {
        for (Decoder decoder : decoders) {
            this.decoders.put(decoder.getName(), decoder);
        }
        log.debug("Registered decoders: {}", this.decoders.keySet());
    }

    /**
     * Look up the decoder of a configuration
     * @throws ConfigurationException if no decoder has the configured name
     */
    public Decoder getDecoder(ResolvedConfiguration configuration) throws ConfigurationException {
        String name = configuration.getString(ConfigurationOption.DECODER);
        Decoder decoder = decoders.get(name);
        if (decoder == null) {
            throw ConfigurationException.unknownDecoder(configuration.getName(), name);
        }
        return decoder;
    }

    public Message create(RawRecord record, ResolvedConfiguration configuration) throws ValidationException {
        if (record.getStatus() == RecordStatus.ERROR) {
            throw ValidationException.brokerError(record.getTopic(), record.getErrorMessage());
        }

        Decoder decoder = decoders.get(configuration.getString(ConfigurationOption.DECODER));
        if (decoder == null) {
            throw new IllegalStateException("No decoder registered for " + configuration.getName());
        }
        return decoder.decode(record, configuration);
    }
}
