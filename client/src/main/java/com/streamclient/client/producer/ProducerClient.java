package com.streamclient.client.producer;

import com.streamclient.common.api.DestinationHandle;
import com.streamclient.common.api.MessagingProducer;
import com.streamclient.common.api.ProducerHandler;
import com.streamclient.common.configuration.ConfigurationOption;
import com.streamclient.common.configuration.ResolvedConfiguration;
import com.streamclient.common.exception.MessagingException;
import com.streamclient.common.exception.ProducerException;
import com.streamclient.common.model.ProducerMessage;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Publishes domain data through the producer handlers that support it.
 *
 * Every supporting handler turns the data into a message which is published to all topics
 * of that handler's producer, then the producer is flushed.
 */
@Singleton
public class ProducerClient {
    private static final Logger log = LoggerFactory.getLogger(ProducerClient.class);

    private final List<ProducerHandler> handlers;
    private final ProducerResourceCache resourceCache;

    public ProducerClient(List<ProducerHandler> handlers, ProducerResourceCache resourceCache) {
        this.handlers = handlers;
        this.resourceCache = resourceCache;
    }

    /**
     * @throws ProducerException with PRODUCER_NOT_FOUND if no handler supports the data
     */
    public void produce(Object data) throws MessagingException {
        boolean produced = false;
        for (ProducerHandler handler : handlers) {
            if (handler.supports(data)) {
                produce(handler.getName(), handler.produce(data));
                produced = true;
            }
        }
        if (!produced) {
            throw ProducerException.notFound(data);
        }
    }

    /**
     * Publish a ready message to every topic of a named producer and wait for delivery
     */
    public void produce(String producerName, ProducerMessage message) throws MessagingException {
        ProducerResourceSet resources = resourceCache.getResources(producerName);
        ResolvedConfiguration configuration = resources.getConfiguration();
        MessagingProducer producer = resources.getProducer();

        int partition = configuration.getInt(ConfigurationOption.PRODUCER_PARTITION);
        long flushTimeout = configuration.getLong(ConfigurationOption.FLUSH_TIMEOUT);

        for (DestinationHandle destination : resources.getDestinations()) {
            producer.publish(destination, partition, message.getPayload(), message.getKey());
        }

        if (!producer.flush(flushTimeout)) {
            throw ProducerException.flushFailed(producerName, flushTimeout);
        }
        log.debug("Producer {} published to {} topic(s)", producerName, resources.getDestinations().size());
    }
}
