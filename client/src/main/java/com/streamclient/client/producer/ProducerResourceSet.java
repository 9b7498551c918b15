package com.streamclient.client.producer;

import com.streamclient.common.api.DestinationHandle;
import com.streamclient.common.api.MessagingProducer;
import com.streamclient.common.configuration.ResolvedConfiguration;

import java.util.List;
import java.util.Properties;

/**
 * Everything needed to publish through one named producer
 */
public final class ProducerResourceSet {
    private final ResolvedConfiguration configuration;
    private final Properties clientConfiguration;
    private final MessagingProducer producer;
    private final List<DestinationHandle> destinations;

    ProducerResourceSet(ResolvedConfiguration configuration, Properties clientConfiguration,
                        MessagingProducer producer, List<DestinationHandle> destinations) {
        this.configuration = configuration;
        this.clientConfiguration = clientConfiguration;
        this.producer = producer;
        this.destinations = destinations;
    }

    public ResolvedConfiguration getConfiguration() {
        return configuration;
    }

    public Properties getClientConfiguration() {
        return clientConfiguration;
    }

    public MessagingProducer getProducer() {
        return producer;
    }

    public List<DestinationHandle> getDestinations() {
        return destinations;
    }
}
