package com.streamclient.client.producer;

import com.streamclient.common.api.BlacklistPolicy;
import com.streamclient.common.api.ClientConfigurationFactory;
import com.streamclient.common.api.DestinationHandle;
import com.streamclient.common.api.MessagingClientFactory;
import com.streamclient.common.api.MessagingProducer;
import com.streamclient.common.configuration.ClientType;
import com.streamclient.common.configuration.ConfigurationOption;
import com.streamclient.common.configuration.ConfigurationResolver;
import com.streamclient.common.configuration.ResolvedConfiguration;
import com.streamclient.common.exception.BlacklistedTopicException;
import com.streamclient.common.exception.MessagingException;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Lazily built, per-producer-name resources, in dependency order:
 * resolved configuration, client configuration, producer, destination handles.
 *
 * Each level is built once per name and returned as the identical instance afterwards.
 * Entries are never evicted: producer names come from configuration, not from message data.
 * Accessors are synchronized so check-build-store is atomic when producers publish from several threads.
 */
@Singleton
public class ProducerResourceCache implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ProducerResourceCache.class);

    private final BlacklistPolicy blacklistPolicy;

    private final ResourceLevel<Map<String, Object>, ResolvedConfiguration> configurations;
    private final ResourceLevel<ResolvedConfiguration, Properties> clientConfigurations;
    private final ResourceLevel<Properties, MessagingProducer> producers;
    private final ResourceLevel<Binding, List<DestinationHandle>> destinations;

    public ProducerResourceCache(ConfigurationResolver configurationResolver,
                                 ClientConfigurationFactory clientConfigurationFactory,
                                 MessagingClientFactory clientFactory,
                                 BlacklistPolicy blacklistPolicy) {
        this.blacklistPolicy = blacklistPolicy;
        this.configurations = new ResourceLevel<>("resolved configuration",
                (name, overrides) -> configurationResolver.resolve(ClientType.PRODUCER, name, overrides));
        this.clientConfigurations = new ResourceLevel<>("client configuration",
                (name, configuration) -> clientConfigurationFactory.create(configuration));
        this.producers = new ResourceLevel<>("producer", (name, clientConfiguration) -> {
            log.info("Creating producer {}", name);
            return clientFactory.createProducer(clientConfiguration);
        });
        this.destinations = new ResourceLevel<>("destination handles", this::buildDestinations);
    }

    public synchronized ResolvedConfiguration getResolvedConfiguration(String producerName)
            throws MessagingException {
        return getResolvedConfiguration(producerName, Map.of());
    }

    /**
     * Overrides only take part in the first resolution for a name
     */
    public synchronized ResolvedConfiguration getResolvedConfiguration(String producerName,
                                                                       Map<String, Object> overrides)
            throws MessagingException {
        return configurations.get(producerName, overrides);
    }

    public synchronized Properties getClientConfiguration(String producerName, ResolvedConfiguration configuration)
            throws MessagingException {
        return clientConfigurations.get(producerName, configuration);
    }

    public synchronized MessagingProducer getProducer(String producerName, Properties clientConfiguration)
            throws MessagingException {
        return producers.get(producerName, clientConfiguration);
    }

    /**
     * @throws BlacklistedTopicException if any configured topic is blacklisted; no handle is created then
     */
    public synchronized List<DestinationHandle> getDestinationHandles(String producerName,
                                                                      ResolvedConfiguration configuration,
                                                                      MessagingProducer producer)
            throws MessagingException {
        return destinations.get(producerName, new Binding(configuration, producer));
    }

    public synchronized ProducerResourceSet getResources(String producerName) throws MessagingException {
        return getResources(producerName, Map.of());
    }

    /**
     * Fetch every level for a producer, building the missing ones in order
     */
    public synchronized ProducerResourceSet getResources(String producerName, Map<String, Object> overrides)
            throws MessagingException {
        ResolvedConfiguration configuration = getResolvedConfiguration(producerName, overrides);
        Properties clientConfiguration = getClientConfiguration(producerName, configuration);
        MessagingProducer producer = getProducer(producerName, clientConfiguration);
        List<DestinationHandle> handles = getDestinationHandles(producerName, configuration, producer);
        return new ProducerResourceSet(configuration, clientConfiguration, producer, handles);
    }

    private List<DestinationHandle> buildDestinations(String producerName, Binding binding)
            throws BlacklistedTopicException {
        List<String> topics = binding.configuration.getList(ConfigurationOption.TOPICS);
        for (String topic : topics) {
            if (blacklistPolicy.isBlacklisted(topic)) {
                log.error("Producer {} is configured for blacklisted topic {}", producerName, topic);
                throw new BlacklistedTopicException(topic);
            }
        }

        List<DestinationHandle> handles = new ArrayList<>(topics.size());
        for (String topic : topics) {
            handles.add(binding.producer.newDestinationHandle(topic));
        }
        log.debug("Producer {} bound to topics {}", producerName, topics);
        return Collections.unmodifiableList(handles);
    }

    synchronized boolean isCached(String producerName) {
        return destinations.contains(producerName);
    }

    @PreDestroy
    @Override
    public synchronized void close() {
        for (MessagingProducer producer : producers.values()) {
            try {
                producer.close();
            } catch (RuntimeException e) {
                log.error("Error closing producer", e);
            }
        }
        destinations.clear();
        producers.clear();
        clientConfigurations.clear();
        configurations.clear();
    }

    private static final class Binding {
        final ResolvedConfiguration configuration;
        final MessagingProducer producer;

        Binding(ResolvedConfiguration configuration, MessagingProducer producer) {
            this.configuration = configuration;
            this.producer = producer;
        }
    }
}
