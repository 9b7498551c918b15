package com.streamclient.client.producer;

import com.streamclient.common.exception.MessagingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * One memoized level of the producer resource chain.
 * Values are built from the previous level's value the first time a producer name asks for them
 * and kept until the cache is closed.
 *
 * Not thread-safe: {@link ProducerResourceCache} serializes access.
 *
 * @param <I> Value of the previous level
 * @param <V> Value of this level
 */
class ResourceLevel<I, V> {
    private static final Logger log = LoggerFactory.getLogger(ResourceLevel.class);

    private final String levelName;
    private final Builder<I, V> builder;
    private final Map<String, V> values = new HashMap<>();

    ResourceLevel(String levelName, Builder<I, V> builder) {
        this.levelName = levelName;
        this.builder = builder;
    }

    V get(String producerName, I input) throws MessagingException {
        V value = values.get(producerName);
        if (value == null) {
            value = builder.build(producerName, input);
            values.put(producerName, value);
            log.debug("Built {} for producer {}", levelName, producerName);
        }
        return value;
    }

    boolean contains(String producerName) {
        return values.containsKey(producerName);
    }

    Iterable<V> values() {
        return values.values();
    }

    void clear() {
        values.clear();
    }

    @FunctionalInterface
    interface Builder<I, V> {
        V build(String producerName, I input) throws MessagingException;
    }
}
