package com.streamclient.client.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer metrics for the consumption loop, tagged per consumer.
 */
@Singleton
public class ConsumerMetrics {
    private static final Logger log = LoggerFactory.getLogger(ConsumerMetrics.class);

    private static final String CONSUMER_TAG = "consumer";

    private final MeterRegistry registry;

    // Per-consumer metric caches
    private final ConcurrentHashMap<String, Counter> messagesConsumed = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> emptyPolls = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> validationFailures = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> recoverableFailures = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> retries = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> retriesExhausted = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> commits = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> processingLatency = new ConcurrentHashMap<>();

    public ConsumerMetrics(MeterRegistry registry) {
        this.registry = registry;
        log.info("Consumer metrics initialized");
    }

    public void recordMessageConsumed(String consumer, long durationNanos) {
        counter(messagesConsumed, "consumer.messages.consumed",
                "Messages that reached a terminal outcome", consumer).increment();
        processingLatency.computeIfAbsent(consumer, name -> Timer.builder("consumer.message.processing.latency")
                        .description("Time from poll to terminal outcome of a message")
                        .tag(CONSUMER_TAG, name)
                        .publishPercentiles(0.5, 0.95, 0.99)
                        .register(registry))
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void recordEmptyPoll(String consumer) {
        counter(emptyPolls, "consumer.polls.empty", "Poll cycles that returned nothing to process", consumer)
                .increment();
    }

    public void recordValidationFailure(String consumer) {
        counter(validationFailures, "consumer.messages.rejected", "Messages rejected as invalid", consumer)
                .increment();
    }

    public void recordRecoverableFailure(String consumer) {
        counter(recoverableFailures, "consumer.attempts.failed", "Attempts that failed transiently", consumer)
                .increment();
    }

    public void recordRetry(String consumer) {
        counter(retries, "consumer.retries", "Retries scheduled after a transient failure", consumer)
                .increment();
    }

    public void recordRetriesExhausted(String consumer) {
        counter(retriesExhausted, "consumer.retries.exhausted",
                "Messages that failed transiently on every allowed attempt", consumer).increment();
    }

    public void recordCommit(String consumer) {
        counter(commits, "consumer.commits", "Explicit offset commits of rejected messages", consumer)
                .increment();
    }

    private Counter counter(ConcurrentHashMap<String, Counter> cache, String name, String description,
                            String consumer) {
        return cache.computeIfAbsent(consumer, key -> Counter.builder(name)
                .description(description)
                .tag(CONSUMER_TAG, key)
                .register(registry));
    }
}
