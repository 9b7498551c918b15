package com.streamclient.client.consumer;

import com.streamclient.client.decoder.MessageFactory;
import com.streamclient.client.metrics.ConsumerMetrics;
import com.streamclient.common.api.ClientConfigurationFactory;
import com.streamclient.common.api.ConsumerHandler;
import com.streamclient.common.api.ConsumptionEventSink;
import com.streamclient.common.api.MessagingClientFactory;
import com.streamclient.common.api.MessagingConsumer;
import com.streamclient.common.configuration.ClientType;
import com.streamclient.common.configuration.ConfigurationOption;
import com.streamclient.common.configuration.ConfigurationResolver;
import com.streamclient.common.configuration.ResolvedConfiguration;
import com.streamclient.common.configuration.RetryPolicy;
import com.streamclient.common.exception.EmptyPollException;
import com.streamclient.common.exception.MessagingException;
import com.streamclient.common.exception.RecoverableMessageException;
import com.streamclient.common.exception.ValidationException;
import com.streamclient.common.model.ConsumptionMetrics;
import com.streamclient.common.model.Context;
import com.streamclient.common.model.Message;
import com.streamclient.common.model.PostMessageConsumedEvent;
import com.streamclient.common.model.PreMessageConsumedEvent;
import com.streamclient.common.model.RawRecord;
import io.micronaut.context.annotation.Prototype;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Consumption loop for one named consumer.
 *
 * Polls one record at a time and runs it through a retry sequence:
 * - empty polls are reported to the consumer and skipped, never counted
 * - {@link ValidationException} rejects the message; with auto-commit disabled its offset is committed
 * - {@link RecoverableMessageException} retries with capped exponential backoff, up to max-retries
 * - anything else propagates and ends the loop
 *
 * Runs on the calling thread until {@link #stop()} is called or an unclassified failure propagates.
 * One instance drives one consumer at a time.
 */
@Prototype
public class ConsumerClient {
    private static final Logger log = LoggerFactory.getLogger(ConsumerClient.class);

    private final ConfigurationResolver configurationResolver;
    private final ClientConfigurationFactory clientConfigurationFactory;
    private final MessagingClientFactory clientFactory;
    private final MessageFactory messageFactory;
    private final ConsumptionEventSink eventSink;
    private final ConsumerMetrics metrics;
    private final Sleeper sleeper;

    private volatile boolean running;

    private long consumedMessages = 0;
    private double consumptionTimeMs = 0;

    @Inject
    public ConsumerClient(ConfigurationResolver configurationResolver,
                          ClientConfigurationFactory clientConfigurationFactory,
                          MessagingClientFactory clientFactory,
                          MessageFactory messageFactory,
                          ConsumptionEventSink eventSink,
                          ConsumerMetrics metrics) {
        this(configurationResolver, clientConfigurationFactory, clientFactory, messageFactory, eventSink, metrics,
                Sleeper.THREAD);
    }

    public ConsumerClient(ConfigurationResolver configurationResolver,
                          ClientConfigurationFactory clientConfigurationFactory,
                          MessagingClientFactory clientFactory,
                          MessageFactory messageFactory,
                          ConsumptionEventSink eventSink,
                          ConsumerMetrics metrics,
                          Sleeper sleeper) {
        this.configurationResolver = configurationResolver;
        this.clientConfigurationFactory = clientConfigurationFactory;
        this.clientFactory = clientFactory;
        this.messageFactory = messageFactory;
        this.eventSink = eventSink != null ? eventSink : ConsumptionEventSink.NONE;
        this.metrics = metrics;
        this.sleeper = sleeper;
    }

    public void consume(ConsumerHandler consumer) throws MessagingException {
        consume(consumer, Map.of());
    }

    /**
     * Run the loop for a consumer until stopped
     *
     * @param consumer Consumer to feed
     * @param overrides Runtime option overrides, may be empty
     * @throws MessagingException when configuration is invalid, the adapter fails,
     *         or the consumer throws an exception other than validation or recoverable failures
     */
    public void consume(ConsumerHandler consumer, Map<String, Object> overrides) throws MessagingException {
        String name = consumer.getName();
        ResolvedConfiguration configuration = configurationResolver.resolve(ClientType.CONSUMER, name, overrides);

        long timeout = configuration.getLong(ConfigurationOption.TIMEOUT);
        RetryPolicy retryPolicy = RetryPolicy.from(configuration);
        List<String> topics = configuration.getList(ConfigurationOption.TOPICS);
        boolean enableAutoCommit = configuration.getBoolean(ConfigurationOption.ENABLE_AUTO_COMMIT);
        messageFactory.getDecoder(configuration);

        Backoff backoff = new Backoff(retryPolicy);
        running = true;

        log.info("Starting consumer {}: topics={}, timeout={}ms, autoCommit={}, {}",
                name, String.join(",", topics), timeout, enableAutoCommit, retryPolicy);

        try (MessagingConsumer client = clientFactory.createConsumer(clientConfigurationFactory.create(configuration))) {
            client.subscribe(topics);

            while (running) {
                long cycleStart = System.nanoTime();
                eventSink.onPreMessageConsumed(new PreMessageConsumedEvent(name, getMetrics()));

                RawRecord record = client.poll(timeout);
                EmptyPollException emptyPoll = classifyPoll(record);
                if (emptyPoll != null) {
                    consumer.handleException(emptyPoll, new Context(configuration, 0));
                    metrics.recordEmptyPoll(name);
                    setConsumptionTime(cycleStart);
                    continue;
                }

                runRetrySequence(consumer, client, record, configuration, retryPolicy, backoff, enableAutoCommit);
                backoff.reset();

                increaseConsumedMessages();
                setConsumptionTime(cycleStart);
                metrics.recordMessageConsumed(name, System.nanoTime() - cycleStart);

                eventSink.onPostMessageConsumed(new PostMessageConsumedEvent(name, getMetrics()));
            }
        } finally {
            running = false;
            log.info("Consumer {} stopped after {} message(s)", name, consumedMessages);
        }
    }

    private void runRetrySequence(ConsumerHandler consumer, MessagingConsumer client, RawRecord record,
                                  ResolvedConfiguration configuration, RetryPolicy retryPolicy, Backoff backoff,
                                  boolean enableAutoCommit) throws MessagingException {
        String name = consumer.getName();
        int maxRetries = retryPolicy.getMaxRetries();

        for (int retry = 0; retry <= maxRetries; ++retry) {
            Context context = new Context(configuration, retry);
            AttemptOutcome outcome = attempt(consumer, record, context);

            switch (outcome.getType()) {
                case SUCCESS:
                    return;

                case VALIDATION_FAILURE:
                    consumer.handleException(outcome.getFailure(), context);
                    metrics.recordValidationFailure(name);
                    if (!enableAutoCommit) {
                        client.commit(record);
                        metrics.recordCommit(name);
                    }
                    return;

                case RECOVERABLE_FAILURE:
                    consumer.handleException(outcome.getFailure(), context);
                    metrics.recordRecoverableFailure(name);
                    if (retry == maxRetries) {
                        log.warn("Consumer {} gave up on {}-{}@{} after {} attempt(s)",
                                name, record.getTopic(), record.getPartition(), record.getOffset(), retry + 1);
                        metrics.recordRetriesExhausted(name);
                        return;
                    }
                    long delay = backoff.next();
                    metrics.recordRetry(name);
                    log.debug("Consumer {} retrying in {}ms (retry {} of {})", name, delay, retry + 1, maxRetries);
                    if (!pause(delay)) {
                        return;
                    }
                    break;

                default:
                    throw new AssertionError("Unhandled attempt outcome " + outcome.getType());
            }
        }
    }

    private AttemptOutcome attempt(ConsumerHandler consumer, RawRecord record, Context context)
            throws MessagingException {
        try {
            Message message = messageFactory.create(record, context.getConfiguration());
            consumer.consume(message, context);
            return AttemptOutcome.success();
        } catch (ValidationException e) {
            return AttemptOutcome.validationFailure(e);
        } catch (RecoverableMessageException e) {
            return AttemptOutcome.recoverableFailure(e);
        }
    }

    private EmptyPollException classifyPoll(RawRecord record) {
        if (record == null) {
            return EmptyPollException.noRecord();
        }
        switch (record.getStatus()) {
            case PARTITION_EOF:
                return EmptyPollException.partitionEof(record.getTopic(), record.getPartition());
            case TIMED_OUT:
                return EmptyPollException.timedOut();
            case ERROR:
                // rejected by the message factory
                return null;
            default:
                break;
        }
        if (!record.hasPayload()) {
            return EmptyPollException.emptyPayload(record.getTopic(), record.getPartition(), record.getOffset());
        }
        return null;
    }

    /**
     * Sleep between retries. An interrupt stops the loop once the current message is accounted for.
     */
    private boolean pause(long delayMs) {
        try {
            sleeper.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Consumer interrupted during retry backoff, stopping");
            running = false;
            return false;
        }
    }

    private void setConsumptionTime(long cycleStart) {
        consumptionTimeMs = (System.nanoTime() - cycleStart) / 1_000_000.0;
    }

    private void increaseConsumedMessages() {
        ++consumedMessages;
    }

    /**
     * Ask the loop to finish after the current cycle
     */
    public void stop() {
        running = false;
    }

    public boolean isRunning() {
        return running;
    }

    public ConsumptionMetrics getMetrics() {
        return new ConsumptionMetrics(consumedMessages, consumptionTimeMs);
    }
}
