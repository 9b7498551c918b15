package com.streamclient.client.consumer;

import com.streamclient.common.api.ConsumerHandler;
import com.streamclient.common.exception.ExceptionLogger;
import com.streamclient.common.exception.MessagingException;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.annotation.Value;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Provider;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Starts one consumption loop per {@link ConsumerHandler} bean when the application starts.
 *
 * Features:
 * - Auto-discovery of ConsumerHandler beans
 * - One dedicated thread and {@link ConsumerClient} per consumer
 * - Loops that die on an unclassified failure are logged, not restarted
 * - Graceful shutdown: loops finish their current cycle before the threads are stopped
 *
 * Disable with messaging.consumers.autostart=false to drive {@link ConsumerClient} by hand.
 */
@Singleton
@Requires(property = "messaging.consumers.autostart", value = "true", defaultValue = "true")
@Requires(beans = ConsumerHandler.class)
public class ClientConsumerManager implements ApplicationEventListener<StartupEvent> {
    private static final Logger log = LoggerFactory.getLogger(ClientConsumerManager.class);

    private final List<ConsumerHandler> handlers;
    private final Provider<ConsumerClient> clientProvider;
    private final long shutdownTimeoutMs;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Map<String, ConsumerRuntime> consumers = new ConcurrentHashMap<>();

    public ClientConsumerManager(List<ConsumerHandler> handlers,
                                 Provider<ConsumerClient> clientProvider,
                                 @Value("${messaging.consumers.shutdown-timeout-ms:5000}") long shutdownTimeoutMs) {
        this.handlers = handlers;
        this.clientProvider = clientProvider;
        this.shutdownTimeoutMs = shutdownTimeoutMs;
    }

    @Override
    public void onApplicationEvent(StartupEvent event) {
        start();
    }

    /**
     * Start a loop for every discovered consumer. Calling it again has no effect.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }

        log.info("=== ClientConsumerManager Starting ===");

        if (handlers.isEmpty()) {
            log.warn("No ConsumerHandler beans found. Consumer framework will not start.");
            return;
        }

        log.info("Discovered {} consumer(s)", handlers.size());
        for (ConsumerHandler handler : handlers) {
            String name = handler.getName();
            if (consumers.containsKey(name)) {
                log.warn("Consumer {} is declared more than once, only the first handler is started", name);
                continue;
            }
            ConsumerRuntime runtime = new ConsumerRuntime(handler, clientProvider.get());
            consumers.put(name, runtime);
            runtime.executor.execute(() -> runLoop(runtime));
            log.info("  → Consumer: {} ({})", name, handler.getClass().getSimpleName());
        }
    }

    private void runLoop(ConsumerRuntime runtime) {
        String name = runtime.handler.getName();
        try {
            runtime.client.consume(runtime.handler);
        } catch (MessagingException e) {
            ExceptionLogger.logError(log, e);
            log.error("Consumer {} stopped", name);
        } catch (RuntimeException e) {
            log.error("Consumer {} stopped on unexpected error", name, e);
        } catch (Error e) {
            log.error("Consumer {} stopped on fatal error", name, e);
            throw e;
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("=== ClientConsumerManager Shutting Down ===");

        running.set(false);
        consumers.values().forEach(runtime -> runtime.client.stop());

        for (ConsumerRuntime runtime : consumers.values()) {
            runtime.executor.shutdown();
            try {
                if (!runtime.executor.awaitTermination(shutdownTimeoutMs, TimeUnit.MILLISECONDS)) {
                    log.warn("Consumer {} did not stop in {}ms, interrupting", runtime.handler.getName(),
                            shutdownTimeoutMs);
                    runtime.executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                runtime.executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        consumers.clear();

        log.info("ClientConsumerManager shutdown complete");
    }

    public boolean isRunning(String consumerName) {
        ConsumerRuntime runtime = consumers.get(consumerName);
        return runtime != null && runtime.client.isRunning();
    }

    public int getConsumerCount() {
        return consumers.size();
    }

    private static class ConsumerRuntime {
        final ConsumerHandler handler;
        final ConsumerClient client;
        final ExecutorService executor;

        ConsumerRuntime(ConsumerHandler handler, ConsumerClient client) {
            this.handler = handler;
            this.client = client;
            this.executor = Executors.newSingleThreadExecutor(r -> new Thread(r, "consumer-" + handler.getName()));
        }
    }
}
