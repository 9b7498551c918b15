package com.streamclient.client.consumer;

import com.streamclient.common.api.ConsumerHandler;
import com.streamclient.common.exception.ExceptionLogger;
import com.streamclient.common.exception.MessagingException;
import com.streamclient.common.exception.RecoverableMessageException;
import com.streamclient.common.model.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for consumers that only need to log failures
 */
public abstract class AbstractConsumer implements ConsumerHandler {
    private static final Logger log = LoggerFactory.getLogger(AbstractConsumer.class);

    private final String name;

    protected AbstractConsumer(String name) {
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void handleException(MessagingException exception, Context context) {
        if (context.getRetryNumber() > 0) {
            log.debug("Consumer {} failed on retry {}", name, context.getRetryNumber());
        }
        if (exception instanceof RecoverableMessageException && context.isLastAttempt()) {
            ExceptionLogger.logError(log, exception);
            return;
        }
        ExceptionLogger.logConditional(log, exception);
    }
}
