package com.streamclient.common.exception;

import org.slf4j.Logger;

/**
 * Structured exception logging shared by the consumer and producer clients.
 */
public class ExceptionLogger {

    private ExceptionLogger() {
    }

    public static void logError(Logger log, MessagingException ex) {
        log.error(ex.getStructuredMessage(), ex.getCause() != null ? ex.getCause() : ex);
    }

    public static void logWarn(Logger log, MessagingException ex) {
        log.warn(ex.getStructuredMessage(), ex.getCause() != null ? ex.getCause() : ex);
    }

    /**
     * Log with a level chosen by retriability.
     * Empty polls: DEBUG, retriable: WARN, non-retriable: ERROR
     */
    public static void logConditional(Logger log, MessagingException ex) {
        if (ex instanceof EmptyPollException) {
            log.debug(ex.getStructuredMessage());
        } else if (ex.isRetriable()) {
            logWarn(log, ex);
        } else {
            logError(log, ex);
        }
    }
}
