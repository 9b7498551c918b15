package com.streamclient.client.consumer;

import com.streamclient.common.exception.MessagingException;
import com.streamclient.common.exception.RecoverableMessageException;
import com.streamclient.common.exception.ValidationException;

/**
 * Result of one attempt at decoding and handling a message
 */
final class AttemptOutcome {
    private static final AttemptOutcome SUCCESS = new AttemptOutcome(Type.SUCCESS, null);

    private final Type type;
    private final MessagingException failure;

    private AttemptOutcome(Type type, MessagingException failure) {
        this.type = type;
        this.failure = failure;
    }

    static AttemptOutcome success() {
        return SUCCESS;
    }

    static AttemptOutcome validationFailure(ValidationException failure) {
        return new AttemptOutcome(Type.VALIDATION_FAILURE, failure);
    }

    static AttemptOutcome recoverableFailure(RecoverableMessageException failure) {
        return new AttemptOutcome(Type.RECOVERABLE_FAILURE, failure);
    }

    Type getType() {
        return type;
    }

    MessagingException getFailure() {
        return failure;
    }

    enum Type {
        SUCCESS,
        VALIDATION_FAILURE,
        RECOVERABLE_FAILURE
    }
}
