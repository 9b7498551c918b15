package com.streamclient.common.api;

import com.streamclient.common.exception.ValidationException;
import com.streamclient.common.model.ProducerMessage;

/**
 * Application code turning domain data into messages for one named producer.
 */
public interface ProducerHandler {

    /**
     * Name of the producer, used to resolve its configuration
     */
    String getName();

    boolean supports(Object data);

    ProducerMessage produce(Object data) throws ValidationException;
}
