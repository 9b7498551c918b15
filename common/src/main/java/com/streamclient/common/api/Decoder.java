package com.streamclient.common.api;

import com.streamclient.common.configuration.ResolvedConfiguration;
import com.streamclient.common.exception.ValidationException;
import com.streamclient.common.model.Message;
import com.streamclient.common.model.RawRecord;

/**
 * Turns a raw record into a message. Selected by the "decoder" option.
 */
public interface Decoder {

    /**
     * Name used in the "decoder" option
     */
    String getName();

    /**
     * @throws ValidationException if the record cannot be decoded
     */
    Message decode(RawRecord record, ResolvedConfiguration configuration) throws ValidationException;
}
