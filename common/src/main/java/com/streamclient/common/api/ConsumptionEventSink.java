package com.streamclient.common.api;

import com.streamclient.common.model.PostMessageConsumedEvent;
import com.streamclient.common.model.PreMessageConsumedEvent;

/**
 * Receives lifecycle notifications from the consumption loop
 */
public interface ConsumptionEventSink {

    ConsumptionEventSink NONE = new ConsumptionEventSink() {
        @Override
        public void onPreMessageConsumed(PreMessageConsumedEvent event) {
        }

        @Override
        public void onPostMessageConsumed(PostMessageConsumedEvent event) {
        }
    };

    /**
     * Called before every poll
     */
    void onPreMessageConsumed(PreMessageConsumedEvent event);

    /**
     * Called after a polled message reached a terminal outcome
     */
    void onPostMessageConsumed(PostMessageConsumedEvent event);
}
