package com.streamclient.client.config;

import com.streamclient.common.api.ConsumptionEventSink;
import com.streamclient.common.model.PostMessageConsumedEvent;
import com.streamclient.common.model.PreMessageConsumedEvent;
import io.micronaut.context.event.ApplicationEventPublisher;
import jakarta.inject.Singleton;

/**
 * Publishes consumption lifecycle events on the application event bus,
 * so any ApplicationEventListener of the event type receives them.
 */
@Singleton
public class ApplicationEventSink implements ConsumptionEventSink {

    private final ApplicationEventPublisher<PreMessageConsumedEvent> prePublisher;
    private final ApplicationEventPublisher<PostMessageConsumedEvent> postPublisher;

    public ApplicationEventSink(ApplicationEventPublisher<PreMessageConsumedEvent> prePublisher,
                                ApplicationEventPublisher<PostMessageConsumedEvent> postPublisher) {
        this.prePublisher = prePublisher;
        this.postPublisher = postPublisher;
    }

    @Override
    public void onPreMessageConsumed(PreMessageConsumedEvent event) {
        prePublisher.publishEvent(event);
    }

    @Override
    public void onPostMessageConsumed(PostMessageConsumedEvent event) {
        postPublisher.publishEvent(event);
    }
}
