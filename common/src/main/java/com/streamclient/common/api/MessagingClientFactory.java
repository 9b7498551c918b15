package com.streamclient.common.api;

import java.util.Properties;

/**
 * Builds messaging client adapters from a client configuration
 */
public interface MessagingClientFactory {

    MessagingConsumer createConsumer(Properties clientConfiguration);

    MessagingProducer createProducer(Properties clientConfiguration);
}
