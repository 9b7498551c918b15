package com.streamclient.client.consumer;

/**
 * Blocking pause between retries
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
