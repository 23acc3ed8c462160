package de.caluga.solo.broadcast;

import de.caluga.solo.Subscription;

import java.util.function.Consumer;

/**
 * Best effort publish / subscribe channel. No delivery guarantee, no ordering,
 * no persistence. A bus endpoint does not deliver its own messages back to itself.
 */
public interface BroadcastBus extends AutoCloseable {

    void publish(String topic, BroadcastMessage message) throws BroadcastException;

    Subscription subscribe(String topic, Consumer<BroadcastMessage> callback) throws BroadcastException;

    @Override
    void close();
}
