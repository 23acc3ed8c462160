package de.caluga.solo.broadcast;

import de.caluga.solo.Subscription;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * One endpoint of an {@link InMemoryBroadcastHub}.
 */
public class InMemoryBroadcastBus implements BroadcastBus {
    private final InMemoryBroadcastHub hub;
    private final Map<String, List<TopicSubscription>> subscriptions = new ConcurrentHashMap<>();
    private volatile boolean closed = false;

    InMemoryBroadcastBus(InMemoryBroadcastHub hub) {
        this.hub = hub;
    }

    @Override
    public void publish(String topic, BroadcastMessage message) throws BroadcastException {
        if (closed) {
            throw new BroadcastException("bus is closed");
        }

        hub.deliver(this, topic, message);
    }

    @Override
    public Subscription subscribe(String topic, Consumer<BroadcastMessage> callback) throws BroadcastException {
        if (closed) {
            throw new BroadcastException("bus is closed");
        }

        TopicSubscription s = new TopicSubscription(topic, callback);
        subscriptions.computeIfAbsent(topic, t -> new CopyOnWriteArrayList<>()).add(s);
        return s;
    }

    void receive(String topic, BroadcastMessage message) {
        if (closed) {
            return;
        }

        List<TopicSubscription> subs = subscriptions.get(topic);

        if (subs == null) {
            return;
        }

        for (TopicSubscription s : subs) {
            if (s.isActive()) {
                s.callback.accept(message);
            }
        }
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
        subscriptions.clear();
        hub.disconnect(this);
    }

    private class TopicSubscription implements Subscription {
        private final String topic;
        private final Consumer<BroadcastMessage> callback;
        private volatile boolean active = true;

        TopicSubscription(String topic, Consumer<BroadcastMessage> callback) {
            this.topic = topic;
            this.callback = callback;
        }

        @Override
        public void unsubscribe() {
            active = false;
            List<TopicSubscription> subs = subscriptions.get(topic);

            if (subs != null) {
                subs.remove(this);
            }
        }

        @Override
        public boolean isActive() {
            return active && !closed;
        }
    }
}
