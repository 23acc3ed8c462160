package de.caluga.solo.broadcast;

import de.caluga.solo.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Routes received JSON envelopes (see {@link BroadcastMessageCodec}) to the topic
 * subscribers of one bus endpoint. Envelopes sent by the endpoint itself, for
 * unknown topics or not decodable are dropped.
 */
public class EnvelopeDispatcher {
    private static final Logger log = LoggerFactory.getLogger(EnvelopeDispatcher.class);

    private final String origin;
    private final Map<String, List<TopicSubscription>> subscriptions = new ConcurrentHashMap<>();
    private volatile boolean closed = false;

    public EnvelopeDispatcher(String origin) {
        this.origin = origin;
    }

    public String getOrigin() {
        return origin;
    }

    public Subscription subscribe(String topic, Consumer<BroadcastMessage> callback) {
        TopicSubscription s = new TopicSubscription(topic, callback);
        subscriptions.computeIfAbsent(topic, t -> new CopyOnWriteArrayList<>()).add(s);
        return s;
    }

    /**
     * @return number of subscribers the message was handed to
     */
    public int dispatch(String json) {
        if (closed || origin.equals(BroadcastMessageCodec.textField(json, "origin"))) {
            return 0;
        }

        String topic = BroadcastMessageCodec.textField(json, "topic");
        BroadcastMessage msg = BroadcastMessageCodec.decode(json);

        if (topic == null || msg == null) {
            return 0;
        }

        List<TopicSubscription> subs = subscriptions.get(topic);

        if (subs == null) {
            return 0;
        }

        int delivered = 0;

        for (TopicSubscription s : subs) {
            if (!s.isActive()) {
                continue;
            }

            delivered++;

            try {
                s.callback.accept(msg);
            } catch (Exception e) {
                log.error("broadcast subscriber threw exception", e);
            }
        }

        return delivered;
    }

    public void close() {
        closed = true;
        subscriptions.clear();
    }

    public boolean isClosed() {
        return closed;
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
