package de.caluga.solo.broadcast;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process broadcast medium. Each participant connects its own
 * {@link InMemoryBroadcastBus} endpoint; messages are delivered synchronously to
 * every other open endpoint subscribed to the topic.
 */
public class InMemoryBroadcastHub {
    private static final Logger log = LoggerFactory.getLogger(InMemoryBroadcastHub.class);

    private final List<InMemoryBroadcastBus> endpoints = new CopyOnWriteArrayList<>();
    private final List<BroadcastMessage> history = new CopyOnWriteArrayList<>();
    private volatile boolean supported = true;

    public InMemoryBroadcastBus connect() throws BroadcastException {
        if (!supported) {
            throw new BroadcastException("in-memory broadcast disabled");
        }

        InMemoryBroadcastBus bus = new InMemoryBroadcastBus(this);
        endpoints.add(bus);
        return bus;
    }

    public BroadcastBusFactory factory() {
        return new BroadcastBusFactory() {
            @Override
            public boolean isSupported() {
                return supported;
            }

            @Override
            public BroadcastBus create() throws BroadcastException {
                return connect();
            }
        };
    }

    void deliver(InMemoryBroadcastBus sender, String topic, BroadcastMessage message) {
        history.add(message);

        for (InMemoryBroadcastBus endpoint : endpoints) {
            if (endpoint == sender) {
                continue;
            }

            try {
                endpoint.receive(topic, message);
            } catch (Exception e) {
                log.error("broadcast receiver threw exception", e);
            }
        }
    }

    void disconnect(InMemoryBroadcastBus endpoint) {
        endpoints.remove(endpoint);
    }

    public int getConnectedCount() {
        return endpoints.size();
    }

    public List<BroadcastMessage> getHistory() {
        return Collections.unmodifiableList(new ArrayList<>(history));
    }

    public boolean isSupported() {
        return supported;
    }

    public InMemoryBroadcastHub setSupported(boolean supported) {
        this.supported = supported;
        return this;
    }
}
