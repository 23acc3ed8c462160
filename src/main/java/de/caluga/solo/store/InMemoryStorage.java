package de.caluga.solo.store;

import de.caluga.solo.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Shared in-process backing storage. Every participant gets its own
 * {@link InMemoryLeaseStore} view through {@link #openContext(String)}; changes made
 * through one view are reported to change subscribers of all other views.
 * <p>
 * Values are kept as serialized strings, so malformed content can be injected
 * with {@link #putRaw(String, String)}. Reads and writes can be made to fail to
 * simulate an unavailable or full storage.
 * <p>
 * Change notification is synchronous: subscribers are called on the writing thread
 * after the value has been stored.
 */
public class InMemoryStorage {
    private static final Logger log = LoggerFactory.getLogger(InMemoryStorage.class);

    private final Map<String, String> data = new ConcurrentHashMap<>();
    private final Map<String, List<ChangeSubscription>> subscribers = new ConcurrentHashMap<>();
    private final AtomicInteger contextCounter = new AtomicInteger();
    private final AtomicLong writes = new AtomicLong();
    private final AtomicLong deletes = new AtomicLong();

    private volatile boolean failReads = false;
    private volatile boolean failWrites = false;

    public InMemoryLeaseStore openContext() {
        return openContext("context-" + contextCounter.incrementAndGet());
    }

    public InMemoryLeaseStore openContext(String contextName) {
        return new InMemoryLeaseStore(this, contextName);
    }

    String read(String key) throws LeaseStoreException {
        if (failReads) {
            throw new LeaseStoreException("storage unavailable", null, "get", key);
        }

        return data.get(key);
    }

    void write(InMemoryLeaseStore origin, String key, String value) throws LeaseStoreException {
        if (failWrites) {
            throw new LeaseStoreException("storage quota exceeded", null, "set", key);
        }

        data.put(key, value);
        writes.incrementAndGet();
        notifySubscribers(origin, key);
    }

    void remove(InMemoryLeaseStore origin, String key) throws LeaseStoreException {
        if (failWrites) {
            throw new LeaseStoreException("storage unavailable", null, "delete", key);
        }

        if (data.remove(key) != null) {
            deletes.incrementAndGet();
            notifySubscribers(origin, key);
        }
    }

    ChangeSubscription addSubscriber(InMemoryLeaseStore origin, String key, Consumer<String> callback) {
        ChangeSubscription subscription = new ChangeSubscription(origin, key, callback);
        subscribers.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).add(subscription);
        return subscription;
    }

    private void removeSubscriber(ChangeSubscription subscription) {
        List<ChangeSubscription> subs = subscribers.get(subscription.key);

        if (subs != null) {
            subs.remove(subscription);
        }
    }

    private void notifySubscribers(InMemoryLeaseStore origin, String key) {
        List<ChangeSubscription> subs = subscribers.get(key);

        if (subs == null || subs.isEmpty()) {
            return;
        }

        for (ChangeSubscription subscription : subs) {
            if (!subscription.isActive() || subscription.origin == origin) {
                continue;
            }

            try {
                subscription.callback.accept(key);
            } catch (Exception e) {
                log.error("change subscriber of {} threw exception", subscription.origin.getContextName(), e);
            }
        }
    }

    /**
     * Store a value as it is, bypassing serialization. Counts as a write from
     * outside of all contexts, so every subscriber is notified.
     */
    public void putRaw(String key, String value) {
        data.put(key, value);
        notifySubscribers(null, key);
    }

    public String getRaw(String key) {
        return data.get(key);
    }

    public void clear() {
        data.clear();
    }

    public long getWriteCount() {
        return writes.get();
    }

    public long getDeleteCount() {
        return deletes.get();
    }

    public boolean isFailReads() {
        return failReads;
    }

    public InMemoryStorage setFailReads(boolean failReads) {
        this.failReads = failReads;
        return this;
    }

    public boolean isFailWrites() {
        return failWrites;
    }

    public InMemoryStorage setFailWrites(boolean failWrites) {
        this.failWrites = failWrites;
        return this;
    }

    public Map<String, Object> getStats() {
        Map<String, Object> stats = new HashMap<>();
        stats.put("keys", data.size());
        stats.put("writes", writes.get());
        stats.put("deletes", deletes.get());
        stats.put("subscriptions", subscribers.values().stream().mapToInt(List::size).sum());
        return stats;
    }

    class ChangeSubscription implements Subscription {
        private final InMemoryLeaseStore origin;
        private final String key;
        private final Consumer<String> callback;
        private volatile boolean active = true;

        ChangeSubscription(InMemoryLeaseStore origin, String key, Consumer<String> callback) {
            this.origin = origin;
            this.key = key;
            this.callback = callback;
        }

        @Override
        public void unsubscribe() {
            active = false;
            removeSubscriber(this);
        }

        @Override
        public boolean isActive() {
            return active;
        }
    }
}
