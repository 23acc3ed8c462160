package de.caluga.solo.store;

import de.caluga.solo.LeaseRecord;
import de.caluga.solo.Subscription;

import java.util.function.Consumer;

/**
 * One execution context's view of an {@link InMemoryStorage}. Acts as both the
 * participant's {@link LeaseStore} and its {@link ChangeListener}.
 */
public class InMemoryLeaseStore implements LeaseStore, ChangeListener {
    private final InMemoryStorage storage;
    private final String contextName;

    InMemoryLeaseStore(InMemoryStorage storage, String contextName) {
        this.storage = storage;
        this.contextName = contextName;
    }

    @Override
    public LeaseRecord get(String key) throws LeaseStoreException {
        return LeaseRecordCodec.decode(storage.read(key));
    }

    @Override
    public void set(String key, LeaseRecord record) throws LeaseStoreException {
        storage.write(this, key, LeaseRecordCodec.encode(record));
    }

    @Override
    public void delete(String key) throws LeaseStoreException {
        storage.remove(this, key);
    }

    @Override
    public boolean isAvailable() {
        return !storage.isFailWrites() && !storage.isFailReads();
    }

    @Override
    public Subscription subscribe(String key, Consumer<String> callback) {
        return storage.addSubscriber(this, key, callback);
    }

    public InMemoryStorage getStorage() {
        return storage;
    }

    public String getContextName() {
        return contextName;
    }

    @Override
    public String toString() {
        return "InMemoryLeaseStore{" + contextName + "}";
    }
}
