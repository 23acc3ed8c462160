package de.caluga.solo.store;

import de.caluga.solo.LeaseRecord;

/**
 * Durable key value storage shared by all participants. Holds at most one
 * record per key.
 * <p>
 * Implementations are <b>not</b> required to be atomic: a read followed by a write
 * may interleave with another participant's read and write. Stored content that
 * cannot be parsed must be reported as absent ({@code null}), never as an error.
 */
public interface LeaseStore {

    /**
     * @return the record stored under key, or null if there is none or it is malformed
     */
    LeaseRecord get(String key) throws LeaseStoreException;

    void set(String key, LeaseRecord record) throws LeaseStoreException;

    void delete(String key) throws LeaseStoreException;

    /**
     * Probe whether the storage accepts writes at all.
     */
    default boolean isAvailable() {
        return true;
    }
}
