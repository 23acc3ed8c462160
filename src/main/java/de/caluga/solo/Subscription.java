package de.caluga.solo;

/**
 * Handle returned by listener registrations. Unsubscribing twice is a no-op.
 */
public interface Subscription {
    void unsubscribe();

    boolean isActive();
}
