package de.caluga.solo.store;

import de.caluga.solo.Subscription;

import java.util.function.Consumer;

/**
 * Notifies about modifications of a key done by a different execution context.
 * Writes originating from the subscribing context do not fire.
 */
public interface ChangeListener {

    /**
     * @param callback called with the modified key, may be called on any thread
     */
    Subscription subscribe(String key, Consumer<String> callback);
}
