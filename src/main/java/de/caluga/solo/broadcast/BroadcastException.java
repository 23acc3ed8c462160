package de.caluga.solo.broadcast;

/**
 * Creating, subscribing to or publishing on a broadcast bus failed.
 */
public class BroadcastException extends Exception {
    public BroadcastException(String message) {
        super(message);
    }

    public BroadcastException(String message, Throwable cause) {
        super(message, cause);
    }
}
