package de.caluga.solo.scheduling;

/**
 * Timer facility of a participant. Drives the periodic reconciliation and the
 * debounce delays. Implementations run all tasks of one scheduler sequentially.
 */
public interface Scheduler extends AutoCloseable {

    Cancellable scheduleAtFixedRate(Runnable task, long initialDelayMs, long periodMs);

    Cancellable schedule(Runnable task, long delayMs);

    /**
     * cancel all tasks and release threads
     */
    @Override
    void close();
}
