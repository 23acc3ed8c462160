package de.caluga.solo.scheduling;

/**
 * Handle of a scheduled task.
 */
public interface Cancellable {
    /**
     * Prevent further executions. Has no effect on an execution already running.
     */
    void cancel();

    /**
     * true once cancelled, or once a one-shot task has run
     */
    boolean isDone();
}
