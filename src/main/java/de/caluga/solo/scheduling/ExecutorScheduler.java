package de.caluga.solo.scheduling;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link Scheduler} backed by a single daemon thread. Exceptions thrown by tasks are
 * logged and swallowed, otherwise a failing periodic task would silently stop.
 */
public class ExecutorScheduler implements Scheduler {
    private static final Logger log = LoggerFactory.getLogger(ExecutorScheduler.class);

    private final ScheduledExecutorService executor;
    private final String name;

    public ExecutorScheduler(String name) {
        this.name = name;
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "solo-" + name);
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public Cancellable scheduleAtFixedRate(Runnable task, long initialDelayMs, long periodMs) {
        ScheduledFuture<?> f = executor.scheduleAtFixedRate(guarded(task), initialDelayMs, periodMs, TimeUnit.MILLISECONDS);
        return new FutureCancellable(f);
    }

    @Override
    public Cancellable schedule(Runnable task, long delayMs) {
        ScheduledFuture<?> f = executor.schedule(guarded(task), delayMs, TimeUnit.MILLISECONDS);
        return new FutureCancellable(f);
    }

    @Override
    public void close() {
        log.debug("Shutting down scheduler {}", name);
        executor.shutdownNow();
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    private Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("Scheduled task of {} failed", name, e);
            }
        };
    }

    private static class FutureCancellable implements Cancellable {
        private final ScheduledFuture<?> future;

        FutureCancellable(ScheduledFuture<?> future) {
            this.future = future;
        }

        @Override
        public void cancel() {
            future.cancel(false);
        }

        @Override
        public boolean isDone() {
            return future.isDone();
        }
    }
}
