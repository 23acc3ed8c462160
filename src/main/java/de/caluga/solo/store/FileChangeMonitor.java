package de.caluga.solo.store;

import de.caluga.solo.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.function.Consumer;

/**
 * Polls the files of a {@link FileLeaseStore} for modifications done by other
 * processes and informs the registered listeners.
 */
@SuppressWarnings("BusyWait")
public class FileChangeMonitor implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(FileChangeMonitor.class);

    private final FileLeaseStore store;
    private final long pollIntervalMs;
    private final Map<String, ConcurrentLinkedDeque<KeyListener>> listeners = new ConcurrentHashMap<>();
    //key -> content seen on the last poll, absent files are stored as ""
    private final Map<String, String> lastSeen = new ConcurrentHashMap<>();
    private volatile boolean running = false;
    private Thread monitorThread;

    public FileChangeMonitor(FileLeaseStore store, long pollIntervalMs) {
        this.store = store;
        this.pollIntervalMs = pollIntervalMs;
    }

    public Subscription addListener(String key, Consumer<String> callback) {
        lastSeen.computeIfAbsent(key, this::snapshot);
        KeyListener l = new KeyListener(key, callback);
        listeners.computeIfAbsent(key, k -> new ConcurrentLinkedDeque<>()).add(l);
        return l;
    }

    public synchronized void start() {
        if (monitorThread != null) {
            throw new IllegalStateException("Already running!");
        }

        running = true;
        monitorThread = new Thread(this);
        monitorThread.setDaemon(true);
        monitorThread.setName("solo-file-monitor-" + store.getDirectory().getFileName());
        monitorThread.start();
    }

    public boolean isRunning() {
        return running;
    }

    public synchronized void terminate() {
        running = false;

        if (monitorThread != null) {
            monitorThread.interrupt();

            try {
                monitorThread.join(pollIntervalMs * 4);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }

            monitorThread = null;
        }

        listeners.clear();
    }

    @Override
    public void run() {
        while (running) {
            try {
                pollOnce();
            } catch (Exception e) {
                log.warn("Error polling lease files - continuing", e);
            }

            try {
                Thread.sleep(pollIntervalMs);
            } catch (InterruptedException e) {
                //terminate() interrupts
                Thread.currentThread().interrupt();
                break;
            }
        }

        log.debug("FileChangeMonitor finished gracefully!");
    }

    void pollOnce() {
        for (Map.Entry<String, ConcurrentLinkedDeque<KeyListener>> e : listeners.entrySet()) {
            String key = e.getKey();
            String current = snapshot(key);
            String previous = lastSeen.put(key, current);

            if (Objects.equals(previous, current)) {
                continue;
            }

            if (store.isOwnWrite(key, current.isEmpty() ? null : current)) {
                log.trace("ignoring own modification of {}", key);
                continue;
            }

            for (KeyListener l : e.getValue()) {
                if (!l.isActive()) {
                    continue;
                }

                try {
                    l.callback.accept(key);
                } catch (Exception ex) {
                    log.error("listener threw exception", ex);
                }
            }
        }
    }

    private String snapshot(String key) {
        try {
            String content = store.readRaw(key);
            return content == null ? "" : content;
        } catch (LeaseStoreException e) {
            log.debug("could not read {}: {}", key, e.getMessage());
            return lastSeen.getOrDefault(key, "");
        }
    }

    private class KeyListener implements Subscription {
        private final String key;
        private final Consumer<String> callback;
        private volatile boolean active = true;

        KeyListener(String key, Consumer<String> callback) {
            this.key = key;
            this.callback = callback;
        }

        @Override
        public void unsubscribe() {
            active = false;
            ConcurrentLinkedDeque<KeyListener> l = listeners.get(key);

            if (l != null) {
                l.remove(this);
            }
        }

        @Override
        public boolean isActive() {
            return active;
        }
    }
}
