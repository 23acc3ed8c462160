package de.caluga.solo.store;

import de.caluga.solo.LeaseRecord;
import de.caluga.solo.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Lease store keeping one JSON file per key in a directory shared by all
 * participants on the machine (one instance per process or context).
 * <p>
 * Writes go to a temp file that is renamed over the target, so readers never see a
 * half written record. That does not make read-then-write atomic.
 * <p>
 * Change notification is done by a {@link FileChangeMonitor} polling the files of
 * subscribed keys. Modifications made through this instance are recognized by their
 * content and not reported.
 */
public class FileLeaseStore implements LeaseStore, ChangeListener, AutoCloseable {
    public static final long DEFAULT_POLL_INTERVAL_MS = 250;
    private static final String PROBE_KEY = "__solo_probe__";

    private static final Logger log = LoggerFactory.getLogger(FileLeaseStore.class);

    private final Path directory;
    private final long pollIntervalMs;
    //key -> content last written by this instance, empty if last deleted by this instance
    private final Map<String, Optional<String>> ownWrites = new ConcurrentHashMap<>();
    private FileChangeMonitor monitor;

    public FileLeaseStore(Path directory) {
        this(directory, DEFAULT_POLL_INTERVAL_MS);
    }

    public FileLeaseStore(Path directory, long pollIntervalMs) {
        if (pollIntervalMs <= 0) {
            throw new IllegalArgumentException("pollIntervalMs must be positive, was " + pollIntervalMs);
        }

        this.directory = directory;
        this.pollIntervalMs = pollIntervalMs;

        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create lease directory " + directory, e);
        }
    }

    @Override
    public LeaseRecord get(String key) throws LeaseStoreException {
        return LeaseRecordCodec.decode(readRaw(key));
    }

    @Override
    public void set(String key, LeaseRecord record) throws LeaseStoreException {
        String content = LeaseRecordCodec.encode(record);
        Path target = fileFor(key);
        Path tmp = null;

        try {
            tmp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            ownWrites.put(key, Optional.of(content));

            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            cleanupTempFile(tmp);
            throw new LeaseStoreException("could not write lease file " + target, e, "set", key);
        }
    }

    @Override
    public void delete(String key) throws LeaseStoreException {
        Path target = fileFor(key);

        try {
            ownWrites.put(key, Optional.empty());
            Files.deleteIfExists(target);
        } catch (IOException e) {
            throw new LeaseStoreException("could not delete lease file " + target, e, "delete", key);
        }
    }

    @Override
    public boolean isAvailable() {
        Path probe = fileFor(PROBE_KEY);

        try {
            Files.writeString(probe, PROBE_KEY, StandardCharsets.UTF_8);
            Files.deleteIfExists(probe);
            return true;
        } catch (IOException e) {
            log.warn("Lease directory {} is not writable: {}", directory, e.getMessage());
            return false;
        }
    }

    @Override
    public synchronized Subscription subscribe(String key, Consumer<String> callback) {
        if (monitor == null) {
            monitor = new FileChangeMonitor(this, pollIntervalMs);
            monitor.start();
        }

        return monitor.addListener(key, callback);
    }

    @Override
    public synchronized void close() {
        if (monitor != null) {
            monitor.terminate();
            monitor = null;
        }
    }

    /**
     * @return the raw file content, null if there is no file
     */
    String readRaw(String key) throws LeaseStoreException {
        Path target = fileFor(key);

        try {
            return Files.readString(target, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return null;
        } catch (IOException e) {
            throw new LeaseStoreException("could not read lease file " + target, e, "get", key);
        }
    }

    /**
     * true if content is exactly what this instance last left in the file for key
     */
    boolean isOwnWrite(String key, String content) {
        Optional<String> own = ownWrites.get(key);
        return own != null && own.equals(Optional.ofNullable(content));
    }

    Path fileFor(String key) {
        return directory.resolve(key.replaceAll("[^A-Za-z0-9._-]", "_") + ".json");
    }

    public Path getDirectory() {
        return directory;
    }

    private void cleanupTempFile(Path tmp) {
        if (tmp == null) {
            return;
        }

        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.debug("could not remove temp file {}: {}", tmp, e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "FileLeaseStore{" + directory + "}";
    }
}
