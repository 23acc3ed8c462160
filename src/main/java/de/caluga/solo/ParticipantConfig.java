package de.caluga.solo;

import java.util.Properties;

/**
 * Configuration of a {@link Participant}.
 * All durations are in milliseconds.
 */
public class ParticipantConfig {
    public static final String DEFAULT_NAMESPACE = "my-app";
    public static final String DEFAULT_STORAGE_PREFIX = "single-owner";

    /**
     * Name of the resource the participants compete for.
     * Default: "my-app"
     */
    private String namespace = DEFAULT_NAMESPACE;

    /**
     * Prefix of the storage key, the key is {@code storagePrefix + "-" + namespace}.
     * Useful to separate test runs or several instances of one application.
     * Default: "single-owner"
     */
    private String storagePrefix = DEFAULT_STORAGE_PREFIX;

    /**
     * Age of a lease record after which its owner is considered dead and the lease
     * may be taken over.
     * Default: 15000ms
     */
    private long timeoutMs = 15000;

    /**
     * Interval of the periodic reconciliation. This is also the heartbeat interval of
     * the leader, so it has to be clearly below timeoutMs.
     * Default: 10000ms
     */
    private long intervalMs = 10000;

    /**
     * Delay between a change notification (store or broadcast) and the reconciliation
     * it triggers. Notifications arriving in between are coalesced.
     * Default: 100ms
     */
    private long debounceMs = 100;

    /**
     * Whether to use a broadcast bus for faster notification if one is available.
     * Default: true
     */
    private boolean useBroadcastBus = true;

    /**
     * Whether to release the lease from a JVM shutdown hook.
     * Default: true
     */
    private boolean registerShutdownHook = true;

    private Runnable onBecomeLeader;
    private Runnable onLoseLeadership;
    private Runnable onOtherDetected;

    public ParticipantConfig() {
    }

    public static ParticipantConfig fromProperties(Properties p) {
        return fromProperties(null, p);
    }

    /**
     * Reads the recognized keys, prefixed with {@code prefix + "."} if prefix is set.
     * Missing keys keep their defaults.
     */
    public static ParticipantConfig fromProperties(String prefix, Properties p) {
        if (prefix != null && !prefix.isEmpty()) {
            prefix += ".";
        } else {
            prefix = "";
        }

        ParticipantConfig cfg = new ParticipantConfig();
        String v;

        if ((v = p.getProperty(prefix + "namespace")) != null) {
            cfg.setNamespace(v.trim());
        }

        if ((v = p.getProperty(prefix + "storagePrefix")) != null) {
            cfg.setStoragePrefix(v.trim());
        }

        if ((v = p.getProperty(prefix + "timeoutMs")) != null) {
            cfg.setTimeoutMs(parseLong(prefix + "timeoutMs", v));
        }

        if ((v = p.getProperty(prefix + "intervalMs")) != null) {
            cfg.setIntervalMs(parseLong(prefix + "intervalMs", v));
        }

        if ((v = p.getProperty(prefix + "debounceMs")) != null) {
            cfg.setDebounceMs(parseLong(prefix + "debounceMs", v));
        }

        if ((v = p.getProperty(prefix + "useBroadcastBus")) != null) {
            cfg.setUseBroadcastBus(v.trim().equals("true"));
        }

        if ((v = p.getProperty(prefix + "registerShutdownHook")) != null) {
            cfg.setRegisterShutdownHook(v.trim().equals("true"));
        }

        return cfg;
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Setting " + key + " is not a number: " + value, e);
        }
    }

    /**
     * @throws IllegalArgumentException for unusable settings
     */
    public ParticipantConfig validate() {
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace must not be empty");
        }

        if (storagePrefix == null) {
            throw new IllegalArgumentException("storagePrefix must not be null");
        }

        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive, was " + timeoutMs);
        }

        if (intervalMs <= 0) {
            throw new IllegalArgumentException("intervalMs must be positive, was " + intervalMs);
        }

        if (debounceMs < 0) {
            throw new IllegalArgumentException("debounceMs must not be negative, was " + debounceMs);
        }

        return this;
    }

    public String getStorageKey() {
        if (storagePrefix.isEmpty()) {
            return namespace;
        }

        return storagePrefix + "-" + namespace;
    }

    // Getters and setters

    public String getNamespace() {
        return namespace;
    }

    public ParticipantConfig setNamespace(String namespace) {
        this.namespace = namespace;
        return this;
    }

    public String getStoragePrefix() {
        return storagePrefix;
    }

    public ParticipantConfig setStoragePrefix(String storagePrefix) {
        this.storagePrefix = storagePrefix;
        return this;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public ParticipantConfig setTimeoutMs(long timeoutMs) {
        this.timeoutMs = timeoutMs;
        return this;
    }

    public long getIntervalMs() {
        return intervalMs;
    }

    public ParticipantConfig setIntervalMs(long intervalMs) {
        this.intervalMs = intervalMs;
        return this;
    }

    public long getDebounceMs() {
        return debounceMs;
    }

    public ParticipantConfig setDebounceMs(long debounceMs) {
        this.debounceMs = debounceMs;
        return this;
    }

    public boolean isUseBroadcastBus() {
        return useBroadcastBus;
    }

    public ParticipantConfig setUseBroadcastBus(boolean useBroadcastBus) {
        this.useBroadcastBus = useBroadcastBus;
        return this;
    }

    public boolean isRegisterShutdownHook() {
        return registerShutdownHook;
    }

    public ParticipantConfig setRegisterShutdownHook(boolean registerShutdownHook) {
        this.registerShutdownHook = registerShutdownHook;
        return this;
    }

    public Runnable getOnBecomeLeader() {
        return onBecomeLeader;
    }

    public ParticipantConfig setOnBecomeLeader(Runnable onBecomeLeader) {
        this.onBecomeLeader = onBecomeLeader;
        return this;
    }

    public Runnable getOnLoseLeadership() {
        return onLoseLeadership;
    }

    public ParticipantConfig setOnLoseLeadership(Runnable onLoseLeadership) {
        this.onLoseLeadership = onLoseLeadership;
        return this;
    }

    public Runnable getOnOtherDetected() {
        return onOtherDetected;
    }

    public ParticipantConfig setOnOtherDetected(Runnable onOtherDetected) {
        this.onOtherDetected = onOtherDetected;
        return this;
    }

    @Override
    public String toString() {
        return "ParticipantConfig{" +
                "namespace='" + namespace + '\'' +
                ", storagePrefix='" + storagePrefix + '\'' +
                ", timeoutMs=" + timeoutMs +
                ", intervalMs=" + intervalMs +
                ", debounceMs=" + debounceMs +
                ", useBroadcastBus=" + useBroadcastBus +
                ", registerShutdownHook=" + registerShutdownHook +
                '}';
    }
}
