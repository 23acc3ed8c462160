package de.caluga.solo;

import de.caluga.solo.broadcast.BroadcastBus;
import de.caluga.solo.broadcast.BroadcastBusFactory;
import de.caluga.solo.broadcast.BroadcastException;
import de.caluga.solo.broadcast.BroadcastMessage;
import de.caluga.solo.scheduling.Cancellable;
import de.caluga.solo.scheduling.ExecutorScheduler;
import de.caluga.solo.scheduling.Scheduler;
import de.caluga.solo.store.ChangeListener;
import de.caluga.solo.store.LeaseStore;
import de.caluga.solo.store.LeaseStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One contender for the single active owner role of a namespace.
 * <p>
 * All triggers (periodic tick, store change notification, broadcast message, explicit
 * calls) end up in {@link #reconcileNow()}, which reads the lease record and applies
 * {@link LeaseRules}. Claims and renewals write {@code {id, now}} to the store; the
 * periodic tick is therefore also the leader's heartbeat.
 * <p>
 * The store offers no compare-and-set. Two participants may claim the same absent or
 * expired lease in the same tick and both consider themselves leader until the loser
 * reads the winner's record on its next reconciliation, at most one interval later.
 * <p>
 * Store failures during reconciliation are resolved in favour of leadership
 * (fail-safe-to-leader): a participant that cannot verify ownership assumes it. If the
 * store is broken for everybody, everybody becomes leader.
 * <p>
 * Thread-safety: reconciliation is not re-entrant. A trigger arriving while a pass is
 * running is queued and executed once by the thread running the pass. Callbacks are
 * invoked on that thread. Lease writes, leadership changes and the release in
 * {@link #close()} happen under one lock; a pass whose read was overtaken by
 * {@link #forceAcquire()} or {@link #close()} discards its result.
 */
public class Participant implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Participant.class);

    // Configuration
    private final String id;
    private final ParticipantConfig config;
    private final String storageKey;
    private final LeaseStore store;

    // Collaborators, may be replaced until start()
    private ChangeListener changeListener;
    private BroadcastBusFactory broadcastBusFactory;
    private Scheduler scheduler;
    private boolean ownsScheduler = false;
    private Clock clock = Clock.systemUTC();

    // Leadership state
    private final AtomicBoolean leader = new AtomicBoolean(false);
    private volatile LeaseRecord lastKnownRecord;
    private volatile boolean hidden = false;
    //guards lease writes, the leader flag and forcedClaims
    private final Object leaseLock = new Object();
    private long forcedClaims = 0;

    // Reconciliation bookkeeping
    private final AtomicBoolean reconciling = new AtomicBoolean(false);
    private final AtomicBoolean rerunRequested = new AtomicBoolean(false);
    private final AtomicBoolean debounceScheduled = new AtomicBoolean(false);
    private final AtomicLong reconciliations = new AtomicLong();
    private final AtomicLong storeErrors = new AtomicLong();

    // Registrations
    private volatile Cancellable tickTask;
    private volatile Cancellable debounceTask;
    private Subscription changeSubscription;
    private volatile BroadcastBus broadcastBus;
    private Subscription broadcastSubscription;
    private Thread shutdownHook;

    // Running state
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public Participant(ParticipantConfig config, LeaseStore store) {
        this(config, store, new ObjectIdGenerator());
    }

    public Participant(ParticipantConfig config, LeaseStore store, IdGenerator idGenerator) {
        if (store == null) {
            throw new IllegalArgumentException("store must not be null");
        }

        this.config = (config != null ? config : new ParticipantConfig()).validate();
        this.store = store;
        this.storageKey = this.config.getStorageKey();
        this.id = idGenerator.generate();

        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("IdGenerator returned an empty id");
        }

        if (store instanceof ChangeListener) {
            changeListener = (ChangeListener) store;
        }

        log.info("Participant {} created for {}", id, storageKey);
    }

    // ==================== Lifecycle ====================

    /**
     * Register with scheduler, change listener and broadcast bus and run the first
     * reconciliation synchronously.
     */
    public void start() {
        if (closed.get()) {
            throw new IllegalStateException("Participant " + id + " is closed");
        }

        if (!started.compareAndSet(false, true)) {
            log.warn("Participant {} already running", id);
            return;
        }

        log.info("Starting participant {} for {} (timeout {}ms, interval {}ms)", id, storageKey, config.getTimeoutMs(), config.getIntervalMs());

        if (!store.isAvailable()) {
            log.warn("Lease store {} reports unavailable - participant {} will assume leadership on errors", store, id);
        }

        if (scheduler == null) {
            scheduler = new ExecutorScheduler(id);
            ownsScheduler = true;
        }

        subscribeToStoreChanges();
        connectBroadcastBus();

        if (config.isRegisterShutdownHook()) {
            registerShutdownHook();
        }

        reconcileNow();
        tickTask = scheduler.scheduleAtFixedRate(this::onTick, config.getIntervalMs(), config.getIntervalMs());
    }

    /**
     * Graceful termination. Deregisters all triggers, then deletes the lease if, and
     * only if, it is still owned by this participant. Calling close twice is a no-op.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        log.info("Closing participant {} ({})", id, storageKey);

        cancel(tickTask);
        cancel(debounceTask);
        unsubscribe(changeSubscription);
        unsubscribe(broadcastSubscription);

        boolean released;

        //waits for a write in progress, passes entering later see closed
        synchronized (leaseLock) {
            released = releaseLease();
            leader.set(false);
        }

        if (released) {
            publish(BroadcastMessage.closing(id, clock.millis()));
        }

        BroadcastBus bus = broadcastBus;
        broadcastBus = null;

        if (bus != null) {
            try {
                bus.close();
            } catch (RuntimeException e) {
                log.debug("Closing broadcast bus failed: {}", e.getMessage());
            }
        }

        if (ownsScheduler && scheduler != null) {
            scheduler.close();
        }

        removeShutdownHook();
    }

    /**
     * @return true if the record was owned by this participant and got deleted
     */
    private boolean releaseLease() {
        LeaseRecord current;

        try {
            current = store.get(storageKey);
        } catch (LeaseStoreException e) {
            log.warn("{} could not read lease {} during shutdown - leaving it to expire: {}", id, storageKey, e.getMessage());
            return false;
        }

        if (current == null || !current.isOwnedBy(id)) {
            log.debug("{} does not own {} at shutdown (owner: {}) - not releasing", id, storageKey, current == null ? null : current.getOwnerId());
            return false;
        }

        try {
            store.delete(storageKey);
            lastKnownRecord = null;
            log.info("{} released lease {}", id, storageKey);
            return true;
        } catch (LeaseStoreException e) {
            storeErrors.incrementAndGet();
            log.warn("{} could not delete lease {} - it will expire after {}ms: {}", id, storageKey, config.getTimeoutMs(), e.getMessage());
            return false;
        }
    }

    private void registerShutdownHook() {
        shutdownHook = new Thread(this::close, "solo-shutdown-" + id);

        try {
            Runtime.getRuntime().addShutdownHook(shutdownHook);
        } catch (IllegalStateException e) {
            log.debug("JVM already shutting down - no shutdown hook for {}", id);
            shutdownHook = null;
        }
    }

    private void removeShutdownHook() {
        if (shutdownHook == null || Thread.currentThread() == shutdownHook) {
            return;
        }

        try {
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
        } catch (IllegalStateException e) {
            log.trace("JVM shutting down, hook of {} stays", id);
        }

        shutdownHook = null;
    }

    // ==================== Trigger fan-in ====================

    private void subscribeToStoreChanges() {
        if (changeListener == null) {
            log.debug("{} has no change listener - relying on polling", id);
            return;
        }

        try {
            changeSubscription = changeListener.subscribe(storageKey, this::onStoreChanged);
        } catch (RuntimeException e) {
            log.warn("{} could not subscribe to changes of {} - relying on polling: {}", id, storageKey, e.getMessage());
        }
    }

    private void connectBroadcastBus() {
        if (!config.isUseBroadcastBus() || broadcastBusFactory == null) {
            return;
        }

        try {
            if (!broadcastBusFactory.isSupported()) {
                log.debug("Broadcast not supported - {} uses polling only", id);
                return;
            }

            BroadcastBus bus = broadcastBusFactory.create();

            try {
                broadcastSubscription = bus.subscribe(storageKey, this::onBroadcast);
            } catch (BroadcastException | RuntimeException e) {
                bus.close();
                throw e;
            }

            broadcastBus = bus;
            log.debug("{} connected to broadcast bus for {}", id, storageKey);
        } catch (BroadcastException | RuntimeException e) {
            log.debug("Broadcast bus unavailable for {} - falling back to polling: {}", id, e.getMessage());
        }
    }

    private void onTick() {
        try {
            reconcileNow();
        } catch (RuntimeException e) {
            log.error("Periodic reconciliation of {} failed", id, e);
        }
    }

    private void onStoreChanged(String key) {
        if (!storageKey.equals(key)) {
            return;
        }

        requestDebouncedReconciliation("store change");
    }

    private void onBroadcast(BroadcastMessage msg) {
        if (id.equals(msg.getSenderId())) {
            return;
        }

        log.debug("{} received {} from {}", id, msg.getKind(), msg.getSenderId());
        requestDebouncedReconciliation("broadcast " + msg.getKind());
    }

    /**
     * Schedule one reconciliation after the debounce delay. Requests arriving while
     * one is already scheduled are coalesced into it.
     */
    private void requestDebouncedReconciliation(String trigger) {
        if (closed.get() || scheduler == null) {
            return;
        }

        if (!debounceScheduled.compareAndSet(false, true)) {
            log.trace("{} coalesced trigger: {}", id, trigger);
            return;
        }

        log.trace("{} scheduling reconciliation in {}ms after {}", id, config.getDebounceMs(), trigger);

        try {
            debounceTask = scheduler.schedule(this::runDebouncedReconciliation, config.getDebounceMs());
        } catch (RejectedExecutionException e) {
            debounceScheduled.set(false);
            log.debug("{} scheduler already shut down, ignoring {}", id, trigger);
        }
    }

    private void runDebouncedReconciliation() {
        debounceScheduled.set(false);
        reconcileNow();
    }

    // ==================== Reconciliation ====================

    /**
     * Evaluate the current lease record and claim, renew or follow accordingly.
     * Runs synchronously; if another pass is in progress the request is queued and
     * this call returns immediately.
     */
    public void reconcileNow() {
        if (closed.get()) {
            log.debug("{} is closed, not reconciling", id);
            return;
        }

        while (true) {
            if (!reconciling.compareAndSet(false, true)) {
                rerunRequested.set(true);
                log.trace("{} reconciliation in progress - request queued", id);
                return;
            }

            try {
                do {
                    rerunRequested.set(false);
                    runReconciliationPass();
                } while (rerunRequested.get() && !closed.get());
            } finally {
                reconciling.set(false);
            }

            //a request may have been queued between the loop check and the release
            if (!rerunRequested.get() || closed.get()) {
                return;
            }
        }
    }

    private void runReconciliationPass() {
        reconciliations.incrementAndGet();
        long now = clock.millis();
        long generation = currentForcedClaims();
        LeaseRecord current;

        try {
            current = store.get(storageKey);
        } catch (LeaseStoreException e) {
            storeErrors.incrementAndGet();
            log.error("{} could not read lease {} - assuming leadership", id, storageKey, e);
            lastKnownRecord = null;
            applyDecision(true, false, now, generation);
            return;
        }

        lastKnownRecord = current;
        LeaseDecision decision = LeaseRules.decide(current, id, now, config.getTimeoutMs());

        if (decision == LeaseDecision.FOLLOW) {
            log.debug("{} follows {} (lease age {}ms)", id, current.getOwnerId(), current.ageAt(now));

            if (applyDecision(false, false, now, generation)) {
                fire(config.getOnOtherDetected(), "onOtherDetected");
            }

            return;
        }

        if (decision == LeaseDecision.CLAIM_EXPIRED) {
            log.info("{} takes over {} - lease of {} expired {}ms ago", id, storageKey, current.getOwnerId(), current.ageAt(now) - config.getTimeoutMs());
        } else if (decision == LeaseDecision.CLAIM_ABSENT) {
            log.debug("{} claims unowned {}", id, storageKey);
        } else {
            log.trace("{} renews {}", id, storageKey);
        }

        applyDecision(true, true, now, generation);
    }

    private long currentForcedClaims() {
        synchronized (leaseLock) {
            return forcedClaims;
        }
    }

    /**
     * Write (if asked to) and set the leader flag, unless the participant was closed or
     * force-acquired since the pass read the record.
     *
     * @return false if the decision was discarded
     */
    private boolean applyDecision(boolean nowLeader, boolean write, long now, long generation) {
        boolean wasLeader;

        synchronized (leaseLock) {
            if (closed.get()) {
                log.debug("{} closed during reconciliation - discarding result", id);
                return false;
            }

            if (forcedClaims != generation) {
                log.debug("{} force-acquired during reconciliation - discarding result", id);
                return false;
            }

            if (write) {
                writeLease(now);
            }

            wasLeader = leader.getAndSet(nowLeader);
        }

        leadershipChanged(wasLeader, nowLeader, now);
        return true;
    }

    /**
     * Write {id, now}. A failed write keeps (or grants) leadership.
     * Callers hold leaseLock.
     */
    private void writeLease(long now) {
        LeaseRecord record = new LeaseRecord(id, now);

        try {
            store.set(storageKey, record);
            lastKnownRecord = record;
        } catch (LeaseStoreException e) {
            storeErrors.incrementAndGet();
            log.error("{} could not write lease {} - assuming leadership anyway", id, storageKey, e);
        }
    }

    /**
     * Fire the edge triggered callbacks for a change of the leader flag.
     */
    private void leadershipChanged(boolean wasLeader, boolean nowLeader, long now) {
        if (!wasLeader && nowLeader) {
            log.info("{} became LEADER of {}", id, storageKey);
            publish(BroadcastMessage.leadershipChanged(id, now));
            fire(config.getOnBecomeLeader(), "onBecomeLeader");
        } else if (wasLeader && !nowLeader) {
            LeaseRecord rec = lastKnownRecord;
            log.info("{} lost leadership of {} to {}", id, storageKey, rec == null ? null : rec.getOwnerId());
            fire(config.getOnLoseLeadership(), "onLoseLeadership");
        }
    }

    private void fire(Runnable callback, String name) {
        if (callback == null) {
            return;
        }

        try {
            callback.run();
        } catch (Exception e) {
            log.error("{} callback {} threw exception", id, name, e);
        }
    }

    private void publish(BroadcastMessage msg) {
        BroadcastBus bus = broadcastBus;

        if (bus == null) {
            return;
        }

        try {
            bus.publish(storageKey, msg);
        } catch (BroadcastException | RuntimeException e) {
            log.debug("{} could not publish {}: {}", id, msg.getKind(), e.getMessage());
        }
    }

    // ==================== Control ====================

    /**
     * Claim the lease unconditionally, even from a live leader. The previous owner
     * is not asked and only finds out on its next reconciliation.
     */
    public void forceAcquire() {
        if (closed.get()) {
            throw new IllegalStateException("Participant " + id + " is closed");
        }

        long now = clock.millis();
        LeaseRecord previous = lastKnownRecord;
        boolean wasLeader;

        synchronized (leaseLock) {
            if (closed.get()) {
                throw new IllegalStateException("Participant " + id + " is closed");
            }

            log.warn("{} forcing leadership of {} (previous owner: {})", id, storageKey, previous == null ? null : previous.getOwnerId());
            //passes that read before this point discard their result
            forcedClaims++;
            writeLease(now);
            wasLeader = leader.getAndSet(true);
        }

        if (wasLeader) {
            publish(BroadcastMessage.leadershipChanged(id, now));
        } else {
            leadershipChanged(false, true, now);
        }
    }

    /**
     * @return the record currently in the store, null if absent, malformed or unreadable
     */
    public LeaseRecord readCurrentRecord() {
        try {
            return store.get(storageKey);
        } catch (LeaseStoreException e) {
            log.warn("{} could not read lease {}: {}", id, storageKey, e.getMessage());
            return null;
        }
    }

    /**
     * Visibility change of the hosting context (backgrounded, minimized...). A hidden
     * leader keeps its lease fresh instead of releasing it; becoming visible again
     * triggers an immediate reconciliation.
     */
    public void setHidden(boolean hidden) {
        this.hidden = hidden;

        if (closed.get()) {
            return;
        }

        if (!hidden) {
            log.debug("{} visible again - reconciling", id);
            reconcileNow();
        } else if (leader.get()) {
            log.debug("{} hidden while leader - renewing lease", id);
            reconcileNow();
        }
    }

    // ==================== Collaborators ====================

    public Participant setChangeListener(ChangeListener changeListener) {
        checkNotStarted();
        this.changeListener = changeListener;
        return this;
    }

    public Participant setBroadcastBusFactory(BroadcastBusFactory broadcastBusFactory) {
        checkNotStarted();
        this.broadcastBusFactory = broadcastBusFactory;
        return this;
    }

    public Participant setScheduler(Scheduler scheduler) {
        checkNotStarted();
        this.scheduler = scheduler;
        this.ownsScheduler = false;
        return this;
    }

    public Participant setClock(Clock clock) {
        checkNotStarted();
        this.clock = clock;
        return this;
    }

    private void checkNotStarted() {
        if (started.get()) {
            throw new IllegalStateException("Participant " + id + " already started");
        }
    }

    private static void cancel(Cancellable c) {
        if (c != null) {
            c.cancel();
        }
    }

    private static void unsubscribe(Subscription s) {
        if (s == null) {
            return;
        }

        try {
            s.unsubscribe();
        } catch (RuntimeException e) {
            log.debug("unsubscribe failed: {}", e.getMessage());
        }
    }

    // ==================== State Accessors ====================

    public String getId() {
        return id;
    }

    public boolean isLeader() {
        return leader.get();
    }

    /**
     * Rough estimate only: 1 while leader, 2 while follower. The protocol records the
     * owner alone, the number of live followers is unknown.
     */
    public int getParticipantCountEstimate() {
        return leader.get() ? 1 : 2;
    }

    public boolean isReconciling() {
        return reconciling.get();
    }

    public ParticipantState getState() {
        boolean l = leader.get();
        return new ParticipantState(id, l, l ? 1 : 2, reconciling.get());
    }

    /**
     * record seen (or written) by the last reconciliation
     */
    public LeaseRecord getLastKnownRecord() {
        return lastKnownRecord;
    }

    public String getStorageKey() {
        return storageKey;
    }

    public ParticipantConfig getConfig() {
        return config;
    }

    public boolean isHidden() {
        return hidden;
    }

    public boolean isRunning() {
        return started.get() && !closed.get();
    }

    public boolean isClosed() {
        return closed.get();
    }

    public boolean isBroadcastConnected() {
        return broadcastBus != null;
    }

    public long getReconciliationCount() {
        return reconciliations.get();
    }

    /**
     * Get statistics for monitoring.
     */
    public Map<String, Object> getStats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        LeaseRecord rec = lastKnownRecord;
        stats.put("id", id);
        stats.put("storageKey", storageKey);
        stats.put("leader", leader.get());
        stats.put("owner", rec == null ? null : rec.getOwnerId());
        stats.put("participantCountEstimate", getParticipantCountEstimate());
        stats.put("reconciliations", reconciliations.get());
        stats.put("storeErrors", storeErrors.get());
        stats.put("broadcast", broadcastBus != null);
        stats.put("hidden", hidden);
        stats.put("running", isRunning());

        if (rec != null) {
            stats.put("leaseAgeMs", Math.max(0, clock.millis() - rec.getAcquiredAt()));
        }

        return stats;
    }

    @Override
    public String toString() {
        return "Participant{" + id + ", key=" + storageKey + ", leader=" + leader.get() + "}";
    }
}
