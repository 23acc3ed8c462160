package de.caluga.test.solo;

import de.caluga.solo.LeaseRecord;
import de.caluga.solo.Participant;
import de.caluga.solo.ParticipantConfig;
import de.caluga.solo.ParticipantState;
import de.caluga.solo.store.InMemoryLeaseStore;
import de.caluga.solo.store.InMemoryStorage;
import de.caluga.solo.store.LeaseRecordCodec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic tests of the lease protocol, driven by virtual time.
 */
public class ParticipantTest {
    private static final Logger log = LoggerFactory.getLogger(ParticipantTest.class);
    private static final String KEY = "single-owner-my-app";

    private MutableClock clock;
    private ManualScheduler scheduler;
    private InMemoryStorage storage;
    private final List<Participant> participants = new ArrayList<>();

    private final AtomicInteger becameLeader = new AtomicInteger();
    private final AtomicInteger lostLeadership = new AtomicInteger();
    private final AtomicInteger otherDetected = new AtomicInteger();

    @BeforeEach
    void setup() {
        clock = new MutableClock(0);
        scheduler = new ManualScheduler(clock);
        storage = new InMemoryStorage();
    }

    @AfterEach
    void cleanup() {
        for (Participant p : participants) {
            try {
                p.close();
            } catch (Exception e) {
                log.debug("Error closing participant: {}", e.getMessage());
            }
        }

        participants.clear();
    }

    private ParticipantConfig config() {
        return new ParticipantConfig()
                .setTimeoutMs(5000)
                .setIntervalMs(1000)
                .setDebounceMs(100)
                .setRegisterShutdownHook(false);
    }

    private ParticipantConfig countingConfig() {
        return config()
                .setOnBecomeLeader(becameLeader::incrementAndGet)
                .setOnLoseLeadership(lostLeadership::incrementAndGet)
                .setOnOtherDetected(otherDetected::incrementAndGet);
    }

    private Participant participant(String id, ParticipantConfig cfg) {
        Participant p = new Participant(cfg, storage.openContext(id), () -> id)
                .setScheduler(scheduler)
                .setClock(clock);
        participants.add(p);
        return p;
    }

    private void writeForeign(String owner, long acquiredAt) throws Exception {
        storage.openContext("external").set(KEY, new LeaseRecord(owner, acquiredAt));
    }

    @Test
    void testBecomesLeaderWhenNoRecordExists() {
        Participant p = participant("A", countingConfig());
        p.start();

        assertTrue(p.isLeader());
        assertEquals(1, p.getParticipantCountEstimate());
        assertEquals(new LeaseRecord("A", 0), p.readCurrentRecord());
        assertEquals(1, becameLeader.get());
        assertEquals(0, otherDetected.get());
    }

    @Test
    void testAbsentRecordAlwaysClaimedForAnyId() throws Exception {
        for (String id : List.of("tab-1", "participant-xyz", "ä-ö-ü", "A")) {
            storage.clear();
            Participant p = participant(id, config());
            p.reconcileNow();

            assertTrue(p.isLeader(), "claim failed for " + id);
            assertEquals(id, storage.openContext().get(KEY).getOwnerId());
        }
    }

    @Test
    void testStaysFollowerWhileOtherOwnerIsAlive() throws Exception {
        writeForeign("A", 0);
        Participant b = participant("B", countingConfig());
        clock.setMillis(5000);
        b.reconcileNow();

        assertFalse(b.isLeader());
        assertEquals(2, b.getParticipantCountEstimate());
        assertEquals(1, otherDetected.get());
        assertEquals(0, becameLeader.get());
        assertEquals("A", b.readCurrentRecord().getOwnerId());
    }

    @Test
    void testTakeoverScenario() throws Exception {
        writeForeign("A", 0);
        Participant b = participant("B", countingConfig());

        clock.setMillis(3000);
        b.reconcileNow();
        assertFalse(b.isLeader());
        assertEquals(1, otherDetected.get());

        clock.setMillis(6000);
        b.reconcileNow();
        assertTrue(b.isLeader());
        assertEquals(new LeaseRecord("B", 6000), b.readCurrentRecord());
        assertEquals(1, becameLeader.get());
        assertEquals(0, lostLeadership.get());
        assertEquals(1, otherDetected.get());
    }

    @Test
    void testExpiredRecordIsClaimedByWhoeverReconcilesFirst() throws Exception {
        writeForeign("dead", 0);
        Participant b = participant("B", config());
        Participant c = participant("C", config());

        clock.setMillis(5001);
        c.reconcileNow();
        b.reconcileNow();

        assertTrue(c.isLeader());
        assertFalse(b.isLeader());
        assertEquals("C", storage.openContext().get(KEY).getOwnerId());
    }

    @Test
    void testMalformedRecordIsTreatedAsAbsent() throws Exception {
        storage.putRaw(KEY, "{not json");
        Participant p = participant("A", countingConfig());
        p.reconcileNow();

        assertTrue(p.isLeader());
        assertEquals(1, becameLeader.get());
        assertEquals("A", LeaseRecordCodec.decode(storage.getRaw(KEY)).getOwnerId());

        storage.putRaw(KEY, "{\"id\":\"B\",\"timestamp\":0}");
        p.reconcileNow();
        assertTrue(p.isLeader());
        assertEquals(0, otherDetected.get());
    }

    @Test
    void testLeaderRenewalIsIdempotent() throws Exception {
        Participant a = participant("A", countingConfig());
        a.start();

        long previous = a.readCurrentRecord().getAcquiredAt();

        for (int i = 0; i < 5; i++) {
            scheduler.advance(1000);
            LeaseRecord rec = a.readCurrentRecord();

            assertTrue(a.isLeader());
            assertEquals("A", rec.getOwnerId());
            assertTrue(rec.getAcquiredAt() >= previous);
            assertEquals(clock.millis(), rec.getAcquiredAt());
            previous = rec.getAcquiredAt();
        }

        a.reconcileNow();
        a.reconcileNow();

        assertEquals(1, becameLeader.get());
        assertEquals(0, lostLeadership.get());
    }

    @Test
    void testSettledFollowerDoesNotWrite() throws Exception {
        writeForeign("A", 0);
        Participant b = participant("B", countingConfig());
        b.start();
        long writes = storage.getWriteCount();

        scheduler.advance(1000);
        scheduler.advance(1000);
        b.reconcileNow();

        assertFalse(b.isLeader());
        assertEquals(writes, storage.getWriteCount());
        assertEquals(new LeaseRecord("A", 0), b.readCurrentRecord());
        assertEquals(4, otherDetected.get());
        assertEquals(0, lostLeadership.get());
    }

    @Test
    void testForceAcquireUsurpsLiveLeader() {
        AtomicInteger aLost = new AtomicInteger();
        Participant a = participant("A", config().setOnLoseLeadership(aLost::incrementAndGet));
        Participant b = participant("B", countingConfig());
        a.start();
        b.start();
        assertTrue(a.isLeader());
        assertFalse(b.isLeader());

        clock.advance(10);
        b.forceAcquire();

        assertTrue(b.isLeader());
        assertEquals(new LeaseRecord("B", 10), b.readCurrentRecord());
        assertEquals(1, becameLeader.get());
        //incumbent does not know yet
        assertTrue(a.isLeader());

        //change notification reaches A, debounced
        scheduler.advance(100);
        assertFalse(a.isLeader());
        assertEquals(1, aLost.get());
        assertTrue(b.isLeader());
    }

    @Test
    void testForceAcquireWhenAlreadyLeader() {
        Participant a = participant("A", countingConfig());
        a.start();
        clock.advance(500);
        a.forceAcquire();

        assertTrue(a.isLeader());
        assertEquals(500, a.readCurrentRecord().getAcquiredAt());
        assertEquals(1, becameLeader.get());
    }

    @Test
    void testForceAcquireWithBrokenStore() {
        Participant a = participant("A", countingConfig());
        storage.setFailWrites(true);
        a.forceAcquire();

        assertTrue(a.isLeader());
        assertNull(storage.getRaw(KEY));
    }

    @Test
    void testGracefulShutdownReleasesOwnLease() {
        Participant a = participant("A", config());
        Participant b = participant("B", countingConfig());
        a.start();
        b.start();
        assertFalse(b.isLeader());

        a.close();

        assertNull(storage.getRaw(KEY));
        assertEquals(1, storage.getDeleteCount());
        assertFalse(a.isLeader());

        //follower reacts to the deletion after the debounce, long before the timeout
        scheduler.advance(100);
        assertTrue(b.isLeader());
        assertEquals(1, becameLeader.get());
        assertEquals(100, b.readCurrentRecord().getAcquiredAt());
    }

    @Test
    void testShutdownDoesNotDeleteForeignLease() throws Exception {
        writeForeign("A", 0);
        Participant b = participant("B", config());
        b.start();
        b.close();

        assertEquals(new LeaseRecord("A", 0), storage.openContext().get(KEY));
        assertEquals(0, storage.getDeleteCount());
    }

    @Test
    void testShutdownAfterUnnoticedTakeoverKeepsNewOwnersLease() {
        Participant a = participant("A", config());
        Participant b = participant("B", config());
        a.start();
        b.start();
        b.forceAcquire();

        //A has not reconciled since and still believes it leads
        assertTrue(a.isLeader());
        a.close();

        assertEquals("B", b.readCurrentRecord().getOwnerId());
        assertEquals(0, storage.getDeleteCount());
    }

    @Test
    void testCloseIsIdempotentAndDeregistersEverything() throws Exception {
        writeForeign("A", 0);
        Participant b = participant("B", countingConfig());
        b.start();

        //triggers the debounce
        writeForeign("A", 10);
        assertEquals(2, scheduler.pendingCount());

        b.close();
        b.close();
        assertEquals(0, scheduler.pendingCount());
        assertTrue(b.isClosed());
        assertFalse(b.isRunning());

        long reconciliations = b.getReconciliationCount();
        writeForeign("A", 20);
        scheduler.advance(5000);
        b.reconcileNow();
        assertEquals(reconciliations, b.getReconciliationCount());
        assertEquals(0, scheduler.pendingCount());
        assertThrows(IllegalStateException.class, b::start);
        assertThrows(IllegalStateException.class, b::forceAcquire);
    }

    @Test
    void testHiddenLeaderRenewsInsteadOfReleasing() {
        Participant a = participant("A", countingConfig());
        a.start();
        clock.setMillis(2500);

        a.setHidden(true);

        assertTrue(a.isLeader());
        assertTrue(a.isHidden());
        assertEquals(new LeaseRecord("A", 2500), a.readCurrentRecord());
        assertEquals(0, storage.getDeleteCount());
        assertEquals(1, becameLeader.get());
        assertEquals(0, lostLeadership.get());
    }

    @Test
    void testHiddenFollowerDoesNotWrite() throws Exception {
        writeForeign("A", 0);
        Participant b = participant("B", config());
        b.start();
        long writes = storage.getWriteCount();

        b.setHidden(true);
        assertEquals(writes, storage.getWriteCount());
        assertFalse(b.isLeader());

        clock.setMillis(6000);
        b.setHidden(false);
        assertTrue(b.isLeader());
    }

    @Test
    void testReadFailureFailsSafeToLeader() throws Exception {
        writeForeign("A", 0);
        Participant b = participant("B", countingConfig());
        b.start();
        assertFalse(b.isLeader());

        storage.setFailReads(true);
        scheduler.advance(1000);

        assertTrue(b.isLeader());
        assertEquals(1, becameLeader.get());
        assertNull(b.readCurrentRecord());
        assertEquals(1L, b.getStats().get("storeErrors"));
    }

    @Test
    void testWriteFailureFailsSafeToLeader() {
        storage.setFailWrites(true);
        Participant a = participant("A", countingConfig());
        a.start();

        assertTrue(a.isLeader());
        assertEquals(1, becameLeader.get());
        assertNull(storage.getRaw(KEY));
    }

    @Test
    void testStoreErrorsDoNotStopTheTicks() {
        storage.setFailReads(true);
        Participant a = participant("A", config());
        a.start();
        long before = a.getReconciliationCount();

        scheduler.advance(3000);
        assertEquals(before + 3, a.getReconciliationCount());

        storage.setFailReads(false);
        scheduler.advance(1000);
        assertEquals(new LeaseRecord("A", 4000), a.readCurrentRecord());
    }

    @Test
    void testCallbackExceptionDoesNotBreakReconciliation() {
        Participant a = participant("A", config().setOnBecomeLeader(() -> {
            throw new IllegalStateException("callback failed");
        }));
        a.start();
        assertTrue(a.isLeader());

        scheduler.advance(1000);
        assertEquals(1000, a.readCurrentRecord().getAcquiredAt());
    }

    @Test
    void testEdgeTriggeredCallbacksAcrossTransitions() throws Exception {
        Participant b = participant("B", countingConfig());
        b.start();
        assertEquals(1, becameLeader.get());

        //someone else claims a fresh lease
        clock.advance(10);
        writeForeign("A", clock.millis());
        scheduler.advance(100);
        assertFalse(b.isLeader());
        assertEquals(1, lostLeadership.get());
        assertEquals(1, otherDetected.get());

        //followers see A on every tick, no further transitions
        scheduler.advance(2000);
        assertEquals(1, lostLeadership.get());
        assertEquals(1, becameLeader.get());
        assertEquals(3, otherDetected.get());

        //A dies, B takes over once
        scheduler.advance(5000);
        assertTrue(b.isLeader());
        assertEquals(2, becameLeader.get());
        assertEquals(1, lostLeadership.get());
    }

    @Test
    void testChangeNotificationsAreDebouncedAndCoalesced() throws Exception {
        writeForeign("A", 0);
        Participant b = participant("B", config());
        b.start();
        long before = b.getReconciliationCount();

        for (int i = 1; i <= 5; i++) {
            writeForeign("A", i);
        }

        scheduler.advance(50);
        assertEquals(before, b.getReconciliationCount());

        scheduler.advance(50);
        assertEquals(before + 1, b.getReconciliationCount());

        //a new burst after the debounce fired schedules a new one
        writeForeign("A", 200);
        scheduler.advance(100);
        assertEquals(before + 2, b.getReconciliationCount());
    }

    @Test
    void testOwnWritesDoNotTriggerReconciliation() {
        Participant a = participant("A", config());
        a.start();

        //only the periodic tick is pending, the own write scheduled nothing
        assertEquals(1, scheduler.pendingCount());
    }

    @Test
    void testRaceConvergesByNextTick() {
        AtomicReference<Participant> bRef = new AtomicReference<>();
        AtomicBoolean interleaved = new AtomicBoolean(false);
        InMemoryLeaseStore aContext = storage.openContext("A");

        //A's read returns, then B runs a complete pass before A writes
        InterleavingLeaseStore aStore = new InterleavingLeaseStore(aContext, () -> {
            if (interleaved.compareAndSet(false, true)) {
                bRef.get().reconcileNow();
            }
        });

        AtomicInteger aBecame = new AtomicInteger();
        AtomicInteger bLost = new AtomicInteger();
        Participant a = new Participant(config().setOnBecomeLeader(aBecame::incrementAndGet), aStore, () -> "A")
                .setScheduler(scheduler).setClock(clock);
        Participant b = participant("B", config().setOnLoseLeadership(bLost::incrementAndGet));
        participants.add(a);
        bRef.set(b);

        a.reconcileNow();

        //split ownership: both claimed the absent record in the same tick
        assertTrue(a.isLeader());
        assertTrue(b.isLeader());
        assertEquals("A", a.readCurrentRecord().getOwnerId());

        //next tick: the loser observes the other id and steps down
        clock.advance(1000);
        b.reconcileNow();
        a.reconcileNow();

        assertTrue(a.isLeader());
        assertFalse(b.isLeader());
        assertEquals(1, bLost.get());
        assertEquals(1, aBecame.get());
        assertEquals(new LeaseRecord("A", 1000), a.readCurrentRecord());
    }

    @Test
    void testReconciliationIsNotReentrant() {
        AtomicReference<Participant> ref = new AtomicReference<>();
        AtomicBoolean reconcilingInCallback = new AtomicBoolean(false);
        Participant a = participant("A", config().setOnBecomeLeader(() -> {
            reconcilingInCallback.set(ref.get().isReconciling());
            ref.get().reconcileNow();
        }));
        ref.set(a);

        a.reconcileNow();

        assertTrue(reconcilingInCallback.get());
        assertFalse(a.isReconciling());
        //the nested request ran once, after the first pass completed
        assertEquals(2, a.getReconciliationCount());
        assertTrue(a.isLeader());
    }

    @Test
    void testStateSnapshotAndStats() throws Exception {
        writeForeign("A", 0);
        Participant b = participant("B", config());
        b.start();

        ParticipantState state = b.getState();
        assertEquals("B", state.getId());
        assertFalse(state.isLeader());
        assertEquals(2, state.getParticipantCountEstimate());
        assertFalse(state.isReconciling());

        clock.setMillis(700);
        Map<String, Object> stats = b.getStats();
        assertEquals("A", stats.get("owner"));
        assertEquals(700L, stats.get("leaseAgeMs"));
        assertEquals(KEY, stats.get("storageKey"));
        assertEquals(true, stats.get("running"));
    }

    @Test
    void testNamespacesAreIndependent() {
        Participant a = participant("A", config().setNamespace("billing"));
        Participant b = participant("B", config().setNamespace("reports"));
        a.start();
        b.start();

        assertTrue(a.isLeader());
        assertTrue(b.isLeader());
        assertEquals("single-owner-billing", a.getStorageKey());
        assertNotNull(storage.getRaw("single-owner-reports"));
    }

    @Test
    void testCollaboratorsCannotBeChangedAfterStart() {
        Participant a = participant("A", config());
        a.start();

        assertThrows(IllegalStateException.class, () -> a.setClock(clock));
        assertThrows(IllegalStateException.class, () -> a.setScheduler(scheduler));
    }
}
