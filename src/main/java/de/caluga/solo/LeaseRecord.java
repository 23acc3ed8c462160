package de.caluga.solo;

import java.util.Objects;

/**
 * The single shared value recording the current owner of a namespace and the
 * time of its last claim or heartbeat.
 * <p>
 * Instances are immutable. Staleness is never stored, it is derived by readers
 * from {@link #getAcquiredAt()}.
 */
public final class LeaseRecord {
    private final String ownerId;
    private final long acquiredAt;

    public LeaseRecord(String ownerId, long acquiredAt) {
        this.ownerId = Objects.requireNonNull(ownerId, "ownerId");
        this.acquiredAt = acquiredAt;
    }

    public String getOwnerId() {
        return ownerId;
    }

    /**
     * epoch milliseconds of the last claim or renewal
     */
    public long getAcquiredAt() {
        return acquiredAt;
    }

    public long ageAt(long now) {
        return now - acquiredAt;
    }

    public boolean isOwnedBy(String participantId) {
        return ownerId.equals(participantId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LeaseRecord)) return false;
        LeaseRecord that = (LeaseRecord) o;
        return acquiredAt == that.acquiredAt && ownerId.equals(that.ownerId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ownerId, acquiredAt);
    }

    @Override
    public String toString() {
        return "LeaseRecord{" +
                "ownerId='" + ownerId + '\'' +
                ", acquiredAt=" + acquiredAt +
                '}';
    }
}
