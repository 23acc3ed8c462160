package de.caluga.solo;

/**
 * Outcome of evaluating the current lease record for one participant.
 * See {@link LeaseRules#decide(LeaseRecord, String, long, long)}.
 */
public enum LeaseDecision {
    /**
     * No record, or the stored value could not be parsed.
     */
    CLAIM_ABSENT,

    /**
     * A record exists but its owner missed the timeout - treated as dead.
     */
    CLAIM_EXPIRED,

    /**
     * The caller already owns a live record and refreshes its timestamp.
     */
    RENEW,

    /**
     * Another live owner exists.
     */
    FOLLOW;

    /**
     * true if the decision results in a write of {callerId, now}
     */
    public boolean writesLease() {
        return this != FOLLOW;
    }

    public boolean isClaim() {
        return this == CLAIM_ABSENT || this == CLAIM_EXPIRED;
    }
}
