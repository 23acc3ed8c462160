package de.caluga.solo;

/**
 * The acquisition rule. Pure function, no store access.
 * <p>
 * Checks are evaluated in a fixed order:
 * <ol>
 * <li>absent or unparsable record: claim</li>
 * <li>{@code now - acquiredAt > timeoutMs}: the owner is considered dead, claim</li>
 * <li>record owned by the caller: renew</li>
 * <li>otherwise follow</li>
 * </ol>
 * There is no compare-and-set behind this. Two callers evaluating the same absent
 * or expired record in the same tick will both be told to claim; the loser finds out
 * on its next evaluation.
 */
public final class LeaseRules {

    private LeaseRules() {
    }

    public static LeaseDecision decide(LeaseRecord current, String callerId, long now, long timeoutMs) {
        if (current == null) {
            return LeaseDecision.CLAIM_ABSENT;
        }

        if (current.ageAt(now) > timeoutMs) {
            return LeaseDecision.CLAIM_EXPIRED;
        }

        if (current.isOwnedBy(callerId)) {
            return LeaseDecision.RENEW;
        }

        return LeaseDecision.FOLLOW;
    }

    public static boolean isExpired(LeaseRecord current, long now, long timeoutMs) {
        return current != null && current.ageAt(now) > timeoutMs;
    }
}
