package de.caluga.solo.broadcast;

import java.util.Objects;

/**
 * Notification sent between participants of one namespace. Carries no lease data,
 * receivers always re-read the store.
 */
public final class BroadcastMessage {

    public enum Kind {
        /**
         * sender has just claimed the lease
         */
        LEADERSHIP_CHANGED,
        /**
         * sender released its lease during shutdown
         */
        CLOSING
    }

    private final Kind kind;
    private final String senderId;
    private final long sentAt;

    public BroadcastMessage(Kind kind, String senderId, long sentAt) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.senderId = Objects.requireNonNull(senderId, "senderId");
        this.sentAt = sentAt;
    }

    public static BroadcastMessage leadershipChanged(String senderId, long now) {
        return new BroadcastMessage(Kind.LEADERSHIP_CHANGED, senderId, now);
    }

    public static BroadcastMessage closing(String senderId, long now) {
        return new BroadcastMessage(Kind.CLOSING, senderId, now);
    }

    public Kind getKind() {
        return kind;
    }

    public String getSenderId() {
        return senderId;
    }

    public long getSentAt() {
        return sentAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BroadcastMessage)) return false;
        BroadcastMessage that = (BroadcastMessage) o;
        return sentAt == that.sentAt && kind == that.kind && senderId.equals(that.senderId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, senderId, sentAt);
    }

    @Override
    public String toString() {
        return "BroadcastMessage{" +
                "kind=" + kind +
                ", senderId='" + senderId + '\'' +
                ", sentAt=" + sentAt +
                '}';
    }
}
