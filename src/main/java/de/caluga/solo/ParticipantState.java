package de.caluga.solo;

/**
 * Snapshot of a participant's observable state.
 */
public final class ParticipantState {
    private final String id;
    private final boolean leader;
    private final int participantCountEstimate;
    private final boolean reconciling;

    public ParticipantState(String id, boolean leader, int participantCountEstimate, boolean reconciling) {
        this.id = id;
        this.leader = leader;
        this.participantCountEstimate = participantCountEstimate;
        this.reconciling = reconciling;
    }

    public String getId() {
        return id;
    }

    public boolean isLeader() {
        return leader;
    }

    /**
     * 1 when leader, 2 otherwise. See {@link Participant#getParticipantCountEstimate()}.
     */
    public int getParticipantCountEstimate() {
        return participantCountEstimate;
    }

    public boolean isReconciling() {
        return reconciling;
    }

    @Override
    public String toString() {
        return "ParticipantState{" +
                "id='" + id + '\'' +
                ", leader=" + leader +
                ", participantCountEstimate=" + participantCountEstimate +
                ", reconciling=" + reconciling +
                '}';
    }
}
