package org.cloudvision.scalp.signal.model;

import java.time.Instant;

/**
 * Cached 5-minute bias. Reused unchanged until {@code lockedUntil}.
 */
public class DirectorResult {
    private final DirectorState state;
    private final int biasScore;
    private final DirectorVotes votes;
    private final Instant lockedUntil;
    private final boolean insideCloud;

    public DirectorResult(DirectorState state, int biasScore, DirectorVotes votes,
                          Instant lockedUntil, boolean insideCloud) {
        this.state = state;
        this.biasScore = biasScore;
        this.votes = votes;
        this.lockedUntil = lockedUntil;
        this.insideCloud = insideCloud;
    }

    /**
     * Neutral result for a window that is too short. Never locked.
     */
    public static DirectorResult insufficientData() {
        return new DirectorResult(DirectorState.CHOP, 0, DirectorVotes.none(), Instant.EPOCH, false);
    }

    public DirectorState getState() { return state; }
    public int getBiasScore() { return biasScore; }
    public DirectorVotes getVotes() { return votes; }
    public Instant getLockedUntil() { return lockedUntil; }
    public boolean isInsideCloud() { return insideCloud; }

    public boolean isLockedAt(Instant now) {
        return now.isBefore(lockedUntil);
    }

    @Override
    public String toString() {
        return String.format("Director[%s score=%d %s lockedUntil=%s cloud=%s]",
            state, biasScore, votes, lockedUntil, insideCloud);
    }
}
