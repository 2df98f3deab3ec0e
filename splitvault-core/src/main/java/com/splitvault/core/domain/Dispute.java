package com.splitvault.core.domain;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The single dispute slot of a vault together with its ordered vote sequence.
 *
 * A new dispute starts open with zero weights and an empty vote list; it only ever
 * moves to closed.
 */
public class Dispute {

    private final String initiator;
    private final BigInteger initiationAmount;
    private final Instant endTime;
    private final List<Vote> votes;
    private BigInteger acceptWeight;
    private BigInteger declineWeight;
    private boolean open;

    private Dispute(String initiator, BigInteger initiationAmount, Instant endTime,
                    List<Vote> votes, BigInteger acceptWeight, BigInteger declineWeight, boolean open) {
        this.initiator = initiator;
        this.initiationAmount = initiationAmount;
        this.endTime = endTime;
        this.votes = votes;
        this.acceptWeight = acceptWeight;
        this.declineWeight = declineWeight;
        this.open = open;
    }

    public static Dispute open(String initiator, BigInteger initiationAmount, Instant endTime) {
        Amounts.requireAccount(initiator, "Initiator");
        Amounts.requireNonNegative(initiationAmount, "Initiation amount");
        Objects.requireNonNull(endTime, "End time cannot be null");
        return new Dispute(initiator, initiationAmount, endTime, new ArrayList<>(),
                BigInteger.ZERO, BigInteger.ZERO, true);
    }

    /**
     * Voting is open up to and including {@code endTime}.
     */
    public boolean acceptsVotesAt(Instant now) {
        return open && !now.isAfter(endTime);
    }

    public boolean resolvableAt(Instant now) {
        return open && now.isAfter(endTime);
    }

    public void recordVote(Vote vote) {
        Objects.requireNonNull(vote, "Vote cannot be null");
        if (!open) {
            throw new IllegalStateException("Cannot vote on a closed dispute");
        }
        votes.add(vote);
        if (vote.side() == VoteSide.ACCEPT) {
            acceptWeight = acceptWeight.add(vote.weight());
        } else {
            declineWeight = declineWeight.add(vote.weight());
        }
    }

    public void close() {
        if (!open) {
            throw new IllegalStateException("Dispute is already closed");
        }
        open = false;
    }

    public boolean hasVotes() {
        return !votes.isEmpty();
    }

    /**
     * Accept strictly above decline; ties, including 0/0, go to decline.
     */
    public boolean acceptPrevails() {
        return acceptWeight.compareTo(declineWeight) > 0;
    }

    public BigInteger totalStake() {
        return acceptWeight.add(declineWeight);
    }

    public Dispute copy() {
        return new Dispute(initiator, initiationAmount, endTime, new ArrayList<>(votes),
                acceptWeight, declineWeight, open);
    }

    public DisputeSnapshot snapshot() {
        return new DisputeSnapshot(initiator, initiationAmount, endTime,
                acceptWeight, declineWeight, open, votes.size());
    }

    public String getInitiator() { return initiator; }
    public BigInteger getInitiationAmount() { return initiationAmount; }
    public Instant getEndTime() { return endTime; }
    public BigInteger getAcceptWeight() { return acceptWeight; }
    public BigInteger getDeclineWeight() { return declineWeight; }
    public boolean isOpen() { return open; }
    public List<Vote> getVotes() { return Collections.unmodifiableList(votes); }
}
