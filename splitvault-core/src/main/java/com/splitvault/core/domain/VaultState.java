package com.splitvault.core.domain;

import com.splitvault.core.exception.DisputeNotOpenException;

import java.util.Optional;

/**
 * The single mutable record a vault operation works on: lock flag, dispute slot,
 * fee ledger and reward ledger.
 *
 * A vault starts locked with an empty dispute slot. {@code locked} only ever goes
 * from true to false.
 */
public class VaultState {

    private boolean locked;
    private Dispute dispute;
    private FeeLedger fees;
    private RewardLedger rewards;

    public VaultState() {
        this.locked = true;
        this.fees = new FeeLedger();
        this.rewards = new RewardLedger();
    }

    public boolean isLocked() {
        return locked;
    }

    public void unlock() {
        locked = false;
    }

    public DisputePhase disputePhase() {
        return dispute != null && dispute.isOpen() ? DisputePhase.OPEN : DisputePhase.CLOSED;
    }

    public Optional<Dispute> currentDispute() {
        return Optional.ofNullable(dispute);
    }

    public Dispute requireOpenDispute() {
        if (disputePhase() != DisputePhase.OPEN) {
            throw new DisputeNotOpenException("No dispute is open");
        }
        return dispute;
    }

    /**
     * Replaces the slot; the previous dispute and its votes are discarded.
     */
    public void replaceDispute(Dispute next) {
        this.dispute = next;
    }

    public FeeLedger fees() {
        return fees;
    }

    public RewardLedger rewards() {
        return rewards;
    }

    public VaultState copy() {
        VaultState copy = new VaultState();
        copy.locked = locked;
        copy.dispute = dispute == null ? null : dispute.copy();
        copy.fees = fees.copy();
        copy.rewards = rewards.copy();
        return copy;
    }

    /**
     * Rolls this state back to a checkpoint taken with {@link #copy()}.
     */
    public void restore(VaultState checkpoint) {
        VaultState source = checkpoint.copy();
        this.locked = source.locked;
        this.dispute = source.dispute;
        this.fees = source.fees;
        this.rewards = source.rewards;
    }
}
