package com.splitvault.api.dispute;

/**
 * What resolving a dispute that received no votes does.
 */
public enum UnvotedDisputePolicy {
    /** Return the initiation deposit to the initiator and close; the lock flag is untouched. */
    REFUND_INITIATOR,
    /** Fail with NoVotesCast; the dispute stays open. */
    REJECT
}
