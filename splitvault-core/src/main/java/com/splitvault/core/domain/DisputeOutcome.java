package com.splitvault.core.domain;

public enum DisputeOutcome {
    /** Accept weight strictly exceeded decline weight; the vault unlocks. */
    ACCEPTED,
    /** Decline weight matched or exceeded accept weight. */
    DECLINED,
    /** No vote was cast; the initiator's deposit was returned. */
    UNVOTED
}
