package com.splitvault.core.domain;

import java.math.BigInteger;

/**
 * One locked stake on one side of the current dispute. Re-votes append further entries.
 */
public record Vote(String voter, VoteSide side, BigInteger weight) {

    public Vote {
        Amounts.requireAccount(voter, "Voter");
        if (side == null) {
            throw new IllegalArgumentException("Vote side is required");
        }
        Amounts.requirePositive(weight, "Vote weight");
    }
}
