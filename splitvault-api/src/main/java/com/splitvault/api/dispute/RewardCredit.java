package com.splitvault.api.dispute;

import com.splitvault.core.domain.VoteSide;

import java.math.BigInteger;

/**
 * Reward credited for one winning vote entry.
 */
public record RewardCredit(
        String voter,
        VoteSide side,
        BigInteger stake,
        BigInteger governanceReward,
        BigInteger baseReward
) {}
