package com.splitvault.api.dispute;

import com.splitvault.core.domain.DisputeOutcome;

import java.math.BigInteger;
import java.util.List;

public record DisputeResolution(
        DisputeOutcome outcome,
        boolean locked,
        BigInteger acceptWeight,
        BigInteger declineWeight,
        List<RewardCredit> credits
) {

    public BigInteger totalGovernanceCredited() {
        return credits.stream().map(RewardCredit::governanceReward).reduce(BigInteger.ZERO, BigInteger::add);
    }

    public BigInteger totalBaseCredited() {
        return credits.stream().map(RewardCredit::baseReward).reduce(BigInteger.ZERO, BigInteger::add);
    }
}
