package com.splitvault.api.vault;

import com.splitvault.api.dispute.DisputeResolution;
import com.splitvault.api.dispute.RewardCredit;
import com.splitvault.core.domain.DisputeOutcome;
import com.splitvault.core.domain.VoteSide;
import net.jqwik.api.*;
import net.jqwik.api.constraints.*;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for dispute settlement.
 *
 * Winners recover their stake plus a floor-divided share of the losing side; credits never
 * exceed what the vault holds, and the rounding dust is below one unit per winning entry.
 */
class DisputeSettlementPropertyTest {

    @Property(tries = 200)
    void settlementNeverOverpays(
            @ForAll @Size(min = 1, max = 8) List<@IntRange(min = 1, max = 10_000) Integer> weights,
            @ForAll @Size(min = 8, max = 8) List<Boolean> acceptSides,
            @ForAll @LongRange(min = 0, max = 1_000_000) long converted) {

        VaultFixture fixture = new VaultFixture();
        VaultService vault = fixture.vault;
        if (converted > 0) {
            fixture.convert("alice", converted);
        }
        BigInteger deposit = fixture.initiate("bob").initiationAmount();

        BigInteger accept = BigInteger.ZERO;
        BigInteger decline = BigInteger.ZERO;
        for (int i = 0; i < weights.size(); i++) {
            VoteSide side = acceptSides.get(i) ? VoteSide.ACCEPT : VoteSide.DECLINE;
            fixture.vote("voter-" + i, side, weights.get(i));
            if (side == VoteSide.ACCEPT) {
                accept = accept.add(BigInteger.valueOf(weights.get(i)));
            } else {
                decline = decline.add(BigInteger.valueOf(weights.get(i)));
            }
        }
        fixture.afterVoting();

        DisputeResolution resolution = vault.resolveDispute("bob");
        BigInteger totalStake = accept.add(decline);
        int winners = resolution.credits().size();

        boolean acceptWins = accept.compareTo(decline) > 0;
        assertThat(resolution.outcome()).isEqualTo(acceptWins ? DisputeOutcome.ACCEPTED : DisputeOutcome.DECLINED);
        assertThat(resolution.locked()).isEqualTo(!acceptWins);

        for (RewardCredit credit : resolution.credits()) {
            assertThat(credit.side()).isEqualTo(acceptWins ? VoteSide.ACCEPT : VoteSide.DECLINE);
            assertThat(credit.governanceReward()).isGreaterThanOrEqualTo(credit.stake());
        }
        assertThat(resolution.totalGovernanceCredited()).isLessThanOrEqualTo(totalStake);
        assertThat(totalStake.subtract(resolution.totalGovernanceCredited()))
                .isLessThan(BigInteger.valueOf(winners));

        if (acceptWins) {
            assertThat(resolution.totalBaseCredited()).isZero();
            assertThat(fixture.base.balanceOf("bob")).isEqualTo(deposit);
        } else {
            assertThat(resolution.totalBaseCredited()).isLessThanOrEqualTo(deposit);
            assertThat(deposit.subtract(resolution.totalBaseCredited()))
                    .isLessThan(BigInteger.valueOf(winners));
        }

        for (int i = 0; i < weights.size(); i++) {
            String voter = "voter-" + i;
            if (vault.pendingGovernanceReward(voter).signum() > 0) {
                vault.withdrawGovernanceTokenReward(voter);
            }
            if (vault.pendingBaseReward(voter).signum() > 0) {
                vault.withdrawBaseTokenReward(voter);
            }
        }
        assertThat(vault.reconcile().solvent()).isTrue();
    }
}
