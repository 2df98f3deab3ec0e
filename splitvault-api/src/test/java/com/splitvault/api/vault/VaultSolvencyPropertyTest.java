package com.splitvault.api.vault;

import com.splitvault.core.domain.VoteSide;
import com.splitvault.core.exception.VaultException;
import net.jqwik.api.*;
import net.jqwik.api.constraints.*;

import java.math.BigInteger;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for vault solvency.
 *
 * For any sequence of operations, the vault holds at least what it owes in both
 * currencies, the claim supplies move together while locked, and a rejected operation
 * changes nothing.
 */
class VaultSolvencyPropertyTest {

    private static final String[] ACTORS = {"alice", "bob", "carol", "dave"};

    record Step(int kind, int actor, long amount) {}

    @Provide
    Arbitrary<Step> steps() {
        return Combinators.combine(
                Arbitraries.integers().between(0, 9),
                Arbitraries.integers().between(0, ACTORS.length - 1),
                Arbitraries.longs().between(1, 5_000)
        ).as(Step::new);
    }

    @Property(tries = 200)
    void vaultStaysSolventUnderAnySequence(@ForAll @Size(min = 1, max = 40) List<@From("steps") Step> steps) {
        VaultFixture fixture = new VaultFixture();
        VaultService vault = fixture.vault;

        for (Step step : steps) {
            Observation before = Observation.of(vault);
            try {
                apply(fixture, step);
            } catch (VaultException rejected) {
                assertThat(Observation.of(vault)).isEqualTo(before);
            }

            SolvencyReport report = vault.reconcile();
            assertThat(report.solvent())
                    .as("solvency after %s: %s", step, report)
                    .isTrue();
            if (vault.isLocked()) {
                assertThat(vault.cToken().totalSupply()).isEqualTo(vault.iToken().totalSupply());
            }
            assertThat(vault.remainingFees()).isLessThanOrEqualTo(vault.accruedFees());
        }
    }

    private static void apply(VaultFixture fixture, Step step) {
        VaultService vault = fixture.vault;
        String actor = ACTORS[step.actor()];
        BigInteger amount = BigInteger.valueOf(step.amount());
        switch (step.kind()) {
            case 0 -> fixture.convert(actor, step.amount());
            case 1 -> vault.redeem(actor, amount);
            case 2 -> fixture.initiate(actor);
            case 3 -> fixture.vote(actor, VoteSide.ACCEPT, step.amount());
            case 4 -> fixture.vote(actor, VoteSide.DECLINE, step.amount());
            case 5 -> fixture.clock.advance(Duration.ofSeconds(step.amount() * 200));
            case 6 -> vault.resolveDispute(actor);
            case 7 -> vault.withdrawOwedFees(actor);
            case 8 -> vault.withdrawGovernanceTokenReward(actor);
            default -> vault.withdrawBaseTokenReward(actor);
        }
    }

    /**
     * Everything a rejected operation must leave untouched.
     */
    record Observation(
            boolean locked,
            BigInteger accruedFees,
            BigInteger remainingFees,
            BigInteger cTokenSupply,
            BigInteger iTokenSupply,
            BigInteger vaultBase,
            BigInteger vaultGovernance,
            Object dispute
    ) {
        static Observation of(VaultService vault) {
            return new Observation(
                    vault.isLocked(),
                    vault.accruedFees(),
                    vault.remainingFees(),
                    vault.cToken().totalSupply(),
                    vault.iToken().totalSupply(),
                    vault.baseAsset().balanceOf(vault.vaultAccount()),
                    vault.governanceAsset().balanceOf(vault.vaultAccount()),
                    vault.getDispute().orElse(null));
        }
    }
}
