package com.splitvault.api.vault;

import com.splitvault.api.conversion.ConversionReceipt;
import com.splitvault.core.domain.VoteSide;
import net.jqwik.api.*;
import net.jqwik.api.constraints.*;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for conversion and redemption.
 *
 * Every converted unit is either minted as a claim pair or kept as fee; redeeming the
 * pair returns exactly the minted amount.
 */
class ConversionPropertyTest {

    @Property(tries = 200)
    void conversionSplitsIntoFeeAndClaimPair(
            @ForAll @LongRange(min = 1, max = 1_000_000_000_000L) long amount) {

        VaultFixture fixture = new VaultFixture();
        ConversionReceipt receipt = fixture.convert("holder", amount);
        VaultService vault = fixture.vault;

        assertThat(receipt.fee()).isEqualTo(BigInteger.valueOf(amount / 100));
        assertThat(receipt.fee().add(receipt.minted())).isEqualTo(BigInteger.valueOf(amount));
        assertThat(vault.cToken().totalSupply()).isEqualTo(receipt.minted());
        assertThat(vault.iToken().totalSupply()).isEqualTo(receipt.minted());
        assertThat(vault.accruedFees()).isEqualTo(receipt.fee());
        assertThat(vault.reconcile().baseSurplus()).isZero();
    }

    @Property(tries = 100)
    void lockedRoundTripReturnsMintedAmount(
            @ForAll @LongRange(min = 1, max = 10_000_000L) long amount,
            @ForAll @IntRange(min = 1, max = 100) int redeemPercent) {

        VaultFixture fixture = new VaultFixture();
        VaultService vault = fixture.vault;
        BigInteger minted = fixture.convert("holder", amount).minted();
        BigInteger redeemed = minted.multiply(BigInteger.valueOf(redeemPercent)).divide(BigInteger.valueOf(100));
        Assume.that(redeemed.signum() > 0);

        vault.redeem("holder", redeemed);

        assertThat(fixture.base.balanceOf("holder")).isEqualTo(redeemed);
        assertThat(vault.cToken().balanceOf("holder")).isEqualTo(minted.subtract(redeemed));
        assertThat(vault.iToken().balanceOf("holder")).isEqualTo(minted.subtract(redeemed));
        assertThat(vault.cToken().totalSupply()).isEqualTo(vault.iToken().totalSupply());
        assertThat(vault.reconcile().solvent()).isTrue();
    }

    @Property(tries = 100)
    void unlockedRedemptionPaysAmountForITokenAlone(
            @ForAll @LongRange(min = 1, max = 10_000_000L) long amount,
            @ForAll @IntRange(min = 1, max = 100) int redeemPercent) {

        VaultFixture fixture = new VaultFixture();
        VaultService vault = fixture.vault;
        BigInteger minted = fixture.convert("holder", amount).minted();
        BigInteger redeemed = minted.multiply(BigInteger.valueOf(redeemPercent)).divide(BigInteger.valueOf(100));
        Assume.that(redeemed.signum() > 0);

        fixture.initiate("initiator");
        fixture.vote("voter", VoteSide.ACCEPT, 1);
        fixture.afterVoting();
        vault.resolveDispute("initiator");
        assertThat(vault.isLocked()).isFalse();

        vault.redeem("holder", redeemed);

        assertThat(fixture.base.balanceOf("holder")).isEqualTo(redeemed);
        assertThat(vault.iToken().balanceOf("holder")).isEqualTo(minted.subtract(redeemed));
        assertThat(vault.cToken().balanceOf("holder")).isEqualTo(minted);
        assertThat(vault.reconcile().solvent()).isTrue();
    }

    @Property(tries = 100)
    void feesAccumulateAcrossConversions(
            @ForAll @Size(min = 1, max = 20) List<@LongRange(min = 1, max = 100_000) Long> amounts) {

        VaultFixture fixture = new VaultFixture();
        long expectedFees = 0;
        for (long amount : amounts) {
            fixture.convert("holder", amount);
            expectedFees += amount / 100;
        }

        assertThat(fixture.vault.accruedFees()).isEqualTo(BigInteger.valueOf(expectedFees));
        assertThat(fixture.vault.remainingFees()).isEqualTo(BigInteger.valueOf(expectedFees));
    }
}
