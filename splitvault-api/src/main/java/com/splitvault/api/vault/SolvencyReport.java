package com.splitvault.api.vault;

import java.math.BigInteger;

/**
 * Holdings versus obligations per currency.
 *
 * Base obligations: outstanding iToken supply, fees still held, pending base rewards and
 * the deposit of an open dispute. Governance obligations: pending governance rewards and
 * the stake locked in an open dispute.
 */
public record SolvencyReport(
        BigInteger baseHoldings,
        BigInteger baseObligations,
        BigInteger governanceHoldings,
        BigInteger governanceObligations
) {

    public BigInteger baseSurplus() {
        return baseHoldings.subtract(baseObligations);
    }

    public BigInteger governanceSurplus() {
        return governanceHoldings.subtract(governanceObligations);
    }

    public boolean solvent() {
        return baseSurplus().signum() >= 0 && governanceSurplus().signum() >= 0;
    }
}
