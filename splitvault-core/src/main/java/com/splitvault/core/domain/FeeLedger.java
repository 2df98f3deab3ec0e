package com.splitvault.core.domain;

import com.splitvault.core.exception.FeeReserveExhaustedException;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * Running-balance fee accounting.
 *
 * {@code accruedFees} only grows; {@code remainingFees} is accrued minus withdrawn and
 * never drops below zero. Each account's share of fees accrued since its last withdrawal
 * is proportional to its governance balance at withdrawal time.
 */
public class FeeLedger {

    private BigInteger accruedFees;
    private BigInteger remainingFees;
    private final Map<String, BigInteger> accruedAtLastWithdrawal;

    public FeeLedger() {
        this(BigInteger.ZERO, BigInteger.ZERO, new HashMap<>());
    }

    private FeeLedger(BigInteger accruedFees, BigInteger remainingFees,
                      Map<String, BigInteger> accruedAtLastWithdrawal) {
        this.accruedFees = accruedFees;
        this.remainingFees = remainingFees;
        this.accruedAtLastWithdrawal = accruedAtLastWithdrawal;
    }

    public void accrue(BigInteger fee) {
        Amounts.requireNonNegative(fee, "Fee");
        accruedFees = accruedFees.add(fee);
        remainingFees = remainingFees.add(fee);
    }

    /**
     * Fees accrued since {@code account} last withdrew.
     */
    public BigInteger newFeesFor(String account) {
        return accruedFees.subtract(accruedAtLastWithdrawal.getOrDefault(account, BigInteger.ZERO));
    }

    /**
     * floor(newFees * governanceBalance / governanceSupply); zero when the supply is zero.
     */
    public BigInteger owedShare(String account, BigInteger governanceBalance, BigInteger governanceSupply) {
        BigInteger newFees = newFeesFor(account);
        if (newFees.signum() == 0 || governanceSupply.signum() == 0) {
            return BigInteger.ZERO;
        }
        return Amounts.mulDiv(newFees, governanceBalance, governanceSupply);
    }

    /**
     * Debits {@code share} from the reserve and advances the account's snapshot to the
     * current accrued total.
     */
    public void recordWithdrawal(String account, BigInteger share) {
        Amounts.requireNonNegative(share, "Fee share");
        if (share.compareTo(remainingFees) > 0) {
            throw new FeeReserveExhaustedException(
                    "Fee share " + share + " exceeds remaining fees " + remainingFees);
        }
        remainingFees = remainingFees.subtract(share);
        accruedAtLastWithdrawal.put(account, accruedFees);
    }

    public FeeLedger copy() {
        return new FeeLedger(accruedFees, remainingFees, new HashMap<>(accruedAtLastWithdrawal));
    }

    public BigInteger getAccruedFees() { return accruedFees; }
    public BigInteger getRemainingFees() { return remainingFees; }

    public BigInteger accruedAtLastWithdrawal(String account) {
        return accruedAtLastWithdrawal.getOrDefault(account, BigInteger.ZERO);
    }
}
