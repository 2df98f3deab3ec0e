package com.splitvault.core.domain;

import java.math.BigInteger;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * Pending dispute rewards per account, in the base and governance currencies.
 * Credited by resolution, drained to zero by withdrawal.
 */
public class RewardLedger {

    private final Map<RewardCurrency, Map<String, BigInteger>> pending;

    public RewardLedger() {
        this.pending = new EnumMap<>(RewardCurrency.class);
        for (RewardCurrency currency : RewardCurrency.values()) {
            pending.put(currency, new HashMap<>());
        }
    }

    public void credit(RewardCurrency currency, String account, BigInteger amount) {
        Amounts.requireAccount(account, "Account");
        Amounts.requireNonNegative(amount, "Reward");
        if (amount.signum() > 0) {
            pending.get(currency).merge(account, amount, BigInteger::add);
        }
    }

    public BigInteger pending(RewardCurrency currency, String account) {
        return pending.get(currency).getOrDefault(account, BigInteger.ZERO);
    }

    /**
     * Removes and returns the account's whole pending balance.
     */
    public BigInteger drain(RewardCurrency currency, String account) {
        BigInteger amount = pending.get(currency).remove(account);
        return amount == null ? BigInteger.ZERO : amount;
    }

    public BigInteger total(RewardCurrency currency) {
        return pending.get(currency).values().stream().reduce(BigInteger.ZERO, BigInteger::add);
    }

    public RewardLedger copy() {
        RewardLedger copy = new RewardLedger();
        pending.forEach((currency, balances) -> copy.pending.get(currency).putAll(balances));
        return copy;
    }
}
