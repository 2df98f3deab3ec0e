package com.splitvault.core.asset;

import com.splitvault.core.domain.Amounts;
import com.splitvault.core.exception.InsufficientAllowanceOrBalanceException;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * In-process fungible ledger.
 *
 * Backs the base and governance assets when no chain is configured, and serves as the
 * storage for the vault-issued claim tokens. All methods are synchronized on the ledger.
 */
public class LedgerAsset implements TransferableAsset {

    private final String symbol;
    private final AssetRole role;
    private final Map<String, BigInteger> balances = new HashMap<>();
    private final Map<String, Map<String, BigInteger>> allowances = new HashMap<>();
    private BigInteger totalSupply = BigInteger.ZERO;

    public LedgerAsset(String symbol, AssetRole role) {
        this.symbol = Amounts.requireAccount(symbol, "Symbol");
        this.role = Objects.requireNonNull(role, "Role cannot be null");
    }

    /**
     * Genesis issuance: credits {@code amount} to {@code account} and grows the supply.
     */
    public synchronized void issue(String account, BigInteger amount) {
        Amounts.requireAccount(account, "Account");
        Amounts.requirePositive(amount, "Issue amount");
        credit(account, amount);
        totalSupply = totalSupply.add(amount);
    }

    @Override
    public String symbol() {
        return symbol;
    }

    @Override
    public AssetRole role() {
        return role;
    }

    @Override
    public synchronized BigInteger balanceOf(String account) {
        return balances.getOrDefault(account, BigInteger.ZERO);
    }

    @Override
    public synchronized BigInteger totalSupply() {
        return totalSupply;
    }

    @Override
    public synchronized BigInteger allowance(String owner, String spender) {
        return allowances.getOrDefault(owner, Map.of()).getOrDefault(spender, BigInteger.ZERO);
    }

    @Override
    public synchronized void transfer(String from, String to, BigInteger amount) {
        Amounts.requireAccount(from, "Sender");
        Amounts.requireAccount(to, "Recipient");
        Amounts.requireNonNegative(amount, "Transfer amount");
        if (balanceOf(from).compareTo(amount) < 0) {
            throw new InsufficientAllowanceOrBalanceException(
                    symbol + ": balance of " + from + " is below " + amount);
        }
        debit(from, amount);
        credit(to, amount);
    }

    @Override
    public synchronized void transferFrom(String spender, String owner, String to, BigInteger amount) {
        Amounts.requireAccount(spender, "Spender");
        Amounts.requireAccount(owner, "Owner");
        Amounts.requireAccount(to, "Recipient");
        Amounts.requireNonNegative(amount, "Transfer amount");
        BigInteger allowed = allowance(owner, spender);
        if (allowed.compareTo(amount) < 0 || balanceOf(owner).compareTo(amount) < 0) {
            throw new InsufficientAllowanceOrBalanceException(
                    symbol + ": " + spender + " cannot move " + amount + " from " + owner);
        }
        allowances.get(owner).put(spender, allowed.subtract(amount));
        debit(owner, amount);
        credit(to, amount);
    }

    @Override
    public synchronized void approve(String owner, String spender, BigInteger amount) {
        Amounts.requireAccount(owner, "Owner");
        Amounts.requireAccount(spender, "Spender");
        Amounts.requireNonNegative(amount, "Allowance");
        allowances.computeIfAbsent(owner, k -> new HashMap<>()).put(spender, amount);
    }

    protected synchronized void credit(String account, BigInteger amount) {
        balances.merge(account, amount, BigInteger::add);
    }

    protected synchronized void debit(String account, BigInteger amount) {
        BigInteger remaining = balanceOf(account).subtract(amount);
        if (remaining.signum() == 0) {
            balances.remove(account);
        } else {
            balances.put(account, remaining);
        }
    }

    protected synchronized void adjustSupply(BigInteger delta) {
        totalSupply = totalSupply.add(delta);
    }

    @Override
    public String toString() {
        return "LedgerAsset{" + symbol + ", " + role + "}";
    }
}
