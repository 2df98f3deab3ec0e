package com.splitvault.core.domain;

import java.math.BigInteger;

/**
 * Argument checks shared by the ledgers and the vault operations.
 * All amounts are unsigned integers in the smallest unit of their asset.
 */
public final class Amounts {

    private Amounts() {}

    public static BigInteger requirePositive(BigInteger amount, String name) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return amount;
    }

    public static BigInteger requireNonNegative(BigInteger amount, String name) {
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException(name + " must not be negative");
        }
        return amount;
    }

    public static String requireAccount(String account, String name) {
        if (account == null || account.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
        return account;
    }

    /**
     * floor(value * numerator / denominator) for non-negative operands.
     */
    public static BigInteger mulDiv(BigInteger value, BigInteger numerator, BigInteger denominator) {
        if (denominator.signum() == 0) {
            throw new ArithmeticException("Division by zero share denominator");
        }
        return value.multiply(numerator).divide(denominator);
    }
}
