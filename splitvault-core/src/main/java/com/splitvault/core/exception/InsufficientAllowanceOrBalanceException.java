package com.splitvault.core.exception;

/**
 * Thrown by an asset service when a transfer exceeds the sender's balance or the spender's allowance.
 */
public class InsufficientAllowanceOrBalanceException extends VaultException {

    public InsufficientAllowanceOrBalanceException(String message) {
        super(VaultErrorCode.INSUFFICIENT_ALLOWANCE_OR_BALANCE, message);
    }
}
