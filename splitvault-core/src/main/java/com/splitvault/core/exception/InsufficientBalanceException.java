package com.splitvault.core.exception;

/**
 * Thrown when an account holds less than a burn or redemption requires.
 */
public class InsufficientBalanceException extends VaultException {

    public InsufficientBalanceException(String message) {
        super(VaultErrorCode.INSUFFICIENT_BALANCE, message);
    }
}
