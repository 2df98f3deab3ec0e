package com.splitvault.core.exception;

/**
 * Thrown when a fee withdrawal computes a zero share.
 */
public class NoFeesOwedException extends VaultException {

    public NoFeesOwedException(String message) {
        super(VaultErrorCode.NO_FEES_OWED, message);
    }
}
