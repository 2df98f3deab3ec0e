package com.splitvault.core.exception;

/**
 * Thrown when a vault is entered again while one of its operations is still in flight.
 */
public class ReentrantCallException extends VaultException {

    public ReentrantCallException(String message) {
        super(VaultErrorCode.REENTRANT_CALL, message);
    }
}
