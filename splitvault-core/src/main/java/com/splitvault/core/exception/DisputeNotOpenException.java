package com.splitvault.core.exception;

/**
 * Thrown when voting or resolution is attempted without an open dispute.
 */
public class DisputeNotOpenException extends VaultException {

    public DisputeNotOpenException(String message) {
        super(VaultErrorCode.DISPUTE_NOT_OPEN, message);
    }
}
