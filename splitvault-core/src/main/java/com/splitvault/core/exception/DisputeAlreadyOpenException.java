package com.splitvault.core.exception;

/**
 * Thrown when a dispute is initiated while another one is still open.
 */
public class DisputeAlreadyOpenException extends VaultException {

    public DisputeAlreadyOpenException(String message) {
        super(VaultErrorCode.DISPUTE_ALREADY_OPEN, message);
    }
}
