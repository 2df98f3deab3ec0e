package com.splitvault.core.exception;

/**
 * Thrown when a computed fee share exceeds the fees still held by the vault.
 */
public class FeeReserveExhaustedException extends VaultException {

    public FeeReserveExhaustedException(String message) {
        super(VaultErrorCode.FEE_RESERVE_EXHAUSTED, message);
    }
}
