package com.splitvault.core.exception;

/**
 * Thrown when an owner-restricted operation is invoked by any other account.
 */
public class UnauthorizedException extends VaultException {

    public UnauthorizedException(String message) {
        super(VaultErrorCode.UNAUTHORIZED, message);
    }
}
