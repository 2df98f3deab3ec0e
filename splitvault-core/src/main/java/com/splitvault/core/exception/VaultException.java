package com.splitvault.core.exception;

/**
 * Base type for every precondition failure raised by the vault or its asset services.
 */
public class VaultException extends RuntimeException {

    private final VaultErrorCode code;

    public VaultException(VaultErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public VaultException(VaultErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public VaultErrorCode getCode() {
        return code;
    }
}
