package com.splitvault.core.exception;

/**
 * Thrown when a remote asset service cannot be reached or returns an unreadable answer.
 */
public class AssetUnavailableException extends VaultException {

    public AssetUnavailableException(String message, Throwable cause) {
        super(VaultErrorCode.ASSET_UNAVAILABLE, message, cause);
    }
}
