package com.splitvault.core.exception;

/**
 * Thrown when a dispute without any votes is resolved under the reject policy.
 */
public class NoVotesCastException extends VaultException {

    public NoVotesCastException(String message) {
        super(VaultErrorCode.NO_VOTES_CAST, message);
    }
}
