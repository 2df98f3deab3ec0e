package com.splitvault.core.exception;

/**
 * Thrown when resolution is attempted before the dispute's end time has passed.
 */
public class VotingStillActiveException extends VaultException {

    public VotingStillActiveException(String message) {
        super(VaultErrorCode.VOTING_STILL_ACTIVE, message);
    }
}
