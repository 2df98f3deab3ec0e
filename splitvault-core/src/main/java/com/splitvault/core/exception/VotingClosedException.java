package com.splitvault.core.exception;

/**
 * Thrown when a vote arrives after the dispute's end time.
 */
public class VotingClosedException extends VaultException {

    public VotingClosedException(String message) {
        super(VaultErrorCode.VOTING_CLOSED, message);
    }
}
