package com.splitvault.core.exception;

/**
 * Thrown when a reward withdrawal finds a zero pending balance.
 */
public class NoRewardOwedException extends VaultException {

    public NoRewardOwedException(String message) {
        super(VaultErrorCode.NO_REWARD_OWED, message);
    }
}
