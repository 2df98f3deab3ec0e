package com.splitvault.core.exception;

/**
 * Failure codes surfaced by vault operations and their asset collaborators.
 * Every code denotes a clean abort of a single operation; none is retried automatically.
 */
public enum VaultErrorCode {
    INSUFFICIENT_BALANCE,
    INSUFFICIENT_ALLOWANCE_OR_BALANCE,
    DISPUTE_ALREADY_OPEN,
    DISPUTE_NOT_OPEN,
    VOTING_CLOSED,
    VOTING_STILL_ACTIVE,
    NO_VOTES_CAST,
    NO_REWARD_OWED,
    NO_FEES_OWED,
    FEE_RESERVE_EXHAUSTED,
    UNAUTHORIZED,
    REENTRANT_CALL,
    ASSET_UNAVAILABLE
}
