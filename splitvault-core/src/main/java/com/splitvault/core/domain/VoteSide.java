package com.splitvault.core.domain;

/**
 * Side of a dispute vote. ACCEPT asserts the tracked condition occurred.
 */
public enum VoteSide {
    ACCEPT,
    DECLINE
}
