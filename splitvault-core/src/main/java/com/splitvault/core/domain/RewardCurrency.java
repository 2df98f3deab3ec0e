package com.splitvault.core.domain;

/**
 * Currency of a pending dispute reward.
 */
public enum RewardCurrency {
    BASE,
    GOVERNANCE
}
