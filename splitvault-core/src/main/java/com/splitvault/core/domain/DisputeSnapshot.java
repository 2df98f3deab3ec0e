package com.splitvault.core.domain;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Read-only view of a dispute, safe to hand out of the vault.
 */
public record DisputeSnapshot(
        String initiator,
        BigInteger initiationAmount,
        Instant endTime,
        BigInteger acceptWeight,
        BigInteger declineWeight,
        boolean open,
        int voteCount
) {}
