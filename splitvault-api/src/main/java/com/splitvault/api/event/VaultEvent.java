package com.splitvault.api.event;

import com.splitvault.core.domain.DisputeOutcome;
import com.splitvault.core.domain.RewardCurrency;
import com.splitvault.core.domain.VoteSide;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Audit events emitted by committed vault operations. Never used for control flow.
 */
public interface VaultEvent {

    Instant occurredAt();

    record Convert(Instant occurredAt, String account, BigInteger amount,
                   BigInteger fee, BigInteger minted) implements VaultEvent {}

    record Redeem(Instant occurredAt, String account, BigInteger amount,
                  boolean locked) implements VaultEvent {}

    record InitiateDispute(Instant occurredAt, String initiator, BigInteger initiationAmount,
                           Instant endTime) implements VaultEvent {}

    record VoteCast(Instant occurredAt, String voter, VoteSide side,
                    BigInteger weight) implements VaultEvent {}

    record ResolveDispute(Instant occurredAt, DisputeOutcome outcome, BigInteger acceptWeight,
                          BigInteger declineWeight, boolean locked) implements VaultEvent {}

    record WithdrawFees(Instant occurredAt, String account, BigInteger amount) implements VaultEvent {}

    record WithdrawReward(Instant occurredAt, String account, RewardCurrency currency,
                          BigInteger amount) implements VaultEvent {}
}
