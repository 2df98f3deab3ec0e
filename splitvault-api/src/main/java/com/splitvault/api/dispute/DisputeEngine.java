package com.splitvault.api.dispute;

import com.splitvault.api.event.VaultEvent;
import com.splitvault.api.vault.OperationContext;
import com.splitvault.api.vault.VaultAssets;
import com.splitvault.core.domain.Amounts;
import com.splitvault.core.domain.Dispute;
import com.splitvault.core.domain.DisputeOutcome;
import com.splitvault.core.domain.DisputePhase;
import com.splitvault.core.domain.DisputeSnapshot;
import com.splitvault.core.domain.RewardCurrency;
import com.splitvault.core.domain.RewardLedger;
import com.splitvault.core.domain.VaultState;
import com.splitvault.core.domain.Vote;
import com.splitvault.core.domain.VoteSide;
import com.splitvault.core.exception.DisputeAlreadyOpenException;
import com.splitvault.core.exception.NoVotesCastException;
import com.splitvault.core.exception.VotingClosedException;
import com.splitvault.core.exception.VotingStillActiveException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Dispute state machine: initiate, vote, resolve.
 *
 * <p>Winning voters get their own stake back plus a share of the losing side's stake
 * proportional to their weight, floor-divided. When decline wins, its voters also split
 * the initiation deposit the same way. Rounding dust stays in the vault.
 */
public class DisputeEngine {

    private static final Logger log = LoggerFactory.getLogger(DisputeEngine.class);

    private final Duration disputeDuration;
    private final BigInteger initiationAmountDenominator;
    private final UnvotedDisputePolicy unvotedPolicy;

    public DisputeEngine(Duration disputeDuration, int initiationAmountDenominator,
                         UnvotedDisputePolicy unvotedPolicy) {
        if (disputeDuration == null || disputeDuration.isNegative() || disputeDuration.isZero()) {
            throw new IllegalArgumentException("Dispute duration must be positive");
        }
        if (initiationAmountDenominator < 1) {
            throw new IllegalArgumentException("Initiation amount denominator must be at least 1");
        }
        this.disputeDuration = disputeDuration;
        this.initiationAmountDenominator = BigInteger.valueOf(initiationAmountDenominator);
        this.unvotedPolicy = Objects.requireNonNull(unvotedPolicy, "Unvoted dispute policy cannot be null");
    }

    public DisputeSnapshot initiate(OperationContext context) {
        VaultState state = context.state();
        if (state.disputePhase() == DisputePhase.OPEN) {
            throw new DisputeAlreadyOpenException("A dispute is already open until "
                    + state.requireOpenDispute().getEndTime());
        }
        VaultAssets assets = context.assets();
        BigInteger initiationAmount = assets.iToken().totalSupply().divide(initiationAmountDenominator);
        Instant endTime = context.now().plus(disputeDuration);

        // The slot is taken before the deposit is pulled so a callback cannot open a second dispute.
        Dispute dispute = Dispute.open(context.caller(), initiationAmount, endTime);
        state.replaceDispute(dispute);
        context.pullFromCaller(assets.base(), initiationAmount);

        context.emit(new VaultEvent.InitiateDispute(context.now(), context.caller(), initiationAmount, endTime));
        log.info("Dispute initiated by {} with deposit {}, voting ends {}", context.caller(), initiationAmount, endTime);
        return dispute.snapshot();
    }

    public DisputeSnapshot vote(OperationContext context, VoteSide side, BigInteger weight) {
        Dispute dispute = context.state().requireOpenDispute();
        Objects.requireNonNull(side, "Vote side cannot be null");
        Amounts.requirePositive(weight, "Vote weight");
        if (!dispute.acceptsVotesAt(context.now())) {
            throw new VotingClosedException("Voting ended at " + dispute.getEndTime());
        }

        dispute.recordVote(new Vote(context.caller(), side, weight));
        context.pullFromCaller(context.assets().governance(), weight);

        context.emit(new VaultEvent.VoteCast(context.now(), context.caller(), side, weight));
        log.debug("{} staked {} on {}", context.caller(), weight, side);
        return dispute.snapshot();
    }

    public DisputeResolution resolve(OperationContext context) {
        VaultState state = context.state();
        Dispute dispute = state.requireOpenDispute();
        if (!dispute.resolvableAt(context.now())) {
            throw new VotingStillActiveException("Voting is open until " + dispute.getEndTime());
        }
        if (!dispute.hasVotes()) {
            return resolveUnvoted(context, dispute);
        }

        BigInteger accept = dispute.getAcceptWeight();
        BigInteger decline = dispute.getDeclineWeight();
        RewardLedger rewards = state.rewards();
        List<RewardCredit> credits = new ArrayList<>();
        DisputeOutcome outcome;

        if (dispute.acceptPrevails()) {
            outcome = DisputeOutcome.ACCEPTED;
            for (Vote vote : dispute.getVotes()) {
                if (vote.side() != VoteSide.ACCEPT) {
                    continue;
                }
                BigInteger governanceReward = vote.weight().add(Amounts.mulDiv(decline, vote.weight(), accept));
                rewards.credit(RewardCurrency.GOVERNANCE, vote.voter(), governanceReward);
                credits.add(new RewardCredit(vote.voter(), vote.side(), vote.weight(), governanceReward, BigInteger.ZERO));
            }
            state.unlock();
            dispute.close();
            context.payOut(context.assets().base(), dispute.getInitiator(), dispute.getInitiationAmount());
        } else {
            outcome = DisputeOutcome.DECLINED;
            for (Vote vote : dispute.getVotes()) {
                if (vote.side() != VoteSide.DECLINE) {
                    continue;
                }
                BigInteger governanceReward = vote.weight().add(Amounts.mulDiv(accept, vote.weight(), decline));
                BigInteger baseReward = Amounts.mulDiv(dispute.getInitiationAmount(), vote.weight(), decline);
                rewards.credit(RewardCurrency.GOVERNANCE, vote.voter(), governanceReward);
                rewards.credit(RewardCurrency.BASE, vote.voter(), baseReward);
                credits.add(new RewardCredit(vote.voter(), vote.side(), vote.weight(), governanceReward, baseReward));
            }
            dispute.close();
        }

        return finish(context, outcome, accept, decline, credits);
    }

    private DisputeResolution resolveUnvoted(OperationContext context, Dispute dispute) {
        if (unvotedPolicy == UnvotedDisputePolicy.REJECT) {
            throw new NoVotesCastException("Dispute closed for voting without any votes");
        }
        dispute.close();
        context.payOut(context.assets().base(), dispute.getInitiator(), dispute.getInitiationAmount());
        return finish(context, DisputeOutcome.UNVOTED, BigInteger.ZERO, BigInteger.ZERO, List.of());
    }

    private DisputeResolution finish(OperationContext context, DisputeOutcome outcome,
                                     BigInteger accept, BigInteger decline, List<RewardCredit> credits) {
        boolean locked = context.state().isLocked();
        context.emit(new VaultEvent.ResolveDispute(context.now(), outcome, accept, decline, locked));
        log.info("Dispute resolved {} (accept={}, decline={}), vault locked={}", outcome, accept, decline, locked);
        return new DisputeResolution(outcome, locked, accept, decline, List.copyOf(credits));
    }
}
