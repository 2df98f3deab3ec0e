package com.splitvault.core.domain;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class DisputeTest {

    private static final Instant END = Instant.parse("2024-01-08T00:00:00Z");

    @Test
    void newDisputeStartsOpenWithEmptyTally() {
        Dispute dispute = Dispute.open("alice", BigInteger.valueOf(1000), END);

        assertThat(dispute.isOpen()).isTrue();
        assertThat(dispute.hasVotes()).isFalse();
        assertThat(dispute.getAcceptWeight()).isZero();
        assertThat(dispute.getDeclineWeight()).isZero();
        assertThat(dispute.totalStake()).isZero();
    }

    @Test
    void votingWindowIncludesEndTime() {
        Dispute dispute = Dispute.open("alice", BigInteger.TEN, END);

        assertThat(dispute.acceptsVotesAt(END.minusSeconds(1))).isTrue();
        assertThat(dispute.acceptsVotesAt(END)).isTrue();
        assertThat(dispute.acceptsVotesAt(END.plusSeconds(1))).isFalse();

        assertThat(dispute.resolvableAt(END)).isFalse();
        assertThat(dispute.resolvableAt(END.plusSeconds(1))).isTrue();
    }

    @Test
    void votesAccumulatePerSideInOrder() {
        Dispute dispute = Dispute.open("alice", BigInteger.TEN, END);

        dispute.recordVote(new Vote("bob", VoteSide.DECLINE, BigInteger.valueOf(100)));
        dispute.recordVote(new Vote("carol", VoteSide.ACCEPT, BigInteger.valueOf(100)));
        dispute.recordVote(new Vote("bob", VoteSide.DECLINE, BigInteger.valueOf(200)));

        assertThat(dispute.getDeclineWeight()).isEqualTo(BigInteger.valueOf(300));
        assertThat(dispute.getAcceptWeight()).isEqualTo(BigInteger.valueOf(100));
        assertThat(dispute.getVotes()).extracting(Vote::voter).containsExactly("bob", "carol", "bob");
        assertThat(dispute.totalStake()).isEqualTo(BigInteger.valueOf(400));
    }

    @Test
    void tieGoesToDecline() {
        Dispute dispute = Dispute.open("alice", BigInteger.TEN, END);
        assertThat(dispute.acceptPrevails()).isFalse();

        dispute.recordVote(new Vote("bob", VoteSide.ACCEPT, BigInteger.valueOf(5)));
        dispute.recordVote(new Vote("carol", VoteSide.DECLINE, BigInteger.valueOf(5)));
        assertThat(dispute.acceptPrevails()).isFalse();

        dispute.recordVote(new Vote("dave", VoteSide.ACCEPT, BigInteger.ONE));
        assertThat(dispute.acceptPrevails()).isTrue();
    }

    @Test
    void closedDisputeRejectsVotesAndSecondClose() {
        Dispute dispute = Dispute.open("alice", BigInteger.TEN, END);
        dispute.close();

        assertThat(dispute.acceptsVotesAt(END)).isFalse();
        assertThat(dispute.resolvableAt(END.plusSeconds(1))).isFalse();
        assertThatThrownBy(() -> dispute.recordVote(new Vote("bob", VoteSide.ACCEPT, BigInteger.ONE)))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(dispute::close).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void copyIsIndependent() {
        Dispute dispute = Dispute.open("alice", BigInteger.TEN, END);
        Dispute copy = dispute.copy();

        dispute.recordVote(new Vote("bob", VoteSide.ACCEPT, BigInteger.ONE));
        dispute.close();

        assertThat(copy.isOpen()).isTrue();
        assertThat(copy.getVotes()).isEmpty();
        assertThat(copy.getAcceptWeight()).isZero();
    }

    @Test
    void snapshotReflectsTally() {
        Dispute dispute = Dispute.open("alice", BigInteger.TEN, END);
        dispute.recordVote(new Vote("bob", VoteSide.DECLINE, BigInteger.valueOf(7)));

        DisputeSnapshot snapshot = dispute.snapshot();

        assertThat(snapshot.initiator()).isEqualTo("alice");
        assertThat(snapshot.initiationAmount()).isEqualTo(BigInteger.TEN);
        assertThat(snapshot.endTime()).isEqualTo(END);
        assertThat(snapshot.declineWeight()).isEqualTo(BigInteger.valueOf(7));
        assertThat(snapshot.open()).isTrue();
        assertThat(snapshot.voteCount()).isEqualTo(1);
    }

    @Test
    void voteRequiresPositiveWeight() {
        assertThatThrownBy(() -> new Vote("bob", VoteSide.ACCEPT, BigInteger.ZERO))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("positive");
        assertThatThrownBy(() -> new Vote(" ", VoteSide.ACCEPT, BigInteger.ONE))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void votesListIsReadOnly() {
        Dispute dispute = Dispute.open("alice", BigInteger.TEN, END);
        assertThatThrownBy(() -> dispute.getVotes().add(new Vote("bob", VoteSide.ACCEPT, BigInteger.ONE)))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
