package com.splitvault.core.asset;

import com.splitvault.core.exception.InsufficientBalanceException;
import com.splitvault.core.exception.UnauthorizedException;
import com.splitvault.core.exception.VaultErrorCode;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.*;

class ClaimTokenTest {

    private final ClaimToken token = new ClaimToken("cToken", AssetRole.C_TOKEN, "vault");

    @Test
    void ownerMintsAndBurns() {
        token.mint("vault", "alice", BigInteger.valueOf(990));
        token.burn("vault", "alice", BigInteger.valueOf(90));

        assertThat(token.balanceOf("alice")).isEqualTo(BigInteger.valueOf(900));
        assertThat(token.totalSupply()).isEqualTo(BigInteger.valueOf(900));
    }

    @Test
    void onlyOwnerMayMintOrBurn() {
        UnauthorizedException denied = catchThrowableOfType(
                () -> token.mint("alice", "alice", BigInteger.TEN), UnauthorizedException.class);
        assertThat(denied.getCode()).isEqualTo(VaultErrorCode.UNAUTHORIZED);

        token.mint("vault", "alice", BigInteger.TEN);
        assertThatThrownBy(() -> token.burn("alice", "alice", BigInteger.ONE))
                .isInstanceOf(UnauthorizedException.class);
        assertThat(token.totalSupply()).isEqualTo(BigInteger.TEN);
    }

    @Test
    void burnBeyondBalanceFails() {
        token.mint("vault", "alice", BigInteger.TEN);

        assertThatThrownBy(() -> token.burn("vault", "alice", BigInteger.valueOf(11)))
                .isInstanceOf(InsufficientBalanceException.class);
        assertThat(token.balanceOf("alice")).isEqualTo(BigInteger.TEN);
    }

    @Test
    void genesisIssuanceIsRefused() {
        assertThatThrownBy(() -> token.issue("alice", BigInteger.TEN))
                .isInstanceOf(UnauthorizedException.class);
    }

    @Test
    void holdersTransferFreely() {
        token.mint("vault", "alice", BigInteger.TEN);
        token.transfer("alice", "bob", BigInteger.valueOf(4));

        assertThat(token.balanceOf("bob")).isEqualTo(BigInteger.valueOf(4));
        assertThat(token.owner()).isEqualTo("vault");
    }

    @Test
    void requiresClaimRole() {
        assertThatThrownBy(() -> new ClaimToken("BASE", AssetRole.BASE, "vault"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
