package com.splitvault.core.asset;

import java.math.BigInteger;

/**
 * Claim token whose supply is controlled by a single owner, the vault that deployed it.
 * {@code mint} and {@code burn} fail with
 * {@link com.splitvault.core.exception.UnauthorizedException} for any other caller;
 * {@code burn} fails with {@link com.splitvault.core.exception.InsufficientBalanceException}
 * when the target holds less than requested.
 */
public interface IssuedClaimToken extends TransferableAsset {

    String owner();

    void mint(String caller, String account, BigInteger amount);

    void burn(String caller, String account, BigInteger amount);
}
