package com.splitvault.core.asset;

import java.math.BigInteger;

/**
 * Minimal fungible balance ledger used for the base asset, the governance asset
 * and, through {@link IssuedClaimToken}, for the two claim tokens.
 *
 * <p>Mutating calls either complete fully or throw; a failed call leaves no trace.
 * Insufficient balance or allowance surfaces as
 * {@link com.splitvault.core.exception.InsufficientAllowanceOrBalanceException}.
 */
public interface TransferableAsset {

    String symbol();

    AssetRole role();

    BigInteger balanceOf(String account);

    BigInteger totalSupply();

    BigInteger allowance(String owner, String spender);

    /**
     * Moves {@code amount} from {@code from} to {@code to}, authorised by {@code from}.
     */
    void transfer(String from, String to, BigInteger amount);

    /**
     * Moves {@code amount} from {@code owner} to {@code to} on behalf of {@code spender},
     * consuming the allowance {@code owner} granted to {@code spender}.
     */
    void transferFrom(String spender, String owner, String to, BigInteger amount);

    void approve(String owner, String spender, BigInteger amount);
}
