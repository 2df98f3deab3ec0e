package com.splitvault.core.asset;

import com.splitvault.core.domain.Amounts;
import com.splitvault.core.exception.InsufficientBalanceException;
import com.splitvault.core.exception.UnauthorizedException;

import java.math.BigInteger;

/**
 * Vault-issued claim token. Only the deploying vault may mint or burn.
 */
public class ClaimToken extends LedgerAsset implements IssuedClaimToken {

    private final String owner;

    public ClaimToken(String symbol, AssetRole role, String owner) {
        super(symbol, role);
        if (!role.isIssuedByVault()) {
            throw new IllegalArgumentException("Role " + role + " is not a claim token role");
        }
        this.owner = Amounts.requireAccount(owner, "Owner");
    }

    @Override
    public String owner() {
        return owner;
    }

    @Override
    public synchronized void mint(String caller, String account, BigInteger amount) {
        requireOwner(caller, "mint");
        Amounts.requireAccount(account, "Account");
        Amounts.requireNonNegative(amount, "Mint amount");
        credit(account, amount);
        adjustSupply(amount);
    }

    @Override
    public synchronized void burn(String caller, String account, BigInteger amount) {
        requireOwner(caller, "burn");
        Amounts.requireAccount(account, "Account");
        Amounts.requireNonNegative(amount, "Burn amount");
        if (balanceOf(account).compareTo(amount) < 0) {
            throw new InsufficientBalanceException(
                    symbol() + ": balance of " + account + " is below " + amount);
        }
        debit(account, amount);
        adjustSupply(amount.negate());
    }

    /**
     * Claim token supply moves only through {@link #mint}.
     */
    @Override
    public void issue(String account, BigInteger amount) {
        throw new UnauthorizedException(symbol() + ": supply is controlled by " + owner);
    }

    private void requireOwner(String caller, String action) {
        if (!owner.equals(caller)) {
            throw new UnauthorizedException(symbol() + ": only " + owner + " may " + action);
        }
    }
}
