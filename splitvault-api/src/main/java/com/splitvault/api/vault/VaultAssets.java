package com.splitvault.api.vault;

import com.splitvault.core.asset.AssetRole;
import com.splitvault.core.asset.IssuedClaimToken;
import com.splitvault.core.asset.TransferableAsset;
import com.splitvault.core.domain.Amounts;
import com.splitvault.core.domain.RewardCurrency;

import java.util.Objects;

/**
 * The vault's custody account and the four asset services it talks to.
 * Base and governance assets are borrowed; the claim tokens are owned by the vault.
 */
public record VaultAssets(
        String vaultAccount,
        TransferableAsset base,
        TransferableAsset governance,
        IssuedClaimToken cToken,
        IssuedClaimToken iToken
) {

    public VaultAssets {
        Amounts.requireAccount(vaultAccount, "Vault account");
        requireRole(base, AssetRole.BASE);
        requireRole(governance, AssetRole.GOVERNANCE);
        requireRole(cToken, AssetRole.C_TOKEN);
        requireRole(iToken, AssetRole.I_TOKEN);
        if (!vaultAccount.equals(cToken.owner()) || !vaultAccount.equals(iToken.owner())) {
            throw new IllegalArgumentException("Claim tokens must be owned by " + vaultAccount);
        }
    }

    public TransferableAsset forReward(RewardCurrency currency) {
        return switch (currency) {
            case BASE -> base;
            case GOVERNANCE -> governance;
        };
    }

    private static void requireRole(TransferableAsset asset, AssetRole role) {
        Objects.requireNonNull(asset, role + " asset cannot be null");
        if (asset.role() != role) {
            throw new IllegalArgumentException("Expected a " + role + " asset but got " + asset.role());
        }
    }
}
