package com.splitvault.core.asset;

/**
 * The role an asset service plays for a vault. Selected when the asset is constructed.
 */
public enum AssetRole {
    /** Deposited asset held in custody and paid out on redemption. */
    BASE(false),
    /** Voting weight and fee-share entitlement. */
    GOVERNANCE(false),
    /** Hedging half of the claim pair; redeemable only together with the iToken while locked. */
    C_TOKEN(true),
    /** Condition claim; redeemable alone once the vault is unlocked. */
    I_TOKEN(true);

    private final boolean issuedByVault;

    AssetRole(boolean issuedByVault) {
        this.issuedByVault = issuedByVault;
    }

    public boolean isIssuedByVault() {
        return issuedByVault;
    }
}
