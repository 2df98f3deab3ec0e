package com.splitvault.api.vault;

import com.splitvault.api.config.VaultProperties;
import com.splitvault.api.conversion.ConversionEngine;
import com.splitvault.api.conversion.ConversionReceipt;
import com.splitvault.api.conversion.RedemptionReceipt;
import com.splitvault.api.dispute.DisputeEngine;
import com.splitvault.api.dispute.DisputeResolution;
import com.splitvault.api.event.VaultEventPublisher;
import com.splitvault.api.ledger.FeeRewardEngine;
import com.splitvault.core.asset.AssetRole;
import com.splitvault.core.asset.ClaimToken;
import com.splitvault.core.asset.IssuedClaimToken;
import com.splitvault.core.asset.TransferableAsset;
import com.splitvault.core.domain.Dispute;
import com.splitvault.core.domain.DisputePhase;
import com.splitvault.core.domain.DisputeSnapshot;
import com.splitvault.core.domain.RewardCurrency;
import com.splitvault.core.domain.VaultState;
import com.splitvault.core.domain.Vote;
import com.splitvault.core.domain.VoteSide;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Collateralized vault that splits base-asset deposits into a cToken/iToken pair,
 * arbitrates whether the tracked condition occurred through a stake-weighted vote,
 * and distributes issuance fees and slashed stakes.
 *
 * <p>Each mutating method runs as one serialized, all-or-nothing operation on behalf of
 * {@code caller}. Callers grant the vault account an allowance on the base or governance
 * asset before converting, initiating a dispute or voting.
 *
 * <p>The vault deploys and owns its two claim tokens; the base and governance assets are
 * supplied by the caller of the constructor.
 */
public class VaultService {

    private static final Logger log = LoggerFactory.getLogger(VaultService.class);

    private final VaultState state = new VaultState();
    private final VaultAssets assets;
    private final String conditionDescription;
    private final ConversionEngine conversionEngine;
    private final DisputeEngine disputeEngine;
    private final FeeRewardEngine feeRewardEngine;
    private final VaultOperationExecutor executor;

    public VaultService(
            VaultProperties properties,
            TransferableAsset baseAsset,
            TransferableAsset governanceAsset,
            Clock clock,
            VaultEventPublisher publisher) {
        this(properties, properties.getAccount(), baseAsset, governanceAsset, clock, publisher);
    }

    /**
     * Holds custody under {@code vaultAccount} instead of the configured account, as when
     * the assets live on chain and the vault must act as the signing key.
     */
    public VaultService(
            VaultProperties properties,
            String vaultAccount,
            TransferableAsset baseAsset,
            TransferableAsset governanceAsset,
            Clock clock,
            VaultEventPublisher publisher) {
        IssuedClaimToken cToken = new ClaimToken("cToken", AssetRole.C_TOKEN, vaultAccount);
        IssuedClaimToken iToken = new ClaimToken("iToken", AssetRole.I_TOKEN, vaultAccount);
        this.assets = new VaultAssets(vaultAccount, baseAsset, governanceAsset, cToken, iToken);
        this.conditionDescription = properties.getConditionDescription();
        this.conversionEngine = new ConversionEngine(properties.getFeeDenominator());
        this.disputeEngine = new DisputeEngine(
                properties.getDisputeDuration(),
                properties.getInitiationAmountDenominator(),
                properties.getUnvotedDisputePolicy());
        this.feeRewardEngine = new FeeRewardEngine();
        this.executor = new VaultOperationExecutor(state, assets, clock, publisher);
        log.info("Vault {} deployed over {} / {} tracking condition '{}'",
                vaultAccount, baseAsset.symbol(), governanceAsset.symbol(), conditionDescription);
    }

    // ==================== Conversion / Redemption ====================

    public ConversionReceipt convert(String caller, BigInteger amount) {
        return executor.execute("convert", caller, context -> conversionEngine.convert(context, amount));
    }

    public RedemptionReceipt redeem(String caller, BigInteger amount) {
        return executor.execute("redeem", caller, context -> conversionEngine.redeem(context, amount));
    }

    // ==================== Dispute ====================

    public DisputeSnapshot initiateDispute(String caller) {
        return executor.execute("initiateDispute", caller, disputeEngine::initiate);
    }

    public DisputeSnapshot vote(String caller, VoteSide side, BigInteger weight) {
        return executor.execute("vote", caller, context -> disputeEngine.vote(context, side, weight));
    }

    public DisputeResolution resolveDispute(String caller) {
        return executor.execute("resolveDispute", caller, disputeEngine::resolve);
    }

    // ==================== Fees and rewards ====================

    public BigInteger withdrawOwedFees(String caller) {
        return executor.execute("withdrawOwedFees", caller, feeRewardEngine::withdrawOwedFees);
    }

    public BigInteger withdrawGovernanceTokenReward(String caller) {
        return executor.execute("withdrawGovernanceTokenReward", caller,
                context -> feeRewardEngine.withdrawReward(context, RewardCurrency.GOVERNANCE));
    }

    public BigInteger withdrawBaseTokenReward(String caller) {
        return executor.execute("withdrawBaseTokenReward", caller,
                context -> feeRewardEngine.withdrawReward(context, RewardCurrency.BASE));
    }

    // ==================== Queries ====================

    public BigInteger getOwedFees(String account) {
        return executor.read("getOwedFees", () -> feeRewardEngine.owedFees(state.fees(), assets, account));
    }

    public boolean isLocked() {
        return executor.read("isLocked", state::isLocked);
    }

    public DisputePhase getDisputePhase() {
        return executor.read("getDisputePhase", state::disputePhase);
    }

    public Optional<DisputeSnapshot> getDispute() {
        return executor.read("getDispute", () -> state.currentDispute().map(Dispute::snapshot));
    }

    public List<Vote> getVotes() {
        return executor.read("getVotes", () -> state.currentDispute()
                .map(dispute -> List.copyOf(dispute.getVotes()))
                .orElse(List.of()));
    }

    public BigInteger pendingBaseReward(String account) {
        return executor.read("pendingBaseReward", () -> state.rewards().pending(RewardCurrency.BASE, account));
    }

    public BigInteger pendingGovernanceReward(String account) {
        return executor.read("pendingGovernanceReward",
                () -> state.rewards().pending(RewardCurrency.GOVERNANCE, account));
    }

    public BigInteger accruedFees() {
        return executor.read("accruedFees", () -> state.fees().getAccruedFees());
    }

    public BigInteger remainingFees() {
        return executor.read("remainingFees", () -> state.fees().getRemainingFees());
    }

    /**
     * Compares actual holdings against everything the vault owes.
     */
    public SolvencyReport reconcile() {
        return executor.read("reconcile", () -> {
            String vault = assets.vaultAccount();
            Optional<Dispute> open = state.currentDispute().filter(Dispute::isOpen);
            BigInteger baseObligations = assets.iToken().totalSupply()
                    .add(state.fees().getRemainingFees())
                    .add(state.rewards().total(RewardCurrency.BASE))
                    .add(open.map(Dispute::getInitiationAmount).orElse(BigInteger.ZERO));
            BigInteger governanceObligations = state.rewards().total(RewardCurrency.GOVERNANCE)
                    .add(open.map(Dispute::totalStake).orElse(BigInteger.ZERO));
            return new SolvencyReport(
                    assets.base().balanceOf(vault), baseObligations,
                    assets.governance().balanceOf(vault), governanceObligations);
        });
    }

    public String conditionDescription() {
        return conditionDescription;
    }

    public String vaultAccount() {
        return assets.vaultAccount();
    }

    public TransferableAsset baseAsset() {
        return assets.base();
    }

    public TransferableAsset governanceAsset() {
        return assets.governance();
    }

    public IssuedClaimToken cToken() {
        return assets.cToken();
    }

    public IssuedClaimToken iToken() {
        return assets.iToken();
    }
}
