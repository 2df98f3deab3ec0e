package com.splitvault.api.ledger;

import com.splitvault.api.event.VaultEvent;
import com.splitvault.api.vault.OperationContext;
import com.splitvault.api.vault.VaultAssets;
import com.splitvault.core.domain.FeeLedger;
import com.splitvault.core.domain.RewardCurrency;
import com.splitvault.core.exception.NoFeesOwedException;
import com.splitvault.core.exception.NoRewardOwedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;

/**
 * Pro-rata fee withdrawals for governance holders and payout of dispute rewards.
 *
 * <p>A holder's fee share is taken against its governance balance at withdrawal time,
 * not its balance history, so a late buyer receives the whole period's share.
 */
public class FeeRewardEngine {

    private static final Logger log = LoggerFactory.getLogger(FeeRewardEngine.class);

    public BigInteger owedFees(FeeLedger fees, VaultAssets assets, String account) {
        return fees.owedShare(account,
                assets.governance().balanceOf(account),
                assets.governance().totalSupply());
    }

    public BigInteger withdrawOwedFees(OperationContext context) {
        String caller = context.caller();
        FeeLedger fees = context.state().fees();
        BigInteger share = owedFees(fees, context.assets(), caller);
        if (fees.newFeesFor(caller).signum() == 0 || share.signum() == 0) {
            throw new NoFeesOwedException("No fees owed to " + caller);
        }

        fees.recordWithdrawal(caller, share);
        context.payOut(context.assets().base(), caller, share);

        context.emit(new VaultEvent.WithdrawFees(context.now(), caller, share));
        log.info("Paid {} in fees to {}, {} remaining", share, caller, fees.getRemainingFees());
        return share;
    }

    public BigInteger withdrawReward(OperationContext context, RewardCurrency currency) {
        String caller = context.caller();
        BigInteger amount = context.state().rewards().drain(currency, caller);
        if (amount.signum() == 0) {
            throw new NoRewardOwedException("No " + currency + " reward owed to " + caller);
        }

        context.payOut(context.assets().forReward(currency), caller, amount);

        context.emit(new VaultEvent.WithdrawReward(context.now(), caller, currency, amount));
        log.info("Paid {} {} reward to {}", amount, currency, caller);
        return amount;
    }
}
