package com.splitvault.api.conversion;

import com.splitvault.api.event.VaultEvent;
import com.splitvault.api.vault.OperationContext;
import com.splitvault.api.vault.VaultAssets;
import com.splitvault.core.domain.Amounts;
import com.splitvault.core.exception.InsufficientBalanceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;

/**
 * Mints and burns the claim-token pair against the base asset.
 */
public class ConversionEngine {

    private static final Logger log = LoggerFactory.getLogger(ConversionEngine.class);

    private final BigInteger feeDenominator;

    public ConversionEngine(int feeDenominator) {
        if (feeDenominator < 1) {
            throw new IllegalArgumentException("Fee denominator must be at least 1");
        }
        this.feeDenominator = BigInteger.valueOf(feeDenominator);
    }

    /**
     * Flat issuance fee, floor(amount / feeDenominator). Amounts below the denominator pay nothing.
     */
    public BigInteger feeFor(BigInteger amount) {
        return amount.divide(feeDenominator);
    }

    public ConversionReceipt convert(OperationContext context, BigInteger amount) {
        Amounts.requirePositive(amount, "Conversion amount");
        VaultAssets assets = context.assets();
        BigInteger fee = feeFor(amount);
        BigInteger minted = amount.subtract(fee);

        context.state().fees().accrue(fee);
        context.pullFromCaller(assets.base(), amount);
        context.mint(assets.cToken(), context.caller(), minted);
        context.mint(assets.iToken(), context.caller(), minted);

        context.emit(new VaultEvent.Convert(context.now(), context.caller(), amount, fee, minted));
        log.info("Converted {} base for {}: minted {} of each claim token, fee {}",
                amount, context.caller(), minted, fee);
        return new ConversionReceipt(amount, fee, minted);
    }

    /**
     * While locked the caller returns a full cToken+iToken pair; once unlocked the iToken
     * alone redeems. Either way the payout is {@code amount} of the base asset.
     */
    public RedemptionReceipt redeem(OperationContext context, BigInteger amount) {
        Amounts.requirePositive(amount, "Redemption amount");
        VaultAssets assets = context.assets();
        String caller = context.caller();
        boolean locked = context.state().isLocked();

        requireBalance(assets.iToken().symbol(), assets.iToken().balanceOf(caller), amount, caller);
        if (locked) {
            requireBalance(assets.cToken().symbol(), assets.cToken().balanceOf(caller), amount, caller);
            context.burn(assets.cToken(), caller, amount);
        }
        context.burn(assets.iToken(), caller, amount);
        context.payOut(assets.base(), caller, amount);

        context.emit(new VaultEvent.Redeem(context.now(), caller, amount, locked));
        log.info("Redeemed {} for {} (locked={})", amount, caller, locked);
        return new RedemptionReceipt(amount, locked);
    }

    private static void requireBalance(String symbol, BigInteger balance, BigInteger amount, String account) {
        if (balance.compareTo(amount) < 0) {
            throw new InsufficientBalanceException(
                    symbol + " balance of " + account + " is " + balance + ", redemption needs " + amount);
        }
    }
}
