package com.splitvault.api.vault;

import com.splitvault.api.event.VaultEvent;
import com.splitvault.core.asset.IssuedClaimToken;
import com.splitvault.core.asset.TransferableAsset;
import com.splitvault.core.domain.VaultState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Everything one vault operation sees: the caller, the operation timestamp, the shared
 * state and the asset services.
 *
 * Collaborator calls go through this context so that each successful call leaves a
 * compensating action behind. Payouts are the last collaborator call of every operation
 * and are not compensated.
 */
public final class OperationContext {

    private static final Logger log = LoggerFactory.getLogger(OperationContext.class);

    private final String caller;
    private final Instant now;
    private final VaultState state;
    private final VaultAssets assets;
    private final Deque<Compensation> compensations = new ArrayDeque<>();
    private final List<VaultEvent> events = new ArrayList<>();

    OperationContext(String caller, Instant now, VaultState state, VaultAssets assets) {
        this.caller = caller;
        this.now = now;
        this.state = state;
        this.assets = assets;
    }

    public String caller() { return caller; }
    public Instant now() { return now; }
    public VaultState state() { return state; }
    public VaultAssets assets() { return assets; }

    /**
     * Pulls {@code amount} from the caller into vault custody using the caller's allowance.
     */
    public void pullFromCaller(TransferableAsset asset, BigInteger amount) {
        if (amount.signum() == 0) {
            return;
        }
        String vault = assets.vaultAccount();
        asset.transferFrom(vault, caller, vault, amount);
        compensations.push(new Compensation("refund " + amount + " " + asset.symbol() + " to " + caller,
                () -> asset.transfer(vault, caller, amount)));
    }

    public void payOut(TransferableAsset asset, String recipient, BigInteger amount) {
        if (amount.signum() == 0) {
            return;
        }
        asset.transfer(assets.vaultAccount(), recipient, amount);
    }

    public void mint(IssuedClaimToken token, String account, BigInteger amount) {
        String vault = assets.vaultAccount();
        token.mint(vault, account, amount);
        compensations.push(new Compensation("burn " + amount + " " + token.symbol() + " from " + account,
                () -> token.burn(vault, account, amount)));
    }

    public void burn(IssuedClaimToken token, String account, BigInteger amount) {
        String vault = assets.vaultAccount();
        token.burn(vault, account, amount);
        compensations.push(new Compensation("re-mint " + amount + " " + token.symbol() + " to " + account,
                () -> token.mint(vault, account, amount)));
    }

    public void emit(VaultEvent event) {
        events.add(event);
    }

    List<VaultEvent> events() {
        return events;
    }

    /**
     * Undoes every recorded collaborator call, newest first. A compensation that fails is
     * attached to {@code failure} as suppressed and the remaining ones still run.
     */
    void compensate(RuntimeException failure) {
        while (!compensations.isEmpty()) {
            Compensation compensation = compensations.pop();
            try {
                compensation.action().run();
            } catch (RuntimeException e) {
                log.error("Compensation '{}' failed while rolling back", compensation.description(), e);
                failure.addSuppressed(e);
            }
        }
    }

    private record Compensation(String description, Runnable action) {}
}
