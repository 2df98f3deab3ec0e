package com.splitvault.api.vault;

import com.splitvault.api.event.VaultEventPublisher;
import com.splitvault.core.domain.Amounts;
import com.splitvault.core.domain.VaultState;
import com.splitvault.core.exception.ReentrantCallException;
import com.splitvault.core.exception.VaultException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Runs vault operations one at a time, all-or-nothing.
 *
 * Other threads wait on the vault lock. A call arriving on the same thread while an
 * operation is in flight can only come from a collaborator calling back into the vault
 * and is rejected. On failure the state is restored from the checkpoint taken before
 * the operation and collaborator calls are compensated; events are published only
 * after commit.
 */
class VaultOperationExecutor {

    private static final Logger log = LoggerFactory.getLogger(VaultOperationExecutor.class);

    private final ReentrantLock lock = new ReentrantLock(true);
    private final VaultState state;
    private final VaultAssets assets;
    private final Clock clock;
    private final VaultEventPublisher publisher;
    private boolean inFlight;

    VaultOperationExecutor(VaultState state, VaultAssets assets, Clock clock, VaultEventPublisher publisher) {
        this.state = state;
        this.assets = assets;
        this.clock = clock;
        this.publisher = publisher;
    }

    <T> T execute(String operation, String caller, Function<OperationContext, T> body) {
        Amounts.requireAccount(caller, "Caller");
        lock.lock();
        try {
            requireNotInFlight(operation);
            inFlight = true;
            VaultState checkpoint = state.copy();
            OperationContext context = new OperationContext(caller, clock.instant(), state, assets);
            T result;
            try {
                result = body.apply(context);
            } catch (RuntimeException e) {
                state.restore(checkpoint);
                context.compensate(e);
                if (e instanceof VaultException vaultException) {
                    log.warn("{} by {} aborted [{}]: {}", operation, caller, vaultException.getCode(), e.getMessage());
                } else {
                    log.warn("{} by {} aborted: {}", operation, caller, e.toString());
                }
                throw e;
            } finally {
                inFlight = false;
            }
            publisher.publishAll(context.events());
            return result;
        } finally {
            lock.unlock();
        }
    }

    <T> T read(String query, Supplier<T> body) {
        lock.lock();
        try {
            requireNotInFlight(query);
            return body.get();
        } finally {
            lock.unlock();
        }
    }

    private void requireNotInFlight(String operation) {
        if (inFlight) {
            throw new ReentrantCallException(operation + " called while another vault operation is in flight");
        }
    }
}
