package com.splitvault.api.config;

import com.splitvault.api.event.VaultEventPublisher;
import com.splitvault.api.vault.VaultService;
import com.splitvault.blockchain.service.ChainConnector;
import com.splitvault.core.asset.AssetRole;
import com.splitvault.core.asset.LedgerAsset;
import com.splitvault.core.asset.TransferableAsset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the vault over chain-backed assets when chain access is enabled,
 * otherwise over in-process ledgers.
 */
@Configuration
public class VaultConfiguration {

    private static final Logger log = LoggerFactory.getLogger(VaultConfiguration.class);

    static final String BASE_SYMBOL = "BASE";
    static final String GOVERNANCE_SYMBOL = "GOV";

    @Bean
    public Clock vaultClock() {
        return Clock.systemUTC();
    }

    @Bean
    public VaultService vaultService(
            VaultProperties properties,
            ChainConnector chainConnector,
            Clock vaultClock,
            VaultEventPublisher publisher) {
        String vaultAccount = properties.getAccount();
        TransferableAsset base;
        TransferableAsset governance;
        if (chainConnector.isEnabled()) {
            // The vault must be the signing key so it can pull allowances and pay out.
            String signer = chainConnector.signerAddress();
            if (!signer.equalsIgnoreCase(vaultAccount)) {
                log.warn("Vault account {} replaced by chain signer {}", vaultAccount, signer);
                vaultAccount = signer;
            }
            base = chainConnector.baseAsset(BASE_SYMBOL);
            governance = chainConnector.governanceAsset(GOVERNANCE_SYMBOL);
        } else {
            log.info("Chain access disabled, vault runs over in-process ledgers");
            base = new LedgerAsset(BASE_SYMBOL, AssetRole.BASE);
            governance = new LedgerAsset(GOVERNANCE_SYMBOL, AssetRole.GOVERNANCE);
        }
        return new VaultService(properties, vaultAccount, base, governance, vaultClock, publisher);
    }
}
