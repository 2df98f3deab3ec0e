package com.splitvault.blockchain.service;

import com.splitvault.blockchain.contract.Erc20Contract;
import com.splitvault.core.asset.AssetRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;
import org.web3j.tx.gas.StaticGasProvider;

import java.math.BigInteger;

/**
 * Opens ERC-20 asset services over a single JSON-RPC connection and signing key.
 */
@Service
public class ChainConnector {

    private static final Logger log = LoggerFactory.getLogger(ChainConnector.class);

    private final ChainConfig config;
    private Web3j web3j;
    private Credentials credentials;
    private StaticGasProvider gasProvider;

    public ChainConnector(ChainConfig config) {
        this.config = config;
        if (config.isEnabled()) {
            connect();
        }
    }

    private void connect() {
        config.requireComplete();
        this.web3j = Web3j.build(new HttpService(config.getNodeUrl()));
        this.credentials = Credentials.create(config.getPrivateKey());
        this.gasProvider = new StaticGasProvider(
                BigInteger.valueOf(config.getGasPrice()),
                BigInteger.valueOf(config.getGasLimit()));
        log.info("Connected to {} as {}", config.getNodeUrl(), credentials.getAddress());
    }

    public boolean isEnabled() {
        return config.isEnabled() && web3j != null;
    }

    /**
     * Address transactions are signed with; the vault account when assets live on chain.
     */
    public String signerAddress() {
        requireEnabled();
        return credentials.getAddress();
    }

    public Erc20AssetService baseAsset(String symbol) {
        return open(config.getBaseAssetAddress(), symbol, AssetRole.BASE);
    }

    public Erc20AssetService governanceAsset(String symbol) {
        return open(config.getGovernanceAssetAddress(), symbol, AssetRole.GOVERNANCE);
    }

    private Erc20AssetService open(String tokenAddress, String symbol, AssetRole role) {
        requireEnabled();
        Erc20Contract contract = Erc20Contract.load(tokenAddress, web3j, credentials, gasProvider);
        log.info("{} asset {} bound to token at {}", role, symbol, tokenAddress);
        return new Erc20AssetService(contract, credentials.getAddress(), symbol, role);
    }

    private void requireEnabled() {
        if (!isEnabled()) {
            throw new IllegalStateException("Chain access is disabled (splitvault.chain.enabled=false)");
        }
    }
}
