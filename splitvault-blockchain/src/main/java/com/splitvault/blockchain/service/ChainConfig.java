package com.splitvault.blockchain.service;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for EVM connectivity of the base and governance assets.
 */
@Configuration
@ConfigurationProperties(prefix = "splitvault.chain")
public class ChainConfig {

    private String nodeUrl = "http://localhost:8545";
    private String baseAssetAddress;
    private String governanceAssetAddress;
    private String privateKey;
    private long gasPrice = 20_000_000_000L; // 20 Gwei
    private long gasLimit = 6_721_975L;
    private boolean enabled = false;

    public String getNodeUrl() { return nodeUrl; }
    public void setNodeUrl(String nodeUrl) { this.nodeUrl = nodeUrl; }
    public String getBaseAssetAddress() { return baseAssetAddress; }
    public void setBaseAssetAddress(String addr) { this.baseAssetAddress = addr; }
    public String getGovernanceAssetAddress() { return governanceAssetAddress; }
    public void setGovernanceAssetAddress(String addr) { this.governanceAssetAddress = addr; }
    public String getPrivateKey() { return privateKey; }
    public void setPrivateKey(String privateKey) { this.privateKey = privateKey; }
    public long getGasPrice() { return gasPrice; }
    public void setGasPrice(long gasPrice) { this.gasPrice = gasPrice; }
    public long getGasLimit() { return gasLimit; }
    public void setGasLimit(long gasLimit) { this.gasLimit = gasLimit; }
    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    /**
     * Fails fast when chain access is enabled without the settings it needs.
     */
    void requireComplete() {
        requireSet(nodeUrl, "node-url");
        requireSet(privateKey, "private-key");
        requireSet(baseAssetAddress, "base-asset-address");
        requireSet(governanceAssetAddress, "governance-asset-address");
    }

    private static void requireSet(String value, String property) {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException("splitvault.chain." + property + " is required when chain access is enabled");
        }
    }
}
