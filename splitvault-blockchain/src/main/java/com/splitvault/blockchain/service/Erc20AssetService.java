package com.splitvault.blockchain.service;

import com.splitvault.blockchain.contract.Erc20Contract;
import com.splitvault.core.asset.AssetRole;
import com.splitvault.core.asset.TransferableAsset;
import com.splitvault.core.domain.Amounts;
import com.splitvault.core.exception.AssetUnavailableException;
import com.splitvault.core.exception.InsufficientAllowanceOrBalanceException;
import com.splitvault.core.exception.UnauthorizedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.protocol.core.RemoteFunctionCall;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.protocol.exceptions.TransactionException;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Transferable asset backed by an ERC-20 token on an EVM chain.
 *
 * Transactions are signed by a single key, so only that account can act as sender,
 * spender or approving owner. Reverted transactions surface as
 * {@link InsufficientAllowanceOrBalanceException}; transport failures as
 * {@link AssetUnavailableException}.
 */
public class Erc20AssetService implements TransferableAsset {

    private static final Logger log = LoggerFactory.getLogger(Erc20AssetService.class);

    private final Erc20Contract contract;
    private final String signerAddress;
    private final String symbol;
    private final AssetRole role;

    public Erc20AssetService(Erc20Contract contract, String signerAddress, String symbol, AssetRole role) {
        this.contract = Objects.requireNonNull(contract, "Contract cannot be null");
        this.signerAddress = Amounts.requireAccount(signerAddress, "Signer address");
        this.symbol = Amounts.requireAccount(symbol, "Symbol");
        this.role = Objects.requireNonNull(role, "Role cannot be null");
        if (role.isIssuedByVault()) {
            throw new IllegalArgumentException("Claim tokens are issued by the vault, not bound from chain");
        }
    }

    @Override
    public String symbol() {
        return symbol;
    }

    @Override
    public AssetRole role() {
        return role;
    }

    public String signerAddress() {
        return signerAddress;
    }

    @Override
    public BigInteger balanceOf(String account) {
        return query("balanceOf(" + account + ")", contract.balanceOf(account));
    }

    @Override
    public BigInteger totalSupply() {
        return query("totalSupply()", contract.totalSupply());
    }

    @Override
    public BigInteger allowance(String owner, String spender) {
        return query("allowance(" + owner + ", " + spender + ")", contract.allowance(owner, spender));
    }

    @Override
    public void transfer(String from, String to, BigInteger amount) {
        requireSigner(from, "transfer from");
        Amounts.requireNonNegative(amount, "Transfer amount");
        submit("transfer " + amount + " to " + to, contract.transfer(to, amount));
    }

    @Override
    public void transferFrom(String spender, String owner, String to, BigInteger amount) {
        requireSigner(spender, "spend for");
        Amounts.requireNonNegative(amount, "Transfer amount");
        submit("transferFrom " + owner + " " + amount + " to " + to, contract.transferFrom(owner, to, amount));
    }

    @Override
    public void approve(String owner, String spender, BigInteger amount) {
        requireSigner(owner, "approve for");
        Amounts.requireNonNegative(amount, "Allowance");
        submit("approve " + spender + " for " + amount, contract.approve(spender, amount));
    }

    private void requireSigner(String account, String action) {
        if (!signerAddress.equalsIgnoreCase(account)) {
            throw new UnauthorizedException(symbol + ": signer " + signerAddress + " cannot " + action + " " + account);
        }
    }

    private BigInteger query(String description, RemoteFunctionCall<BigInteger> call) {
        try {
            return call.send();
        } catch (Exception e) {
            log.error("{}: call {} failed", symbol, description, e);
            throw new AssetUnavailableException(symbol + ": " + description + " failed", e);
        }
    }

    private void submit(String description, RemoteFunctionCall<TransactionReceipt> call) {
        TransactionReceipt receipt;
        try {
            receipt = call.send();
        } catch (TransactionException e) {
            throw new InsufficientAllowanceOrBalanceException(symbol + ": " + description + " reverted: " + e.getMessage());
        } catch (Exception e) {
            log.error("{}: transaction {} failed", symbol, description, e);
            throw new AssetUnavailableException(symbol + ": " + description + " failed", e);
        }
        if (!receipt.isStatusOK()) {
            throw new InsufficientAllowanceOrBalanceException(
                    symbol + ": " + description + " reverted in " + receipt.getTransactionHash());
        }
        log.info("{}: {} mined in {}", symbol, description, receipt.getTransactionHash());
    }
}
