package com.splitvault.blockchain.contract;

import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Event;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.RemoteFunctionCall;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.tx.Contract;
import org.web3j.tx.gas.ContractGasProvider;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;

/**
 * ERC-20 token contract - Web3j wrapper.
 *
 * Used for base and governance assets that live on an EVM chain. Only the functions the
 * vault needs are bound.
 *
 * Solidity interface:
 * interface IERC20 {
 *     function totalSupply() external view returns (uint256);
 *     function balanceOf(address account) external view returns (uint256);
 *     function allowance(address owner, address spender) external view returns (uint256);
 *     function transfer(address to, uint256 amount) external returns (bool);
 *     function approve(address spender, uint256 amount) external returns (bool);
 *     function transferFrom(address from, address to, uint256 amount) external returns (bool);
 *
 *     event Transfer(address indexed from, address indexed to, uint256 value);
 *     event Approval(address indexed owner, address indexed spender, uint256 value);
 * }
 */
public class Erc20Contract extends Contract {

    /**
     * The wrapper only binds to already deployed tokens; use {@link #load}.
     */
    public static final String BINARY = "";

    public static final String FUNC_TOTALSUPPLY = "totalSupply";
    public static final String FUNC_BALANCEOF = "balanceOf";
    public static final String FUNC_ALLOWANCE = "allowance";
    public static final String FUNC_TRANSFER = "transfer";
    public static final String FUNC_APPROVE = "approve";
    public static final String FUNC_TRANSFERFROM = "transferFrom";

    // Events
    public static final Event TRANSFER_EVENT = new Event("Transfer",
            Arrays.asList(
                    new TypeReference<Address>(true) {},  // from
                    new TypeReference<Address>(true) {},  // to
                    new TypeReference<Uint256>() {}       // value
            ));

    public static final Event APPROVAL_EVENT = new Event("Approval",
            Arrays.asList(
                    new TypeReference<Address>(true) {},  // owner
                    new TypeReference<Address>(true) {},  // spender
                    new TypeReference<Uint256>() {}       // value
            ));

    protected Erc20Contract(String contractAddress, Web3j web3j, Credentials credentials,
                            ContractGasProvider gasProvider) {
        super(BINARY, contractAddress, web3j, credentials, gasProvider);
    }

    public RemoteFunctionCall<BigInteger> totalSupply() {
        final Function function = new Function(
                FUNC_TOTALSUPPLY,
                Collections.emptyList(),
                Arrays.asList(new TypeReference<Uint256>() {}));
        return executeRemoteCallSingleValueReturn(function, BigInteger.class);
    }

    public RemoteFunctionCall<BigInteger> balanceOf(String account) {
        final Function function = new Function(
                FUNC_BALANCEOF,
                Arrays.asList(new Address(account)),
                Arrays.asList(new TypeReference<Uint256>() {}));
        return executeRemoteCallSingleValueReturn(function, BigInteger.class);
    }

    public RemoteFunctionCall<BigInteger> allowance(String owner, String spender) {
        final Function function = new Function(
                FUNC_ALLOWANCE,
                Arrays.asList(new Address(owner), new Address(spender)),
                Arrays.asList(new TypeReference<Uint256>() {}));
        return executeRemoteCallSingleValueReturn(function, BigInteger.class);
    }

    /**
     * Transfers from the signing account.
     */
    public RemoteFunctionCall<TransactionReceipt> transfer(String to, BigInteger amount) {
        final Function function = new Function(
                FUNC_TRANSFER,
                Arrays.asList(new Address(to), new Uint256(amount)),
                Collections.emptyList());
        return executeRemoteCallTransaction(function);
    }

    public RemoteFunctionCall<TransactionReceipt> approve(String spender, BigInteger amount) {
        final Function function = new Function(
                FUNC_APPROVE,
                Arrays.asList(new Address(spender), new Uint256(amount)),
                Collections.emptyList());
        return executeRemoteCallTransaction(function);
    }

    /**
     * Spends the signing account's allowance on {@code from}.
     */
    public RemoteFunctionCall<TransactionReceipt> transferFrom(String from, String to, BigInteger amount) {
        final Function function = new Function(
                FUNC_TRANSFERFROM,
                Arrays.asList(new Address(from), new Address(to), new Uint256(amount)),
                Collections.emptyList());
        return executeRemoteCallTransaction(function);
    }

    /**
     * Loads an existing token at the given address.
     */
    public static Erc20Contract load(String contractAddress, Web3j web3j,
                                     Credentials credentials, ContractGasProvider gasProvider) {
        return new Erc20Contract(contractAddress, web3j, credentials, gasProvider);
    }
}
