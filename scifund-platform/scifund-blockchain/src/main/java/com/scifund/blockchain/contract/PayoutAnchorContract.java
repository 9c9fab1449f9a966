package com.scifund.blockchain.contract;

import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.generated.Bytes32;
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
 * Payout Anchor Smart Contract - Web3j wrapper.
 *
 * Records a hash of every milestone payout so funders can check releases
 * against an independent, append-only log.
 *
 * Solidity equivalent:
 * contract PayoutAnchor {
 *     mapping(bytes32 => bool) public anchored;
 *     event PayoutAnchored(bytes32 indexed milestoneKey, bytes32 receiptHash, uint256 amount);
 *     function anchorPayout(bytes32 milestoneKey, bytes32 receiptHash, uint256 amount) external;
 *     function isAnchored(bytes32 receiptHash) external view returns (bool);
 * }
 */
public class PayoutAnchorContract extends Contract {

    /**
     * Deployed separately; use {@link #load} with the contract address.
     */
    public static final String BINARY = "";

    public static final String FUNC_ANCHORPAYOUT = "anchorPayout";
    public static final String FUNC_ISANCHORED = "isAnchored";

    protected PayoutAnchorContract(String contractAddress, Web3j web3j,
                                   Credentials credentials, ContractGasProvider gasProvider) {
        super(BINARY, contractAddress, web3j, credentials, gasProvider);
    }

    public RemoteFunctionCall<TransactionReceipt> anchorPayout(
            byte[] milestoneKey, byte[] receiptHash, BigInteger amount) {
        final Function function = new Function(
                FUNC_ANCHORPAYOUT,
                Arrays.asList(
                        new Bytes32(milestoneKey),
                        new Bytes32(receiptHash),
                        new Uint256(amount)
                ),
                Collections.emptyList());
        return executeRemoteCallTransaction(function);
    }

    public RemoteFunctionCall<Boolean> isAnchored(byte[] receiptHash) {
        final Function function = new Function(
                FUNC_ISANCHORED,
                Arrays.asList(new Bytes32(receiptHash)),
                Arrays.asList(new TypeReference<Bool>() {}));
        return executeRemoteCallSingleValueReturn(function, Boolean.class);
    }

    public static PayoutAnchorContract load(String contractAddress, Web3j web3j,
                                            Credentials credentials, ContractGasProvider gasProvider) {
        return new PayoutAnchorContract(contractAddress, web3j, credentials, gasProvider);
    }
}
