package com.scifund.blockchain.service;

import com.scifund.blockchain.contract.PayoutAnchorContract;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.protocol.http.HttpService;
import org.web3j.tx.gas.StaticGasProvider;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.HexFormat;
import java.util.Optional;

/**
 * Anchors milestone payout receipts on chain.
 * Every call is a no-op returning empty while anchoring is disabled.
 */
@Service
public class BlockchainPayoutAnchorService {

    private static final Logger log = LoggerFactory.getLogger(BlockchainPayoutAnchorService.class);
    private final BlockchainConfig config;
    private PayoutAnchorContract contract;
    private Web3j web3j;

    public BlockchainPayoutAnchorService(BlockchainConfig config) {
        this.config = config;
        if (config.isEnabled()) {
            initializeContract();
        }
    }

    private void initializeContract() {
        try {
            this.web3j = Web3j.build(new HttpService(config.getNodeUrl()));
            Credentials credentials = Credentials.create(config.getPrivateKey());
            StaticGasProvider gasProvider = new StaticGasProvider(
                    BigInteger.valueOf(config.getGasPrice()),
                    BigInteger.valueOf(config.getGasLimit()));
            this.contract = PayoutAnchorContract.load(
                    config.getPayoutAnchorAddress(), web3j, credentials, gasProvider);
            log.info("Payout anchor contract initialized at {}", config.getPayoutAnchorAddress());
        } catch (Exception e) {
            log.error("Failed to initialize payout anchor contract", e);
        }
    }

    /**
     * Anchors the receipt hash of a milestone payout.
     */
    public Optional<AnchorResult> anchorPayout(long milestoneId, String receiptHash, BigInteger amount) {
        if (!isEnabled()) {
            return Optional.empty();
        }
        try {
            TransactionReceipt receipt = contract.anchorPayout(
                    milestoneKey(milestoneId), hexToBytes32(receiptHash), amount).send();
            return Optional.of(new AnchorResult(
                    milestoneId,
                    receipt.getTransactionHash(),
                    receipt.getBlockNumber(),
                    receipt.isStatusOK()
            ));
        } catch (Exception e) {
            log.error("Failed to anchor payout of milestone {} on blockchain", milestoneId, e);
            return Optional.empty();
        }
    }

    public Optional<Boolean> isAnchored(String receiptHash) {
        if (!isEnabled()) {
            return Optional.empty();
        }
        try {
            return Optional.of(contract.isAnchored(hexToBytes32(receiptHash)).send());
        } catch (Exception e) {
            log.error("Failed to look up payout anchor {}", receiptHash, e);
            return Optional.empty();
        }
    }

    public boolean isEnabled() {
        return config.isEnabled() && contract != null;
    }

    /**
     * Milestone id as a big-endian uint256 in a bytes32 slot.
     */
    static byte[] milestoneKey(long milestoneId) {
        if (milestoneId <= 0) {
            throw new IllegalArgumentException("Milestone id must be positive");
        }
        return ByteBuffer.allocate(32).putLong(24, milestoneId).array();
    }

    static byte[] hexToBytes32(String hex) {
        String cleanHex = hex.startsWith("0x") ? hex.substring(2) : hex;
        if (cleanHex.length() > 64 || cleanHex.length() % 2 != 0) {
            throw new IllegalArgumentException("Not a 32-byte hex value: " + hex);
        }
        byte[] bytes = new byte[32];
        byte[] hexBytes = HexFormat.of().parseHex(cleanHex);
        System.arraycopy(hexBytes, 0, bytes, 32 - hexBytes.length, hexBytes.length);
        return bytes;
    }

    public record AnchorResult(long milestoneId, String txHash, BigInteger blockNumber, boolean success) {}
}
