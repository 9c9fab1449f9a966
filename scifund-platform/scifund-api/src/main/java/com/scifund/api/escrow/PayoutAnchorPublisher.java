package com.scifund.api.escrow;

import com.scifund.blockchain.service.BlockchainPayoutAnchorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.math.BigInteger;

/**
 * Anchors payout receipts on chain once the payout has committed.
 * A rolled-back payout is never anchored; an anchoring failure never touches the ledger.
 */
@Component
public class PayoutAnchorPublisher {

    private static final Logger log = LoggerFactory.getLogger(PayoutAnchorPublisher.class);

    private final BlockchainPayoutAnchorService anchorService;

    public PayoutAnchorPublisher(BlockchainPayoutAnchorService anchorService) {
        this.anchorService = anchorService;
    }

    public void publishAfterCommit(PayoutReceipt receipt) {
        if (!anchorService.isEnabled()) {
            log.debug("Payout anchoring disabled, skipping milestone {}", receipt.milestoneId());
            return;
        }
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            anchor(receipt);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                anchor(receipt);
            }
        });
    }

    void anchor(PayoutReceipt receipt) {
        BigInteger total = receipt.researcherShare().add(receipt.fee());
        anchorService.anchorPayout(receipt.milestoneId(), receipt.receiptHash(), total)
                .ifPresentOrElse(
                        result -> log.info("Payout of milestone {} anchored in tx {}",
                                receipt.milestoneId(), result.txHash()),
                        () -> log.warn("Payout of milestone {} was not anchored", receipt.milestoneId()));
    }
}
