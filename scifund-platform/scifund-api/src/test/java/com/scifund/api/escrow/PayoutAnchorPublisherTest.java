package com.scifund.api.escrow;

import com.scifund.blockchain.service.BlockchainConfig;
import com.scifund.blockchain.service.BlockchainPayoutAnchorService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class PayoutAnchorPublisherTest {

    private final RecordingAnchorService anchorService = new RecordingAnchorService();
    private final PayoutAnchorPublisher publisher = new PayoutAnchorPublisher(anchorService);

    @AfterEach
    void clearSynchronization() {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    @Test
    void anchorsOnlyAfterCommit() {
        TransactionSynchronizationManager.initSynchronization();

        publisher.publishAfterCommit(receipt(7L));
        assertThat(anchorService.anchored).isEmpty();

        for (TransactionSynchronization synchronization : TransactionSynchronizationManager.getSynchronizations()) {
            synchronization.afterCommit();
        }
        assertThat(anchorService.anchored).containsExactly(7L);
        assertThat(anchorService.amounts).containsExactly(BigInteger.valueOf(400));
    }

    @Test
    void rolledBackPayoutIsNeverAnchored() {
        TransactionSynchronizationManager.initSynchronization();

        publisher.publishAfterCommit(receipt(7L));
        for (TransactionSynchronization synchronization : TransactionSynchronizationManager.getSynchronizations()) {
            synchronization.afterCompletion(TransactionSynchronization.STATUS_ROLLED_BACK);
        }

        assertThat(anchorService.anchored).isEmpty();
    }

    @Test
    void anchorsImmediatelyOutsideATransaction() {
        publisher.publishAfterCommit(receipt(3L));

        assertThat(anchorService.anchored).containsExactly(3L);
    }

    @Test
    void disabledAnchoringRegistersNothing() {
        PayoutAnchorPublisher disabled = new PayoutAnchorPublisher(new BlockchainPayoutAnchorService(new BlockchainConfig()));
        TransactionSynchronizationManager.initSynchronization();

        disabled.publishAfterCommit(receipt(1L));

        assertThat(TransactionSynchronizationManager.getSynchronizations()).isEmpty();
    }

    private static PayoutReceipt receipt(long milestoneId) {
        return new PayoutReceipt(milestoneId, 1L, "alice", BigInteger.valueOf(390), "fee-treasury",
                BigInteger.TEN, 250, Instant.parse("2026-01-01T00:00:00Z"), "ab".repeat(32));
    }

    private static class RecordingAnchorService extends BlockchainPayoutAnchorService {

        final List<Long> anchored = new ArrayList<>();
        final List<BigInteger> amounts = new ArrayList<>();

        RecordingAnchorService() {
            super(new BlockchainConfig());
        }

        @Override
        public boolean isEnabled() {
            return true;
        }

        @Override
        public Optional<AnchorResult> anchorPayout(long milestoneId, String receiptHash, BigInteger amount) {
            anchored.add(milestoneId);
            amounts.add(amount);
            return Optional.of(new AnchorResult(milestoneId, "0x01", BigInteger.ONE, true));
        }
    }
}
