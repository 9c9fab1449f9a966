package com.scifund.api.escrow;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Result of a milestone payout. receiptHash is what gets anchored on chain.
 */
public record PayoutReceipt(
        long milestoneId,
        long projectId,
        String researcherId,
        BigInteger researcherShare,
        String feeRecipientId,
        BigInteger fee,
        int feeBps,
        Instant releasedAt,
        String receiptHash
) {}
