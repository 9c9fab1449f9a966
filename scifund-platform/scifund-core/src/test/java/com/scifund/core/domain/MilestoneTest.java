package com.scifund.core.domain;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class MilestoneTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private Milestone milestone;

    @BeforeEach
    void setUp() {
        milestone = Milestone.create(1L, 7L, "Dataset collected", BigInteger.valueOf(400), NOW);
    }

    @Test
    void newMilestoneIsOpen() {
        assertFalse(milestone.isCompleted());
        assertFalse(milestone.isVerified());
        assertFalse(milestone.isReleased());
        assertEquals(7L, milestone.getProjectId());
    }

    @Test
    void completeRecordsEvidence() {
        milestone.complete("ipfs://evidence", NOW.plusSeconds(60));

        assertTrue(milestone.isCompleted());
        assertEquals("ipfs://evidence", milestone.getEvidenceRef());
        assertEquals(NOW.plusSeconds(60), milestone.getCompletedAt());
    }

    @Test
    void completeTwiceFails() {
        milestone.complete("ipfs://evidence", NOW);
        assertThrows(IllegalStateException.class, () -> milestone.complete("ipfs://other", NOW));
        assertEquals("ipfs://evidence", milestone.getEvidenceRef());
    }

    @Test
    void blankEvidenceIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> milestone.complete(" ", NOW));
        assertFalse(milestone.isCompleted());
    }

    @Test
    void verifyRequiresCompletion() {
        assertThrows(IllegalStateException.class, () -> milestone.markVerified("verifier-1", NOW));
        assertFalse(milestone.isVerified());
    }

    @Test
    void verifyOnlyOnce() {
        milestone.complete("ipfs://evidence", NOW);
        milestone.markVerified("verifier-1", NOW);

        assertTrue(milestone.isVerified());
        assertEquals("verifier-1", milestone.getVerifiedBy());
        assertThrows(IllegalStateException.class, () -> milestone.markVerified("verifier-2", NOW));
        assertEquals("verifier-1", milestone.getVerifiedBy());
    }

    @Test
    void releaseRequiresVerification() {
        FeeSplit split = FeeSplit.of(milestone.getFundingAmount(), 250);
        assertThrows(IllegalStateException.class, () -> milestone.recordRelease(split, NOW));

        milestone.complete("ipfs://evidence", NOW);
        milestone.markVerified("verifier-1", NOW);
        milestone.recordRelease(split, NOW);

        assertTrue(milestone.isReleased());
        assertEquals(BigInteger.valueOf(390), milestone.getResearcherShare());
        assertEquals(BigInteger.TEN, milestone.getFeeAmount());
        assertThrows(IllegalStateException.class, () -> milestone.recordRelease(split, NOW));
    }

    @Test
    void createValidatesInput() {
        assertThrows(IllegalArgumentException.class,
                () -> Milestone.create(2L, 7L, "", BigInteger.ONE, NOW));
        assertThrows(IllegalArgumentException.class,
                () -> Milestone.create(2L, 7L, "Analysis", BigInteger.ZERO, NOW));
    }
}
