package com.scifund.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigInteger;
import java.time.Instant;

/**
 * Fundable research deliverable of a project.
 *
 * Invariant: verified implies completed. The verified flag is the single record
 * of "already paid" and is set before any funds move.
 */
@Entity
@Table(name = "milestones", indexes = {
    @Index(name = "idx_milestone_project", columnList = "project_id")
})
public class Milestone {

    @Id
    private Long id;

    @NotNull
    @Column(name = "project_id", nullable = false, updatable = false)
    private Long projectId;

    @NotNull
    @Column(nullable = false, columnDefinition = "TEXT")
    private String description;

    @NotNull
    @Positive
    @Column(name = "funding_amount", nullable = false, precision = 38, scale = 0)
    private BigInteger fundingAmount;

    @Column(nullable = false)
    private boolean completed;

    @Column(nullable = false)
    private boolean verified;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "evidence_ref", columnDefinition = "TEXT")
    private String evidenceRef;

    @Column(name = "verified_by")
    private String verifiedBy;

    @Column(name = "verified_at")
    private Instant verifiedAt;

    @Column(name = "researcher_share", precision = 38, scale = 0)
    private BigInteger researcherShare;

    @Column(name = "fee_amount", precision = 38, scale = 0)
    private BigInteger feeAmount;

    @Column(name = "released_at")
    private Instant releasedAt;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Version
    private Long version;

    protected Milestone() {}

    public static Milestone create(long id, long projectId, String description,
                                   BigInteger fundingAmount, Instant now) {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("Description must not be empty");
        }
        if (fundingAmount == null || fundingAmount.signum() <= 0) {
            throw new IllegalArgumentException("Funding amount must be positive");
        }
        var milestone = new Milestone();
        milestone.id = id;
        milestone.projectId = projectId;
        milestone.description = description;
        milestone.fundingAmount = fundingAmount;
        milestone.createdAt = now;
        return milestone;
    }

    public void complete(String evidenceRef, Instant now) {
        if (completed) {
            throw new IllegalStateException("Milestone already completed");
        }
        if (evidenceRef == null || evidenceRef.isBlank()) {
            throw new IllegalArgumentException("Evidence reference must not be empty");
        }
        this.completed = true;
        this.completedAt = now;
        this.evidenceRef = evidenceRef;
    }

    public void markVerified(String verifierId, Instant now) {
        if (!completed) {
            throw new IllegalStateException("Milestone is not completed");
        }
        if (verified) {
            throw new IllegalStateException("Milestone already verified");
        }
        this.verified = true;
        this.verifiedBy = verifierId;
        this.verifiedAt = now;
    }

    public void recordRelease(FeeSplit split, Instant now) {
        if (!verified) {
            throw new IllegalStateException("Cannot release funds for an unverified milestone");
        }
        if (releasedAt != null) {
            throw new IllegalStateException("Milestone funds already released");
        }
        this.researcherShare = split.researcherShare();
        this.feeAmount = split.fee();
        this.releasedAt = now;
    }

    public boolean isReleased() {
        return releasedAt != null;
    }

    // Getters
    public Long getId() { return id; }
    public Long getProjectId() { return projectId; }
    public String getDescription() { return description; }
    public BigInteger getFundingAmount() { return fundingAmount; }
    public boolean isCompleted() { return completed; }
    public boolean isVerified() { return verified; }
    public Instant getCompletedAt() { return completedAt; }
    public String getEvidenceRef() { return evidenceRef; }
    public String getVerifiedBy() { return verifiedBy; }
    public Instant getVerifiedAt() { return verifiedAt; }
    public BigInteger getResearcherShare() { return researcherShare; }
    public BigInteger getFeeAmount() { return feeAmount; }
    public Instant getReleasedAt() { return releasedAt; }
    public Instant getCreatedAt() { return createdAt; }
}
