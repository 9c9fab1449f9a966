package com.scifund.core.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import java.math.BigInteger;
import java.time.Instant;

/**
 * Cumulative contribution of one funder to one project.
 * Owned by {@link Project}; never exposed as a mutable reference.
 */
@Embeddable
public class Contribution {

    @Column(name = "contributor_id", nullable = false)
    private String contributorId;

    @Column(name = "amount", nullable = false, precision = 38, scale = 0)
    private BigInteger amount;

    @Column(name = "first_contributed_at", nullable = false)
    private Instant firstContributedAt;

    @Column(name = "last_contributed_at", nullable = false)
    private Instant lastContributedAt;

    protected Contribution() {}

    Contribution(String contributorId, BigInteger amount, Instant at) {
        this.contributorId = contributorId;
        this.amount = amount;
        this.firstContributedAt = at;
        this.lastContributedAt = at;
    }

    void add(BigInteger more, Instant at) {
        this.amount = this.amount.add(more);
        this.lastContributedAt = at;
    }

    public String getContributorId() { return contributorId; }
    public BigInteger getAmount() { return amount; }
    public Instant getFirstContributedAt() { return firstContributedAt; }
    public Instant getLastContributedAt() { return lastContributedAt; }
}
