package com.scifund.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;

/**
 * Trust flag for a milestone verifier. Managed by the platform owner.
 */
@Entity
@Table(name = "verifier_grants")
public class VerifierGrant {

    @Id
    @Column(name = "principal_id", nullable = false, updatable = false)
    private String principalId;

    @Column(nullable = false)
    private boolean enabled;

    @NotNull
    @Column(name = "updated_by", nullable = false)
    private String updatedBy;

    @NotNull
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    protected VerifierGrant() {}

    public static VerifierGrant create(String principalId, boolean enabled, String updatedBy, Instant now) {
        var grant = new VerifierGrant();
        grant.principalId = principalId;
        grant.update(enabled, updatedBy, now);
        return grant;
    }

    public void update(boolean enabled, String updatedBy, Instant now) {
        this.enabled = enabled;
        this.updatedBy = updatedBy;
        this.updatedAt = now;
    }

    public String getPrincipalId() { return principalId; }
    public boolean isEnabled() { return enabled; }
    public String getUpdatedBy() { return updatedBy; }
    public Instant getUpdatedAt() { return updatedAt; }
}
