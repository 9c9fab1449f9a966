package com.scifund.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;

/**
 * Platform-wide parameters. Exactly one row, id {@link #SINGLETON_ID}.
 */
@Entity
@Table(name = "platform_settings")
public class PlatformSettings {

    public static final long SINGLETON_ID = 1L;
    public static final int DEFAULT_FEE_BPS = 250;
    public static final int MAX_FEE_BPS = 1000;

    @Id
    private Long id;

    @NotNull
    @Column(name = "owner_id", nullable = false)
    private String ownerId;

    @NotNull
    @Column(name = "fee_recipient_id", nullable = false)
    private String feeRecipientId;

    @Column(name = "fee_bps", nullable = false)
    private int feeBps;

    @NotNull
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    protected PlatformSettings() {}

    public static PlatformSettings initialize(String ownerId, String feeRecipientId, int feeBps, Instant now) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("Platform owner must be configured");
        }
        var settings = new PlatformSettings();
        settings.id = SINGLETON_ID;
        settings.ownerId = ownerId;
        settings.changeFeeRecipient(feeRecipientId == null || feeRecipientId.isBlank() ? ownerId : feeRecipientId, now);
        settings.changeFee(feeBps, now);
        return settings;
    }

    public void changeFee(int feeBps, Instant now) {
        if (feeBps < 0 || feeBps > MAX_FEE_BPS) {
            throw new IllegalArgumentException("Fee must be between 0 and " + MAX_FEE_BPS + " bps");
        }
        this.feeBps = feeBps;
        this.updatedAt = now;
    }

    public void changeFeeRecipient(String feeRecipientId, Instant now) {
        if (feeRecipientId == null || feeRecipientId.isBlank()) {
            throw new IllegalArgumentException("Fee recipient must not be empty");
        }
        this.feeRecipientId = feeRecipientId;
        this.updatedAt = now;
    }

    public boolean isOwner(String principalId) {
        return ownerId.equals(principalId);
    }

    public Long getId() { return id; }
    public String getOwnerId() { return ownerId; }
    public String getFeeRecipientId() { return feeRecipientId; }
    public int getFeeBps() { return feeBps; }
    public Instant getUpdatedAt() { return updatedAt; }
}
