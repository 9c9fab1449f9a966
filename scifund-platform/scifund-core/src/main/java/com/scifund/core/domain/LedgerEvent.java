package com.scifund.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;

/**
 * Append-only record of a ledger state change, hash-chained to its predecessor.
 */
@Entity
@Table(name = "ledger_events", indexes = {
    @Index(name = "idx_event_resource", columnList = "resource_type, resource_id"),
    @Index(name = "idx_event_actor", columnList = "actor_id"),
    @Index(name = "idx_event_type", columnList = "event_type")
})
public class LedgerEvent {

    public static final String GENESIS = "GENESIS";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 64)
    private EventType eventType;

    @NotNull
    @Column(name = "occurred_at", nullable = false)
    private Instant occurredAt;

    @NotNull
    @Column(name = "actor_id", nullable = false)
    private String actorId;

    @NotNull
    @Column(name = "resource_type", nullable = false, length = 64)
    private String resourceType;

    @NotNull
    @Column(name = "resource_id", nullable = false)
    private String resourceId;

    @Column(columnDefinition = "TEXT")
    private String details;

    @NotNull
    @Column(name = "previous_hash", nullable = false, length = 64)
    private String previousHash;

    @Column(name = "event_hash", length = 64)
    private String eventHash;

    protected LedgerEvent() {}

    public static LedgerEvent create(
            EventType eventType,
            String actorId,
            String resourceType,
            String resourceId,
            String details,
            String previousHash,
            Instant now) {

        var event = new LedgerEvent();
        event.eventType = eventType;
        event.occurredAt = now;
        event.actorId = actorId;
        event.resourceType = resourceType;
        event.resourceId = resourceId;
        event.details = details;
        event.previousHash = previousHash;
        return event;
    }

    // Getters
    public Long getId() { return id; }
    public EventType getEventType() { return eventType; }
    public Instant getOccurredAt() { return occurredAt; }
    public String getActorId() { return actorId; }
    public String getResourceType() { return resourceType; }
    public String getResourceId() { return resourceId; }
    public String getDetails() { return details; }
    public String getPreviousHash() { return previousHash; }
    public String getEventHash() { return eventHash; }

    public void setEventHash(String hash) { this.eventHash = hash; }

    public enum EventType {
        RESEARCHER_REGISTERED,
        PROJECT_CREATED,
        CONTRIBUTION_RECEIVED,
        PROJECT_FUNDED,
        PROJECT_STARTED,
        MILESTONE_CREATED,
        MILESTONE_COMPLETED,
        MILESTONE_VERIFIED,
        FUNDS_RELEASED,
        VERIFIER_UPDATED,
        PLATFORM_FEE_UPDATED,
        FEE_RECIPIENT_UPDATED,
        EMERGENCY_WITHDRAWAL
    }
}
