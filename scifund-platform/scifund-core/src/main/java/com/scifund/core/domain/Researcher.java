package com.scifund.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Registered researcher, keyed by the caller's principal id.
 * Registration overwrites the profile and resets reputation; the owned project
 * list survives re-registration.
 */
@Entity
@Table(name = "researchers")
public class Researcher {

    public static final long INITIAL_REPUTATION = 100;
    public static final long RELEASE_REPUTATION_BONUS = 10;

    @Id
    @Column(name = "principal_id", nullable = false, updatable = false)
    private String principalId;

    @NotNull
    @Column(nullable = false, columnDefinition = "TEXT")
    private String name;

    @NotNull
    @Column(nullable = false, columnDefinition = "TEXT")
    private String institution;

    @ElementCollection
    @CollectionTable(name = "researcher_expertise", joinColumns = @JoinColumn(name = "principal_id"))
    @OrderColumn(name = "item_order")
    @Column(name = "tag", nullable = false, columnDefinition = "TEXT")
    private List<String> expertise = new ArrayList<>();

    @PositiveOrZero
    @Column(nullable = false)
    private long reputation;

    @Column(nullable = false)
    private boolean verified;

    @ElementCollection
    @CollectionTable(name = "researcher_projects", joinColumns = @JoinColumn(name = "principal_id"))
    @OrderColumn(name = "item_order")
    @Column(name = "project_id", nullable = false)
    private List<Long> projectIds = new ArrayList<>();

    @NotNull
    @Column(name = "registered_at", nullable = false, updatable = false)
    private Instant registeredAt;

    @NotNull
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    protected Researcher() {}

    public static Researcher register(String principalId, String name, String institution,
                                      List<String> expertise, Instant now) {
        var researcher = new Researcher();
        researcher.principalId = principalId;
        researcher.registeredAt = now;
        researcher.overwriteProfile(name, institution, expertise, now);
        return researcher;
    }

    /**
     * Full overwrite of the profile. Reputation goes back to its initial value.
     */
    public void overwriteProfile(String name, String institution, List<String> expertise, Instant now) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Name must not be empty");
        }
        if (institution == null || institution.isBlank()) {
            throw new IllegalArgumentException("Institution must not be empty");
        }
        this.name = name;
        this.institution = institution;
        this.expertise.clear();
        if (expertise != null) {
            this.expertise.addAll(expertise);
        }
        this.reputation = INITIAL_REPUTATION;
        this.verified = false;
        this.updatedAt = now;
    }

    public void addProject(long projectId) {
        projectIds.add(projectId);
    }

    public void rewardRelease(Instant now) {
        this.reputation += RELEASE_REPUTATION_BONUS;
        this.updatedAt = now;
    }

    // Getters
    public String getPrincipalId() { return principalId; }
    public String getName() { return name; }
    public String getInstitution() { return institution; }
    public List<String> getExpertise() { return Collections.unmodifiableList(expertise); }
    public long getReputation() { return reputation; }
    public boolean isVerified() { return verified; }
    public List<Long> getProjectIds() { return Collections.unmodifiableList(projectIds); }
    public Instant getRegisteredAt() { return registeredAt; }
    public Instant getUpdatedAt() { return updatedAt; }
}
