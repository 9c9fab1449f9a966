package com.scifund.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Crowdfunded research project.
 *
 * Owns its contribution aggregate: the contributor list and the per-contributor
 * amounts live in a single ordered collection, so a contributor is listed iff
 * their cumulative amount is non-zero and currentFunding always equals the sum
 * of all contributions.
 */
@Entity
@Table(name = "projects", indexes = {
    @Index(name = "idx_project_researcher", columnList = "researcher_id"),
    @Index(name = "idx_project_status", columnList = "status")
})
public class Project {

    @Id
    private Long id;

    @NotNull
    @Column(name = "researcher_id", nullable = false, updatable = false)
    private String researcherId;

    @NotNull
    @Column(nullable = false, columnDefinition = "TEXT")
    private String title;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "research_area", columnDefinition = "TEXT")
    private String researchArea;

    @NotNull
    @Positive
    @Column(name = "funding_goal", nullable = false, precision = 38, scale = 0)
    private BigInteger fundingGoal;

    @NotNull
    @PositiveOrZero
    @Column(name = "current_funding", nullable = false, precision = 38, scale = 0)
    private BigInteger currentFunding;

    @NotNull
    @Column(nullable = false)
    private Instant deadline;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private ProjectStatus status;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "funded_at")
    private Instant fundedAt;

    @ElementCollection
    @CollectionTable(name = "project_planned_milestones", joinColumns = @JoinColumn(name = "project_id"))
    @OrderColumn(name = "item_order")
    @Column(name = "description", nullable = false, columnDefinition = "TEXT")
    private List<String> plannedMilestones = new ArrayList<>();

    @ElementCollection
    @CollectionTable(name = "project_contributions", joinColumns = @JoinColumn(name = "project_id"))
    @OrderColumn(name = "item_order")
    private List<Contribution> contributions = new ArrayList<>();

    @Version
    private Long version;

    protected Project() {}

    public static Project create(
            long id,
            String researcherId,
            String title,
            String description,
            String researchArea,
            BigInteger fundingGoal,
            Instant deadline,
            List<String> plannedMilestones,
            Instant now) {

        if (id <= 0) {
            throw new IllegalArgumentException("Project id must be positive");
        }
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Title must not be empty");
        }
        if (fundingGoal == null || fundingGoal.signum() <= 0) {
            throw new IllegalArgumentException("Funding goal must be positive");
        }
        if (!deadline.isAfter(now)) {
            throw new IllegalArgumentException("Deadline must be in the future");
        }

        var project = new Project();
        project.id = id;
        project.researcherId = researcherId;
        project.title = title;
        project.description = description;
        project.researchArea = researchArea;
        project.fundingGoal = fundingGoal;
        project.currentFunding = BigInteger.ZERO;
        project.deadline = deadline;
        project.status = ProjectStatus.ACTIVE;
        project.createdAt = now;
        if (plannedMilestones != null) {
            project.plannedMilestones.addAll(plannedMilestones);
        }
        return project;
    }

    /**
     * Records a contribution and moves the project to FUNDED once the goal is met.
     * Overshoot is accepted in full.
     *
     * @return true if this contribution reached the funding goal
     */
    public boolean acceptContribution(String contributorId, BigInteger amount, Instant now) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Contribution must be positive");
        }
        if (status != ProjectStatus.ACTIVE) {
            throw new IllegalStateException("Project is not active: " + status);
        }
        if (!now.isBefore(deadline)) {
            throw new IllegalStateException("Funding deadline has passed");
        }
        if (isGoalReached()) {
            throw new IllegalStateException("Funding goal already reached");
        }

        contributions.stream()
                .filter(c -> c.getContributorId().equals(contributorId))
                .findFirst()
                .ifPresentOrElse(
                        c -> c.add(amount, now),
                        () -> contributions.add(new Contribution(contributorId, amount, now)));
        currentFunding = currentFunding.add(amount);

        if (isGoalReached()) {
            advanceTo(ProjectStatus.FUNDED);
            fundedAt = now;
            return true;
        }
        return false;
    }

    /**
     * First completed milestone of a funded project starts the work phase.
     *
     * @return true if the status changed
     */
    public boolean startWork() {
        if (status != ProjectStatus.FUNDED) {
            return false;
        }
        advanceTo(ProjectStatus.IN_PROGRESS);
        return true;
    }

    public boolean isAcceptingMilestones() {
        return status == ProjectStatus.FUNDED || status == ProjectStatus.IN_PROGRESS;
    }

    public boolean isGoalReached() {
        return currentFunding.compareTo(fundingGoal) >= 0;
    }

    public boolean isOwnedBy(String principalId) {
        return researcherId.equals(principalId);
    }

    private void advanceTo(ProjectStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal project transition " + status + " -> " + next);
        }
        status = next;
    }

    public List<String> getContributors() {
        return contributions.stream()
                .map(Contribution::getContributorId)
                .toList();
    }

    public BigInteger getContributionOf(String contributorId) {
        return contributions.stream()
                .filter(c -> c.getContributorId().equals(contributorId))
                .map(Contribution::getAmount)
                .findFirst()
                .orElse(BigInteger.ZERO);
    }

    public Map<String, BigInteger> getContributions() {
        Map<String, BigInteger> view = new LinkedHashMap<>();
        contributions.forEach(c -> view.put(c.getContributorId(), c.getAmount()));
        return Collections.unmodifiableMap(view);
    }

    // Getters
    public Long getId() { return id; }
    public String getResearcherId() { return researcherId; }
    public String getTitle() { return title; }
    public String getDescription() { return description; }
    public String getResearchArea() { return researchArea; }
    public BigInteger getFundingGoal() { return fundingGoal; }
    public BigInteger getCurrentFunding() { return currentFunding; }
    public Instant getDeadline() { return deadline; }
    public ProjectStatus getStatus() { return status; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getFundedAt() { return fundedAt; }
    public List<String> getPlannedMilestones() { return Collections.unmodifiableList(plannedMilestones); }
}
