package com.scifund.api.milestone;

import com.scifund.api.access.AccessPolicy;
import com.scifund.api.access.LedgerOperation;
import com.scifund.api.error.InvalidInputException;
import com.scifund.api.error.InvalidStateException;
import com.scifund.api.error.NotFoundException;
import com.scifund.api.escrow.EscrowPayoutService;
import com.scifund.api.escrow.PayoutReceipt;
import com.scifund.api.event.LedgerEventService;
import com.scifund.api.ledger.LedgerGate;
import com.scifund.api.ledger.SequenceService;
import com.scifund.core.domain.LedgerEvent.EventType;
import com.scifund.core.domain.Milestone;
import com.scifund.core.domain.Project;
import com.scifund.core.repository.MilestoneRepository;
import com.scifund.core.repository.ProjectRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Milestone engine: creation, completion evidence and verification.
 *
 * Verification sets the verified flag and then releases the milestone's funding
 * in the same transaction. A second verification is rejected, so a milestone pays out once.
 * Milestone amounts are not checked against the project's funding.
 */
@Service
public class MilestoneService {

    private static final Logger log = LoggerFactory.getLogger(MilestoneService.class);
    static final String RESOURCE_TYPE = "Milestone";

    private final MilestoneRepository milestoneRepository;
    private final ProjectRepository projectRepository;
    private final SequenceService sequenceService;
    private final EscrowPayoutService payoutService;
    private final AccessPolicy accessPolicy;
    private final LedgerEventService eventService;
    private final LedgerGate gate;
    private final Clock clock;

    public MilestoneService(
            MilestoneRepository milestoneRepository,
            ProjectRepository projectRepository,
            SequenceService sequenceService,
            EscrowPayoutService payoutService,
            AccessPolicy accessPolicy,
            LedgerEventService eventService,
            LedgerGate gate,
            Clock clock) {
        this.milestoneRepository = milestoneRepository;
        this.projectRepository = projectRepository;
        this.sequenceService = sequenceService;
        this.payoutService = payoutService;
        this.accessPolicy = accessPolicy;
        this.eventService = eventService;
        this.gate = gate;
        this.clock = clock;
    }

    public long createMilestone(String caller, long projectId, String description, BigInteger fundingAmount) {
        return gate.execute("createMilestone", () -> {
            Project project = projectRepository.findByIdForUpdate(projectId)
                    .orElseThrow(() -> new NotFoundException("Project not found: " + projectId));
            accessPolicy.authorize(LedgerOperation.CREATE_MILESTONE, caller, project);
            if (!project.isAcceptingMilestones()) {
                throw new InvalidStateException("Project " + projectId + " cannot take milestones while " + project.getStatus());
            }
            if (description == null || description.isBlank()) {
                throw new InvalidInputException("Description must not be empty");
            }
            if (fundingAmount == null || fundingAmount.signum() <= 0) {
                throw new InvalidInputException("Funding amount must be positive");
            }

            long milestoneId = sequenceService.next(SequenceService.MILESTONE);
            milestoneRepository.save(Milestone.create(milestoneId, projectId, description, fundingAmount, clock.instant()));

            eventService.append(EventType.MILESTONE_CREATED, caller, RESOURCE_TYPE, milestoneId,
                    Map.of("project", projectId, "amount", fundingAmount));
            log.info("Milestone {} created for project {} ({})", milestoneId, projectId, fundingAmount);
            return milestoneId;
        });
    }

    public MilestoneView completeMilestone(String caller, long milestoneId, String evidenceRef) {
        return gate.execute("completeMilestone", () -> {
            Milestone milestone = milestoneRepository.findByIdForUpdate(milestoneId)
                    .orElseThrow(() -> new NotFoundException("Milestone not found: " + milestoneId));
            Project project = projectRepository.findByIdForUpdate(milestone.getProjectId())
                    .orElseThrow(() -> new NotFoundException("Project not found: " + milestone.getProjectId()));
            accessPolicy.authorize(LedgerOperation.COMPLETE_MILESTONE, caller, project);
            if (milestone.isCompleted()) {
                throw new InvalidStateException("Milestone " + milestoneId + " already completed");
            }
            if (evidenceRef == null || evidenceRef.isBlank()) {
                throw new InvalidInputException("Evidence reference must not be empty");
            }

            milestone.complete(evidenceRef, clock.instant());
            eventService.append(EventType.MILESTONE_COMPLETED, caller, RESOURCE_TYPE, milestoneId,
                    Map.of("evidence", evidenceRef));
            if (project.startWork()) {
                eventService.append(EventType.PROJECT_STARTED, caller, "Project", project.getId(), Map.of());
                log.info("Project {} in progress", project.getId());
            }
            return toView(milestone);
        });
    }

    public PayoutReceipt verifyMilestone(String caller, long milestoneId) {
        return gate.execute("verifyMilestone", () -> {
            accessPolicy.authorize(LedgerOperation.VERIFY_MILESTONE, caller);
            Milestone milestone = milestoneRepository.findByIdForUpdate(milestoneId)
                    .orElseThrow(() -> new NotFoundException("Milestone not found: " + milestoneId));
            if (!milestone.isCompleted()) {
                throw new InvalidStateException("Milestone " + milestoneId + " is not completed");
            }
            if (milestone.isVerified()) {
                throw new InvalidStateException("Milestone " + milestoneId + " already verified");
            }

            milestone.markVerified(caller, clock.instant());
            milestoneRepository.flush();
            eventService.append(EventType.MILESTONE_VERIFIED, caller, RESOURCE_TYPE, milestoneId, Map.of());
            log.info("Milestone {} verified by {}", milestoneId, caller);

            return payoutService.releaseMilestoneFunds(milestone, caller);
        });
    }

    @Transactional(readOnly = true)
    public MilestoneView getMilestone(long milestoneId) {
        return milestoneRepository.findById(milestoneId)
                .map(MilestoneService::toView)
                .orElseThrow(() -> new NotFoundException("Milestone not found: " + milestoneId));
    }

    @Transactional(readOnly = true)
    public List<MilestoneView> getProjectMilestones(long projectId) {
        if (!projectRepository.existsById(projectId)) {
            throw new NotFoundException("Project not found: " + projectId);
        }
        return milestoneRepository.findByProjectIdOrderByIdAsc(projectId).stream()
                .map(MilestoneService::toView)
                .toList();
    }

    public long getTotalMilestones() {
        return sequenceService.issuedCount(SequenceService.MILESTONE);
    }

    private static MilestoneView toView(Milestone milestone) {
        return new MilestoneView(
                milestone.getId(),
                milestone.getProjectId(),
                milestone.getDescription(),
                milestone.getFundingAmount(),
                milestone.isCompleted(),
                milestone.isVerified(),
                milestone.getCompletedAt(),
                milestone.getEvidenceRef(),
                milestone.getVerifiedBy(),
                milestone.getVerifiedAt(),
                milestone.getResearcherShare(),
                milestone.getFeeAmount()
        );
    }

    public record MilestoneView(
            long id,
            long projectId,
            String description,
            BigInteger fundingAmount,
            boolean completed,
            boolean verified,
            Instant completedAt,
            String evidenceRef,
            String verifiedBy,
            Instant verifiedAt,
            BigInteger researcherShare,
            BigInteger feeAmount
    ) {}
}
