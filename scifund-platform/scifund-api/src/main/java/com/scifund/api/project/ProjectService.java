package com.scifund.api.project;

import com.scifund.api.access.AccessPolicy;
import com.scifund.api.access.LedgerOperation;
import com.scifund.api.error.InvalidInputException;
import com.scifund.api.error.InvalidStateException;
import com.scifund.api.error.NotFoundException;
import com.scifund.api.escrow.FundsTransferGateway;
import com.scifund.api.event.LedgerEventService;
import com.scifund.api.ledger.LedgerGate;
import com.scifund.api.ledger.SequenceService;
import com.scifund.core.domain.LedgerEvent.EventType;
import com.scifund.core.domain.Project;
import com.scifund.core.domain.ProjectStatus;
import com.scifund.core.domain.Researcher;
import com.scifund.core.repository.ProjectRepository;
import com.scifund.core.repository.ResearcherRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Project lifecycle: creation and pooled funding.
 *
 * Status moves Active -> Funded here; Funded -> InProgress happens on the
 * first completed milestone. Contributions are accepted in full, overshoot included.
 */
@Service
public class ProjectService {

    private static final Logger log = LoggerFactory.getLogger(ProjectService.class);
    static final String RESOURCE_TYPE = "Project";

    private final ProjectRepository projectRepository;
    private final ResearcherRepository researcherRepository;
    private final SequenceService sequenceService;
    private final FundsTransferGateway transferGateway;
    private final AccessPolicy accessPolicy;
    private final LedgerEventService eventService;
    private final LedgerGate gate;
    private final Clock clock;

    public ProjectService(
            ProjectRepository projectRepository,
            ResearcherRepository researcherRepository,
            SequenceService sequenceService,
            FundsTransferGateway transferGateway,
            AccessPolicy accessPolicy,
            LedgerEventService eventService,
            LedgerGate gate,
            Clock clock) {
        this.projectRepository = projectRepository;
        this.researcherRepository = researcherRepository;
        this.sequenceService = sequenceService;
        this.transferGateway = transferGateway;
        this.accessPolicy = accessPolicy;
        this.eventService = eventService;
        this.gate = gate;
        this.clock = clock;
    }

    /**
     * @return the new project's id
     */
    public long createProject(String caller, NewProject request) {
        return gate.execute("createProject", () -> {
            accessPolicy.authorize(LedgerOperation.CREATE_PROJECT, caller);
            if (request.title() == null || request.title().isBlank()) {
                throw new InvalidInputException("Title must not be empty");
            }
            if (request.fundingGoal() == null || request.fundingGoal().signum() <= 0) {
                throw new InvalidInputException("Funding goal must be positive");
            }
            if (request.durationDays() <= 0) {
                throw new InvalidInputException("Duration must be positive");
            }

            Instant now = clock.instant();
            Instant deadline = deadlineAfter(now, request.durationDays());
            long projectId = sequenceService.next(SequenceService.PROJECT);

            Project project = Project.create(
                    projectId,
                    caller,
                    request.title(),
                    request.description(),
                    request.researchArea(),
                    request.fundingGoal(),
                    deadline,
                    request.plannedMilestones(),
                    now
            );
            projectRepository.save(project);

            Researcher researcher = researcherRepository.findByIdForUpdate(caller)
                    .orElseThrow(() -> new InvalidStateException("Researcher vanished: " + caller));
            researcher.addProject(projectId);

            eventService.append(EventType.PROJECT_CREATED, caller, RESOURCE_TYPE, projectId,
                    Map.of("goal", request.fundingGoal(), "deadline", deadline));
            log.info("Project {} created by {} with goal {}", projectId, caller, request.fundingGoal());
            return projectId;
        });
    }

    public ProjectView fundProject(String caller, long projectId, BigInteger amount) {
        return gate.execute("fundProject", () -> {
            accessPolicy.authorize(LedgerOperation.FUND_PROJECT, caller);
            Project project = projectRepository.findByIdForUpdate(projectId)
                    .orElseThrow(() -> new NotFoundException("Project not found: " + projectId));
            if (amount == null || amount.signum() <= 0) {
                throw new InvalidInputException("Contribution must be positive");
            }

            Instant now = clock.instant();
            if (project.getStatus() != ProjectStatus.ACTIVE) {
                throw new InvalidStateException("Project " + projectId + " is not accepting funds: " + project.getStatus());
            }
            if (!now.isBefore(project.getDeadline())) {
                throw new InvalidStateException("Funding deadline of project " + projectId + " has passed");
            }
            if (project.isGoalReached()) {
                throw new InvalidStateException("Project " + projectId + " already reached its goal");
            }

            boolean funded = project.acceptContribution(caller, amount, now);
            long contributionNo = sequenceService.next(SequenceService.CONTRIBUTION);
            transferGateway.collect(caller, amount, "CONTRIBUTION:" + contributionNo);

            eventService.append(EventType.CONTRIBUTION_RECEIVED, caller, RESOURCE_TYPE, projectId,
                    Map.of("amount", amount, "total", project.getCurrentFunding()));
            if (funded) {
                eventService.append(EventType.PROJECT_FUNDED, caller, RESOURCE_TYPE, projectId,
                        Map.of("total", project.getCurrentFunding()));
                log.info("Project {} funded: {} of {}", projectId, project.getCurrentFunding(), project.getFundingGoal());
            }
            return toView(project);
        });
    }

    @Transactional(readOnly = true)
    public ProjectView getProject(long projectId) {
        return toView(findProject(projectId));
    }

    @Transactional(readOnly = true)
    public List<String> getProjectContributors(long projectId) {
        return List.copyOf(findProject(projectId).getContributors());
    }

    @Transactional(readOnly = true)
    public BigInteger getContribution(long projectId, String contributorId) {
        return findProject(projectId).getContributionOf(contributorId);
    }

    @Transactional(readOnly = true)
    public List<ProjectView> getResearcherProjects(String researcherId) {
        return projectRepository.findByResearcherIdOrderByIdAsc(researcherId).stream()
                .map(ProjectService::toView)
                .toList();
    }

    public long getTotalProjects() {
        return sequenceService.issuedCount(SequenceService.PROJECT);
    }

    private Project findProject(long projectId) {
        return projectRepository.findById(projectId)
                .orElseThrow(() -> new NotFoundException("Project not found: " + projectId));
    }

    static Instant deadlineAfter(Instant now, long durationDays) {
        try {
            return now.plus(Duration.ofDays(durationDays));
        } catch (ArithmeticException | DateTimeException e) {
            throw new InvalidInputException("Duration out of range: " + durationDays + " days");
        }
    }

    private static ProjectView toView(Project project) {
        return new ProjectView(
                project.getId(),
                project.getResearcherId(),
                project.getTitle(),
                project.getDescription(),
                project.getResearchArea(),
                project.getFundingGoal(),
                project.getCurrentFunding(),
                project.getDeadline(),
                project.getStatus(),
                project.getCreatedAt(),
                project.getFundedAt(),
                List.copyOf(project.getPlannedMilestones()),
                List.copyOf(project.getContributors())
        );
    }

    public record NewProject(
            String title,
            String description,
            String researchArea,
            BigInteger fundingGoal,
            long durationDays,
            List<String> plannedMilestones
    ) {}

    public record ProjectView(
            long id,
            String researcherId,
            String title,
            String description,
            String researchArea,
            BigInteger fundingGoal,
            BigInteger currentFunding,
            Instant deadline,
            ProjectStatus status,
            Instant createdAt,
            Instant fundedAt,
            List<String> plannedMilestones,
            List<String> contributors
    ) {}
}
