package com.scifund.api.project;

import com.scifund.api.LedgerIntegrationTestSupport;
import com.scifund.api.error.InvalidInputException;
import com.scifund.api.error.InvalidStateException;
import com.scifund.api.error.NotFoundException;
import com.scifund.api.error.UnauthorizedException;
import com.scifund.api.MutableClock;
import com.scifund.core.domain.LedgerAccount;
import com.scifund.core.domain.ProjectStatus;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProjectServiceTest extends LedgerIntegrationTestSupport {

    @Test
    void unregisteredPrincipalCannotCreateProject() {
        assertThrows(UnauthorizedException.class, () -> createProject("stranger", 1000, 30));
        assertEquals(0, projectService.getTotalProjects());
    }

    @Test
    void createAssignsSequentialIdsAndRecordsOwnership() {
        register(RESEARCHER);

        long first = createProject(RESEARCHER, 1000, 30);
        long second = createProject(RESEARCHER, 500, 10);

        assertEquals(1, first);
        assertEquals(2, second);
        assertEquals(2, projectService.getTotalProjects());
        assertEquals(List.of(1L, 2L), researcherService.getResearcher(RESEARCHER).projectIds());

        ProjectService.ProjectView project = projectService.getProject(first);
        assertEquals(ProjectStatus.ACTIVE, project.status());
        assertEquals(RESEARCHER, project.researcherId());
        assertEquals(MutableClock.START.plus(Duration.ofDays(30)), project.deadline());
        assertEquals(List.of("Phase 1", "Phase 2"), project.plannedMilestones());
        assertEquals(BigInteger.ZERO, project.currentFunding());
        assertEquals(2, projectService.getResearcherProjects(RESEARCHER).size());
    }

    @Test
    void createValidatesInput() {
        register(RESEARCHER);

        assertThrows(InvalidInputException.class, () -> projectService.createProject(RESEARCHER,
                new ProjectService.NewProject(" ", "d", "a", BigInteger.TEN, 30, List.of())));
        assertThrows(InvalidInputException.class, () -> createProject(RESEARCHER, 0, 30));
        assertThrows(InvalidInputException.class, () -> createProject(RESEARCHER, 1000, 0));
        assertThrows(InvalidInputException.class, () -> createProject(RESEARCHER, 1000, Long.MAX_VALUE));
        assertEquals(0, projectService.getTotalProjects());
    }

    @Test
    void fundingReachesGoalWithOvershoot() {
        long projectId = fundedProject();

        ProjectService.ProjectView project = projectService.getProject(projectId);
        assertEquals(ProjectStatus.FUNDED, project.status());
        assertEquals(BigInteger.valueOf(1100), project.currentFunding());
        assertEquals(List.of("funder-a", "funder-b"), projectService.getProjectContributors(projectId));
        assertEquals(BigInteger.valueOf(600), projectService.getContribution(projectId, "funder-a"));
        assertEquals(BigInteger.ZERO, projectService.getContribution(projectId, "funder-z"));
        assertEquals(BigInteger.valueOf(1100), platformService.getPoolBalance());
        assertEquals(BigInteger.valueOf(1100), balanceOf(LedgerAccount.POOL));
    }

    @Test
    void fundingAFundedProjectIsInvalidStateAndChangesNothing() {
        long projectId = fundedProject();

        assertThrows(InvalidStateException.class, () -> fund("funder-c", projectId, 10));

        assertEquals(BigInteger.valueOf(1100), projectService.getProject(projectId).currentFunding());
        assertFalse(projectService.getProjectContributors(projectId).contains("funder-c"));
        assertEquals(BigInteger.valueOf(1100), platformService.getPoolBalance());
    }

    @Test
    void fundingAfterDeadlineIsInvalidState() {
        register(RESEARCHER);
        long projectId = createProject(RESEARCHER, 1000, 30);
        fund("funder-a", projectId, 100);

        clock.advance(Duration.ofDays(30));

        assertThrows(InvalidStateException.class, () -> fund("funder-a", projectId, 100));
        assertEquals(BigInteger.valueOf(100), projectService.getContribution(projectId, "funder-a"));
    }

    @Test
    void fundingChecksExistenceBeforeAmount() {
        assertThrows(NotFoundException.class, () -> fund("funder-a", 42, 0));

        register(RESEARCHER);
        long projectId = createProject(RESEARCHER, 1000, 30);
        assertThrows(InvalidInputException.class, () -> fund("funder-a", projectId, 0));
        assertThrows(InvalidInputException.class,
                () -> projectService.fundProject("funder-a", projectId, BigInteger.valueOf(-5)));
        assertTrue(projectService.getProjectContributors(projectId).isEmpty());
    }

    @Test
    void readsOutsideAssignedRangeAreNotFound() {
        assertThrows(NotFoundException.class, () -> projectService.getProject(0));
        assertThrows(NotFoundException.class, () -> projectService.getProject(1));
        assertThrows(NotFoundException.class, () -> projectService.getProjectContributors(7));
        assertThrows(NotFoundException.class, () -> projectService.getContribution(7, "funder-a"));
    }

    @Test
    void longTextFieldsAreStoredVerbatim() {
        register(RESEARCHER);
        String title = "T".repeat(3000);
        String description = "d".repeat(20000);
        String phase = "p".repeat(5000);

        long projectId = projectService.createProject(RESEARCHER, new ProjectService.NewProject(
                title, description, "Biology", BigInteger.valueOf(1000), 30, List.of(phase)));

        ProjectService.ProjectView project = projectService.getProject(projectId);
        assertEquals(title, project.title());
        assertEquals(description, project.description());
        assertEquals(List.of(phase), project.plannedMilestones());
    }
}
