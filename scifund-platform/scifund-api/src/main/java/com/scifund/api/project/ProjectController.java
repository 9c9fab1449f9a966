package com.scifund.api.project;

import com.scifund.api.access.Principals;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.List;

/**
 * Project lifecycle REST API.
 */
@RestController
@RequestMapping("/api/v1/projects")
public class ProjectController {

    private final ProjectService projectService;

    public ProjectController(ProjectService projectService) {
        this.projectService = projectService;
    }

    /**
     * POST /api/v1/projects
     */
    @PostMapping
    public ResponseEntity<ProjectCreated> createProject(
            @RequestHeader(Principals.HEADER) String caller,
            @Valid @RequestBody CreateProjectRequest request) {
        long projectId = projectService.createProject(caller, new ProjectService.NewProject(
                request.title(),
                request.description(),
                request.researchArea(),
                request.fundingGoal(),
                request.durationDays(),
                request.plannedMilestones()
        ));
        return ResponseEntity.status(HttpStatus.CREATED).body(new ProjectCreated(projectId));
    }

    /**
     * POST /api/v1/projects/{projectId}/fund
     */
    @PostMapping("/{projectId}/fund")
    public ResponseEntity<ProjectService.ProjectView> fundProject(
            @RequestHeader(Principals.HEADER) String caller,
            @PathVariable long projectId,
            @Valid @RequestBody FundRequest request) {
        return ResponseEntity.ok(projectService.fundProject(caller, projectId, request.amount()));
    }

    @GetMapping("/{projectId}")
    public ResponseEntity<ProjectService.ProjectView> getProject(@PathVariable long projectId) {
        return ResponseEntity.ok(projectService.getProject(projectId));
    }

    @GetMapping("/{projectId}/contributors")
    public ResponseEntity<List<String>> getContributors(@PathVariable long projectId) {
        return ResponseEntity.ok(projectService.getProjectContributors(projectId));
    }

    @GetMapping("/{projectId}/contributions/{contributorId}")
    public ResponseEntity<ContributionResponse> getContribution(
            @PathVariable long projectId,
            @PathVariable String contributorId) {
        return ResponseEntity.ok(new ContributionResponse(
                projectId, contributorId, projectService.getContribution(projectId, contributorId)));
    }

    /**
     * GET /api/v1/projects?researcher={principalId}
     */
    @GetMapping
    public ResponseEntity<List<ProjectService.ProjectView>> getResearcherProjects(
            @RequestParam("researcher") String researcherId) {
        return ResponseEntity.ok(projectService.getResearcherProjects(researcherId));
    }

    @GetMapping("/count")
    public ResponseEntity<CountResponse> getTotalProjects() {
        return ResponseEntity.ok(new CountResponse(projectService.getTotalProjects()));
    }

    // DTOs
    public record CreateProjectRequest(
            String title,
            String description,
            String researchArea,
            @NotNull BigInteger fundingGoal,
            long durationDays,
            List<String> plannedMilestones
    ) {}

    public record FundRequest(@NotNull BigInteger amount) {}

    public record ProjectCreated(long projectId) {}

    public record ContributionResponse(long projectId, String contributorId, BigInteger amount) {}

    public record CountResponse(long total) {}
}
