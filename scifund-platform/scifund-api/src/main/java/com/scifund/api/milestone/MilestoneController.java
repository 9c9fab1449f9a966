package com.scifund.api.milestone;

import com.scifund.api.access.Principals;
import com.scifund.api.escrow.PayoutReceipt;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.List;

/**
 * Milestone REST API.
 */
@RestController
@RequestMapping("/api/v1")
public class MilestoneController {

    private final MilestoneService milestoneService;

    public MilestoneController(MilestoneService milestoneService) {
        this.milestoneService = milestoneService;
    }

    /**
     * POST /api/v1/projects/{projectId}/milestones
     */
    @PostMapping("/projects/{projectId}/milestones")
    public ResponseEntity<MilestoneCreated> createMilestone(
            @RequestHeader(Principals.HEADER) String caller,
            @PathVariable long projectId,
            @Valid @RequestBody CreateMilestoneRequest request) {
        long milestoneId = milestoneService.createMilestone(
                caller, projectId, request.description(), request.fundingAmount());
        return ResponseEntity.status(HttpStatus.CREATED).body(new MilestoneCreated(milestoneId));
    }

    @GetMapping("/projects/{projectId}/milestones")
    public ResponseEntity<List<MilestoneService.MilestoneView>> getProjectMilestones(@PathVariable long projectId) {
        return ResponseEntity.ok(milestoneService.getProjectMilestones(projectId));
    }

    /**
     * POST /api/v1/milestones/{milestoneId}/complete
     */
    @PostMapping("/milestones/{milestoneId}/complete")
    public ResponseEntity<MilestoneService.MilestoneView> completeMilestone(
            @RequestHeader(Principals.HEADER) String caller,
            @PathVariable long milestoneId,
            @RequestBody CompleteMilestoneRequest request) {
        return ResponseEntity.ok(milestoneService.completeMilestone(caller, milestoneId, request.evidenceRef()));
    }

    /**
     * Verify a completed milestone and release its funding.
     * POST /api/v1/milestones/{milestoneId}/verify
     */
    @PostMapping("/milestones/{milestoneId}/verify")
    public ResponseEntity<PayoutReceipt> verifyMilestone(
            @RequestHeader(Principals.HEADER) String caller,
            @PathVariable long milestoneId) {
        return ResponseEntity.ok(milestoneService.verifyMilestone(caller, milestoneId));
    }

    @GetMapping("/milestones/{milestoneId}")
    public ResponseEntity<MilestoneService.MilestoneView> getMilestone(@PathVariable long milestoneId) {
        return ResponseEntity.ok(milestoneService.getMilestone(milestoneId));
    }

    @GetMapping("/milestones/count")
    public ResponseEntity<CountResponse> getTotalMilestones() {
        return ResponseEntity.ok(new CountResponse(milestoneService.getTotalMilestones()));
    }

    // DTOs
    public record CreateMilestoneRequest(String description, @NotNull BigInteger fundingAmount) {}

    public record CompleteMilestoneRequest(String evidenceRef) {}

    public record MilestoneCreated(long milestoneId) {}

    public record CountResponse(long total) {}
}
