package com.scifund.api.researcher;

import com.scifund.api.access.Principals;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Researcher registry REST API.
 */
@RestController
@RequestMapping("/api/v1/researchers")
public class ResearcherController {

    private final ResearcherService researcherService;

    public ResearcherController(ResearcherService researcherService) {
        this.researcherService = researcherService;
    }

    /**
     * Register or overwrite the caller's researcher profile.
     * POST /api/v1/researchers
     */
    @PostMapping
    public ResponseEntity<ResearcherService.ResearcherView> register(
            @RequestHeader(Principals.HEADER) String caller,
            @Valid @RequestBody RegisterRequest request) {
        return ResponseEntity.ok(researcherService.register(
                caller, request.name(), request.institution(), request.expertise()));
    }

    /**
     * GET /api/v1/researchers/{principalId}
     */
    @GetMapping("/{principalId}")
    public ResponseEntity<ResearcherService.ResearcherView> getResearcher(@PathVariable String principalId) {
        return ResponseEntity.ok(researcherService.getResearcher(principalId));
    }

    public record RegisterRequest(
            @NotBlank String name,
            @NotBlank String institution,
            List<String> expertise
    ) {}
}
