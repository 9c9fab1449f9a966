package com.scifund.api.researcher;

import com.scifund.api.LedgerIntegrationTestSupport;
import com.scifund.api.error.InvalidInputException;
import com.scifund.api.error.NotFoundException;
import com.scifund.api.error.UnauthorizedException;
import com.scifund.core.domain.Researcher;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResearcherServiceTest extends LedgerIntegrationTestSupport {

    @Test
    void registerCreatesResearcherWithInitialReputation() {
        ResearcherService.ResearcherView view =
                researcherService.register("bob", "Bob", "Oxford", List.of("chemistry", "ml"));

        assertEquals("bob", view.principalId());
        assertEquals(Researcher.INITIAL_REPUTATION, view.reputation());
        assertFalse(view.verified());
        assertEquals(List.of("chemistry", "ml"), researcherService.getResearcher("bob").expertise());
    }

    @Test
    void reRegistrationOverwritesProfileAndResetsReputation() {
        long projectId = fundedProject();
        long milestoneId = completedMilestone(projectId, 400);
        milestoneService.verifyMilestone(VERIFIER, milestoneId);
        assertEquals(110, researcherService.getResearcher(RESEARCHER).reputation());

        researcherService.register(RESEARCHER, "Alice Smith", "CERN", List.of("physics"));

        ResearcherService.ResearcherView view = researcherService.getResearcher(RESEARCHER);
        assertEquals("Alice Smith", view.name());
        assertEquals("CERN", view.institution());
        assertEquals(List.of("physics"), view.expertise());
        assertEquals(100, view.reputation());
        assertEquals(List.of(projectId), view.projectIds());
    }

    @Test
    void emptyNameOrInstitutionIsInvalidInput() {
        assertThrows(InvalidInputException.class,
                () -> researcherService.register("bob", "", "Oxford", List.of()));
        assertThrows(InvalidInputException.class,
                () -> researcherService.register("bob", "Bob", " ", List.of()));
        assertFalse(researcherRepository.existsById("bob"));
    }

    @Test
    void blankCallerIsUnauthorized() {
        assertThrows(UnauthorizedException.class,
                () -> researcherService.register(" ", "Bob", "Oxford", List.of()));
    }

    @Test
    void unknownResearcherIsNotFound() {
        assertThrows(NotFoundException.class, () -> researcherService.getResearcher("nobody"));
    }
}
