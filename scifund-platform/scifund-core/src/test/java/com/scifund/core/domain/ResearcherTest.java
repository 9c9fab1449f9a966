package com.scifund.core.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResearcherTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void reRegistrationResetsReputationButKeepsProjects() {
        Researcher researcher = Researcher.register("alice", "Alice", "MIT", List.of("genomics"), NOW);
        researcher.addProject(1L);
        researcher.rewardRelease(NOW);
        assertEquals(110, researcher.getReputation());

        researcher.overwriteProfile("Alice B.", "ETH", List.of("proteomics", "ml"), NOW.plusSeconds(5));

        assertEquals(Researcher.INITIAL_REPUTATION, researcher.getReputation());
        assertEquals("ETH", researcher.getInstitution());
        assertEquals(List.of("proteomics", "ml"), researcher.getExpertise());
        assertEquals(List.of(1L), researcher.getProjectIds());
        assertFalse(researcher.isVerified());
    }

    @Test
    void blankProfileFieldsAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> Researcher.register("alice", "", "MIT", List.of(), NOW));
        assertThrows(IllegalArgumentException.class,
                () -> Researcher.register("alice", "Alice", " ", List.of(), NOW));
    }
}
