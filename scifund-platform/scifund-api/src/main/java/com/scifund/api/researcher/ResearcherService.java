package com.scifund.api.researcher;

import com.scifund.api.access.AccessPolicy;
import com.scifund.api.access.LedgerOperation;
import com.scifund.api.error.InvalidInputException;
import com.scifund.api.error.NotFoundException;
import com.scifund.api.event.LedgerEventService;
import com.scifund.api.ledger.LedgerGate;
import com.scifund.core.domain.LedgerEvent.EventType;
import com.scifund.core.domain.Researcher;
import com.scifund.core.repository.ResearcherRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Researcher registry.
 * Registration is an overwrite: profile and reputation are replaced, owned projects are kept.
 */
@Service
public class ResearcherService {

    private static final Logger log = LoggerFactory.getLogger(ResearcherService.class);
    static final String RESOURCE_TYPE = "Researcher";

    private final ResearcherRepository researcherRepository;
    private final AccessPolicy accessPolicy;
    private final LedgerEventService eventService;
    private final LedgerGate gate;
    private final Clock clock;

    public ResearcherService(
            ResearcherRepository researcherRepository,
            AccessPolicy accessPolicy,
            LedgerEventService eventService,
            LedgerGate gate,
            Clock clock) {
        this.researcherRepository = researcherRepository;
        this.accessPolicy = accessPolicy;
        this.eventService = eventService;
        this.gate = gate;
        this.clock = clock;
    }

    public ResearcherView register(String caller, String name, String institution, List<String> expertise) {
        return gate.execute("registerResearcher", () -> {
            accessPolicy.authorize(LedgerOperation.REGISTER_RESEARCHER, caller);
            if (name == null || name.isBlank()) {
                throw new InvalidInputException("Name must not be empty");
            }
            if (institution == null || institution.isBlank()) {
                throw new InvalidInputException("Institution must not be empty");
            }

            Instant now = clock.instant();
            Researcher researcher = researcherRepository.findByIdForUpdate(caller)
                    .map(existing -> {
                        existing.overwriteProfile(name, institution, expertise, now);
                        return existing;
                    })
                    .orElseGet(() -> researcherRepository.save(
                            Researcher.register(caller, name, institution, expertise, now)));

            eventService.append(EventType.RESEARCHER_REGISTERED, caller, RESOURCE_TYPE, caller,
                    Map.of("institution", institution));
            log.info("Researcher {} registered", caller);
            return toView(researcher);
        });
    }

    @Transactional(readOnly = true)
    public ResearcherView getResearcher(String principalId) {
        return researcherRepository.findById(principalId)
                .map(ResearcherService::toView)
                .orElseThrow(() -> new NotFoundException("Researcher not found: " + principalId));
    }

    private static ResearcherView toView(Researcher researcher) {
        return new ResearcherView(
                researcher.getPrincipalId(),
                researcher.getName(),
                researcher.getInstitution(),
                List.copyOf(researcher.getExpertise()),
                researcher.getReputation(),
                researcher.isVerified(),
                List.copyOf(researcher.getProjectIds()),
                researcher.getRegisteredAt()
        );
    }

    public record ResearcherView(
            String principalId,
            String name,
            String institution,
            List<String> expertise,
            long reputation,
            boolean verified,
            List<Long> projectIds,
            Instant registeredAt
    ) {}
}
