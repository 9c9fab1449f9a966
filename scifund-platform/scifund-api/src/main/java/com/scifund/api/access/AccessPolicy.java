package com.scifund.api.access;

import com.scifund.api.error.UnauthorizedException;
import com.scifund.core.domain.PlatformSettings;
import com.scifund.core.domain.Project;
import com.scifund.core.repository.PlatformSettingsRepository;
import com.scifund.core.repository.ResearcherRepository;
import com.scifund.core.repository.VerifierGrantRepository;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Operation to capability table, checked at the start of every mutating operation.
 */
@Component
public class AccessPolicy {

    private static final Map<LedgerOperation, AccessRule> RULES;

    static {
        Map<LedgerOperation, AccessRule> rules = new EnumMap<>(LedgerOperation.class);
        rules.put(LedgerOperation.REGISTER_RESEARCHER, AccessRule.ANY_PRINCIPAL);
        rules.put(LedgerOperation.CREATE_PROJECT, AccessRule.REGISTERED_RESEARCHER);
        rules.put(LedgerOperation.FUND_PROJECT, AccessRule.ANY_PRINCIPAL);
        rules.put(LedgerOperation.CREATE_MILESTONE, AccessRule.PROJECT_RESEARCHER);
        rules.put(LedgerOperation.COMPLETE_MILESTONE, AccessRule.PROJECT_RESEARCHER);
        rules.put(LedgerOperation.VERIFY_MILESTONE, AccessRule.TRUSTED_VERIFIER);
        rules.put(LedgerOperation.SET_VERIFIER, AccessRule.PLATFORM_OWNER);
        rules.put(LedgerOperation.SET_PLATFORM_FEE, AccessRule.PLATFORM_OWNER);
        rules.put(LedgerOperation.SET_FEE_RECIPIENT, AccessRule.PLATFORM_OWNER);
        rules.put(LedgerOperation.EMERGENCY_WITHDRAW, AccessRule.PLATFORM_OWNER);
        RULES = Collections.unmodifiableMap(rules);
    }

    private final ResearcherRepository researcherRepository;
    private final VerifierGrantRepository verifierRepository;
    private final PlatformSettingsRepository settingsRepository;

    public AccessPolicy(
            ResearcherRepository researcherRepository,
            VerifierGrantRepository verifierRepository,
            PlatformSettingsRepository settingsRepository) {
        this.researcherRepository = researcherRepository;
        this.verifierRepository = verifierRepository;
        this.settingsRepository = settingsRepository;
    }

    public static AccessRule ruleFor(LedgerOperation operation) {
        return RULES.get(operation);
    }

    public void authorize(LedgerOperation operation, String caller) {
        authorize(operation, caller, null);
    }

    /**
     * @param project target of the operation; required for {@link AccessRule#PROJECT_RESEARCHER}
     * @throws UnauthorizedException if the caller lacks the capability or uses a reserved ledger key
     */
    public void authorize(LedgerOperation operation, String caller, Project project) {
        if (caller == null || caller.isBlank()) {
            throw new UnauthorizedException("No caller identity for " + operation);
        }
        if (!Principals.isAccountHolder(caller)) {
            throw new UnauthorizedException("Caller identity cannot hold a ledger account: " + operation);
        }
        AccessRule rule = ruleFor(operation);
        boolean allowed = switch (rule) {
            case ANY_PRINCIPAL -> true;
            case REGISTERED_RESEARCHER -> researcherRepository.existsById(caller);
            case PROJECT_RESEARCHER -> {
                if (project == null) {
                    throw new IllegalArgumentException(operation + " needs a target project");
                }
                yield project.isOwnedBy(caller);
            }
            case TRUSTED_VERIFIER -> verifierRepository.existsByPrincipalIdAndEnabledTrue(caller);
            case PLATFORM_OWNER -> settingsRepository.findById(PlatformSettings.SINGLETON_ID)
                    .map(settings -> settings.isOwner(caller))
                    .orElse(false);
        };
        if (!allowed) {
            throw new UnauthorizedException(caller + " is not allowed to " + describe(operation, rule));
        }
    }

    private static String describe(LedgerOperation operation, AccessRule rule) {
        return operation.name().toLowerCase().replace('_', ' ') + " (requires " + rule + ")";
    }
}
