package com.scifund.api.config;

import com.scifund.api.access.Principals;
import com.scifund.core.domain.LedgerAccount;
import com.scifund.core.domain.PlatformSettings;
import com.scifund.core.domain.VerifierGrant;
import com.scifund.core.repository.LedgerAccountRepository;
import com.scifund.core.repository.PlatformSettingsRepository;
import com.scifund.core.repository.VerifierGrantRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Seeds platform settings, the pooled escrow account and the initial verifier set.
 * Existing rows are left untouched.
 */
@Component
@Transactional
public class PlatformBootstrap implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(PlatformBootstrap.class);

    private final PlatformProperties properties;
    private final PlatformSettingsRepository settingsRepository;
    private final VerifierGrantRepository verifierRepository;
    private final LedgerAccountRepository accountRepository;
    private final Clock clock;

    public PlatformBootstrap(
            PlatformProperties properties,
            PlatformSettingsRepository settingsRepository,
            VerifierGrantRepository verifierRepository,
            LedgerAccountRepository accountRepository,
            Clock clock) {
        this.properties = properties;
        this.settingsRepository = settingsRepository;
        this.verifierRepository = verifierRepository;
        this.accountRepository = accountRepository;
        this.clock = clock;
    }

    @Override
    public void run(ApplicationArguments args) {
        initialize();
    }

    public void initialize() {
        Instant now = clock.instant();

        if (!accountRepository.existsById(LedgerAccount.POOL)) {
            accountRepository.save(LedgerAccount.open(LedgerAccount.POOL, now));
        }

        if (settingsRepository.existsById(PlatformSettings.SINGLETON_ID)) {
            return;
        }

        requireAccountHolder("owner", properties.getOwner());
        requireAccountHolder("fee-recipient", properties.getFeeRecipient());
        properties.getVerifiers().forEach(verifier -> requireAccountHolder("verifiers", verifier));

        PlatformSettings settings = PlatformSettings.initialize(
                properties.getOwner(),
                properties.getFeeRecipient(),
                properties.getFeeBps(),
                now
        );
        settingsRepository.save(settings);

        Set<String> verifiers = new LinkedHashSet<>();
        verifiers.add(settings.getOwnerId());
        verifiers.addAll(properties.getVerifiers());
        for (String verifier : verifiers) {
            if (!verifierRepository.existsById(verifier)) {
                verifierRepository.save(VerifierGrant.create(verifier, true, settings.getOwnerId(), now));
            }
        }

        log.info("Platform initialized: owner={}, feeRecipient={}, feeBps={}, verifiers={}",
                settings.getOwnerId(), settings.getFeeRecipientId(), settings.getFeeBps(), verifiers);
    }

    private static void requireAccountHolder(String property, String principalId) {
        if (!Principals.isAccountHolder(principalId)) {
            throw new IllegalStateException("scifund.platform." + property + " is not a valid principal: " + principalId);
        }
    }
}
