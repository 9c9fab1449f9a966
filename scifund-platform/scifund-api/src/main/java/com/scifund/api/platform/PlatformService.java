package com.scifund.api.platform;

import com.scifund.api.access.AccessPolicy;
import com.scifund.api.access.LedgerOperation;
import com.scifund.api.access.Principals;
import com.scifund.api.error.InvalidInputException;
import com.scifund.api.error.InvalidStateException;
import com.scifund.api.error.LimitExceededException;
import com.scifund.api.escrow.FundsTransferGateway;
import com.scifund.api.event.LedgerEventService;
import com.scifund.api.ledger.LedgerGate;
import com.scifund.api.ledger.SequenceService;
import com.scifund.core.domain.LedgerAccount;
import com.scifund.core.domain.LedgerEvent.EventType;
import com.scifund.core.domain.PlatformSettings;
import com.scifund.core.domain.VerifierGrant;
import com.scifund.core.repository.LedgerAccountRepository;
import com.scifund.core.repository.PlatformSettingsRepository;
import com.scifund.core.repository.VerifierGrantRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Owner-only platform administration: verifier set, fee parameters and the
 * emergency sweep of the pool.
 */
@Service
public class PlatformService {

    private static final Logger log = LoggerFactory.getLogger(PlatformService.class);
    static final String RESOURCE_TYPE = "Platform";

    private final PlatformSettingsRepository settingsRepository;
    private final VerifierGrantRepository verifierRepository;
    private final LedgerAccountRepository accountRepository;
    private final FundsTransferGateway transferGateway;
    private final SequenceService sequenceService;
    private final AccessPolicy accessPolicy;
    private final LedgerEventService eventService;
    private final LedgerGate gate;
    private final Clock clock;

    public PlatformService(
            PlatformSettingsRepository settingsRepository,
            VerifierGrantRepository verifierRepository,
            LedgerAccountRepository accountRepository,
            FundsTransferGateway transferGateway,
            SequenceService sequenceService,
            AccessPolicy accessPolicy,
            LedgerEventService eventService,
            LedgerGate gate,
            Clock clock) {
        this.settingsRepository = settingsRepository;
        this.verifierRepository = verifierRepository;
        this.accountRepository = accountRepository;
        this.transferGateway = transferGateway;
        this.sequenceService = sequenceService;
        this.accessPolicy = accessPolicy;
        this.eventService = eventService;
        this.gate = gate;
        this.clock = clock;
    }

    public void setVerifier(String caller, String principalId, boolean enabled) {
        gate.run("setVerifier", () -> {
            accessPolicy.authorize(LedgerOperation.SET_VERIFIER, caller);
            if (principalId == null || principalId.isBlank()) {
                throw new InvalidInputException("Verifier principal must not be empty");
            }
            if (!Principals.isAccountHolder(principalId)) {
                throw new InvalidInputException("Verifier principal is not a valid account holder");
            }
            Instant now = clock.instant();
            verifierRepository.findById(principalId)
                    .ifPresentOrElse(
                            grant -> grant.update(enabled, caller, now),
                            () -> verifierRepository.save(VerifierGrant.create(principalId, enabled, caller, now)));

            eventService.append(EventType.VERIFIER_UPDATED, caller, "Verifier", principalId, Map.of("enabled", enabled));
            log.info("Verifier {} {} by {}", principalId, enabled ? "trusted" : "revoked", caller);
        });
    }

    public void setPlatformFee(String caller, int feeBps) {
        gate.run("setPlatformFee", () -> {
            accessPolicy.authorize(LedgerOperation.SET_PLATFORM_FEE, caller);
            if (feeBps < 0) {
                throw new InvalidInputException("Fee must not be negative");
            }
            if (feeBps > PlatformSettings.MAX_FEE_BPS) {
                throw new LimitExceededException(
                        "Fee " + feeBps + " bps exceeds maximum of " + PlatformSettings.MAX_FEE_BPS + " bps");
            }
            PlatformSettings settings = lockSettings();
            int previous = settings.getFeeBps();
            settings.changeFee(feeBps, clock.instant());

            eventService.append(EventType.PLATFORM_FEE_UPDATED, caller, RESOURCE_TYPE, PlatformSettings.SINGLETON_ID,
                    Map.of("from", previous, "to", feeBps));
            log.info("Platform fee changed from {} to {} bps", previous, feeBps);
        });
    }

    public void setFeeRecipient(String caller, String feeRecipientId) {
        gate.run("setFeeRecipient", () -> {
            accessPolicy.authorize(LedgerOperation.SET_FEE_RECIPIENT, caller);
            if (feeRecipientId == null || feeRecipientId.isBlank()) {
                throw new InvalidInputException("Fee recipient must not be empty");
            }
            if (!Principals.isAccountHolder(feeRecipientId)) {
                throw new InvalidInputException("Fee recipient is not a valid account holder");
            }
            PlatformSettings settings = lockSettings();
            settings.changeFeeRecipient(feeRecipientId, clock.instant());

            eventService.append(EventType.FEE_RECIPIENT_UPDATED, caller, RESOURCE_TYPE, PlatformSettings.SINGLETON_ID,
                    Map.of("recipient", feeRecipientId));
            log.info("Fee recipient changed to {}", feeRecipientId);
        });
    }

    /**
     * Sweeps the whole pool to the owner's account, bypassing project and milestone accounting.
     *
     * @return the amount swept; zero when the pool is empty
     */
    public BigInteger emergencyWithdraw(String caller) {
        return gate.execute("emergencyWithdraw", () -> {
            accessPolicy.authorize(LedgerOperation.EMERGENCY_WITHDRAW, caller);
            PlatformSettings settings = lockSettings();
            BigInteger balance = transferGateway.poolBalance();
            if (balance.signum() > 0) {
                long withdrawalNo = sequenceService.next(SequenceService.WITHDRAWAL);
                transferGateway.disburse(settings.getOwnerId(), balance, "EMERGENCY:" + withdrawalNo);
            }

            eventService.append(EventType.EMERGENCY_WITHDRAWAL, caller, "Account", LedgerAccount.POOL,
                    Map.of("amount", balance, "owner", settings.getOwnerId()));
            log.warn("Emergency withdrawal of {} to owner {}", balance, settings.getOwnerId());
            return balance;
        });
    }

    @Transactional(readOnly = true)
    public SettingsView getPlatformSettings() {
        PlatformSettings settings = settingsRepository.findById(PlatformSettings.SINGLETON_ID)
                .orElseThrow(() -> new InvalidStateException("Platform settings not initialized"));
        List<String> verifiers = verifierRepository.findByEnabledTrueOrderByPrincipalIdAsc().stream()
                .map(VerifierGrant::getPrincipalId)
                .toList();
        return new SettingsView(settings.getOwnerId(), settings.getFeeRecipientId(), settings.getFeeBps(), verifiers);
    }

    @Transactional(readOnly = true)
    public boolean isVerifier(String principalId) {
        return verifierRepository.existsByPrincipalIdAndEnabledTrue(principalId);
    }

    /**
     * Accounts that never moved value report a zero balance.
     */
    @Transactional(readOnly = true)
    public AccountView getAccountBalance(String accountKey) {
        return accountRepository.findById(accountKey)
                .map(account -> new AccountView(
                        account.getAccountKey(),
                        account.getBalance(),
                        account.getTotalCredited(),
                        account.getTotalDebited()))
                .orElseGet(() -> new AccountView(accountKey, BigInteger.ZERO, BigInteger.ZERO, BigInteger.ZERO));
    }

    public BigInteger getPoolBalance() {
        return transferGateway.poolBalance();
    }

    private PlatformSettings lockSettings() {
        return settingsRepository.findByIdForUpdate(PlatformSettings.SINGLETON_ID)
                .orElseThrow(() -> new InvalidStateException("Platform settings not initialized"));
    }

    public record SettingsView(String ownerId, String feeRecipientId, int feeBps, List<String> verifiers) {}

    public record AccountView(String accountKey, BigInteger balance, BigInteger totalCredited, BigInteger totalDebited) {}
}
