package com.scifund.api.escrow;

import com.scifund.api.error.InvalidStateException;
import com.scifund.api.event.LedgerEventService;
import com.scifund.api.event.LedgerHashes;
import com.scifund.core.domain.FeeSplit;
import com.scifund.core.domain.LedgerEvent.EventType;
import com.scifund.core.domain.Milestone;
import com.scifund.core.domain.PlatformSettings;
import com.scifund.core.domain.Project;
import com.scifund.core.domain.Researcher;
import com.scifund.core.repository.PlatformSettingsRepository;
import com.scifund.core.repository.ProjectRepository;
import com.scifund.core.repository.ResearcherRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/**
 * Releases a verified milestone's funding from the pool.
 *
 * Runs once per milestone, inside the verifying transaction and after the
 * verified flag is set. Both transfers land or neither does.
 */
@Service
public class EscrowPayoutService {

    private static final Logger log = LoggerFactory.getLogger(EscrowPayoutService.class);

    private final ProjectRepository projectRepository;
    private final ResearcherRepository researcherRepository;
    private final PlatformSettingsRepository settingsRepository;
    private final FundsTransferGateway transferGateway;
    private final LedgerEventService eventService;
    private final PayoutAnchorPublisher anchorPublisher;
    private final Clock clock;

    public EscrowPayoutService(
            ProjectRepository projectRepository,
            ResearcherRepository researcherRepository,
            PlatformSettingsRepository settingsRepository,
            FundsTransferGateway transferGateway,
            LedgerEventService eventService,
            PayoutAnchorPublisher anchorPublisher,
            Clock clock) {
        this.projectRepository = projectRepository;
        this.researcherRepository = researcherRepository;
        this.settingsRepository = settingsRepository;
        this.transferGateway = transferGateway;
        this.eventService = eventService;
        this.anchorPublisher = anchorPublisher;
        this.clock = clock;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public PayoutReceipt releaseMilestoneFunds(Milestone milestone, String verifierId) {
        if (!milestone.isVerified() || milestone.isReleased()) {
            throw new InvalidStateException("Milestone " + milestone.getId() + " is not releasable");
        }
        PlatformSettings settings = settingsRepository.findById(PlatformSettings.SINGLETON_ID)
                .orElseThrow(() -> new InvalidStateException("Platform settings not initialized"));
        Project project = projectRepository.findById(milestone.getProjectId())
                .orElseThrow(() -> new InvalidStateException("Project missing for milestone " + milestone.getId()));
        Researcher researcher = researcherRepository.findByIdForUpdate(project.getResearcherId())
                .orElseThrow(() -> new InvalidStateException("Researcher missing: " + project.getResearcherId()));

        Instant now = clock.instant();
        FeeSplit split = FeeSplit.of(milestone.getFundingAmount(), settings.getFeeBps());
        milestone.recordRelease(split, now);
        researcher.rewardRelease(now);

        String reference = "PAYOUT:" + milestone.getId();
        if (split.researcherShare().signum() > 0) {
            transferGateway.disburse(researcher.getPrincipalId(), split.researcherShare(), reference + ":RESEARCHER");
        }
        if (split.fee().signum() > 0) {
            transferGateway.disburse(settings.getFeeRecipientId(), split.fee(), reference + ":FEE");
        }

        PayoutReceipt receipt = new PayoutReceipt(
                milestone.getId(),
                project.getId(),
                researcher.getPrincipalId(),
                split.researcherShare(),
                settings.getFeeRecipientId(),
                split.fee(),
                split.feeBps(),
                now,
                receiptHash(milestone.getId(), researcher.getPrincipalId(), split, settings.getFeeRecipientId())
        );

        eventService.append(EventType.FUNDS_RELEASED, verifierId, "Milestone", milestone.getId(),
                Map.of(
                        "researcher", receipt.researcherId(),
                        "share", receipt.researcherShare(),
                        "feeRecipient", receipt.feeRecipientId(),
                        "fee", receipt.fee(),
                        "receipt", receipt.receiptHash()));
        anchorPublisher.publishAfterCommit(receipt);

        log.info("Released milestone {}: {} to researcher {}, {} fee to {}",
                milestone.getId(), split.researcherShare(), researcher.getPrincipalId(),
                split.fee(), settings.getFeeRecipientId());
        return receipt;
    }

    static String receiptHash(long milestoneId, String researcherId, FeeSplit split, String feeRecipientId) {
        return LedgerHashes.sha256(
                Long.toString(milestoneId),
                researcherId,
                split.researcherShare().toString(),
                feeRecipientId,
                split.fee().toString()
        );
    }
}
