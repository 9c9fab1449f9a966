package com.scifund.api.ledger;

import com.scifund.core.domain.LedgerSequence;
import com.scifund.core.repository.LedgerSequenceRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Hands out ledger ids. Ids start at 1 and are never reused.
 */
@Service
public class SequenceService {

    public static final String PROJECT = "project";
    public static final String MILESTONE = "milestone";
    public static final String CONTRIBUTION = "contribution";
    public static final String WITHDRAWAL = "withdrawal";

    private final LedgerSequenceRepository sequenceRepository;

    public SequenceService(LedgerSequenceRepository sequenceRepository) {
        this.sequenceRepository = sequenceRepository;
    }

    /**
     * Allocates the next id. Only valid inside a ledger transaction, so an id
     * taken by a rolled-back operation is handed out again.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public long next(String name) {
        LedgerSequence sequence = sequenceRepository.findByNameForUpdate(name)
                .orElseGet(() -> sequenceRepository.save(LedgerSequence.start(name)));
        return sequence.allocate();
    }

    @Transactional(readOnly = true)
    public long issuedCount(String name) {
        return sequenceRepository.findById(name)
                .map(LedgerSequence::getIssuedCount)
                .orElse(0L);
    }
}
