package com.scifund.api.escrow;

import com.scifund.api.error.TransferFailedException;
import com.scifund.core.domain.JournalEntry;
import com.scifund.core.domain.LedgerAccount;
import com.scifund.core.repository.JournalEntryRepository;
import com.scifund.core.repository.LedgerAccountRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;

/**
 * Funds gateway backed by the internal double-entry ledger.
 * Contributions: EXTERNAL:&lt;funder&gt; -&gt; POOL. Payouts: POOL -&gt; &lt;recipient&gt;.
 */
@Component
public class LedgerTransferGateway implements FundsTransferGateway {

    private final LedgerAccountRepository accountRepository;
    private final JournalEntryRepository journalEntryRepository;
    private final Clock clock;

    public LedgerTransferGateway(
            LedgerAccountRepository accountRepository,
            JournalEntryRepository journalEntryRepository,
            Clock clock) {
        this.accountRepository = accountRepository;
        this.journalEntryRepository = journalEntryRepository;
        this.clock = clock;
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void collect(String funderId, BigInteger amount, String reference) {
        requireHolder(funderId);
        requireFresh(reference);
        Instant now = clock.instant();

        LedgerAccount pool = lockOrOpen(LedgerAccount.POOL, now);
        pool.credit(amount, now);

        journalEntryRepository.save(JournalEntry.create(
                LedgerAccount.EXTERNAL_PREFIX + funderId,
                LedgerAccount.POOL,
                amount,
                "Contribution from " + funderId,
                reference,
                now
        ));
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void disburse(String recipientId, BigInteger amount, String reference) {
        requireHolder(recipientId);
        requireFresh(reference);
        Instant now = clock.instant();

        LedgerAccount pool = lockOrOpen(LedgerAccount.POOL, now);
        if (!pool.covers(amount)) {
            throw new TransferFailedException(
                    "Pool balance " + pool.getBalance() + " cannot cover transfer of " + amount + " to " + recipientId);
        }
        pool.debit(amount, now);

        LedgerAccount recipient = lockOrOpen(recipientId, now);
        recipient.credit(amount, now);

        journalEntryRepository.save(JournalEntry.create(
                LedgerAccount.POOL,
                recipientId,
                amount,
                "Payout to " + recipientId,
                reference,
                now
        ));
    }

    @Override
    @Transactional(readOnly = true)
    public BigInteger poolBalance() {
        return accountRepository.findById(LedgerAccount.POOL)
                .map(LedgerAccount::getBalance)
                .orElse(BigInteger.ZERO);
    }

    private static void requireHolder(String principalId) {
        if (LedgerAccount.isReserved(principalId)) {
            throw new TransferFailedException("Reserved ledger account cannot be a transfer party: " + principalId);
        }
    }

    private void requireFresh(String reference) {
        if (journalEntryRepository.existsByIdempotencyKey(reference)) {
            throw new TransferFailedException("Transfer already recorded: " + reference);
        }
    }

    private LedgerAccount lockOrOpen(String accountKey, Instant now) {
        return accountRepository.findByAccountKeyForUpdate(accountKey)
                .orElseGet(() -> accountRepository.save(LedgerAccount.open(accountKey, now)));
    }
}
