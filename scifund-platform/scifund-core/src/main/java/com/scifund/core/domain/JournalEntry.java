package com.scifund.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Double-entry journal entry. Immutable once created.
 * Value flows from the debit account to the credit account.
 */
@Entity
@Table(name = "journal_entries", indexes = {
    @Index(name = "idx_journal_debit", columnList = "debit_account"),
    @Index(name = "idx_journal_credit", columnList = "credit_account"),
    @Index(name = "idx_journal_recorded_at", columnList = "recorded_at"),
    @Index(name = "idx_journal_idempotency", columnList = "idempotency_key", unique = true)
})
public class JournalEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt;

    @NotNull
    @Column(name = "debit_account", nullable = false)
    private String debitAccount;

    @NotNull
    @Column(name = "credit_account", nullable = false)
    private String creditAccount;

    @NotNull
    @Positive
    @Column(nullable = false, precision = 38, scale = 0)
    private BigInteger amount;

    @NotNull
    @Column(nullable = false, length = 512)
    private String reference;

    @NotNull
    @Column(name = "idempotency_key", nullable = false, unique = true)
    private String idempotencyKey;

    protected JournalEntry() {}

    public static JournalEntry create(
            String debitAccount,
            String creditAccount,
            BigInteger amount,
            String reference,
            String idempotencyKey,
            Instant now) {

        if (debitAccount.equals(creditAccount)) {
            throw new IllegalArgumentException("Debit and credit accounts must be different");
        }
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be positive");
        }

        var entry = new JournalEntry();
        entry.recordedAt = now;
        entry.debitAccount = debitAccount;
        entry.creditAccount = creditAccount;
        entry.amount = amount;
        entry.reference = reference;
        entry.idempotencyKey = idempotencyKey;
        return entry;
    }

    // Getters (immutable - no setters)
    public UUID getId() { return id; }
    public Instant getRecordedAt() { return recordedAt; }
    public String getDebitAccount() { return debitAccount; }
    public String getCreditAccount() { return creditAccount; }
    public BigInteger getAmount() { return amount; }
    public String getReference() { return reference; }
    public String getIdempotencyKey() { return idempotencyKey; }
}
