package com.scifund.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigInteger;
import java.time.Instant;

/**
 * Balance held by the ledger for one account: a principal, or the pooled escrow.
 */
@Entity
@Table(name = "ledger_accounts")
public class LedgerAccount {

    public static final String POOL = "POOL";
    public static final String EXTERNAL_PREFIX = "EXTERNAL:";

    @Id
    @Column(name = "account_key", nullable = false, updatable = false)
    private String accountKey;

    @NotNull
    @PositiveOrZero
    @Column(nullable = false, precision = 38, scale = 0)
    private BigInteger balance;

    @NotNull
    @Column(name = "total_credited", nullable = false, precision = 38, scale = 0)
    private BigInteger totalCredited;

    @NotNull
    @Column(name = "total_debited", nullable = false, precision = 38, scale = 0)
    private BigInteger totalDebited;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @NotNull
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    protected LedgerAccount() {}

    public static LedgerAccount open(String accountKey, Instant now) {
        var account = new LedgerAccount();
        account.accountKey = accountKey;
        account.balance = BigInteger.ZERO;
        account.totalCredited = BigInteger.ZERO;
        account.totalDebited = BigInteger.ZERO;
        account.createdAt = now;
        account.updatedAt = now;
        return account;
    }

    public void credit(BigInteger amount, Instant now) {
        requirePositive(amount);
        this.balance = this.balance.add(amount);
        this.totalCredited = this.totalCredited.add(amount);
        this.updatedAt = now;
    }

    public void debit(BigInteger amount, Instant now) {
        requirePositive(amount);
        if (!covers(amount)) {
            throw new IllegalStateException("Insufficient balance in " + accountKey);
        }
        this.balance = this.balance.subtract(amount);
        this.totalDebited = this.totalDebited.add(amount);
        this.updatedAt = now;
    }

    public boolean covers(BigInteger amount) {
        return balance.compareTo(amount) >= 0;
    }

    private static void requirePositive(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be positive");
        }
    }

    public String getAccountKey() { return accountKey; }
    public BigInteger getBalance() { return balance; }
    public BigInteger getTotalCredited() { return totalCredited; }
    public BigInteger getTotalDebited() { return totalDebited; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    /**
     * Keys owned by the ledger itself: the pool and the external funding sources.
     * No principal may hold an account under one of these.
     */
    public static boolean isReserved(String accountKey) {
        return POOL.equals(accountKey) || accountKey.startsWith(EXTERNAL_PREFIX);
    }
}
