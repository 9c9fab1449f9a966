package com.scifund.core.domain;

import jakarta.persistence.*;

/**
 * Monotonic id sequence. Ids start at 1 and are never reused; 0 means "no such entity".
 */
@Entity
@Table(name = "ledger_sequences")
public class LedgerSequence {

    @Id
    @Column(name = "sequence_name", nullable = false, updatable = false, length = 64)
    private String name;

    @Column(name = "next_value", nullable = false)
    private long nextValue;

    @Version
    private Long version;

    protected LedgerSequence() {}

    public static LedgerSequence start(String name) {
        var sequence = new LedgerSequence();
        sequence.name = name;
        sequence.nextValue = 1;
        return sequence;
    }

    public long allocate() {
        return nextValue++;
    }

    public long getIssuedCount() {
        return nextValue - 1;
    }

    public String getName() { return name; }
    public long getNextValue() { return nextValue; }
}
