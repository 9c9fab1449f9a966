package com.scifund.api.event;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LedgerHashesTest {

    @Test
    void fieldsAreLengthPrefixed() {
        assertThat(LedgerHashes.encode("ab", "", "c")).isEqualTo("2:ab0:1:c");
    }

    @Test
    void separatorInsideAFieldDoesNotCollide() {
        assertThat(LedgerHashes.sha256("alice|Project", "7"))
                .isNotEqualTo(LedgerHashes.sha256("alice", "Project|7"));
        assertThat(LedgerHashes.sha256("a:b", "c"))
                .isNotEqualTo(LedgerHashes.sha256("a", "b:c"));
    }

    @Test
    void digestIsLowerCaseHex() {
        assertThat(LedgerHashes.sha256("GENESIS")).matches("[0-9a-f]{64}");
        assertThat(LedgerHashes.sha256("x", "y")).isEqualTo(LedgerHashes.sha256("x", "y"));
    }
}
