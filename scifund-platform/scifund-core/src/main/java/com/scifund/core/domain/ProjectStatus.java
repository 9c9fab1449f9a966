package com.scifund.core.domain;

/**
 * Lifecycle of a research project.
 *
 * Forward path: ACTIVE -> FUNDED -> IN_PROGRESS -> COMPLETED.
 * CANCELLED is absorbing and reachable from any non-terminal state.
 * COMPLETED and CANCELLED are reserved; no ledger operation enters them yet.
 */
public enum ProjectStatus {
    ACTIVE,
    FUNDED,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED;

    public boolean canTransitionTo(ProjectStatus next) {
        return switch (this) {
            case ACTIVE -> next == FUNDED || next == CANCELLED;
            case FUNDED -> next == IN_PROGRESS || next == CANCELLED;
            case IN_PROGRESS -> next == COMPLETED || next == CANCELLED;
            case COMPLETED, CANCELLED -> false;
        };
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }
}
