package com.scifund.api.access;

/**
 * Capability a caller must hold to run a ledger operation.
 */
public enum AccessRule {
    /** Any authenticated principal. */
    ANY_PRINCIPAL,
    /** Caller has a researcher record. */
    REGISTERED_RESEARCHER,
    /** Caller owns the project the operation targets. */
    PROJECT_RESEARCHER,
    /** Caller is in the trusted verifier set. */
    TRUSTED_VERIFIER,
    /** Caller is the platform owner. */
    PLATFORM_OWNER
}
