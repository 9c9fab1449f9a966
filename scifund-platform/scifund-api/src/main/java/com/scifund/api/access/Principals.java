package com.scifund.api.access;

import com.scifund.core.domain.LedgerAccount;

/**
 * The authenticated caller arrives as a header set by the upstream gateway.
 */
public final class Principals {

    public static final String HEADER = "X-Principal-Id";

    /** Width of the principal id columns. */
    public static final int MAX_LENGTH = 255;

    private Principals() {}

    /**
     * Whether {@code principalId} can own a ledger account: non-blank, within the id width,
     * and outside the ledger's own key space.
     */
    public static boolean isAccountHolder(String principalId) {
        return principalId != null
                && !principalId.isBlank()
                && principalId.length() <= MAX_LENGTH
                && !LedgerAccount.isReserved(principalId);
    }
}
