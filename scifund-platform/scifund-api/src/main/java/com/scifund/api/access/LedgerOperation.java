package com.scifund.api.access;

public enum LedgerOperation {
    REGISTER_RESEARCHER,
    CREATE_PROJECT,
    FUND_PROJECT,
    CREATE_MILESTONE,
    COMPLETE_MILESTONE,
    VERIFY_MILESTONE,
    SET_VERIFIER,
    SET_PLATFORM_FEE,
    SET_FEE_RECIPIENT,
    EMERGENCY_WITHDRAW
}
