package com.scifund.api;

import com.scifund.api.escrow.FundsTransferGateway;
import com.scifund.api.escrow.LedgerTransferGateway;

import java.math.BigInteger;

/**
 * Ledger gateway with a hook that runs before each payout, used to inject
 * transfer failures and reentrant calls.
 */
public class HookedTransferGateway implements FundsTransferGateway {

    @FunctionalInterface
    public interface DisburseHook {
        void beforeDisburse(String recipientId, BigInteger amount, String reference);
    }

    private static final DisburseHook NO_HOOK = (recipientId, amount, reference) -> {};

    private final LedgerTransferGateway delegate;
    private volatile DisburseHook disburseHook = NO_HOOK;

    public HookedTransferGateway(LedgerTransferGateway delegate) {
        this.delegate = delegate;
    }

    public void onDisburse(DisburseHook hook) {
        this.disburseHook = hook;
    }

    public void clearHooks() {
        this.disburseHook = NO_HOOK;
    }

    @Override
    public void collect(String funderId, BigInteger amount, String reference) {
        delegate.collect(funderId, amount, reference);
    }

    @Override
    public void disburse(String recipientId, BigInteger amount, String reference) {
        disburseHook.beforeDisburse(recipientId, amount, reference);
        delegate.disburse(recipientId, amount, reference);
    }

    @Override
    public BigInteger poolBalance() {
        return delegate.poolBalance();
    }
}
