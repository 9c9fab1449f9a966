package com.scifund.api.escrow;

import java.math.BigInteger;

/**
 * Moves value into and out of the pooled escrow account.
 * Implementations must join the caller's ledger transaction; a failed transfer
 * throws and takes the whole operation down with it.
 */
public interface FundsTransferGateway {

    /**
     * Credits a funder's contribution to the pool.
     *
     * @param reference unique per movement; reused references are rejected
     */
    void collect(String funderId, BigInteger amount, String reference);

    /**
     * Pays out of the pool.
     *
     * @throws com.scifund.api.error.TransferFailedException if the pool cannot cover the amount
     */
    void disburse(String recipientId, BigInteger amount, String reference);

    BigInteger poolBalance();
}
