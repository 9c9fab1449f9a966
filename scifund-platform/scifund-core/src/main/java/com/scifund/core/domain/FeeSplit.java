package com.scifund.core.domain;

import java.math.BigInteger;

/**
 * Split of a milestone payout between researcher and platform.
 * fee = floor(amount * feeBps / 10000); researcherShare = amount - fee.
 */
public record FeeSplit(BigInteger amount, int feeBps, BigInteger fee, BigInteger researcherShare) {

    public static final int BPS_DENOMINATOR = 10_000;

    public static FeeSplit of(BigInteger amount, int feeBps) {
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("Amount must be non-negative");
        }
        if (feeBps < 0 || feeBps > BPS_DENOMINATOR) {
            throw new IllegalArgumentException("Fee basis points out of range: " + feeBps);
        }
        // non-negative operands, so divide() is floor division
        BigInteger fee = amount.multiply(BigInteger.valueOf(feeBps))
                .divide(BigInteger.valueOf(BPS_DENOMINATOR));
        return new FeeSplit(amount, feeBps, fee, amount.subtract(fee));
    }
}
