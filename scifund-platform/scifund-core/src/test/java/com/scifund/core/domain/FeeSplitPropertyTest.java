package com.scifund.core.domain;

import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.LongRange;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Property-based tests for the milestone fee split.
 * fee + researcherShare always equals the milestone amount, and the fee is the
 * floor of amount * bps / 10000.
 */
class FeeSplitPropertyTest {

    @Property
    void splitIsExactForReferenceAmounts(
            @ForAll("referenceAmounts") long amount,
            @ForAll("referenceFees") int feeBps) {

        FeeSplit split = FeeSplit.of(BigInteger.valueOf(amount), feeBps);

        assertThat(split.fee().add(split.researcherShare())).isEqualTo(BigInteger.valueOf(amount));
        assertThat(split.fee().signum()).isGreaterThanOrEqualTo(0);
    }

    @Property(tries = 500)
    void feeIsFlooredBasisPointShare(
            @ForAll @LongRange(min = 0, max = Long.MAX_VALUE) long amount,
            @ForAll @IntRange(min = 0, max = PlatformSettings.MAX_FEE_BPS) int feeBps) {

        BigInteger a = BigInteger.valueOf(amount);
        FeeSplit split = FeeSplit.of(a, feeBps);

        BigInteger scaled = a.multiply(BigInteger.valueOf(feeBps));
        BigInteger denominator = BigInteger.valueOf(FeeSplit.BPS_DENOMINATOR);
        assertThat(split.fee().multiply(denominator)).isLessThanOrEqualTo(scaled);
        assertThat(split.fee().add(BigInteger.ONE).multiply(denominator)).isGreaterThan(scaled);
        assertThat(split.researcherShare()).isEqualTo(a.subtract(split.fee()));
    }

    @Example
    void defaultFeeOnFourHundred() {
        FeeSplit split = FeeSplit.of(BigInteger.valueOf(400), PlatformSettings.DEFAULT_FEE_BPS);

        assertThat(split.fee()).isEqualTo(BigInteger.TEN);
        assertThat(split.researcherShare()).isEqualTo(BigInteger.valueOf(390));
    }

    @Example
    void smallAmountsPayNoFee() {
        FeeSplit split = FeeSplit.of(BigInteger.valueOf(9), PlatformSettings.MAX_FEE_BPS);

        assertThat(split.fee()).isZero();
        assertThat(split.researcherShare()).isEqualTo(BigInteger.valueOf(9));
    }

    @Example
    void rejectsNegativeInputs() {
        assertThatThrownBy(() -> FeeSplit.of(BigInteger.valueOf(-1), 250))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FeeSplit.of(BigInteger.TEN, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Provide
    Arbitrary<Long> referenceAmounts() {
        return Arbitraries.of(1L, 9_999L, 10_000L, 123_456_789L);
    }

    @Provide
    Arbitrary<Integer> referenceFees() {
        return Arbitraries.of(0, 250, 1000);
    }
}
