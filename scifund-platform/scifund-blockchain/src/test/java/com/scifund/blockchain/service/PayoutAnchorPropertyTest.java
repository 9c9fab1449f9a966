package com.scifund.blockchain.service;

import net.jqwik.api.*;
import net.jqwik.api.constraints.LongRange;

import java.math.BigInteger;
import java.util.HexFormat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Property-based tests for payout anchor encoding.
 */
class PayoutAnchorPropertyTest {

    @Property(tries = 100)
    void milestoneKeyIsBigEndianUint256(@ForAll @LongRange(min = 1, max = Long.MAX_VALUE) long milestoneId) {
        byte[] key = BlockchainPayoutAnchorService.milestoneKey(milestoneId);

        assertThat(key).hasSize(32);
        assertThat(new BigInteger(1, key)).isEqualTo(BigInteger.valueOf(milestoneId));
    }

    @Property(tries = 100)
    void receiptHashRoundTripsThroughBytes32(@ForAll("sha256Hex") String hash) {
        byte[] bytes = BlockchainPayoutAnchorService.hexToBytes32(hash);

        assertThat(bytes).hasSize(32);
        assertThat(HexFormat.of().formatHex(bytes)).isEqualTo(hash);
        assertThat(BlockchainPayoutAnchorService.hexToBytes32("0x" + hash)).isEqualTo(bytes);
    }

    @Example
    void shortHexIsLeftPadded() {
        byte[] bytes = BlockchainPayoutAnchorService.hexToBytes32("0x01ff");

        assertThat(bytes[30]).isEqualTo((byte) 0x01);
        assertThat(bytes[31]).isEqualTo((byte) 0xff);
        assertThat(new BigInteger(1, bytes)).isEqualTo(BigInteger.valueOf(0x01ff));
    }

    @Example
    void oversizedHexIsRejected() {
        String tooLong = "ab".repeat(33);
        assertThatThrownBy(() -> BlockchainPayoutAnchorService.hexToBytes32(tooLong))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Example
    void nonPositiveMilestoneIdIsRejected() {
        assertThatThrownBy(() -> BlockchainPayoutAnchorService.milestoneKey(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Example
    void disabledServiceDoesNothing() {
        BlockchainConfig config = new BlockchainConfig();
        BlockchainPayoutAnchorService service = new BlockchainPayoutAnchorService(config);

        assertThat(config.isEnabled()).isFalse();
        assertThat(service.isEnabled()).isFalse();
        assertThat(service.anchorPayout(1L, "ab".repeat(32), BigInteger.valueOf(400))).isEmpty();
        assertThat(service.isAnchored("ab".repeat(32))).isEmpty();
    }

    @Provide
    Arbitrary<String> sha256Hex() {
        return Arbitraries.strings()
                .withChars("0123456789abcdef")
                .ofLength(64);
    }
}
