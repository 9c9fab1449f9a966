package com.scifund.api.event;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

public final class LedgerHashes {

    private LedgerHashes() {}

    /**
     * Lower-case hex SHA-256 over the fields, each written as {@code <length>:<value>}
     * so that no two field lists share an encoding.
     */
    public static String sha256(String... fields) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(encode(fields).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    static String encode(String... fields) {
        StringBuilder encoded = new StringBuilder();
        for (String field : fields) {
            encoded.append(field.length()).append(':').append(field);
        }
        return encoded.toString();
    }
}
