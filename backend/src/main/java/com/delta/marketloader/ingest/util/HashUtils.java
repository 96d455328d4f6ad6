package com.delta.marketloader.ingest.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.StringJoiner;

public final class HashUtils {
    private HashUtils() {
    }

    public static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    /**
     * Hashes the parts joined with {@code '|'}; null parts hash as empty strings.
     */
    public static String sha256Hex(String first, String... rest) {
        StringJoiner joiner = new StringJoiner("|");
        joiner.add(first == null ? "" : first);
        for (String part : rest) {
            joiner.add(part == null ? "" : part);
        }
        return sha256Hex(joiner.toString());
    }
}
