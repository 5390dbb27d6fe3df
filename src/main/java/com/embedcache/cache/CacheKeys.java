package com.embedcache.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

public final class CacheKeys {
    private CacheKeys() {
    }

    /**
     * Lowercase hex SHA-256 of the sentence's UTF-8 bytes, always 64 characters.
     */
    public static String of(String sentence) {
        return HexFormat.of().formatHex(sha256(sentence.getBytes(StandardCharsets.UTF_8)));
    }

    static byte[] sha256(byte[] bytes) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(bytes);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
