package com.entity.integration.identity;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * MD5 content hashing for stable identifiers.
 * Used for run-to-run stability of ids, not for collision resistance.
 */
public final class ContentHash {

    private ContentHash() {
    }

    /**
     * Returns the lowercase hex MD5 digest of the UTF-8 bytes of the value.
     */
    public static String md5Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // every JRE is required to ship MD5
            throw new IllegalStateException("MD5 digest not available", e);
        }
    }

    /**
     * Returns the first {@code length} hex characters of the MD5 digest.
     */
    public static String md5Prefix(String value, int length) {
        if (length < 1 || length > 32) {
            throw new IllegalArgumentException("length must be between 1 and 32, got " + length);
        }
        return md5Hex(value).substring(0, length);
    }
}
