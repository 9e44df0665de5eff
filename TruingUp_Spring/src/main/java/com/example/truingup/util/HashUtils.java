package com.example.truingup.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/** SHA-256 digests as lowercase hex, the form stored in the audit trail's checksum column. */
public final class HashUtils {

    public static final String ALGORITHM = "SHA-256";
    public static final int HEX_LENGTH = 64;

    private static final HexFormat HEX = HexFormat.of();

    private HashUtils() {}

    public static String sha256Hex(String input) {
        return sha256Hex(input.getBytes(StandardCharsets.UTF_8));
    }

    public static String sha256Hex(byte[] input) {
        return HEX.formatHex(newDigest().digest(input));
    }

    /**
     * Compares two hex digests in constant time. Anything that is not a well-formed
     * 64-character hex digest never matches.
     */
    public static boolean digestsMatch(String expectedHex, String actualHex) {
        if (!isSha256Hex(expectedHex) || !isSha256Hex(actualHex)) {
            return false;
        }
        return MessageDigest.isEqual(HEX.parseHex(expectedHex), HEX.parseHex(actualHex));
    }

    public static boolean isSha256Hex(String value) {
        if (value == null || value.length() != HEX_LENGTH) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            if (Character.digit(value.charAt(i), 16) < 0) return false;
        }
        return true;
    }

    // MessageDigest instances are not thread-safe: one per call
    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " not supported", e);
        }
    }
}
