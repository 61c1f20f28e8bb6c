package org.example.assessment.service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * 256-bit digests are carried as {@code 0x}-prefixed, 64 character lower-case hex strings.
 */
public final class Hashes {

    public static final String ZERO = "0x" + "0".repeat(64);

    private static final int HEX_LENGTH = 64;

    private Hashes() {
    }

    public static boolean isWellFormed(String value) {
        if (value == null || value.length() != HEX_LENGTH + 2 || !value.startsWith("0x")) {
            return false;
        }
        for (int i = 2; i < value.length(); i++) {
            // ASCII only; Character.digit also accepts other scripts' digits
            if (!HexFormat.isHexDigit(value.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    public static boolean isZero(String value) {
        return ZERO.equals(value);
    }

    /**
     * Returns the canonical form of a digest, or throws with the given error when malformed.
     */
    public static String require(String value, AssessmentError error) {
        String trimmed = value == null ? null : value.trim();
        if (trimmed != null && trimmed.startsWith("0X")) {
            trimmed = "0x" + trimmed.substring(2);
        }
        if (!isWellFormed(trimmed)) {
            throw new AssessmentException(error, error.getDefaultMessage() + ": " + value);
        }
        return trimmed.toLowerCase(Locale.ROOT);
    }

    public static String sha256(String value) {
        return sha256(value.getBytes(StandardCharsets.UTF_8));
    }

    public static String sha256(byte[] value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return "0x" + HexFormat.of().formatHex(digest.digest(value));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
