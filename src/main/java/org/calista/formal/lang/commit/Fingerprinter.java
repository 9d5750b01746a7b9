package org.calista.formal.lang.commit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 content fingerprints over canonical (compact, insertion-ordered) JSON.
 *
 * <p>A fingerprint is the first {@link #length()} hex characters of the digest.
 * Not a zero-knowledge proof: it is a tamper-evident commitment only.</p>
 */
public final class Fingerprinter {

    public static final int DEFAULT_LENGTH = 16;
    public static final int MIN_LENGTH = 8;
    public static final int MAX_LENGTH = 64;

    private static final ObjectMapper CANONICAL = new ObjectMapper();
    private static final HexFormat HEX = HexFormat.of();

    private final int length;
    private final String zero;

    public Fingerprinter() {
        this(DEFAULT_LENGTH);
    }

    public Fingerprinter(int length) {
        if (length < MIN_LENGTH || length > MAX_LENGTH) {
            throw new IllegalArgumentException("fingerprint length must be in [" + MIN_LENGTH + ", " + MAX_LENGTH + "]: " + length);
        }
        this.length = length;
        this.zero = "0".repeat(length);
    }

    public int length() {
        return length;
    }

    /** All-zero sentinel of fingerprint length. */
    public String zero() {
        return zero;
    }

    public String fingerprint(JsonNode content) {
        return truncate(sha256Hex(canonical(content)));
    }

    public String truncate(String fullHex) {
        return fullHex.length() <= length ? fullHex : fullHex.substring(0, length);
    }

    public static String canonical(JsonNode content) {
        try {
            return CANONICAL.writeValueAsString(content);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize content for hashing", e);
        }
    }

    /** Full 64-char SHA-256 hex of the UTF-8 bytes of {@code text}. */
    public static String sha256Hex(String text) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HEX.formatHex(md.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    static boolean isHex(String s) {
        if (s == null || s.isEmpty()) return false;
        for (int i = 0; i < s.length(); i++) {
            if (Character.digit(s.charAt(i), 16) < 0) return false;
        }
        return true;
    }
}
