package com.example.tokenauth.util;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Mints raw token secrets and derives their storage keys.
 * <p>
 * A raw token is 32 random bytes rendered as unpadded base64url and carries no
 * claims. Only its SHA-256 digest is ever stored, so a leaked store does not
 * leak usable tokens.
 */
@Component
public class TokenCodec {

    public static final int SECRET_BYTES = 32;
    public static final int MAX_TOKEN_LENGTH = 512;

    private static final char[] HEX_DIGITS = "0123456789abcdef".toCharArray();
    private static final int FINGERPRINT_LENGTH = 8;

    private final SecureRandom secureRandom;

    public TokenCodec() {
        this(new SecureRandom());
    }

    public TokenCodec(SecureRandom secureRandom) {
        this.secureRandom = secureRandom;
    }

    public String newSecret() {
        byte[] bytes = new byte[SECRET_BYTES];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    /**
     * SHA-256 of the raw token as 64 lowercase hex characters.
     *
     * @throws IllegalArgumentException if the token is null or blank
     */
    public String digest(String rawToken) {
        if (rawToken == null || rawToken.isBlank()) {
            throw new IllegalArgumentException("raw token must not be null/blank");
        }
        return toHex(sha256(rawToken.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * Cheap shape check done before any storage lookup.
     */
    public boolean isWellFormed(String rawToken) {
        if (rawToken == null || rawToken.isEmpty() || rawToken.length() > MAX_TOKEN_LENGTH) {
            return false;
        }
        for (int i = 0; i < rawToken.length(); i++) {
            if (!isUrlSafe(rawToken.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Short prefix of a digest, safe to put in logs.
     */
    public static String fingerprint(String digest) {
        if (digest == null) {
            return "null";
        }
        return digest.length() <= FINGERPRINT_LENGTH ? digest : digest.substring(0, FINGERPRINT_LENGTH);
    }

    private static boolean isUrlSafe(char c) {
        return (c >= 'A' && c <= 'Z')
            || (c >= 'a' && c <= 'z')
            || (c >= '0' && c <= '9')
            || c == '-' || c == '_';
    }

    private static byte[] sha256(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String toHex(byte[] bytes) {
        char[] hex = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            int v = bytes[i] & 0xFF;
            hex[i * 2] = HEX_DIGITS[v >>> 4];
            hex[i * 2 + 1] = HEX_DIGITS[v & 0x0F];
        }
        return new String(hex);
    }
}
