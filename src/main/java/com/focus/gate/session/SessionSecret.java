package com.focus.gate.session;

import org.apache.commons.codec.binary.Base64;
import org.apache.commons.codec.digest.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.List;

/**
 * Session termination secret, split into three contiguous fragments for separate custodians.
 *
 * <p>This is plain concatenation, not threshold secret sharing: each fragment discloses
 * a third of the secret, and all three together are required to unlock. Only the
 * SHA-256 of the full secret is stored.
 */
public final class SessionSecret {

    public static final int FRAGMENTS = 3;

    private static final int SECRET_BYTES = 32;

    private SessionSecret() {
    }

    public static String generate(SecureRandom random) {
        byte[] bytes = new byte[SECRET_BYTES];
        random.nextBytes(bytes);
        return Base64.encodeBase64URLSafeString(bytes);
    }

    public static List<String> split(String secret) {
        int part = secret.length() / FRAGMENTS;
        List<String> fragments = new ArrayList<>(FRAGMENTS);
        for (int i = 0; i < FRAGMENTS; i++) {
            int start = i * part;
            int end = i == FRAGMENTS - 1 ? secret.length() : start + part;
            fragments.add(secret.substring(start, end));
        }
        return List.copyOf(fragments);
    }

    public static String hash(String secret) {
        return DigestUtils.sha256Hex(secret);
    }

    public static boolean matches(String provided, String storedHash) {
        if (provided == null || storedHash == null) {
            return false;
        }
        return MessageDigest.isEqual(
                hash(provided).getBytes(StandardCharsets.US_ASCII),
                storedHash.getBytes(StandardCharsets.US_ASCII));
    }
}
