package com.codelens.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;
import java.util.UUID;

/**
 * Generates identifiers for analyzed sources and output artifacts.
 *
 * <p>Two flavours:
 * <ul>
 *   <li>{@link #fingerprint(String)} - deterministic SHA-256 based id, identical for identical sources</li>
 *   <li>{@link #artifactId(String)} - random, collision-resistant id for files written per invocation</li>
 * </ul>
 *
 * <p>Artifact ids never derive from the wall clock, so concurrent invocations within the
 * same second cannot collide.
 */
public final class IdGenerator {

    private static final String HASH_ALGORITHM = "SHA-256";
    private static final int FINGERPRINT_LENGTH = 16;
    private static final String SEPARATOR = "_";

    private IdGenerator() {
        // Utility class
    }

    /**
     * Returns the first 16 hex characters of the SHA-256 hash of the text.
     *
     * @param text text to fingerprint, may be empty
     * @return 16-character lowercase hex id
     */
    public static String fingerprint(String text) {
        return fullHash(text).substring(0, FINGERPRINT_LENGTH);
    }

    /**
     * Returns the full SHA-256 hash of the text.
     *
     * @param text text to hash, may be empty
     * @return 64-character lowercase hex hash
     */
    public static String fullHash(String text) {
        Objects.requireNonNull(text, "text must not be null");
        try {
            MessageDigest digest = MessageDigest.getInstance(HASH_ALGORITHM);
            byte[] hash = digest.digest(text.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(HASH_ALGORITHM + " not available", e);
        }
    }

    /**
     * Returns a new unique artifact id of the form {@code <prefix>_<32 hex chars>}.
     *
     * @param prefix id prefix, e.g. {@code ast}
     * @return unique id
     * @throws IllegalArgumentException if the prefix is null or blank
     */
    public static String artifactId(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("Prefix must not be null or blank");
        }
        return prefix + SEPARATOR + UUID.randomUUID().toString().replace("-", "");
    }
}
