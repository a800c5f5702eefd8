package io.arrayshim.flight.store;

import java.security.SecureRandom;

/**
 * Opaque identifiers used for session tokens and tickets.
 */
public final class RandomTokens {

    public static final int TOKEN_LENGTH = 32;

    private static final char[] ALPHABET =
            "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789".toCharArray();
    private static final SecureRandom RANDOM = new SecureRandom();

    private RandomTokens() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * @return {@value #TOKEN_LENGTH} characters drawn uniformly from {@code [A-Za-z0-9]}
     */
    public static String next() {
        var chars = new char[TOKEN_LENGTH];
        for (int i = 0; i < TOKEN_LENGTH; i++) {
            chars[i] = ALPHABET[RANDOM.nextInt(ALPHABET.length)];
        }
        return new String(chars);
    }
}
