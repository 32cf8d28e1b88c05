package com.modelregistry.api.util;

import java.security.SecureRandom;

/**
 * Utility class for generating secure random passwords.
 * Uses SecureRandom for cryptographically strong random generation.
 */
public final class PasswordGenerator {

    private static final SecureRandom RANDOM = new SecureRandom();

    public static final int DEFAULT_LENGTH = 12;

    public static final int MAX_LENGTH = 1024;

    /**
     * Characters used for password generation.
     * Excludes ambiguous characters: 0, O, I, l, 1
     */
    static final String ALPHANUMERIC_CHARS =
            "ABCDEFGHJKLMNPQRSTUVWXYZabcdefghijkmnopqrstuvwxyz23456789";

    static final String SPECIAL_CHARS = "!@#$%^&*";

    private PasswordGenerator() {
    }

    /**
     * Generate a random password with optional special characters.
     * When special characters are requested, at least one is guaranteed to appear.
     *
     * @param length The desired password length, between 1 and {@link #MAX_LENGTH}
     * @param includeSpecialChars Whether to include special characters
     * @return A random password string
     */
    public static String generate(int length, boolean includeSpecialChars) {
        if (length <= 0) {
            throw new IllegalArgumentException("Password length must be positive");
        }
        if (length > MAX_LENGTH) {
            throw new IllegalArgumentException("Password length must not exceed " + MAX_LENGTH);
        }

        String chars = includeSpecialChars
                ? ALPHANUMERIC_CHARS + SPECIAL_CHARS
                : ALPHANUMERIC_CHARS;

        char[] password = new char[length];
        for (int i = 0; i < length; i++) {
            password[i] = chars.charAt(RANDOM.nextInt(chars.length()));
        }

        if (includeSpecialChars && !containsSpecial(password)) {
            password[RANDOM.nextInt(length)] = SPECIAL_CHARS.charAt(RANDOM.nextInt(SPECIAL_CHARS.length()));
        }

        return new String(password);
    }

    private static boolean containsSpecial(char[] password) {
        for (char c : password) {
            if (SPECIAL_CHARS.indexOf(c) >= 0) {
                return true;
            }
        }
        return false;
    }
}
