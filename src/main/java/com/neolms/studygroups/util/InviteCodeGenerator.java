package com.neolms.studygroups.util;

import java.security.SecureRandom;
import java.util.function.Predicate;

/**
 * Generates opaque, URL-safe invite codes from a {@link SecureRandom}.
 * Codes carry no information about the group they belong to.
 */
public final class InviteCodeGenerator {

    // Drops look-alike characters (0/O, 1/l/I) so codes can be read aloud or retyped
    static final String ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZabcdefghjkmnpqrstuvwxyz23456789";
    static final int CODE_LENGTH = 16;
    private static final int MAX_ATTEMPTS = 10;
    private static final SecureRandom random = new SecureRandom();

    private InviteCodeGenerator() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static String generate() {
        StringBuilder code = new StringBuilder(CODE_LENGTH);
        for (int i = 0; i < CODE_LENGTH; i++) {
            code.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return code.toString();
    }

    /**
     * Generate a code that is not yet in use anywhere. Codes live in one global namespace.
     *
     * With 55^16 possible codes a collision is practically impossible, so running out of
     * attempts signals a broken existence check rather than bad luck.
     *
     * @param existsChecker returns true if a code is already taken
     * @throws IllegalStateException if no free code was found
     */
    public static String generateUnique(Predicate<String> existsChecker) {
        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            String code = generate();
            if (!existsChecker.test(code)) {
                return code;
            }
        }
        throw new IllegalStateException("Could not generate a unique invite code after " + MAX_ATTEMPTS + " attempts");
    }

    public static boolean isWellFormed(String code) {
        if (code == null || code.length() != CODE_LENGTH) {
            return false;
        }
        for (int i = 0; i < code.length(); i++) {
            if (ALPHABET.indexOf(code.charAt(i)) < 0) {
                return false;
            }
        }
        return true;
    }
}
