package dev.catananti.resumeengine.util;

import java.util.Objects;

/**
 * Content fingerprints for rendered artifacts.
 */
public final class DigestUtils {

    private DigestUtils() {
        // utility class
    }

    /**
     * 32-bit rolling hash ({@code h = 31 * h + c}) rendered as unsigned hex.
     * Detects accidental changes only; not suitable where tampering matters.
     *
     * @param input text to fingerprint
     * @return lowercase hex string, at most 8 characters
     */
    public static String rollingHashHex(String input) {
        Objects.requireNonNull(input, "Input must not be null");
        int hash = 0;
        for (int i = 0; i < input.length(); i++) {
            hash = (hash << 5) - hash + input.charAt(i);
        }
        return Integer.toHexString(hash);
    }
}
