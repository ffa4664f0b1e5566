package com.jsprinter.sourcemap;

/**
 * Base64 variable-length quantity encoding used by the "mappings" field of source maps.
 */
final class Base64Vlq {
    private static final String BASE64 =
        "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789+/";

    private static final int SHIFT = 5;
    private static final int MASK = (1 << SHIFT) - 1;
    private static final int CONTINUATION = 1 << SHIFT;

    private Base64Vlq() {
    }

    static void encode(StringBuilder out, int value) {
        // Sign goes in the least significant bit
        int vlq = value < 0 ? ((-value) << 1) | 1 : value << 1;
        do {
            int digit = vlq & MASK;
            vlq >>>= SHIFT;
            if (vlq > 0) {
                digit |= CONTINUATION;
            }
            out.append(BASE64.charAt(digit));
        } while (vlq > 0);
    }
}
