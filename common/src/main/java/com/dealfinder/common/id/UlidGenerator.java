package com.dealfinder.common.id;

import java.security.SecureRandom;
import java.time.Clock;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Generates ULIDs: a 48-bit millisecond timestamp followed by 80 random bits, written as 26
 * Crockford Base32 characters. Run ids and notification row ids use them so rows sort by
 * creation time.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class UlidGenerator {

    private static final char[] ALPHABET = "0123456789ABCDEFGHJKMNPQRSTVWXYZ".toCharArray();
    private static final int TIME_CHARS = 10;
    private static final int RANDOM_CHARS = 16;
    private static final SecureRandom RANDOM = new SecureRandom();

    public static String generate() {
        return generate(Clock.systemUTC());
    }

    public static String generate(Clock clock) {
        var out = new char[TIME_CHARS + RANDOM_CHARS];
        long millis = clock.millis();
        for (int i = TIME_CHARS - 1; i >= 0; i--) {
            out[i] = ALPHABET[(int) (millis & 0x1F)];
            millis >>>= 5;
        }

        // 80 random bits split into two 40-bit halves, 8 characters each
        long high = RANDOM.nextLong() & 0xFF_FFFF_FFFFL;
        long low = RANDOM.nextLong() & 0xFF_FFFF_FFFFL;
        writeFortyBits(out, TIME_CHARS, high);
        writeFortyBits(out, TIME_CHARS + 8, low);
        return new String(out);
    }

    private static void writeFortyBits(char[] out, int offset, long bits) {
        for (int i = 7; i >= 0; i--) {
            out[offset + i] = ALPHABET[(int) (bits & 0x1F)];
            bits >>>= 5;
        }
    }
}
