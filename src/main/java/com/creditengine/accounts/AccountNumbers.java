package com.creditengine.accounts;

import java.security.SecureRandom;

/**
 * Generates 20-digit account numbers: the ruble current-account prefix followed by random digits.
 */
public final class AccountNumbers {

    private static final String PREFIX = "40817810";
    private static final SecureRandom RANDOM = new SecureRandom();

    private AccountNumbers() {
    }

    public static String generate() {
        long suffix = Math.floorMod(RANDOM.nextLong(), 1_000_000_000_000L);
        return PREFIX + String.format("%012d", suffix);
    }
}
