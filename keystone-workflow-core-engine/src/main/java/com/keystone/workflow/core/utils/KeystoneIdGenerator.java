package com.keystone.workflow.core.utils;

import java.time.Clock;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Generates ids of the form {@code <prefix><epochMillis>_<9 base-36 chars>}.
 */
public final class KeystoneIdGenerator {

    private static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int RANDOM_LENGTH = 9;

    private KeystoneIdGenerator() {
    }

    public static String next(String prefix, Clock clock) {
        StringBuilder id = new StringBuilder(prefix)
                .append(clock.millis())
                .append('_');
        ThreadLocalRandom random = ThreadLocalRandom.current();
        for (int i = 0; i < RANDOM_LENGTH; i++) {
            id.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return id.toString();
    }
}
