package com.tradebot.client.rpc;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Request id source: wall clock millis followed by a random base-36 suffix.
 */
public final class RequestIds {
    private static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int SUFFIX_LENGTH = 9;

    private RequestIds() {}

    public static String next() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder sb = new StringBuilder(24);
        sb.append(System.currentTimeMillis());
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }
}
