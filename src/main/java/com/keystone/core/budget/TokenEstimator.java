package com.keystone.core.budget;

/**
 * Rough token estimate for text exchanged with workers: one token per four characters.
 */
public final class TokenEstimator {

    private TokenEstimator() {}

    public static long estimate(String text) {
        if (text == null || text.isEmpty()) return 0;
        return (text.length() + 3) / 4;
    }
}
