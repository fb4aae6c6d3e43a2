package com.project.image.charge.service;

/**
 * Gray-level histogram and its Shannon entropy.
 */
public final class Entropy {

    public static final int BINS = 256;

    private static final double LN2 = Math.log(2.0);

    private Entropy() {}

    public static long[] histogram(int[] gray) {
        long[] hist = new long[BINS];
        for (int i = 0; i < gray.length; i++) {
            int v = gray[i];
            if (v < 0 || v >= BINS) {
                throw new IllegalArgumentException("Gray level at index " + i + " is outside [0, " + (BINS - 1) + "]: " + v);
            }
            hist[v]++;
        }
        return hist;
    }

    /**
     * {@code H = -sum(p * log2(p))} in bits over the normalised histogram. Empty bins
     * contribute nothing, so a single-valued image gives exactly 0.
     */
    public static double shannon(long[] histogram) {
        long total = 0;
        for (long c : histogram) total += c;
        if (total == 0) return 0.0;

        double h = 0.0;
        for (long c : histogram) {
            if (c == 0) continue;
            double p = (double) c / total;
            h -= p * (Math.log(p) / LN2);
        }
        return Math.max(0.0, h);
    }
}
