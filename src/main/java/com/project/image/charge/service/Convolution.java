package com.project.image.charge.service;

import com.project.image.charge.DTOs.ScalarField;

/**
 * Neighbourhood filters on a {@link ScalarField}. Every filter here resolves out-of-range
 * pixels with the same reflect-101 rule ({@code gfedcb|abcdefgh|gfedcba}).
 */
public final class Convolution {

    private Convolution() {}

    /**
     * Maps a coordinate outside {@code [0, n)} back into range by mirroring around the edge
     * pixel without repeating it. A single-pixel axis always maps to 0.
     */
    public static int reflect101(int p, int n) {
        if (n == 1) return 0;
        while (p < 0 || p >= n) {
            p = (p < 0) ? -p : 2 * n - 2 - p;
        }
        return p;
    }

    /**
     * Mean over a {@code k x k} window centred on each pixel. Computed as two 1-D passes,
     * which gives the same result as the 2-D box kernel since the border rule is per axis.
     */
    public static ScalarField boxMean(ScalarField src, int k) {
        int w = src.width(), h = src.height();
        int r = k / 2;
        double[] in = src.values();
        double[] tmp = new double[w * h];
        double[] out = new double[w * h];

        for (int y = 0; y < h; y++) {
            int row = y * w;
            for (int x = 0; x < w; x++) {
                double sum = 0;
                for (int dx = -r; dx <= r; dx++) {
                    sum += in[row + reflect101(x + dx, w)];
                }
                tmp[row + x] = sum;
            }
        }

        double norm = 1.0 / (k * k);
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                double sum = 0;
                for (int dy = -r; dy <= r; dy++) {
                    sum += tmp[reflect101(y + dy, h) * w + x];
                }
                out[y * w + x] = sum * norm;
            }
        }
        return new ScalarField(w, h, out);
    }

    /**
     * 4-neighbour Laplacian, stencil {@code [0 1 0; 1 -4 1; 0 1 0]}.
     */
    public static ScalarField laplacian(ScalarField src) {
        int w = src.width(), h = src.height();
        double[] in = src.values();
        double[] out = new double[w * h];
        for (int y = 0; y < h; y++) {
            int up = reflect101(y - 1, h) * w;
            int down = reflect101(y + 1, h) * w;
            int row = y * w;
            for (int x = 0; x < w; x++) {
                int left = reflect101(x - 1, w);
                int right = reflect101(x + 1, w);
                out[row + x] = in[row + left] + in[row + right] + in[up + x] + in[down + x] - 4.0 * in[row + x];
            }
        }
        return new ScalarField(w, h, out);
    }

    /** Pointwise {@code |src - mean|}. */
    public static ScalarField absoluteDeviation(ScalarField src, ScalarField mean) {
        double[] a = src.values(), b = mean.values();
        double[] out = new double[a.length];
        for (int i = 0; i < a.length; i++) {
            out[i] = Math.abs(a[i] - b[i]);
        }
        return new ScalarField(src.width(), src.height(), out);
    }

    public static ScalarField abs(ScalarField src) {
        double[] in = src.values();
        double[] out = new double[in.length];
        for (int i = 0; i < in.length; i++) {
            out[i] = Math.abs(in[i]);
        }
        return new ScalarField(src.width(), src.height(), out);
    }
}
