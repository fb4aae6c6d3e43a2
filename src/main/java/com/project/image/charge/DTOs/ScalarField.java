package com.project.image.charge.DTOs;

import java.util.Arrays;

/**
 * Row-major grid of doubles, one value per pixel. Used for every intermediate map
 * (local mean, deviation, curvature) and for the charge field itself.
 *
 * @param width  number of columns, at least 1
 * @param height number of rows, at least 1
 * @param values {@code width * height} values, index {@code y * width + x}; copied on the
 *               way in and out, so a field never changes after construction
 */
public record ScalarField(int width, int height, double[] values) {

    public ScalarField {
        if (width < 1 || height < 1) {
            throw new IllegalArgumentException("Field dimensions must be positive, got " + width + "x" + height);
        }
        if (values == null || values.length != width * height) {
            throw new IllegalArgumentException("Expected " + (width * height) + " values for a "
                    + width + "x" + height + " field, got " + (values == null ? "none" : values.length));
        }
        values = values.clone();
    }

    @Override
    public double[] values() {
        return values.clone();
    }

    public static ScalarField constant(int width, int height, double value) {
        double[] values = new double[width * height];
        Arrays.fill(values, value);
        return new ScalarField(width, height, values);
    }

    public double get(int x, int y) {
        return values[y * width + x];
    }

    public int size() {
        return values.length;
    }

    public double min() {
        double lo = Double.POSITIVE_INFINITY;
        for (double v : values) if (v < lo) lo = v;
        return lo;
    }

    public double max() {
        double hi = Double.NEGATIVE_INFINITY;
        for (double v : values) if (v > hi) hi = v;
        return hi;
    }

    public double mean() {
        double sum = 0;
        for (double v : values) sum += v;
        return sum / values.length;
    }

    /**
     * Min-max rescale into [0, 1]. A constant field maps to all zeros.
     */
    public ScalarField normalized() {
        double lo = min();
        double range = max() - lo;
        double[] out = new double[values.length];
        if (range > 0) {
            for (int i = 0; i < values.length; i++) {
                out[i] = (values[i] - lo) / range;
            }
        }
        return new ScalarField(width, height, out);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScalarField other)) return false;
        return width == other.width && height == other.height && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "ScalarField[" + width + "x" + height + ", min=" + min() + ", max=" + max() + "]";
    }
}
