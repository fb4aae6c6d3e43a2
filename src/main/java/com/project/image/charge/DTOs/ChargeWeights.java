package com.project.image.charge.DTOs;

import com.project.image.charge.exceptions.InvalidParameterException;

/**
 * Contribution of each signal to the charge field. All weights are finite and non-negative.
 *
 * @param lContrast weight of |L - local mean(L)|
 * @param aContrast weight of |a - local mean(a)|
 * @param bContrast weight of |b - local mean(b)|
 * @param curvature weight of |Laplacian(L)|
 * @param entropy   weight of the global gray-level entropy
 */
public record ChargeWeights(
        double lContrast,
        double aContrast,
        double bContrast,
        double curvature,
        double entropy
) {
    public static final int COUNT = 5;

    public static final ChargeWeights DEFAULT = new ChargeWeights(1.0, 1.0, 1.0, 0.5, 0.3);

    public ChargeWeights {
        requireWeight("lContrast", lContrast);
        requireWeight("aContrast", aContrast);
        requireWeight("bContrast", bContrast);
        requireWeight("curvature", curvature);
        requireWeight("entropy", entropy);
    }

    /**
     * Weights in (L, a, b, curvature, entropy) order.
     */
    public static ChargeWeights of(double... weights) {
        if (weights == null || weights.length != COUNT) {
            throw new InvalidParameterException("Expected exactly " + COUNT
                    + " weights (L, a, b, curvature, entropy), got " + (weights == null ? 0 : weights.length));
        }
        return new ChargeWeights(weights[0], weights[1], weights[2], weights[3], weights[4]);
    }

    /**
     * Parses a comma-separated list such as {@code "1.0,1.0,1.0,0.5,0.3"}.
     */
    public static ChargeWeights parse(String csv) {
        if (csv == null || csv.isBlank()) {
            throw new InvalidParameterException("Weights are empty");
        }
        String[] parts = csv.split(",");
        double[] weights = new double[parts.length];
        for (int i = 0; i < parts.length; i++) {
            try {
                weights[i] = Double.parseDouble(parts[i].trim());
            } catch (NumberFormatException e) {
                throw new InvalidParameterException("Weight #" + (i + 1) + " is not a number: '" + parts[i].trim() + "'");
            }
        }
        return of(weights);
    }

    public double[] toArray() {
        return new double[]{lContrast, aContrast, bContrast, curvature, entropy};
    }

    @Override
    public String toString() {
        return lContrast + "," + aContrast + "," + bContrast + "," + curvature + "," + entropy;
    }

    private static void requireWeight(String name, double value) {
        if (!Double.isFinite(value) || value < 0) {
            throw new InvalidParameterException("Weight '" + name + "' must be a finite non-negative number, got " + value);
        }
    }
}
