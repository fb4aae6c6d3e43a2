package com.project.image.charge.DTOs;

import com.project.image.charge.exceptions.InvalidParameterException;

/**
 * Neighbourhood size and weights for one charge field computation.
 * Even kernel sizes are rejected rather than rounded.
 */
public record ChargeParameters(int kernelSize, ChargeWeights weights) {

    public static final int DEFAULT_KERNEL_SIZE = 5;

    public static final ChargeParameters DEFAULT = new ChargeParameters(DEFAULT_KERNEL_SIZE, ChargeWeights.DEFAULT);

    public ChargeParameters {
        if (kernelSize < 1) {
            throw new InvalidParameterException("Kernel size must be a positive odd integer, got " + kernelSize);
        }
        if (kernelSize % 2 == 0) {
            throw new InvalidParameterException("Kernel size must be odd, got " + kernelSize);
        }
        if (weights == null) {
            throw new InvalidParameterException("Weights are required");
        }
    }

    public static ChargeParameters of(int kernelSize, double... weights) {
        return new ChargeParameters(kernelSize, ChargeWeights.of(weights));
    }
}
