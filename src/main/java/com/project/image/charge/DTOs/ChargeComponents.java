package com.project.image.charge.DTOs;

/**
 * The unweighted signals the charge field is built from. The entropy is one scalar for
 * the whole image; {@link #entropyField()} broadcasts it.
 */
public record ChargeComponents(
        ScalarField lContrast,
        ScalarField aContrast,
        ScalarField bContrast,
        ScalarField curvature,
        double entropy
) {
    public int width() { return lContrast.width(); }

    public int height() { return lContrast.height(); }

    public ScalarField entropyField() {
        return ScalarField.constant(width(), height(), entropy);
    }
}
