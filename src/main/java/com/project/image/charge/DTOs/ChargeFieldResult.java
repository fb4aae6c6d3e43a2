package com.project.image.charge.DTOs;

import java.awt.image.BufferedImage;

/**
 * Output of a charge field computation.
 *
 * @param field      the weighted charge field, same size as the input, all values >= 0
 * @param rgb        the input as a canonical TYPE_INT_RGB copy, for display only
 * @param components the unweighted maps and the entropy the field was built from
 * @param parameters kernel size and weights used
 */
public record ChargeFieldResult(
        ScalarField field,
        BufferedImage rgb,
        ChargeComponents components,
        ChargeParameters parameters
) {
    public int width() { return field.width(); }

    public int height() { return field.height(); }

    public ScalarField view(FieldView view) {
        switch (view) {
            case L_CONTRAST: return components.lContrast();
            case A_CONTRAST: return components.aContrast();
            case B_CONTRAST: return components.bContrast();
            case CURVATURE:  return components.curvature();
            default:         return field;
        }
    }
}
