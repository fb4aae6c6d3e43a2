package com.project.image.charge.DTOs;

/**
 * An image in CIELAB, one field per channel. L is in [0, 100], a and b roughly in [-128, 127].
 */
public record LabImage(ScalarField l, ScalarField a, ScalarField b) {

    public LabImage {
        if (l.width() != a.width() || l.width() != b.width()
                || l.height() != a.height() || l.height() != b.height()) {
            throw new IllegalArgumentException("Lab channels must share the same dimensions");
        }
    }

    public int width() { return l.width(); }

    public int height() { return l.height(); }
}
