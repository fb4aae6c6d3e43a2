package com.project.image.charge.DTOs;

import com.project.image.charge.exceptions.InvalidParameterException;

import java.util.Locale;

/** Which map of a result gets rendered. */
public enum FieldView {
    CHARGE,
    L_CONTRAST,
    A_CONTRAST,
    B_CONTRAST,
    CURVATURE;

    /** Request parameter form, e.g. {@code l-contrast}. */
    public String param() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    public static FieldView fromParam(String value) {
        for (FieldView view : values()) {
            if (view.param().equalsIgnoreCase(value == null ? "" : value.trim())) {
                return view;
            }
        }
        throw new InvalidParameterException("Unknown view: " + value);
    }
}
