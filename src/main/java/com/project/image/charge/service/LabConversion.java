package com.project.image.charge.service;

import com.project.image.charge.DTOs.LabImage;
import com.project.image.charge.DTOs.ScalarField;

/**
 * sRGB to CIELAB (D65) and sRGB to 8-bit gray.
 */
public final class LabConversion {

    private LabConversion() {}

    // D65 white point
    private static final double XN = 0.95047;
    private static final double YN = 1.00000;
    private static final double ZN = 1.08883;

    private static final double DELTA = 6.0 / 29.0;
    private static final double DELTA_CUBED = DELTA * DELTA * DELTA;

    /**
     * Convert sRGB (0-255 per channel) to [L*, a*, b*].
     */
    public static double[] srgbToLab(int r8, int g8, int b8) {
        double r = invGamma(r8 / 255.0), g = invGamma(g8 / 255.0), b = invGamma(b8 / 255.0);
        double x = 0.4124564 * r + 0.3575761 * g + 0.1804375 * b;
        double y = 0.2126729 * r + 0.7151522 * g + 0.0721750 * b;
        double z = 0.0193339 * r + 0.1191920 * g + 0.9503041 * b;
        double fx = fxyz(x / XN), fy = fxyz(y / YN), fz = fxyz(z / ZN);
        return new double[]{116.0 * fy - 16.0, 500.0 * (fx - fy), 200.0 * (fy - fz)};
    }

    /**
     * Converts packed (A)RGB pixels, as returned by {@code BufferedImage.getRGB}, into a Lab image.
     * Alpha is ignored.
     */
    public static LabImage toLab(int[] argb, int width, int height) {
        int n = width * height;
        double[] l = new double[n], a = new double[n], b = new double[n];
        for (int i = 0; i < n; i++) {
            int p = argb[i];
            double[] lab = srgbToLab((p >> 16) & 0xFF, (p >> 8) & 0xFF, p & 0xFF);
            l[i] = lab[0];
            a[i] = lab[1];
            b[i] = lab[2];
        }
        return new LabImage(new ScalarField(width, height, l),
                new ScalarField(width, height, a),
                new ScalarField(width, height, b));
    }

    /**
     * ITU-R BT.601 luma in 14-bit fixed point, rounded. Result in [0, 255].
     */
    public static int gray(int r, int g, int b) {
        return (r * 4899 + g * 9617 + b * 1868 + (1 << 13)) >> 14;
    }

    public static int[] toGray(int[] argb) {
        int[] out = new int[argb.length];
        for (int i = 0; i < argb.length; i++) {
            int p = argb[i];
            out[i] = gray((p >> 16) & 0xFF, (p >> 8) & 0xFF, p & 0xFF);
        }
        return out;
    }

    private static double invGamma(double c) {
        return (c <= 0.04045) ? (c / 12.92) : Math.pow((c + 0.055) / 1.055, 2.4);
    }

    private static double fxyz(double t) {
        return (t > DELTA_CUBED) ? Math.cbrt(t) : (t / (3 * DELTA * DELTA) + 4.0 / 29.0);
    }
}
