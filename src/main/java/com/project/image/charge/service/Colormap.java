package com.project.image.charge.service;

import com.project.image.charge.exceptions.InvalidParameterException;

import java.util.Locale;

/**
 * Maps a value in [0, 1] to a packed RGB color. Both maps are polynomial fits.
 */
public enum Colormap {
    INFERNO,
    TURBO;

    public int rgb(double value) {
        double t = clamp01(value);
        switch (this) {
            case TURBO:
                return turbo(t);
            default:
                return inferno(t);
        }
    }

    public String param() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Colormap fromParam(String value) {
        for (Colormap map : values()) {
            if (map.param().equalsIgnoreCase(value == null ? "" : value.trim())) {
                return map;
            }
        }
        throw new InvalidParameterException("Unknown colormap: " + value);
    }

    // matplotlib inferno, degree-6 fit, channels in [0, 1]
    private static int inferno(double t) {
        double r = 0.0002189403691192265 + t * (0.1065134194856116 + t * (11.60249308247187
                + t * (-41.70399613139459 + t * (77.162935699427 + t * (-71.31942824499214 + t * 25.13112622477341)))));
        double g = 0.001651004631001012 + t * (0.5639564367884091 + t * (-3.972853965665698
                + t * (17.43639888205313 + t * (-33.40235894210092 + t * (32.62606426397723 + t * -12.24266895238567)))));
        double b = -0.01948089843709184 + t * (3.932712388889277 + t * (-15.9423941062914
                + t * (44.35414519872813 + t * (-81.80730925738993 + t * (73.20951985803202 + t * -23.07032500287172)))));
        return pack(r * 255, g * 255, b * 255);
    }

    // Google turbo, channels in [0, 255]
    private static int turbo(double x) {
        double r = 34.61 + x * (1172.33 - x * (10793.56 - x * (33300.12 - x * (38394.49 - x * 14825.05))));
        double g = 23.31 + x * (557.33 + x * (1225.33 - x * (3574.96 - x * (1073.77 + x * 707.56))));
        double b = 27.2 + x * (3211.1 - x * (15327.97 - x * (27814.0 - x * (22569.18 - x * 6838.66))));
        return pack(r, g, b);
    }

    private static int pack(double r, double g, double b) {
        return (clamp255(r) << 16) | (clamp255(g) << 8) | clamp255(b);
    }

    private static int clamp255(double v) {
        long c = Math.round(v);
        return (int) ((c < 0) ? 0 : Math.min(255, c));
    }

    private static double clamp01(double x) {
        if (Double.isNaN(x)) return 0;
        return x < 0 ? 0 : Math.min(1, x);
    }
}
