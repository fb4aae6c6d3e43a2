package com.project.image.charge.service;

import com.project.image.charge.DTOs.ChargeComponents;
import com.project.image.charge.DTOs.ChargeWeights;
import com.project.image.charge.DTOs.ScalarField;

/**
 * q = w1 |dL| + w2 |da| + w3 |db| + w4 |Laplacian L| + w5 H, pointwise.
 */
public final class ChargeCombiner {

    private ChargeCombiner() {}

    public static ScalarField combine(ChargeComponents c, ChargeWeights w) {
        double[] l = c.lContrast().values();
        double[] a = c.aContrast().values();
        double[] b = c.bContrast().values();
        double[] lap = c.curvature().values();
        double entropyTerm = w.entropy() * c.entropy();

        double[] q = new double[l.length];
        for (int i = 0; i < q.length; i++) {
            q[i] = w.lContrast() * l[i]
                    + w.aContrast() * a[i]
                    + w.bContrast() * b[i]
                    + w.curvature() * lap[i]
                    + entropyTerm;
        }
        return new ScalarField(c.width(), c.height(), q);
    }
}
