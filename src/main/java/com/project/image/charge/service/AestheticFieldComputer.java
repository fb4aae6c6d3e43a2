package com.project.image.charge.service;

import com.project.image.charge.DTOs.ChargeComponents;
import com.project.image.charge.DTOs.ChargeFieldResult;
import com.project.image.charge.DTOs.ChargeParameters;
import com.project.image.charge.DTOs.LabImage;
import com.project.image.charge.DTOs.ScalarField;
import com.project.image.charge.exceptions.InvalidInputException;
import com.project.image.charge.exceptions.InvalidParameterException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;

/**
 * Computes the aesthetic charge field of an image:
 * local CIELAB contrast per channel, curvature of L, and the global gray-level entropy,
 * combined with caller-supplied weights. Stateless; every call builds its own buffers.
 */
@Service
public class AestheticFieldComputer {
    private static final Logger log = LoggerFactory.getLogger(AestheticFieldComputer.class);

    public ChargeFieldResult compute(BufferedImage input) {
        return compute(input, ChargeParameters.DEFAULT);
    }

    public ChargeFieldResult compute(BufferedImage input, int kernelSize, double... weights) {
        return compute(input, ChargeParameters.of(kernelSize, weights));
    }

    public ChargeFieldResult compute(BufferedImage input, ChargeParameters parameters) {
        if (parameters == null) {
            throw new InvalidParameterException("Parameters are required");
        }
        requireImage(input);

        final int w = input.getWidth(), h = input.getHeight();
        final int k = parameters.kernelSize();
        log.info("Computing charge field for image {}x{}, kernelSize={}, weights=({})",
                w, h, k, parameters.weights());

        int[] argb = new int[w * h];
        input.getRGB(0, 0, w, h, argb, 0, w);
        BufferedImage rgb = toCanonicalRgb(argb, w, h);

        LabImage lab = LabConversion.toLab(argb, w, h);

        ScalarField lContrast = Convolution.absoluteDeviation(lab.l(), Convolution.boxMean(lab.l(), k));
        ScalarField aContrast = Convolution.absoluteDeviation(lab.a(), Convolution.boxMean(lab.a(), k));
        ScalarField bContrast = Convolution.absoluteDeviation(lab.b(), Convolution.boxMean(lab.b(), k));
        ScalarField curvature = Convolution.abs(Convolution.laplacian(lab.l()));

        double entropy = Entropy.shannon(Entropy.histogram(LabConversion.toGray(argb)));
        log.debug("Global gray-level entropy: {} bits", String.format("%.4f", entropy));

        ChargeComponents components = new ChargeComponents(lContrast, aContrast, bContrast, curvature, entropy);
        ScalarField field = ChargeCombiner.combine(components, parameters.weights());
        logSummary(field);

        return new ChargeFieldResult(field, rgb, components, parameters);
    }

    static void requireImage(BufferedImage input) {
        if (input == null) {
            throw new InvalidInputException("Image is missing or could not be decoded.");
        }
        if (input.getWidth() < 1 || input.getHeight() < 1) {
            throw new InvalidInputException("Image has zero area: " + input.getWidth() + "x" + input.getHeight());
        }
    }

    /**
     * Copies packed pixels into a TYPE_INT_RGB image, whatever channel order the source was stored in.
     */
    static BufferedImage toCanonicalRgb(int[] argb, int w, int h) {
        BufferedImage rgb = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        rgb.setRGB(0, 0, w, h, argb, 0, w);
        return rgb;
    }

    static void logSummary(ScalarField field) {
        log.info("Charge field computed: min={}, max={}, mean={}",
                String.format("%.3f", field.min()),
                String.format("%.3f", field.max()),
                String.format("%.3f", field.mean()));
    }
}
