package com.project.image.charge.service;

import com.project.image.charge.DTOs.ScalarField;
import com.project.image.charge.exceptions.ChargeFieldException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import javax.imageio.ImageIO;

/**
 * Renders a scalar field as a false-color image. The field is min-max normalised first,
 * so the full colormap is used whatever the field's range.
 */
@Service
public class HeatmapRenderer {
    private static final Logger log = LoggerFactory.getLogger(HeatmapRenderer.class);

    public BufferedImage render(ScalarField field, Colormap colormap) {
        final int w = field.width(), h = field.height();
        double[] norm = field.normalized().values();
        int[] pixels = new int[norm.length];
        for (int i = 0; i < norm.length; i++) {
            pixels[i] = colormap.rgb(norm[i]);
        }
        BufferedImage heatmap = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        heatmap.setRGB(0, 0, w, h, pixels, 0, w);
        log.debug("Rendered {}x{} heatmap with {}", w, h, colormap);
        return heatmap;
    }

    public byte[] renderPng(ScalarField field, Colormap colormap) {
        return toPng(render(field, colormap));
    }

    public byte[] toPng(BufferedImage img) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            ImageIO.write(img, "png", baos);
            return baos.toByteArray();
        } catch (IOException e) {
            throw new ChargeFieldException("Failed to encode image", e);
        }
    }
}
