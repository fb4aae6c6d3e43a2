package com.project.image.charge.service;

import com.project.image.charge.exceptions.InvalidInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import javax.imageio.ImageIO;

/**
 * Turns uploaded bytes into a {@link BufferedImage}, rejecting anything the charge
 * computation cannot use.
 */
@Service
public class ImageDecoder {
    private static final Logger log = LoggerFactory.getLogger(ImageDecoder.class);

    private final int maxDimension;

    public ImageDecoder(@Value("${app.charge.max-dimension:4000}") int maxDimension) {
        this.maxDimension = maxDimension;
    }

    public BufferedImage decode(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new InvalidInputException("Image file is empty.");
        }

        BufferedImage image;
        try (var in = new ByteArrayInputStream(bytes)) {
            image = ImageIO.read(in);
        } catch (IOException e) {
            throw new InvalidInputException("File is not a valid image or is corrupted: " + e.getMessage(), e);
        }

        if (image == null) {
            throw new InvalidInputException("File is not a valid image or is corrupted.");
        }
        if (image.getWidth() < 1 || image.getHeight() < 1) {
            throw new InvalidInputException("Image has zero area: " + image.getWidth() + "x" + image.getHeight());
        }
        if (image.getWidth() > maxDimension || image.getHeight() > maxDimension) {
            throw new InvalidInputException("Image is too large: " + image.getWidth() + "x" + image.getHeight()
                    + ". Maximum size: " + maxDimension + "x" + maxDimension + " pixels");
        }

        log.debug("Image decoded: {}x{}", image.getWidth(), image.getHeight());
        return image;
    }
}
