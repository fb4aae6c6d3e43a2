package com.project.image.charge;

import com.project.image.charge.DTOs.ChargeFieldResult;
import com.project.image.charge.DTOs.ChargeParameters;
import com.project.image.charge.exceptions.InvalidInputException;
import com.project.image.charge.service.AestheticFieldComputer;
import com.project.image.charge.service.OpenCVAestheticFieldComputer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.awt.*;
import java.awt.image.BufferedImage;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class OpenCVAestheticFieldComputerTest {
    private final OpenCVAestheticFieldComputer openCv = new OpenCVAestheticFieldComputer();
    private final AestheticFieldComputer java = new AestheticFieldComputer();

    @BeforeEach
    void requireOpenCv() {
        assumeTrue(OpenCVAestheticFieldComputer.isAvailable(), "OpenCV native library not available");
    }

    @Test
    void compute_agreesWithJavaEngine() {
        BufferedImage img = scene(40, 30);

        for (int k : new int[]{1, 3, 5}) {
            ChargeParameters params = ChargeParameters.of(k, 1.0, 1.0, 1.0, 0.5, 0.3);
            ChargeFieldResult cv = openCv.compute(img, params);
            ChargeFieldResult jv = java.compute(img, params);

            assertThat(cv.width()).isEqualTo(jv.width());
            assertThat(cv.height()).isEqualTo(jv.height());
            assertThat(cv.components().entropy()).isCloseTo(jv.components().entropy(), within(1e-9));

            double[] a = cv.field().values(), b = jv.field().values();
            for (int i = 0; i < a.length; i++) {
                assertThat(a[i]).isCloseTo(b[i], within(0.25 + 0.01 * b[i]));
            }
        }
    }

    @Test
    void compute_flatImage_isZero() {
        BufferedImage img = new BufferedImage(6, 6, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = img.createGraphics();
        g.setColor(new Color(90, 140, 200));
        g.fillRect(0, 0, 6, 6);
        g.dispose();

        ChargeFieldResult res = openCv.compute(img);

        assertThat(res.components().entropy()).isEqualTo(0.0);
        assertThat(res.field().min()).isCloseTo(0.0, within(1e-4));
        assertThat(res.field().max()).isCloseTo(0.0, within(1e-4));
    }

    @Test
    void compute_repeatedCalls_returnFieldsThatOutliveTheNativeBuffers() {
        BufferedImage img = scene(40, 30);
        ChargeFieldResult first = openCv.compute(img);

        for (int i = 0; i < 20; i++) {
            ChargeFieldResult next = openCv.compute(img);
            assertThat(next.field()).isEqualTo(first.field());
            assertThat(next.components()).isEqualTo(first.components());
        }
        assertThat(first.field().max()).isGreaterThan(0.0);
    }

    @Test
    void compute_missingImage_isInvalidInput() {
        assertThatThrownBy(() -> openCv.compute(null))
                .isInstanceOf(InvalidInputException.class);
    }

    private static BufferedImage scene(int w, int h) {
        BufferedImage img = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int r = (x * 255) / (w - 1);
                int gr = (y * 255) / (h - 1);
                img.setRGB(x, y, (r << 16) | (gr << 8) | 128);
            }
        }
        Graphics2D g = img.createGraphics();
        g.setColor(Color.RED);
        g.fillRect(5, 5, 8, 8);
        g.setColor(Color.WHITE);
        g.fillOval(20, 12, 12, 12);
        g.dispose();
        return img;
    }
}
