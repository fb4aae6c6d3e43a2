package com.project.image.charge.service;

import com.project.image.charge.DTOs.ChargeComponents;
import com.project.image.charge.DTOs.ChargeFieldResult;
import com.project.image.charge.DTOs.ChargeParameters;
import com.project.image.charge.DTOs.ScalarField;
import com.project.image.charge.exceptions.ChargeFieldException;
import com.project.image.charge.exceptions.InvalidParameterException;
import org.opencv.core.*;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.util.ArrayList;
import java.util.List;

/**
 * Same computation as {@link AestheticFieldComputer}, built on OpenCV's
 * cvtColor / filter2D / Laplacian / calcHist. Both use reflect-101 borders and the
 * 4-neighbour Laplacian, so results agree up to the Lab conversion's float precision.
 */
@Service
public class OpenCVAestheticFieldComputer {
    private static final Logger log = LoggerFactory.getLogger(OpenCVAestheticFieldComputer.class);

    private static final boolean NATIVE_LOADED = loadNative();

    private static boolean loadNative() {
        try {
            nu.pattern.OpenCV.loadLocally();
            log.info("OpenCV loaded successfully");
            return true;
        } catch (Exception | UnsatisfiedLinkError e) {
            log.error("Failed to load OpenCV", e);
            return false;
        }
    }

    public static boolean isAvailable() {
        return NATIVE_LOADED;
    }

    public ChargeFieldResult compute(BufferedImage input) {
        return compute(input, ChargeParameters.DEFAULT);
    }

    public ChargeFieldResult compute(BufferedImage input, ChargeParameters parameters) {
        if (parameters == null) {
            throw new InvalidParameterException("Parameters are required");
        }
        AestheticFieldComputer.requireImage(input);
        if (!NATIVE_LOADED) {
            throw new ChargeFieldException("OpenCV native library is not available");
        }

        final int w = input.getWidth(), h = input.getHeight();
        final int k = parameters.kernelSize();
        log.info("Computing charge field with OpenCV for image {}x{}, kernelSize={}, weights=({})",
                w, h, k, parameters.weights());

        int[] argb = new int[w * h];
        input.getRGB(0, 0, w, h, argb, 0, w);
        BufferedImage rgb = AestheticFieldComputer.toCanonicalRgb(argb, w, h);

        // Every Mat allocated below is released in the finally block
        List<Mat> mats = new ArrayList<>();
        try {
            Mat bgr = track(mats, bufferedImageToMat(rgb));

            Mat rgbMat = track(mats, new Mat());
            Imgproc.cvtColor(bgr, rgbMat, Imgproc.COLOR_BGR2RGB);
            Mat rgbFloat = track(mats, new Mat());
            rgbMat.convertTo(rgbFloat, CvType.CV_32FC3, 1.0 / 255.0);
            Mat lab32 = track(mats, new Mat());
            Imgproc.cvtColor(rgbFloat, lab32, Imgproc.COLOR_RGB2Lab);
            Mat lab = track(mats, new Mat());
            lab32.convertTo(lab, CvType.CV_64FC3);

            List<Mat> channels = new ArrayList<>(3);
            Core.split(lab, channels);
            mats.addAll(channels);

            Mat kernel = track(mats, new Mat(k, k, CvType.CV_64F, new Scalar(1.0 / (k * k))));
            ScalarField lContrast = localContrast(channels.get(0), kernel, mats);
            ScalarField aContrast = localContrast(channels.get(1), kernel, mats);
            ScalarField bContrast = localContrast(channels.get(2), kernel, mats);

            Mat laplacian = track(mats, new Mat());
            Imgproc.Laplacian(channels.get(0), laplacian, CvType.CV_64F, 1, 1, 0, Core.BORDER_REFLECT_101);
            Core.absdiff(laplacian, Scalar.all(0), laplacian);
            ScalarField curvature = toField(laplacian);

            Mat gray = track(mats, new Mat());
            Imgproc.cvtColor(bgr, gray, Imgproc.COLOR_BGR2GRAY);
            double entropy = Entropy.shannon(grayHistogram(gray, mats));
            log.debug("Global gray-level entropy: {} bits", String.format("%.4f", entropy));

            ChargeComponents components = new ChargeComponents(lContrast, aContrast, bContrast, curvature, entropy);
            ScalarField field = ChargeCombiner.combine(components, parameters.weights());
            AestheticFieldComputer.logSummary(field);

            return new ChargeFieldResult(field, rgb, components, parameters);

        } catch (CvException e) {
            log.error("OpenCV charge field computation failed", e);
            throw new ChargeFieldException("OpenCV charge field computation failed: " + e.getMessage(), e);
        } finally {
            for (Mat m : mats) {
                m.release();
            }
        }
    }

    private static <M extends Mat> M track(List<Mat> mats, M mat) {
        mats.add(mat);
        return mat;
    }

    private static ScalarField localContrast(Mat channel, Mat kernel, List<Mat> mats) {
        Mat mean = track(mats, new Mat());
        Imgproc.filter2D(channel, mean, -1, kernel, new Point(-1, -1), 0, Core.BORDER_REFLECT_101);
        Mat diff = track(mats, new Mat());
        Core.absdiff(channel, mean, diff);
        return toField(diff);
    }

    private static long[] grayHistogram(Mat gray, List<Mat> mats) {
        Mat hist = track(mats, new Mat());
        Imgproc.calcHist(List.of(gray), track(mats, new MatOfInt(0)), track(mats, new Mat()), hist,
                track(mats, new MatOfInt(Entropy.BINS)), track(mats, new MatOfFloat(0f, 256f)));
        float[] counts = new float[Entropy.BINS];
        hist.get(0, 0, counts);
        long[] out = new long[Entropy.BINS];
        for (int i = 0; i < counts.length; i++) {
            out[i] = Math.round(counts[i]);
        }
        return out;
    }

    private static ScalarField toField(Mat mat) {
        double[] values = new double[mat.rows() * mat.cols()];
        mat.get(0, 0, values);
        return new ScalarField(mat.cols(), mat.rows(), values);
    }

    private static Mat bufferedImageToMat(BufferedImage image) {
        BufferedImage bgrImage = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_3BYTE_BGR);
        Graphics2D graphics = bgrImage.createGraphics();
        graphics.drawImage(image, 0, 0, null);
        graphics.dispose();
        byte[] pixels = ((DataBufferByte) bgrImage.getRaster().getDataBuffer()).getData();
        Mat mat = new Mat(image.getHeight(), image.getWidth(), CvType.CV_8UC3);
        mat.put(0, 0, pixels);
        return mat;
    }
}
