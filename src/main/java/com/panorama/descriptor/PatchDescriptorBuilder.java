package com.panorama.descriptor;

import com.panorama.featureDetection.Keypoint;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.javacpp.indexer.FloatIndexer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Rect;
import org.bytedeco.opencv.opencv_core.Size;

import java.util.ArrayList;
import java.util.List;

import static org.bytedeco.opencv.global.opencv_core.*;
import static org.bytedeco.opencv.global.opencv_imgproc.*;

/**
 * MOPS style descriptor: a 40x40 window around the keypoint, blurred and area-sampled down
 * to 8x8, then normalised to zero mean and unit standard deviation.
 */
@Slf4j
public class PatchDescriptorBuilder {
    public static final int WINDOW = 40;
    public static final int HALF_WINDOW = WINDOW / 2;
    public static final int SAMPLES = 8;
    private static final int BLUR_SIZE = 5;
    private static final double BLUR_SIGMA = 1.0;
    private static final double FLAT_TOLERANCE = 1e-6;

    public List<Feature> describe(Mat image, List<Keypoint> keypoints) {
        Mat gray = image;
        if (image.type() != CV_32F) {
            gray = new Mat();
            image.convertTo(gray, CV_32F);
        }

        List<Feature> features = new ArrayList<>(keypoints.size());
        int flat = 0;
        for (Keypoint kp : keypoints) {
            double[] descriptor = describe(gray, kp);
            if (isZero(descriptor)) flat++;
            features.add(new Feature(kp, descriptor));
        }

        if (gray != image) gray.release();
        if (flat > 0) log.debug("{} of {} patches were flat, using zero descriptors", flat, keypoints.size());
        return features;
    }

    private double[] describe(Mat gray, Keypoint kp) {
        int w = gray.cols();
        int h = gray.rows();
        if (kp.x < 0 || kp.y < 0 || kp.x >= w || kp.y >= h) {
            throw new IllegalArgumentException(kp + " lies outside the " + w + "x" + h + " image");
        }

        // Window covers [x-20, x+20) x [y-20, y+20); clamp, then replicate the edge into the rest.
        int left = kp.x - HALF_WINDOW;
        int top = kp.y - HALF_WINDOW;
        int x0 = Math.max(0, left);
        int y0 = Math.max(0, top);
        int x1 = Math.min(w, left + WINDOW);
        int y1 = Math.min(h, top + WINDOW);

        Mat roi = new Mat(gray, new Rect(x0, y0, x1 - x0, y1 - y0));
        Mat patch = new Mat();
        copyMakeBorder(roi, patch, y0 - top, top + WINDOW - y1, x0 - left, left + WINDOW - x1, BORDER_REPLICATE);

        Mat blurred = new Mat();
        GaussianBlur(patch, blurred, new Size(BLUR_SIZE, BLUR_SIZE), BLUR_SIGMA, BLUR_SIGMA, BORDER_DEFAULT);

        Mat small = new Mat();
        resize(blurred, small, new Size(SAMPLES, SAMPLES), 0, 0, INTER_AREA);

        double[] values = new double[SAMPLES * SAMPLES];
        try (FloatIndexer idx = small.createIndexer()) {
            for (int r = 0; r < SAMPLES; r++) {
                for (int c = 0; c < SAMPLES; c++) {
                    values[r * SAMPLES + c] = idx.get(r, c);
                }
            }
        }

        roi.release();
        patch.release();
        blurred.release();
        small.release();
        return normalize(values);
    }

    /**
     * Zero mean, unit population standard deviation. A constant vector becomes all zeros;
     * the flatness test is relative to the mean because blurring a constant float patch
     * leaves rounding noise.
     */
    static double[] normalize(double[] values) {
        double mean = 0.0;
        for (double v : values) mean += v;
        mean /= values.length;

        double variance = 0.0;
        for (double v : values) variance += (v - mean) * (v - mean);
        double std = Math.sqrt(variance / values.length);

        double[] out = new double[values.length];
        if (std <= FLAT_TOLERANCE * Math.max(1.0, Math.abs(mean))) return out;
        for (int i = 0; i < values.length; i++) {
            out[i] = (values[i] - mean) / std;
        }
        return out;
    }

    private static boolean isZero(double[] descriptor) {
        for (double v : descriptor) {
            if (v != 0.0) return false;
        }
        return true;
    }
}
