package com.panorama.featureDetection;

import lombok.extern.slf4j.Slf4j;
import org.bytedeco.javacpp.DoublePointer;
import org.bytedeco.opencv.opencv_core.Mat;

import java.util.ArrayList;
import java.util.List;

import static org.bytedeco.opencv.global.opencv_core.minMaxLoc;
import static org.bytedeco.opencv.global.opencv_imgproc.THRESH_TOZERO;
import static org.bytedeco.opencv.global.opencv_imgproc.threshold;

/**
 * Corner response, relative threshold and ANMS in one step.
 * <p>
 * Responses below {@code minResponseRatio * max} are set to zero before the maxima
 * search. The zeroed area is flat, so it contributes no candidates to the quadratic
 * suppression step.
 */
@Slf4j
public class CornerDetector {
    private final CornerResponse cornerResponse;
    private final AdaptiveNonMaximalSuppression suppression;
    private final int maxKeypoints;
    private final double minResponseRatio;

    public CornerDetector(CornerResponse cornerResponse, AdaptiveNonMaximalSuppression suppression,
                          int maxKeypoints, double minResponseRatio) {
        this.cornerResponse = cornerResponse;
        this.suppression = suppression;
        this.maxKeypoints = maxKeypoints;
        this.minResponseRatio = minResponseRatio;
    }

    public List<Keypoint> detect(Mat grayImage) {
        Mat scores = cornerResponse.compute(grayImage);

        DoublePointer minVal = new DoublePointer(1);
        DoublePointer maxVal = new DoublePointer(1);
        minMaxLoc(scores, minVal, maxVal, null, null, null);
        double max = maxVal.get();
        minVal.close();
        maxVal.close();

        if (max <= 0) {
            log.debug("No positive corner response in {}x{} image", grayImage.cols(), grayImage.rows());
            scores.release();
            return new ArrayList<>();
        }

        Mat filtered = new Mat();
        threshold(scores, filtered, minResponseRatio * max, 0, THRESH_TOZERO);

        List<Keypoint> keypoints = suppression.select(filtered, maxKeypoints);
        log.debug("Detected {} keypoints in {}x{} image", keypoints.size(), grayImage.cols(), grayImage.rows());

        scores.release();
        filtered.release();
        return keypoints;
    }
}
