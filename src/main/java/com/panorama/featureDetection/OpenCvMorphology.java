package com.panorama.featureDetection;

import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Size;

import static org.bytedeco.opencv.global.opencv_imgproc.*;

/**
 * {@link Morphology} backed by OpenCV with a square structuring element.
 * Pixels outside the image are ignored by both operations.
 */
public class OpenCvMorphology implements Morphology {
    private final Mat kernel;

    public OpenCvMorphology() {
        this(3);
    }

    public OpenCvMorphology(int windowSize) {
        if (windowSize < 1 || windowSize % 2 == 0) {
            throw new IllegalArgumentException("Window size must be odd and positive: " + windowSize);
        }
        this.kernel = getStructuringElement(MORPH_RECT, new Size(windowSize, windowSize));
    }

    @Override
    public Mat dilate(Mat src) {
        Mat dst = new Mat();
        org.bytedeco.opencv.global.opencv_imgproc.dilate(src, dst, kernel);
        return dst;
    }

    @Override
    public Mat erode(Mat src) {
        Mat dst = new Mat();
        org.bytedeco.opencv.global.opencv_imgproc.erode(src, dst, kernel);
        return dst;
    }
}
