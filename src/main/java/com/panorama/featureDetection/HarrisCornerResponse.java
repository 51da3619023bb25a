package com.panorama.featureDetection;

import lombok.Getter;
import org.bytedeco.opencv.opencv_core.Mat;

import static org.bytedeco.opencv.global.opencv_core.CV_32F;
import static org.bytedeco.opencv.global.opencv_imgproc.cornerHarris;

/**
 * Harris corner measure {@code det(M) - k * trace(M)^2} computed by OpenCV.
 */
@Getter
public class HarrisCornerResponse implements CornerResponse {
    private final int blockSize;
    private final int kernelSize;
    private final double k;

    public HarrisCornerResponse() {
        this(2, 3, 0.04);
    }

    public HarrisCornerResponse(int blockSize, int kernelSize, double k) {
        this.blockSize = blockSize;
        this.kernelSize = kernelSize;
        this.k = k;
    }

    @Override
    public Mat compute(Mat grayImage) {
        if (grayImage.channels() != 1) {
            throw new IllegalArgumentException("Harris response needs a single channel image, got "
                    + grayImage.channels() + " channels");
        }
        Mat src = grayImage;
        if (grayImage.type() != CV_32F) {
            src = new Mat();
            grayImage.convertTo(src, CV_32F);
        }

        Mat response = new Mat();
        cornerHarris(src, response, blockSize, kernelSize, k);

        if (src != grayImage) src.release();
        return response;
    }
}
