package com.panorama.featureDetection;

import org.bytedeco.opencv.opencv_core.Mat;

/**
 * Dense per-pixel cornerness. The returned score map is CV_32F and has the size of the image.
 */
public interface CornerResponse {

    Mat compute(Mat grayImage);
}
