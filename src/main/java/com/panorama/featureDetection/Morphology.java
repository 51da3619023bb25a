package com.panorama.featureDetection;

import org.bytedeco.opencv.opencv_core.Mat;

/**
 * Grayscale morphology over a fixed neighbourhood. Results have the size and type of the input.
 */
public interface Morphology {

    Mat dilate(Mat src);

    Mat erode(Mat src);
}
