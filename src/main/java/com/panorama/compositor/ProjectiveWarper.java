package com.panorama.compositor;

import com.panorama.homography.HomographyMatrix;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Size;

/**
 * Resamples an image under a 3x3 transform into a raster of the given size.
 * Canvas pixels without a source sample are zero.
 */
public interface ProjectiveWarper {

    Mat warp(Mat image, HomographyMatrix homography, Size outputSize);
}
