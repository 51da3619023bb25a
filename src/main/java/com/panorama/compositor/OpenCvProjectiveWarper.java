package com.panorama.compositor;

import com.panorama.homography.HomographyMatrix;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.bytedeco.opencv.opencv_core.Size;

import static org.bytedeco.opencv.global.opencv_core.BORDER_CONSTANT;
import static org.bytedeco.opencv.global.opencv_imgproc.INTER_LINEAR;
import static org.bytedeco.opencv.global.opencv_imgproc.warpPerspective;

public class OpenCvProjectiveWarper implements ProjectiveWarper {

    @Override
    public Mat warp(Mat image, HomographyMatrix homography, Size outputSize) {
        Mat H = homography.toMat();
        Mat warped = new Mat();
        warpPerspective(image, warped, H, outputSize, INTER_LINEAR, BORDER_CONSTANT, new Scalar(0, 0, 0, 0));
        H.release();
        return warped;
    }
}
