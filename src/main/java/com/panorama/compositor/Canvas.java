package com.panorama.compositor;

import com.panorama.homography.HomographyMatrix;
import lombok.Getter;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.bytedeco.opencv.opencv_core.Size;

import static org.bytedeco.opencv.global.opencv_core.max;

/**
 * Output raster of one stitching run and the translation that moves the base frame into it.
 * Images are merged with the per-pixel maximum, which is associative and commutative, so
 * the merge order does not change the result.
 */
@Getter
public class Canvas {
    private final int width;
    private final int height;
    private final HomographyMatrix translation;
    private final Mat raster;

    public Canvas(int width, int height, HomographyMatrix translation, int type) {
        this.width = width;
        this.height = height;
        this.translation = translation;
        this.raster = new Mat(height, width, type, new Scalar(0.0));
    }

    public Size size() {
        return new Size(width, height);
    }

    /** Brighter pixel wins. {@code warped} must already have the canvas size and type. */
    public void merge(Mat warped) {
        if (warped.cols() != width || warped.rows() != height || warped.type() != raster.type()) {
            throw new IllegalArgumentException(String.format(
                    "Warped image %dx%d (type %d) does not fit canvas %dx%d (type %d)",
                    warped.cols(), warped.rows(), warped.type(), width, height, raster.type()));
        }
        max(raster, warped, raster);
    }
}
