package com.panorama.featureDetection;

import org.bytedeco.opencv.opencv_core.Mat;

import static org.bytedeco.opencv.global.opencv_core.*;

/**
 * Regional maxima of a score map computed with one dilation and one erosion.
 * <p>
 * A pixel is a maximum when it equals the dilated map (nothing in the window is larger)
 * and is strictly above the eroded map (the window is not constant). A pixel whose whole
 * window is flat is never reported, so a constant map has no maxima at all.
 */
public class LocalMaxima {
    private final Morphology morphology;

    public LocalMaxima(Morphology morphology) {
        this.morphology = morphology;
    }

    /**
     * @param scores single channel score map, left untouched
     * @return CV_8U mask of the same size, 1 at maxima and 0 elsewhere
     */
    public Mat regionalMaxima(Mat scores) {
        Mat dilated = morphology.dilate(scores);
        Mat eroded = morphology.erode(scores);

        Mat isPeak = new Mat();
        Mat notFlat = new Mat();
        compare(scores, dilated, isPeak, CMP_GE);
        compare(scores, eroded, notFlat, CMP_GT);

        Mat both = new Mat();
        bitwise_and(isPeak, notFlat, both);

        // compare() writes 255 for true
        Mat mask = new Mat();
        both.convertTo(mask, CV_8U, 1.0 / 255.0, 0.0);

        dilated.release();
        eroded.release();
        isPeak.release();
        notFlat.release();
        both.release();
        return mask;
    }
}
