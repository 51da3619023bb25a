package com.panorama.pipeline;

import com.panorama.homography.HomographyMatrix;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.bytedeco.opencv.opencv_core.Mat;

import java.util.List;

/**
 * The stitched raster plus what it was built from.
 * {@code homographies.get(k)} maps input image {@code firstImage + k} into the last image.
 */
@AllArgsConstructor
@Getter
public class PanoramaResult {
    private final Mat panorama;
    private final int firstImage;
    private final List<HomographyMatrix> homographies;
    private final List<PairReport> pairs;
}
