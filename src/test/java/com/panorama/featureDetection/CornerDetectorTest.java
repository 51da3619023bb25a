package com.panorama.featureDetection;

import com.panorama.TestImages;
import org.bytedeco.opencv.opencv_core.Mat;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CornerDetectorTest {

    private final CornerDetector detector = new CornerDetector(
            new HarrisCornerResponse(),
            new AdaptiveNonMaximalSuppression(new LocalMaxima(new OpenCvMorphology())),
            50, 0.01);

    @Test
    void findsTheCornersOfABrightSquare() {
        Mat image = TestImages.constant(60, 60, 0.0);
        for (int y = 20; y < 40; y++) {
            for (int x = 20; x < 40; x++) TestImages.set(image, x, y, 1.0f);
        }

        List<Keypoint> keypoints = detector.detect(image);

        assertThat(keypoints).isNotEmpty().hasSizeLessThanOrEqualTo(50);
        for (int[] corner : new int[][]{{20, 20}, {39, 20}, {20, 39}, {39, 39}}) {
            assertThat(keypoints).anySatisfy(kp -> {
                assertThat(Math.abs(kp.x - corner[0])).isLessThanOrEqualTo(2);
                assertThat(Math.abs(kp.y - corner[1])).isLessThanOrEqualTo(2);
            });
        }
    }

    @Test
    void blankImageHasNoKeypoints() {
        assertThat(detector.detect(TestImages.constant(40, 40, 0.7))).isEmpty();
    }

    @Test
    void textureYieldsAtMostMaxKeypoints() {
        List<Keypoint> keypoints = detector.detect(TestImages.texture(150, 100, 2.0, 21L));

        assertThat(keypoints).hasSize(50);
        assertThat(keypoints).allSatisfy(kp -> {
            assertThat(kp.x).isBetween(0, 149);
            assertThat(kp.y).isBetween(0, 99);
        });
    }
}
