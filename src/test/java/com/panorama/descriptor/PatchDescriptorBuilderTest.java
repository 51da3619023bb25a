package com.panorama.descriptor;

import com.panorama.TestImages;
import com.panorama.featureDetection.Keypoint;
import org.bytedeco.opencv.opencv_core.Mat;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PatchDescriptorBuilderTest {

    private final PatchDescriptorBuilder builder = new PatchDescriptorBuilder();

    @Test
    void descriptorsAreNormalisedEvenAtTheBorder() {
        Mat image = TestImages.texture(100, 80, 2.0, 1L);
        List<Keypoint> points = List.of(
                new Keypoint(0, 0), new Keypoint(99, 79), new Keypoint(50, 40),
                new Keypoint(5, 70), new Keypoint(97, 2));

        List<Feature> features = builder.describe(image, points);

        assertThat(features).hasSize(points.size());
        for (int i = 0; i < features.size(); i++) {
            Feature f = features.get(i);
            assertThat(f.getKeypoint()).isEqualTo(points.get(i));
            assertThat(f.getDescriptor()).hasSize(64);
            assertThat(mean(f.getDescriptor())).isCloseTo(0.0, within(1e-9));
            assertThat(std(f.getDescriptor())).isCloseTo(1.0, within(1e-9));
        }
    }

    @Test
    void flatPatchGivesZeroVector() {
        Mat image = TestImages.constant(60, 60, 0.4);

        List<Feature> features = builder.describe(image, List.of(new Keypoint(30, 30), new Keypoint(0, 59)));

        for (Feature f : features) {
            assertThat(f.getDescriptor()).containsOnly(0.0);
        }
    }

    @Test
    void identicalNeighbourhoodsGiveIdenticalDescriptors() {
        Mat scene = TestImages.texture(160, 90, 2.0, 4L);
        Mat left = TestImages.crop(scene, 0, 110);
        Mat right = TestImages.crop(scene, 40, 110);

        Feature a = builder.describe(left, List.of(new Keypoint(80, 45))).get(0);
        Feature b = builder.describe(right, List.of(new Keypoint(40, 45))).get(0);

        assertThat(a.distanceTo(b)).isLessThan(1e-6);
    }

    @Test
    void differentNeighbourhoodsGiveDifferentDescriptors() {
        Mat scene = TestImages.texture(160, 90, 2.0, 4L);

        List<Feature> features = builder.describe(scene, List.of(new Keypoint(30, 30), new Keypoint(120, 60)));

        assertThat(features.get(0).distanceTo(features.get(1))).isGreaterThan(1.0);
    }

    @Test
    void keypointOutsideTheImageIsRejected() {
        Mat image = TestImages.constant(20, 20, 0.1);

        assertThatThrownBy(() -> builder.describe(image, List.of(new Keypoint(20, 3))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void normalizeMapsConstantInputToZero() {
        double[] constant = new double[64];
        Arrays.fill(constant, 0.25);

        assertThat(PatchDescriptorBuilder.normalize(constant)).containsOnly(0.0);
    }

    private static double mean(double[] v) {
        double s = 0;
        for (double x : v) s += x;
        return s / v.length;
    }

    private static double std(double[] v) {
        double m = mean(v), s = 0;
        for (double x : v) s += (x - m) * (x - m);
        return Math.sqrt(s / v.length);
    }
}
