package com.panorama.matching;

import com.panorama.descriptor.Feature;
import com.panorama.featureDetection.Keypoint;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DescriptorMatcherTest {

    private final DescriptorMatcher matcher = new DescriptorMatcher();

    @Test
    void matchingAgainstItselfGivesTheIdentity() {
        List<Feature> features = randomFeatures(40, 3L);

        MatchResult result = matcher.match(features, features);

        assertThat(result.isConfident()).isTrue();
        assertThat(result.getMinDistance()).isZero();
        assertThat(result.getCorrespondences()).hasSize(40);
        for (Correspondence c : result.getCorrespondences()) {
            assertThat(c.indexB).isEqualTo(c.indexA);
            assertThat(c.distance).isZero();
        }
    }

    @Test
    void ambiguousMatchIsRejected() {
        double[] a = alternating();
        double[] nudge = new double[64];
        nudge[0] = 0.5;
        Feature query = feature(0, a);
        Feature plus = feature(1, add(a, nudge, 1));
        Feature minus = feature(2, add(a, nudge, -1));

        MatchResult result = matcher.match(List.of(query), List.of(plus, minus));

        // both neighbours are 0.5 away: ratio 1
        assertThat(result.getCorrespondences()).isEmpty();
        assertThat(result.getMinDistance()).isEqualTo(0.5);
        assertThat(result.isConfident()).isTrue();
    }

    @Test
    void oneTargetMayBeClaimedByManyQueries() {
        double[] target = alternating();
        double[] n1 = new double[64];
        double[] n2 = new double[64];
        n1[3] = 0.1;
        n2[7] = -0.1;
        List<Feature> a = List.of(feature(0, add(target, n1, 1)), feature(1, add(target, n2, 1)));
        List<Feature> b = List.of(feature(0, target), feature(1, blocks()));

        MatchResult result = matcher.match(a, b);

        assertThat(result.getCorrespondences())
                .extracting(c -> c.indexA + "->" + c.indexB)
                .containsExactlyInAnyOrder("0->0", "1->0");
    }

    @Test
    void farMatchesAreNotConfident() {
        double[] v = alternating();
        Feature query = feature(0, v);
        Feature opposite = feature(0, add(new double[64], v, -1));
        Feature other = feature(1, blocks());

        MatchResult result = matcher.match(List.of(query), List.of(opposite, other));

        // |v - blocks| = sqrt(128) ~ 11.3, |v + v| = 16
        assertThat(result.isConfident()).isFalse();
        assertThat(result.getMinDistance()).isCloseTo(Math.sqrt(128), within(1e-9));
        assertThat(result.getCorrespondences()).containsExactly(new Correspondence(0, 1, 0));
    }

    @Test
    void singleTargetHasNoSecondNeighbour() {
        List<Feature> features = randomFeatures(5, 8L);

        MatchResult result = matcher.match(features, features.subList(0, 1));

        assertThat(result.getCorrespondences()).isEmpty();
        assertThat(result.isConfident()).isTrue();
    }

    @Test
    void emptyInputsGiveNothing() {
        MatchResult result = matcher.match(new ArrayList<>(), randomFeatures(3, 1L));

        assertThat(result.getCorrespondences()).isEmpty();
        assertThat(result.isConfident()).isFalse();
        assertThat(result.getMinDistance()).isInfinite();
    }

    private static List<Feature> randomFeatures(int count, long seed) {
        Random random = new Random(seed);
        List<Feature> features = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            double[] d = new double[64];
            for (int k = 0; k < 64; k++) d[k] = random.nextGaussian();
            features.add(feature(i, d));
        }
        return features;
    }

    private static Feature feature(int i, double[] descriptor) {
        return new Feature(new Keypoint(i, i), descriptor);
    }

    /** +1, -1, +1, ... */
    private static double[] alternating() {
        double[] v = new double[64];
        for (int k = 0; k < 64; k++) v[k] = k % 2 == 0 ? 1 : -1;
        return v;
    }

    /** +1, +1, -1, -1, ... */
    private static double[] blocks() {
        double[] v = new double[64];
        for (int k = 0; k < 64; k++) v[k] = (k / 2) % 2 == 0 ? 1 : -1;
        return v;
    }

    private static double[] add(double[] a, double[] b, double scale) {
        double[] out = new double[a.length];
        for (int k = 0; k < a.length; k++) out[k] = a[k] + scale * b[k];
        return out;
    }
}
