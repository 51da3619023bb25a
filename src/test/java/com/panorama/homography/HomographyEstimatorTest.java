package com.panorama.homography;

import com.panorama.exception.DegenerateGeometryException;
import com.panorama.exception.DimensionMismatchException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class HomographyEstimatorTest {

    private static final HomographyMatrix PROJECTIVE = new HomographyMatrix(new double[][]{
            {1.05, 0.03, 12.0},
            {-0.02, 0.97, -7.5},
            {1e-4, -5e-5, 1.0}
    });

    private final HomographyEstimator estimator = new HomographyEstimator();

    @Test
    void fourCornersOfATranslation() {
        double[][] src = {{0, 0}, {99, 0}, {0, 99}, {99, 99}};
        double[][] dst = {{10, 5}, {109, 5}, {10, 104}, {109, 104}};

        HomographyMatrix h = estimator.estimate(src, dst).normalized();

        assertThat(h.get(0, 2)).isCloseTo(10.0, within(1e-6));
        assertThat(h.get(1, 2)).isCloseTo(5.0, within(1e-6));
        assertThat(h.get(0, 0)).isCloseTo(1.0, within(1e-9));
        assertThat(h.get(1, 1)).isCloseTo(1.0, within(1e-9));
        assertThat(h.get(2, 0)).isCloseTo(0.0, within(1e-9));
        assertThat(h.get(2, 1)).isCloseTo(0.0, within(1e-9));
    }

    @Test
    void exactFitThroughFourProjectivePoints() {
        double[][] src = {{3, 4}, {210, 17}, {25, 180}, {190, 160}};
        double[][] dst = project(PROJECTIVE, src);

        HomographyMatrix h = estimator.estimate(src, dst);

        for (double e : estimator.reprojectionErrors(h, src, dst)) {
            assertThat(e).isLessThan(1e-6);
        }
    }

    @Test
    void overdeterminedNoiselessFitRecoversTheMatrix() {
        double[][] src = new double[30][];
        for (int i = 0; i < src.length; i++) {
            src[i] = new double[]{(i * 37) % 300, (i * 53) % 200 + 0.5 * i};
        }
        double[][] dst = project(PROJECTIVE, src);

        HomographyMatrix h = estimator.estimate(src, dst).normalized();

        for (int r = 0; r < 3; r++) {
            for (int c = 0; c < 3; c++) {
                assertThat(h.get(r, c)).as("h%d%d", r, c).isCloseTo(PROJECTIVE.get(r, c), within(1e-6));
            }
        }
    }

    @Test
    void resultDoesNotDependOnPointOrder() {
        double[][] src = {{3, 4}, {210, 17}, {25, 180}, {190, 160}, {90, 90}, {140, 30}};
        double[][] dst = project(PROJECTIVE, src);
        double[][] srcReversed = new double[src.length][];
        double[][] dstReversed = new double[dst.length][];
        for (int i = 0; i < src.length; i++) {
            srcReversed[i] = src[src.length - 1 - i];
            dstReversed[i] = dst[dst.length - 1 - i];
        }

        HomographyMatrix forward = estimator.estimate(src, dst).normalized();
        HomographyMatrix reversed = estimator.estimate(srcReversed, dstReversed).normalized();

        for (int r = 0; r < 3; r++) {
            for (int c = 0; c < 3; c++) {
                assertThat(reversed.get(r, c)).isCloseTo(forward.get(r, c), within(1e-8));
            }
        }
    }

    @Test
    void mismatchedPointListsAreRejected() {
        double[][] src = {{0, 0}, {1, 0}, {0, 1}, {1, 1}};
        double[][] dst = {{0, 0}, {1, 0}, {0, 1}};

        assertThatThrownBy(() -> estimator.estimate(src, dst))
                .isInstanceOf(DimensionMismatchException.class);
    }

    @Test
    void fewerThanFourPairsAreRejected() {
        double[][] three = {{0, 0}, {1, 0}, {0, 1}};

        assertThatThrownBy(() -> estimator.estimate(three, three))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least 4");
    }

    @Test
    void repeatedSourcePointGivesDegenerateGeometry() {
        double[][] src = {{50, 50}, {50, 50}, {50, 50}, {50, 50}};
        double[][] dst = {{0, 0}, {100, 0}, {0, 100}, {100, 100}};

        HomographyMatrix h = estimator.estimate(src, dst);

        assertThatThrownBy(() -> estimator.checkGeometry(h, src, dst, 4.0))
                .isInstanceOf(DegenerateGeometryException.class);
    }

    @Test
    void goodFitPassesTheGeometryCheck() {
        double[][] src = {{3, 4}, {210, 17}, {25, 180}, {190, 160}, {90, 90}};
        double[][] dst = project(PROJECTIVE, src);

        HomographyMatrix h = estimator.estimate(src, dst);

        assertThatCode(() -> estimator.checkGeometry(h, src, dst, 1.0)).doesNotThrowAnyException();
    }

    @Test
    void reprojectionErrorIsInfiniteForPointsAtInfinity() {
        HomographyMatrix h = new HomographyMatrix(new double[][]{
                {1, 0, 0},
                {0, 1, 0},
                {1, 0, -10}
        });

        double[] errors = estimator.reprojectionErrors(h, new double[][]{{10, 3}}, new double[][]{{0, 0}});

        assertThat(errors[0]).isInfinite();
    }

    private static double[][] project(HomographyMatrix h, double[][] points) {
        double[][] out = new double[points.length][];
        for (int i = 0; i < points.length; i++) out[i] = h.project(points[i][0], points[i][1]);
        return out;
    }
}
