package com.panorama.homography;

import com.panorama.exception.DegenerateGeometryException;
import com.panorama.exception.DimensionMismatchException;
import org.bytedeco.javacpp.indexer.DoubleIndexer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.SVD;

import static org.bytedeco.opencv.global.opencv_core.CV_64F;
import static org.bytedeco.opencv.global.opencv_core.SVDecomp;

/**
 * Direct linear transform: the homography is the right singular vector of the 2N x 9
 * constraint matrix that belongs to its smallest singular value. Exact for four points in
 * general position, an algebraic least-squares fit for more.
 * <p>
 * Degenerate input (repeated or collinear points) is not special-cased here; use
 * {@link #checkGeometry} on the result.
 */
public class HomographyEstimator {
    public static final int MIN_POINTS = 4;
    private static final double SINGULAR_DETERMINANT = 1e-10;

    /**
     * @param src points {@code {x, y}} in the source image
     * @param dst matching points in the destination image, same order
     */
    public HomographyMatrix estimate(double[][] src, double[][] dst) {
        if (src.length != dst.length) {
            throw new DimensionMismatchException("Destination points", src.length, dst.length);
        }
        int n = src.length;
        if (n < MIN_POINTS) {
            throw new IllegalArgumentException("Need at least " + MIN_POINTS + " point pairs, got " + n);
        }

        Mat A = new Mat(2 * n, 9, CV_64F);
        try (DoubleIndexer a = A.createIndexer()) {
            for (int i = 0; i < n; i++) {
                double x = src[i][0], y = src[i][1];
                double u = dst[i][0], v = dst[i][1];
                int r = 2 * i;

                a.put(r, 0, -x);  a.put(r, 1, -y);  a.put(r, 2, -1);
                a.put(r, 3, 0);   a.put(r, 4, 0);   a.put(r, 5, 0);
                a.put(r, 6, u * x); a.put(r, 7, u * y); a.put(r, 8, u);

                a.put(r + 1, 0, 0);   a.put(r + 1, 1, 0);   a.put(r + 1, 2, 0);
                a.put(r + 1, 3, -x);  a.put(r + 1, 4, -y);  a.put(r + 1, 5, -1);
                a.put(r + 1, 6, v * x); a.put(r + 1, 7, v * y); a.put(r + 1, 8, v);
            }
        }

        // with fewer rows than columns the null vector is only in the full V
        Mat w = new Mat(), u = new Mat(), vt = new Mat();
        SVDecomp(A, w, u, vt, 2 * n < 9 ? SVD.FULL_UV : 0);

        double[] h = new double[9];
        try (DoubleIndexer v = vt.createIndexer()) {
            int last = (int) v.size(0) - 1;
            for (int k = 0; k < 9; k++) h[k] = v.get(last, k);
        }

        A.release(); w.release(); u.release(); vt.release();
        return HomographyMatrix.fromVector(h);
    }

    /**
     * Euclidean distance between {@code h(src[i])} and {@code dst[i]} for every pair;
     * infinite where the point maps to infinity.
     */
    public double[] reprojectionErrors(HomographyMatrix h, double[][] src, double[][] dst) {
        if (src.length != dst.length) {
            throw new DimensionMismatchException("Destination points", src.length, dst.length);
        }
        double[] errors = new double[src.length];
        for (int i = 0; i < src.length; i++) {
            double[] p = h.project(src[i][0], src[i][1]);
            errors[i] = p == null ? Double.POSITIVE_INFINITY
                    : Math.hypot(p[0] - dst[i][0], p[1] - dst[i][1]);
        }
        return errors;
    }

    /**
     * Rejects a fitted homography that is not finite, is singular, or whose mean
     * reprojection error over the pairs it was fitted on exceeds {@code maxMeanError}.
     *
     * @throws DegenerateGeometryException when any of the checks fails
     */
    public void checkGeometry(HomographyMatrix h, double[][] src, double[][] dst, double maxMeanError) {
        if (!h.isFinite()) {
            throw new DegenerateGeometryException("Homography has non-finite entries: " + h);
        }
        double det = h.normalized().determinant();
        if (!Double.isFinite(det) || Math.abs(det) < SINGULAR_DETERMINANT) {
            throw new DegenerateGeometryException("Homography is singular (det=" + det + ")");
        }
        double[] errors = reprojectionErrors(h, src, dst);
        double mean = 0.0;
        for (double e : errors) mean += e;
        mean /= Math.max(1, errors.length);
        if (!(mean <= maxMeanError)) {
            throw new DegenerateGeometryException(String.format(
                    "Mean reprojection error %.2f px exceeds %.2f px over %d pairs", mean, maxMeanError, errors.length));
        }
    }
}
