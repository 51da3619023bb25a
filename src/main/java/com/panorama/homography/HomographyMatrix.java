package com.panorama.homography;

import org.bytedeco.javacpp.indexer.DoubleIndexer;
import org.bytedeco.opencv.opencv_core.Mat;

import java.util.Arrays;

import static org.bytedeco.opencv.global.opencv_core.CV_64F;

/**
 * 3x3 projective transform acting on homogeneous column vectors {@code (x, y, 1)}.
 * Only defined up to scale; {@link #normalized()} fixes {@code h22 = 1} where possible.
 */
public class HomographyMatrix {
    private final double[][] data;

    public HomographyMatrix(double[][] data) {
        if (data.length != 3 || data[0].length != 3 || data[1].length != 3 || data[2].length != 3) {
            throw new IllegalArgumentException("Homography must be 3x3");
        }
        this.data = new double[3][];
        for (int r = 0; r < 3; r++) this.data[r] = data[r].clone();
    }

    public static HomographyMatrix identity() {
        return translation(0, 0);
    }

    public static HomographyMatrix translation(double tx, double ty) {
        return new HomographyMatrix(new double[][]{
                {1, 0, tx},
                {0, 1, ty},
                {0, 0, 1}
        });
    }

    /** Row-major vector of 9 values, e.g. a singular vector from the DLT. */
    public static HomographyMatrix fromVector(double[] h) {
        return new HomographyMatrix(new double[][]{
                {h[0], h[1], h[2]},
                {h[3], h[4], h[5]},
                {h[6], h[7], h[8]}
        });
    }

    public double[][] getData() {
        double[][] copy = new double[3][];
        for (int r = 0; r < 3; r++) copy[r] = data[r].clone();
        return copy;
    }

    public double get(int row, int col) {
        return data[row][col];
    }

    /**
     * @return projected {@code (x', y')}, or {@code null} when the point maps to infinity
     */
    public double[] project(double x, double y) {
        double z_prime = data[2][0] * x + data[2][1] * y + data[2][2];
        if (Math.abs(z_prime) < 1e-10) return null;

        double x_prime = (data[0][0] * x + data[0][1] * y + data[0][2]) / z_prime;
        double y_prime = (data[1][0] * x + data[1][1] * y + data[1][2]) / z_prime;

        return new double[]{x_prime, y_prime};
    }

    /** {@code this * that}: apply {@code that} first, then {@code this}. */
    public HomographyMatrix multiply(HomographyMatrix that) {
        double[][] out = new double[3][3];
        for (int r = 0; r < 3; r++) {
            for (int c = 0; c < 3; c++) {
                double sum = 0.0;
                for (int k = 0; k < 3; k++) sum += this.data[r][k] * that.data[k][c];
                out[r][c] = sum;
            }
        }
        return new HomographyMatrix(out);
    }

    public double determinant() {
        double[][] m = data;
        return m[0][0] * (m[1][1] * m[2][2] - m[1][2] * m[2][1])
                - m[0][1] * (m[1][0] * m[2][2] - m[1][2] * m[2][0])
                + m[0][2] * (m[1][0] * m[2][1] - m[1][1] * m[2][0]);
    }

    /**
     * Scaled so that {@code h22 == 1}. Returned unchanged when {@code h22} is (almost) zero.
     */
    public HomographyMatrix normalized() {
        double s = data[2][2];
        if (Math.abs(s) < 1e-12) return this;
        double[][] out = new double[3][3];
        for (int r = 0; r < 3; r++) {
            for (int c = 0; c < 3; c++) out[r][c] = data[r][c] / s;
        }
        return new HomographyMatrix(out);
    }

    public boolean isFinite() {
        for (double[] row : data) {
            for (double v : row) {
                if (!Double.isFinite(v)) return false;
            }
        }
        return true;
    }

    /** CV_64F copy for OpenCV calls such as {@code warpPerspective}. */
    public Mat toMat() {
        Mat mat = new Mat(3, 3, CV_64F);
        try (DoubleIndexer idx = mat.createIndexer()) {
            for (int r = 0; r < 3; r++) {
                for (int c = 0; c < 3; c++) idx.put(r, c, data[r][c]);
            }
        }
        return mat;
    }

    @Override
    public String toString() {
        return Arrays.deepToString(data);
    }
}
