package com.panorama.pipeline;

import com.panorama.homography.HomographyMatrix;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * What happened when image {@code indexA} was aligned to image {@code indexA + 1}.
 * {@code homography} and {@code inliers} are only meaningful when {@link #isAligned()}.
 */
@AllArgsConstructor
@Getter
public class PairReport {
    private final int indexA;
    private final int indexB;
    private final int correspondences;
    private final int inliers;
    private final int rounds;
    private final HomographyMatrix homography;
    private final String failure;

    static PairReport aligned(int indexA, int correspondences, int inliers, int rounds, HomographyMatrix h) {
        return new PairReport(indexA, indexA + 1, correspondences, inliers, rounds, h, null);
    }

    static PairReport failed(int indexA, String failure) {
        return new PairReport(indexA, indexA + 1, 0, 0, 0, null, failure);
    }

    public boolean isAligned() {
        return failure == null;
    }

    @Override
    public String toString() {
        if (!isAligned()) return String.format("pair %d-%d FAILED: %s", indexA, indexB, failure);
        return String.format("pair %d-%d: %d matches, %d inliers, %d rounds", indexA, indexB,
                correspondences, inliers, rounds);
    }
}
