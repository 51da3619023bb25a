package com.panorama.featureDetection;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * A regional maximum together with its corner score and its suppression radius
 * (squared pixel distance, {@link Double#POSITIVE_INFINITY} when nothing suppresses it).
 */
@AllArgsConstructor
@Getter
public class RankedCandidate implements Comparable<RankedCandidate> {
    private final Keypoint keypoint;
    private final float score;
    private final double radius;

    @Override
    public int compareTo(RankedCandidate that) {
        return Double.compare(this.radius, that.radius);
    }

    @Override
    public String toString() {
        return String.format("%s score=%.6f radius=%.1f", keypoint, score, radius);
    }
}
