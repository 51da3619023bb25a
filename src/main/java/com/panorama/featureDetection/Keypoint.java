package com.panorama.featureDetection;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Integer pixel location of a detected corner. Column first, row second.
 */
@AllArgsConstructor
@Getter
@EqualsAndHashCode
public class Keypoint {
    public final int x, y;

    public double squaredDistance(Keypoint that) {
        double dx = this.x - that.x;
        double dy = this.y - that.y;
        return dx * dx + dy * dy;
    }

    @Override
    public String toString() {
        return String.format("Keypoint(%d, %d)", x, y);
    }
}
