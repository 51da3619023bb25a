package com.panorama.matching;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/** Feature {@code indexA} of image A matched to feature {@code indexB} of image B. */
@AllArgsConstructor
@Getter
@EqualsAndHashCode
public class Correspondence {
    public final int indexA;
    public final int indexB;
    @EqualsAndHashCode.Exclude
    public final double distance;

    @Override
    public String toString() {
        return String.format("(%d -> %d, d=%.3f)", indexA, indexB, distance);
    }
}
