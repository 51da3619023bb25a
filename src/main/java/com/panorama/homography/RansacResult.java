package com.panorama.homography;

import com.panorama.matching.Correspondence;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Homography refitted on the winning consensus set, that set, and how many sampling
 * rounds were spent before it was accepted.
 */
@AllArgsConstructor
@Getter
public class RansacResult {
    private final HomographyMatrix homography;
    private final List<Correspondence> inliers;
    private final int rounds;
}
