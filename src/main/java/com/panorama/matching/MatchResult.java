package com.panorama.matching;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Outcome of matching two feature sets.
 * {@code confident} is set when the best descriptor distance over all pairs is below the
 * absolute threshold, i.e. at least one very strong match exists.
 */
@AllArgsConstructor
@Getter
public class MatchResult {
    private final boolean confident;
    private final List<Correspondence> correspondences;
    private final double minDistance;
}
