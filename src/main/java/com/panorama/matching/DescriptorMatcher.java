package com.panorama.matching;

import com.panorama.descriptor.Feature;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Brute force nearest neighbour matching with Lowe's ratio test.
 * <p>
 * There is no B to A cross check: two features of A may both pick the same feature of B.
 * RANSAC downstream tolerates such conflicting pairs.
 */
@Slf4j
@Getter
public class DescriptorMatcher {
    public static final double DEFAULT_RATIO = 0.8;
    public static final double DEFAULT_CONFIDENT_DISTANCE = 4.0;

    private final double ratio;
    private final double confidentDistance;

    public DescriptorMatcher() {
        this(DEFAULT_RATIO, DEFAULT_CONFIDENT_DISTANCE);
    }

    public DescriptorMatcher(double ratio, double confidentDistance) {
        this.ratio = ratio;
        this.confidentDistance = confidentDistance;
    }

    public MatchResult match(List<Feature> featuresA, List<Feature> featuresB) {
        List<Correspondence> correspondences = new ArrayList<>();
        double globalBest = Double.POSITIVE_INFINITY;

        for (int i = 0; i < featuresA.size(); i++) {
            Feature a = featuresA.get(i);

            double bestDist = Double.POSITIVE_INFINITY;
            double secondBest = Double.POSITIVE_INFINITY;
            int bestIndex = -1;

            for (int j = 0; j < featuresB.size(); j++) {
                double dist = a.distanceTo(featuresB.get(j));
                if (dist < bestDist) {
                    secondBest = bestDist;
                    bestDist = dist;
                    bestIndex = j;
                } else if (dist < secondBest) {
                    secondBest = dist;
                }
            }

            if (bestIndex < 0) continue;
            globalBest = Math.min(globalBest, bestDist);

            // ratio test as a product: 0/0 fails, and no second neighbour means no match
            if (Double.isFinite(secondBest) && bestDist < ratio * secondBest) {
                correspondences.add(new Correspondence(i, bestIndex, bestDist));
            }
        }

        boolean confident = globalBest < confidentDistance;
        log.debug("Matched {} of {} features against {} (best distance {}, confident={})",
                correspondences.size(), featuresA.size(), featuresB.size(), globalBest, confident);
        return new MatchResult(confident, correspondences, globalBest);
    }
}
