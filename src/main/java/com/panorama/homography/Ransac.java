package com.panorama.homography;

import com.panorama.exception.NoConsensusException;
import com.panorama.featureDetection.Keypoint;
import com.panorama.matching.Correspondence;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * RANSAC over the four point homography.
 * <p>
 * Each round fits {@link HomographyEstimator#MIN_POINTS} randomly sampled correspondences
 * and counts the correspondences whose projected source point lands within
 * {@code threshold} pixels of its destination. Only the best round so far is kept; a
 * round whose inlier fraction exceeds {@code consensus} ends the search early. The final
 * homography is a least-squares fit over every inlier of the best round.
 */
@Slf4j
@Getter
public class Ransac {
    public static final int DEFAULT_ROUNDS = 30;
    public static final double DEFAULT_THRESHOLD = 4.0;
    public static final double DEFAULT_CONSENSUS = 0.9;

    private final HomographyEstimator estimator;
    private final Random random;
    private final int numIterations;
    private final double threshold;
    private final double consensus;

    public Ransac(HomographyEstimator estimator, Random random) {
        this(estimator, random, DEFAULT_ROUNDS, DEFAULT_THRESHOLD, DEFAULT_CONSENSUS);
    }

    public Ransac(HomographyEstimator estimator, Random random, int numIterations, double threshold, double consensus) {
        this.estimator = estimator;
        this.random = random;
        this.numIterations = numIterations;
        this.threshold = threshold;
        this.consensus = consensus;
    }

    /**
     * @param matches correspondences between {@code pointsA} (source) and {@code pointsB} (destination)
     * @throws NoConsensusException when fewer than four correspondences exist or the best
     *                              round leaves fewer than four inliers to refit on
     */
    public RansacResult estimate(List<Correspondence> matches, List<Keypoint> pointsA, List<Keypoint> pointsB) {
        int n = matches.size();
        if (n < HomographyEstimator.MIN_POINTS) {
            throw new NoConsensusException("No reliable transform found: " + n
                    + " correspondences, at least " + HomographyEstimator.MIN_POINTS + " needed");
        }

        double[][] src = new double[n][];
        double[][] dst = new double[n][];
        for (int i = 0; i < n; i++) {
            Correspondence c = matches.get(i);
            Keypoint a = pointsA.get(c.indexA);
            Keypoint b = pointsB.get(c.indexB);
            src[i] = new double[]{a.x, a.y};
            dst[i] = new double[]{b.x, b.y};
        }

        int[] order = new int[n];
        for (int i = 0; i < n; i++) order[i] = i;

        List<Integer> bestInliers = new ArrayList<>();
        int rounds = 0;
        double thresholdSq = threshold * threshold;

        while (rounds < numIterations) {
            rounds++;
            int[] sample = sample(order, HomographyEstimator.MIN_POINTS);
            double[][] sampleSrc = new double[sample.length][];
            double[][] sampleDst = new double[sample.length][];
            for (int k = 0; k < sample.length; k++) {
                sampleSrc[k] = src[sample[k]];
                sampleDst[k] = dst[sample[k]];
            }
            HomographyMatrix H = estimator.estimate(sampleSrc, sampleDst);

            List<Integer> inliers = new ArrayList<>();
            if (H.isFinite()) {
                for (int i = 0; i < n; i++) {
                    double[] projected = H.project(src[i][0], src[i][1]);
                    if (projected == null) continue;

                    double distSq = Math.pow(projected[0] - dst[i][0], 2) + Math.pow(projected[1] - dst[i][1], 2);
                    if (distSq < thresholdSq) inliers.add(i);
                }
            }

            if (inliers.size() > bestInliers.size()) {
                bestInliers = inliers;
            }
            if ((double) inliers.size() / n > consensus) {
                log.debug("RANSAC reached consensus after {} rounds", rounds);
                break;
            }
        }

        log.debug("RANSAC finished: best inliers {}/{} after {} rounds", bestInliers.size(), n, rounds);
        if (bestInliers.size() < HomographyEstimator.MIN_POINTS) {
            throw new NoConsensusException("No reliable transform found: best round kept "
                    + bestInliers.size() + " of " + n + " correspondences within " + threshold + " px");
        }

        double[][] inlierSrc = new double[bestInliers.size()][];
        double[][] inlierDst = new double[bestInliers.size()][];
        List<Correspondence> inlierMatches = new ArrayList<>(bestInliers.size());
        for (int k = 0; k < bestInliers.size(); k++) {
            int i = bestInliers.get(k);
            inlierSrc[k] = src[i];
            inlierDst[k] = dst[i];
            inlierMatches.add(matches.get(i));
        }

        HomographyMatrix refined = estimator.estimate(inlierSrc, inlierDst).normalized();
        return new RansacResult(refined, inlierMatches, rounds);
    }

    /** First {@code k} entries of a partial Fisher-Yates shuffle of {@code order}. */
    private int[] sample(int[] order, int k) {
        int n = order.length;
        for (int i = 0; i < k; i++) {
            int j = i + random.nextInt(n - i);
            int tmp = order[i];
            order[i] = order[j];
            order[j] = tmp;
        }
        int[] picked = new int[k];
        System.arraycopy(order, 0, picked, 0, k);
        return picked;
    }
}
