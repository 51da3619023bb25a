package com.panorama.featureDetection;

import edu.princeton.cs.algorithms.MinPQ;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.javacpp.indexer.FloatIndexer;
import org.bytedeco.javacpp.indexer.UByteIndexer;
import org.bytedeco.opencv.opencv_core.Mat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import static org.bytedeco.opencv.global.opencv_core.CV_32F;

/**
 * Adaptive non-maximal suppression (Brown, Szeliski and Winder).
 * <p>
 * Every regional maximum gets a suppression radius: the squared distance to the nearest
 * maximum that is stronger by the robustness margin. Keeping the largest radii yields
 * strong corners that are spread over the whole image instead of clustered in textured areas.
 * The radius computation is quadratic in the number of maxima, so callers should threshold
 * weak responses away before calling.
 */
@Slf4j
public class AdaptiveNonMaximalSuppression {
    public static final double DEFAULT_ROBUSTNESS = 0.9;

    private final LocalMaxima localMaxima;
    private final double robustness;

    public AdaptiveNonMaximalSuppression(LocalMaxima localMaxima) {
        this(localMaxima, DEFAULT_ROBUSTNESS);
    }

    public AdaptiveNonMaximalSuppression(LocalMaxima localMaxima, double robustness) {
        if (robustness <= 0 || robustness > 1) {
            throw new IllegalArgumentException("Robustness must be in (0, 1]: " + robustness);
        }
        this.localMaxima = localMaxima;
        this.robustness = robustness;
    }

    /**
     * The {@code maxCount} candidates with the largest suppression radius, largest first.
     */
    public List<Keypoint> select(Mat scores, int maxCount) {
        if (maxCount <= 0) return new ArrayList<>();

        MinPQ<RankedCandidate> best = new MinPQ<>();
        for (RankedCandidate candidate : computeRadii(scores)) {
            best.insert(candidate);
            if (best.size() > maxCount) best.delMin();
        }

        List<Keypoint> selected = new ArrayList<>(best.size());
        while (!best.isEmpty()) {
            selected.add(best.delMin().getKeypoint());
        }
        Collections.reverse(selected);

        log.debug("ANMS kept {} keypoints (requested {})", selected.size(), maxCount);
        return selected;
    }

    /**
     * Every candidate with its radius, sorted by radius descending.
     */
    public List<RankedCandidate> rank(Mat scores) {
        List<RankedCandidate> ranked = computeRadii(scores);
        ranked.sort(Comparator.comparingDouble(RankedCandidate::getRadius).reversed());
        return ranked;
    }

    private List<RankedCandidate> computeRadii(Mat scores) {
        Mat floatScores = scores;
        if (scores.type() != CV_32F) {
            floatScores = new Mat();
            scores.convertTo(floatScores, CV_32F);
        }

        Mat mask = localMaxima.regionalMaxima(floatScores);
        List<Keypoint> points = new ArrayList<>();
        List<Float> values = new ArrayList<>();

        try (UByteIndexer maskIdx = mask.createIndexer();
             FloatIndexer scoreIdx = floatScores.createIndexer()) {
            int rows = floatScores.rows();
            int cols = floatScores.cols();
            for (int y = 0; y < rows; y++) {
                for (int x = 0; x < cols; x++) {
                    if (maskIdx.get(y, x) != 0) {
                        points.add(new Keypoint(x, y));
                        values.add(scoreIdx.get(y, x));
                    }
                }
            }
        }
        mask.release();
        if (floatScores != scores) floatScores.release();

        int n = points.size();
        float[] s = new float[n];
        for (int i = 0; i < n; i++) s[i] = values.get(i);

        List<RankedCandidate> candidates = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            double threshold = s[i] / robustness;
            double radius = Double.POSITIVE_INFINITY;
            Keypoint p = points.get(i);
            for (int j = 0; j < n; j++) {
                if (j == i || s[j] <= threshold) continue;
                radius = Math.min(radius, p.squaredDistance(points.get(j)));
            }
            candidates.add(new RankedCandidate(p, s[i], radius));
        }

        log.debug("ANMS ranked {} regional maxima", n);
        return candidates;
    }
}
