package com.panorama.pipeline;

import com.panorama.compositor.CanvasCompositor;
import com.panorama.descriptor.Feature;
import com.panorama.descriptor.PatchDescriptorBuilder;
import com.panorama.exception.NoConsensusException;
import com.panorama.exception.StitchingException;
import com.panorama.featureDetection.CornerDetector;
import com.panorama.featureDetection.Keypoint;
import com.panorama.homography.HomographyEstimator;
import com.panorama.homography.HomographyMatrix;
import com.panorama.homography.Ransac;
import com.panorama.homography.RansacResult;
import com.panorama.matching.MatchResult;
import com.panorama.matching.DescriptorMatcher;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.opencv.opencv_core.Mat;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

/**
 * Stitches an ordered image sequence into the frame of its last image.
 * <p>
 * Features are extracted per image (optionally in parallel), consecutive images are
 * aligned pairwise, and the pairwise transforms are chained:
 * {@code H(n-1) = I, H(i) = H(i+1) * H(i -> i+1)}.
 * A pair that cannot be aligned aborts the run, unless {@code skipUnalignedPairs} is set:
 * then every image before the last broken link is dropped.
 */
@Slf4j
public class PanoramaStitcher {
    private final CornerDetector detector;
    private final PatchDescriptorBuilder descriptorBuilder;
    private final DescriptorMatcher matcher;
    private final Ransac ransac;
    private final HomographyEstimator estimator;
    private final CanvasCompositor compositor;
    private final boolean requireConfidentMatch;
    private final boolean skipUnalignedPairs;
    private final int featureThreads;

    public PanoramaStitcher(CornerDetector detector, PatchDescriptorBuilder descriptorBuilder,
                            DescriptorMatcher matcher, Ransac ransac, HomographyEstimator estimator,
                            CanvasCompositor compositor, boolean requireConfidentMatch,
                            boolean skipUnalignedPairs, int featureThreads) {
        this.detector = detector;
        this.descriptorBuilder = descriptorBuilder;
        this.matcher = matcher;
        this.ransac = ransac;
        this.estimator = estimator;
        this.compositor = compositor;
        this.requireConfidentMatch = requireConfidentMatch;
        this.skipUnalignedPairs = skipUnalignedPairs;
        this.featureThreads = Math.max(1, featureThreads);
    }

    public PanoramaResult stitch(List<Mat> images) {
        return stitch(images, skipUnalignedPairs);
    }

    public PanoramaResult stitch(List<Mat> images, boolean skipUnaligned) {
        if (images == null || images.isEmpty()) {
            throw new IllegalArgumentException("No images to stitch");
        }
        int n = images.size();
        log.info("Stitching {} images", n);

        List<List<Feature>> features = extractFeatures(images);

        HomographyMatrix[] relative = new HomographyMatrix[n - 1];
        List<PairReport> reports = new ArrayList<>();
        int firstImage = 0;
        for (int i = 0; i < n - 1; i++) {
            try {
                PairReport report = alignPair(i, features.get(i), features.get(i + 1));
                relative[i] = report.getHomography();
                reports.add(report);
                log.info("{}", report);
            } catch (StitchingException e) {
                if (!skipUnaligned) throw e;
                log.warn("Skipping image pair {}-{}: {}", i, i + 1, e.getMessage());
                reports.add(PairReport.failed(i, e.getMessage()));
                firstImage = i + 1;
            }
        }
        if (firstImage > 0) {
            log.info("Dropping images 0..{} that are not connected to the base frame", firstImage - 1);
        }

        HomographyMatrix[] global = new HomographyMatrix[n];
        global[n - 1] = HomographyMatrix.identity();
        for (int i = n - 2; i >= firstImage; i--) {
            global[i] = global[i + 1].multiply(relative[i]).normalized();
        }

        List<Mat> used = images.subList(firstImage, n);
        List<HomographyMatrix> chain = Arrays.asList(global).subList(firstImage, n - 1);
        Mat panorama = compositor.composite(used, chain);
        log.info("Panorama {}x{} from {} images", panorama.cols(), panorama.rows(), used.size());

        return new PanoramaResult(panorama, firstImage, new ArrayList<>(chain), reports);
    }

    private PairReport alignPair(int index, List<Feature> a, List<Feature> b) {
        MatchResult match = matcher.match(a, b);
        if (requireConfidentMatch && !match.isConfident()) {
            throw new NoConsensusException(String.format(
                    "No confident descriptor match (best distance %.3f, needs < %.3f)",
                    match.getMinDistance(), matcher.getConfidentDistance()));
        }

        List<Keypoint> pointsA = keypoints(a);
        List<Keypoint> pointsB = keypoints(b);
        RansacResult result = ransac.estimate(match.getCorrespondences(), pointsA, pointsB);

        double[][] src = new double[result.getInliers().size()][];
        double[][] dst = new double[result.getInliers().size()][];
        for (int k = 0; k < src.length; k++) {
            Keypoint pa = pointsA.get(result.getInliers().get(k).indexA);
            Keypoint pb = pointsB.get(result.getInliers().get(k).indexB);
            src[k] = new double[]{pa.x, pa.y};
            dst[k] = new double[]{pb.x, pb.y};
        }
        estimator.checkGeometry(result.getHomography(), src, dst, ransac.getThreshold());

        return PairReport.aligned(index, match.getCorrespondences().size(), result.getInliers().size(),
                result.getRounds(), result.getHomography());
    }

    private List<List<Feature>> extractFeatures(List<Mat> images) {
        if (featureThreads == 1 || images.size() == 1) {
            List<List<Feature>> all = new ArrayList<>();
            for (Mat image : images) all.add(describe(image));
            return all;
        }

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(featureThreads, images.size()));
        try {
            List<Callable<List<Feature>>> tasks = images.stream()
                    .map(image -> (Callable<List<Feature>>) () -> describe(image))
                    .collect(Collectors.toList());
            List<List<Feature>> all = new ArrayList<>();
            for (Future<List<Feature>> future : pool.invokeAll(tasks)) {
                all.add(future.get());
            }
            return all;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while extracting features", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) throw (RuntimeException) e.getCause();
            throw new IllegalStateException("Feature extraction failed", e.getCause());
        } finally {
            pool.shutdownNow();
        }
    }

    private List<Feature> describe(Mat image) {
        List<Keypoint> keypoints = detector.detect(image);
        List<Feature> features = descriptorBuilder.describe(image, keypoints);
        log.debug("Image {}x{}: {} features", image.cols(), image.rows(), features.size());
        return features;
    }

    private static List<Keypoint> keypoints(List<Feature> features) {
        List<Keypoint> points = new ArrayList<>(features.size());
        for (Feature f : features) points.add(f.getKeypoint());
        return points;
    }
}
