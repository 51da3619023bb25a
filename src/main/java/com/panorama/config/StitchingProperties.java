package com.panorama.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables of the stitching pipeline, bound from {@code panorama.*}.
 */
@Data
@ConfigurationProperties(prefix = "panorama")
public class StitchingProperties {

    /** Seed for RANSAC sampling; unset means a fresh random sequence per start. */
    private Long randomSeed;

    /** Abort on the first pair that cannot be aligned unless this is set. */
    private boolean skipUnalignedPairs = false;

    /** Refuse a pair whose best descriptor distance is not below matching.confident-distance. */
    private boolean requireConfidentMatch = true;

    /** Threads for per-image feature extraction; 1 runs sequentially. */
    private int featureThreads = Runtime.getRuntime().availableProcessors();

    private Harris harris = new Harris();
    private Features features = new Features();
    private Matching matching = new Matching();
    private RansacSettings ransac = new RansacSettings();
    private Storage storage = new Storage();

    @Data
    public static class Harris {
        private int blockSize = 2;
        private int kernelSize = 3;
        private double k = 0.04;
    }

    @Data
    public static class Features {
        private int maxKeypoints = 500;
        private double minResponseRatio = 0.01;
        private double robustness = 0.9;
        private int maximaWindow = 3;
    }

    @Data
    public static class Matching {
        private double ratio = 0.8;
        private double confidentDistance = 4.0;
    }

    @Data
    public static class RansacSettings {
        private int maxRounds = 30;
        private double inlierThreshold = 4.0;
        private double consensus = 0.9;
    }

    @Data
    public static class Storage {
        private String uploadDir = "uploads";
        private String outputDir = "stitch";
        private String publicUrl = "http://localhost:8080/stitch/";
    }
}
