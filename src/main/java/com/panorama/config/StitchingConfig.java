package com.panorama.config;

import com.panorama.compositor.CanvasCompositor;
import com.panorama.compositor.OpenCvProjectiveWarper;
import com.panorama.descriptor.PatchDescriptorBuilder;
import com.panorama.featureDetection.AdaptiveNonMaximalSuppression;
import com.panorama.featureDetection.CornerDetector;
import com.panorama.featureDetection.HarrisCornerResponse;
import com.panorama.featureDetection.LocalMaxima;
import com.panorama.featureDetection.OpenCvMorphology;
import com.panorama.homography.HomographyEstimator;
import com.panorama.homography.Ransac;
import com.panorama.imageOperator.GrayImageIO;
import com.panorama.matching.DescriptorMatcher;
import com.panorama.pipeline.PanoramaStitcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Random;

@Slf4j
@Configuration
@EnableConfigurationProperties(StitchingProperties.class)
public class StitchingConfig {

    @Bean
    public HomographyEstimator homographyEstimator() {
        return new HomographyEstimator();
    }

    @Bean
    public GrayImageIO grayImageIO() {
        return new GrayImageIO();
    }

    @Bean
    public CornerDetector cornerDetector(StitchingProperties properties) {
        StitchingProperties.Harris harris = properties.getHarris();
        StitchingProperties.Features features = properties.getFeatures();
        LocalMaxima localMaxima = new LocalMaxima(new OpenCvMorphology(features.getMaximaWindow()));
        return new CornerDetector(
                new HarrisCornerResponse(harris.getBlockSize(), harris.getKernelSize(), harris.getK()),
                new AdaptiveNonMaximalSuppression(localMaxima, features.getRobustness()),
                features.getMaxKeypoints(),
                features.getMinResponseRatio());
    }

    @Bean
    public Ransac ransac(StitchingProperties properties, HomographyEstimator estimator) {
        Random random;
        if (properties.getRandomSeed() != null) {
            log.info("RANSAC sampling seeded with {}", properties.getRandomSeed());
            random = new Random(properties.getRandomSeed());
        } else {
            random = new Random();
        }
        StitchingProperties.RansacSettings settings = properties.getRansac();
        return new Ransac(estimator, random, settings.getMaxRounds(), settings.getInlierThreshold(),
                settings.getConsensus());
    }

    @Bean
    public PanoramaStitcher panoramaStitcher(StitchingProperties properties, CornerDetector cornerDetector,
                                             Ransac ransac, HomographyEstimator estimator) {
        StitchingProperties.Matching matching = properties.getMatching();
        return new PanoramaStitcher(
                cornerDetector,
                new PatchDescriptorBuilder(),
                new DescriptorMatcher(matching.getRatio(), matching.getConfidentDistance()),
                ransac,
                estimator,
                new CanvasCompositor(new OpenCvProjectiveWarper()),
                properties.isRequireConfidentMatch(),
                properties.isSkipUnalignedPairs(),
                properties.getFeatureThreads());
    }
}
