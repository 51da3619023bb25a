package com.panorama.API;

import com.panorama.config.StitchingProperties;
import com.panorama.imageOperator.GrayImageIO;
import com.panorama.pipeline.PairReport;
import com.panorama.pipeline.PanoramaResult;
import com.panorama.pipeline.PanoramaStitcher;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.opencv.opencv_core.Mat;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@Service
public class StitchingService {

    private final PanoramaStitcher stitcher;
    private final GrayImageIO imageIO;
    private final Path outputPath;
    private final String publicUrl;

    public StitchingService(PanoramaStitcher stitcher, GrayImageIO imageIO, StitchingProperties properties) {
        this.stitcher = stitcher;
        this.imageIO = imageIO;
        this.outputPath = Paths.get(properties.getStorage().getOutputDir());
        String url = properties.getStorage().getPublicUrl();
        this.publicUrl = url.endsWith("/") ? url : url + "/";
    }

    @Getter
    @AllArgsConstructor
    public static class StitchedImage {
        private final String filename;
        private final String imageUrl;
        private final int imagesUsed;
        private final int width;
        private final int height;
        private final List<String> pairs;
    }

    /**
     * Stitches the images in the given order into the frame of the last one and writes the
     * panorama to the output directory.
     */
    public StitchedImage stitchImages(List<Path> inputs, boolean skipUnaligned) throws IOException {
        List<Mat> images = new ArrayList<>();
        try {
            for (Path input : inputs) {
                images.add(imageIO.load(input));
            }

            PanoramaResult result = stitcher.stitch(images, skipUnaligned);

            String filename = "panorama_" + System.currentTimeMillis() + ".jpg";
            imageIO.save(result.getPanorama(), outputPath.resolve(filename));

            List<String> pairs = result.getPairs().stream()
                    .map(PairReport::toString)
                    .collect(Collectors.toList());
            StitchedImage stitched = new StitchedImage(filename, publicUrl + filename,
                    inputs.size() - result.getFirstImage(),
                    result.getPanorama().cols(), result.getPanorama().rows(), pairs);
            result.getPanorama().release();
            return stitched;
        } finally {
            for (Mat image : images) image.release();
        }
    }
}
