package com.panorama.imageOperator;

import lombok.extern.slf4j.Slf4j;
import org.bytedeco.opencv.opencv_core.Mat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.bytedeco.opencv.global.opencv_core.CV_32F;
import static org.bytedeco.opencv.global.opencv_core.CV_8U;
import static org.bytedeco.opencv.global.opencv_imgcodecs.*;

/**
 * Reads images as single channel float rasters in [0, 1] and writes such rasters back as 8 bit.
 */
@Slf4j
public class GrayImageIO {

    public Mat load(Path path) throws IOException {
        Mat raw = imread(path.toAbsolutePath().toString(), IMREAD_GRAYSCALE);
        if (raw == null || raw.empty()) {
            throw new IOException("Cannot decode image " + path);
        }
        Mat gray = new Mat();
        raw.convertTo(gray, CV_32F, 1.0 / 255.0, 0.0);
        raw.release();
        log.debug("Loaded {} ({}x{})", path.getFileName(), gray.cols(), gray.rows());
        return gray;
    }

    public void save(Mat image, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
        }
        Mat out = new Mat();
        image.convertTo(out, CV_8U, 255.0, 0.0);
        boolean written = imwrite(path.toAbsolutePath().toString(), out);
        out.release();
        if (!written) {
            throw new IOException("Cannot write image " + path);
        }
        log.info("Saved {}", path);
    }
}
