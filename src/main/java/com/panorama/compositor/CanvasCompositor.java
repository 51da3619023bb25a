package com.panorama.compositor;

import com.panorama.exception.DegenerateGeometryException;
import com.panorama.exception.DimensionMismatchException;
import com.panorama.homography.HomographyMatrix;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.opencv.opencv_core.Mat;

import java.util.List;

/**
 * Warps a chain of images into the frame of the last one and merges them with the
 * maximum rule.
 * <p>
 * {@code homographies.get(i)} maps {@code images.get(i)} into the base frame. The canvas is
 * the smallest axis-aligned box holding the base image and the four projected corner pixels
 * of every other image; its origin is moved to (0, 0) by a translation that is composed
 * with every homography.
 */
@Slf4j
public class CanvasCompositor {
    private static final int MAX_CANVAS_SIDE = 30000;

    private final ProjectiveWarper warper;

    public CanvasCompositor(ProjectiveWarper warper) {
        this.warper = warper;
    }

    public Mat composite(List<Mat> images, List<HomographyMatrix> homographies) {
        if (images.isEmpty()) {
            throw new IllegalArgumentException("Nothing to composite");
        }
        if (homographies.size() != images.size() - 1) {
            throw new DimensionMismatchException("Homographies", images.size() - 1, homographies.size());
        }

        Mat base = images.get(images.size() - 1);
        if (images.size() == 1) return base.clone();

        Canvas canvas = createCanvas(images, homographies);
        log.debug("Canvas {}x{}, translation {}", canvas.getWidth(), canvas.getHeight(), canvas.getTranslation());

        for (int i = 0; i < homographies.size(); i++) {
            HomographyMatrix toCanvas = canvas.getTranslation().multiply(homographies.get(i));
            Mat warped = warper.warp(images.get(i), toCanvas, canvas.size());
            canvas.merge(warped);
            warped.release();
        }

        Mat warpedBase = warper.warp(base, canvas.getTranslation(), canvas.size());
        canvas.merge(warpedBase);
        warpedBase.release();

        return canvas.getRaster();
    }

    /**
     * Bounds are tracked in pixel coordinates, so an image of width {@code w} spans
     * {@code 0 .. w-1}. Left/top are floored once and that same value feeds both the
     * translation and the width/height, which keeps the canvas and the warp targets equal.
     */
    Canvas createCanvas(List<Mat> images, List<HomographyMatrix> homographies) {
        Mat base = images.get(images.size() - 1);
        double minX = 0, minY = 0;
        double maxX = base.cols() - 1, maxY = base.rows() - 1;

        for (int i = 0; i < homographies.size(); i++) {
            Mat img = images.get(i);
            HomographyMatrix h = homographies.get(i);
            double[][] corners = {
                    {0, 0},
                    {img.cols() - 1, 0},
                    {0, img.rows() - 1},
                    {img.cols() - 1, img.rows() - 1}
            };
            for (double[] corner : corners) {
                double[] p = h.project(corner[0], corner[1]);
                if (p == null || !Double.isFinite(p[0]) || !Double.isFinite(p[1])) {
                    throw new DegenerateGeometryException("Image " + i + " corner " + corner[0] + "," + corner[1]
                            + " maps to infinity under " + h);
                }
                minX = Math.min(minX, p[0]);
                minY = Math.min(minY, p[1]);
                maxX = Math.max(maxX, p[0]);
                maxY = Math.max(maxY, p[1]);
            }
        }

        // extent is checked in double; the int casts below must not saturate
        double extentX = Math.ceil(maxX) - Math.floor(minX) + 1;
        double extentY = Math.ceil(maxY) - Math.floor(minY) + 1;
        if (!(extentX >= 1 && extentX <= MAX_CANVAS_SIDE && extentY >= 1 && extentY <= MAX_CANVAS_SIDE)) {
            throw new DegenerateGeometryException(String.format("Invalid canvas size: %.0fx%.0f", extentX, extentY));
        }

        int left = (int) Math.floor(minX);
        int top = (int) Math.floor(minY);
        int width = (int) extentX;
        int height = (int) extentY;

        return new Canvas(width, height, HomographyMatrix.translation(-left, -top), base.type());
    }
}
