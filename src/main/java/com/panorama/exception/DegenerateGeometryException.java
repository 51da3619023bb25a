package com.panorama.exception;

/**
 * The estimated homography does not describe the correspondences it was fitted on
 * (collinear or repeated points, singular matrix).
 */
public class DegenerateGeometryException extends StitchingException {

    public DegenerateGeometryException(String message) {
        super(message);
    }

    @Override
    public String kind() {
        return "DEGENERATE_GEOMETRY";
    }
}
