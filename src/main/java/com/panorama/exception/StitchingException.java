package com.panorama.exception;

/**
 * Base class for the failures that abort one pairwise stitch.
 * The caller decides whether to skip the image pair or abort the whole panorama.
 */
public class StitchingException extends RuntimeException {

    public StitchingException(String message) {
        super(message);
    }

    public StitchingException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Short machine readable name, reported by the REST layer.
     */
    public String kind() {
        return "STITCHING_FAILED";
    }
}
