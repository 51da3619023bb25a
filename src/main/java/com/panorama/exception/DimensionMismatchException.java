package com.panorama.exception;

/**
 * Two sequences that must be index aligned have different lengths.
 */
public class DimensionMismatchException extends StitchingException {

    public DimensionMismatchException(String what, int expected, int actual) {
        super(what + ": expected " + expected + " entries but got " + actual);
    }

    @Override
    public String kind() {
        return "DIMENSION_MISMATCH";
    }
}
