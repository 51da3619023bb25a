package com.panorama.exception;

/**
 * No reliable transform found: RANSAC ended with fewer inliers than a homography needs,
 * or the matcher found no confident descriptor pair.
 */
public class NoConsensusException extends StitchingException {

    public NoConsensusException(String message) {
        super(message);
    }

    @Override
    public String kind() {
        return "NO_CONSENSUS";
    }
}
