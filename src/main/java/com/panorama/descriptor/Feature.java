package com.panorama.descriptor;

import com.panorama.featureDetection.Keypoint;
import lombok.Getter;

/**
 * A keypoint and the descriptor computed at it. Keeping both in one object means the
 * point list and the descriptor list of an image can never drift apart.
 */
public class Feature {
    public static final int DESCRIPTOR_LENGTH = 64;

    @Getter
    private final Keypoint keypoint;
    private final double[] descriptor;

    public Feature(Keypoint keypoint, double[] descriptor) {
        if (descriptor.length != DESCRIPTOR_LENGTH) {
            throw new IllegalArgumentException("Descriptor must have " + DESCRIPTOR_LENGTH
                    + " values, got " + descriptor.length);
        }
        this.keypoint = keypoint;
        this.descriptor = descriptor.clone();
    }

    /** A copy; the stored descriptor never changes after construction. */
    public double[] getDescriptor() {
        return descriptor.clone();
    }

    /** Euclidean distance between the two descriptors. */
    public double distanceTo(Feature that) {
        double sum = 0.0;
        for (int i = 0; i < DESCRIPTOR_LENGTH; i++) {
            double d = this.descriptor[i] - that.descriptor[i];
            sum += d * d;
        }
        return Math.sqrt(sum);
    }

    @Override
    public String toString() {
        return String.format("Feature[%s | Descriptor[0..1]=%.3f, %.3f,...]",
                keypoint, descriptor[0], descriptor[1]);
    }
}
