package com.viewquality.pmos.model;

import java.util.Optional;

/**
 * Upsampling method assumed when the player window is larger than the encoded video.
 * Only affects HDR coefficient selection in the WR model.
 */
public enum UpsamplingMethod {

    /** Conventional bicubic upsampling. The common default. */
    BICUBIC(0),

    /** Nearest-neighbour upsampling. Poor, but occurs in practice. */
    NEAREST_NEIGHBOR(1),

    /** Learned / super-resolution reconstruction. */
    SUPER_RESOLUTION(2);

    private final int code;

    UpsamplingMethod(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static Optional<UpsamplingMethod> fromCode(int code) {
        for (UpsamplingMethod method : values()) {
            if (method.code == code) return Optional.of(method);
        }
        return Optional.empty();
    }
}
