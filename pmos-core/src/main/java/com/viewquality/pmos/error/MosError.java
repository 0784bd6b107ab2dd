package com.viewquality.pmos.error;

/**
 * Reasons a MOS or geometry computation can be rejected.
 *
 * <p>Each constant keeps the negative code used by hosts that consume the
 * single-channel convention (score or negative code); see
 * {@link MosResult#toLegacyValue()}.
 */
public enum MosError {

    /** Video width or height outside [1, 8192]. */
    INVALID_RESOLUTION(-1),

    /** Player width or height outside [1, 8192]. */
    INVALID_PLAYER_SIZE(-2),

    /** HDR indicator other than 0 or 1. */
    INVALID_HDR_FLAG(-3),

    /** Upsampling selector outside the known methods. */
    INVALID_UPSAMPLING(-4),

    /** Device selector outside the known categories. */
    INVALID_DEVICE(-5),

    /** Required argument missing, e.g. no profile for a custom device. */
    MISSING_PARAMETER(-6),

    /** A custom device profile field is out of bounds. */
    INVALID_CUSTOM_DEVICE(-7),

    /** Derived viewing angle or angular resolution is implausible. */
    INTERNAL_ERROR(-8),

    /** Objective metric value outside its domain. */
    INVALID_METRIC(-9);

    private final int code;

    MosError(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static MosError fromCode(int code) {
        for (MosError error : values()) {
            if (error.code == code) return error;
        }
        throw new IllegalArgumentException("Unknown MOS error code: " + code);
    }
}
