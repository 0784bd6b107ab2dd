package com.viewquality.pmos.model;

/**
 * Unit in which a {@link DeviceParams#distance()} value is expressed.
 *
 * <p>The wire discriminant is an int: 0 = absolute inches, any other
 * non-negative value = multiples of the display height.
 */
public enum DistanceType {
    ABSOLUTE_INCHES(0),
    DISPLAY_HEIGHTS(1);

    private final int code;

    DistanceType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /** Non-zero discriminants are treated as relative distances. */
    public static DistanceType fromCode(int code) {
        return code == 0 ? ABSOLUTE_INCHES : DISPLAY_HEIGHTS;
    }
}
