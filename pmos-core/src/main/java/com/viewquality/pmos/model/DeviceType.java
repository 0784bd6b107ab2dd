package com.viewquality.pmos.model;

import java.util.Optional;

/**
 * Device category selecting a built-in display/viewing profile.
 *
 * <p>Codes match the integer selectors accepted by
 * {@link com.viewquality.pmos.ParametricMos}: mobile=0, tablet=1, PC=2, TV=3, custom=4.
 * {@link #CUSTOM} has no table entry; the caller must supply {@link DeviceParams}.
 */
public enum DeviceType {

    /** Phone class display, e.g. 6.2" 2400x1080 panel viewed at ~13". */
    MOBILE(0),

    /** Tablet class display, e.g. 12.4" 2800x1752 panel viewed at ~18". */
    TABLET(1),

    /** Desktop monitor, e.g. 30" 2560x1600 viewed at ~24". */
    PC(2),

    /** 55" UHD TV viewed at three display heights (~81"). */
    TV(3),

    /** Caller-defined display; parameters come from a {@link DeviceParams} instance. */
    CUSTOM(4);

    private final int code;

    DeviceType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * @param code integer selector (0..4)
     * @return the matching device type, or empty when out of range
     */
    public static Optional<DeviceType> fromCode(int code) {
        for (DeviceType type : values()) {
            if (type.code == code) return Optional.of(type);
        }
        return Optional.empty();
    }
}
