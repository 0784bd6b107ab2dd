package com.viewquality.pmos.device;

import com.viewquality.pmos.error.MosComputationException;
import com.viewquality.pmos.error.MosError;
import com.viewquality.pmos.model.DeviceParams;
import com.viewquality.pmos.model.DeviceType;
import com.viewquality.pmos.model.DistanceType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Maps a device selector to a validated display profile and absolute viewing distance.
 *
 * <h3>Built-in profiles</h3>
 * <pre>
 *   device   w     h     ppi_x ppi_y  distance
 *   MOBILE   2400  1080  421   421    13 in     (e.g. 6.2" phone)
 *   TABLET   2800  1752  266   266    18 in     (e.g. 12.4" tablet)
 *   PC       2560  1600  100   100    24 in     (e.g. 30" monitor)
 *   TV       3840  2160  80    80     3 H       (55" UHD set, 81 in)
 * </pre>
 *
 * <h3>Custom profile bounds</h3>
 * <pre>
 *   displayWidth, displayHeight  [128, 16384]
 *   ppiX, ppiY                   [1, 10000]
 *   distanceType                 >= 0
 *   distance                     (0, 10000]
 * </pre>
 *
 * <p>This is the only place where distance units are normalized; everything
 * downstream works in pixels and inches. The table is immutable; the class is
 * stateless and thread-safe.
 */
public final class DeviceProfileResolver {

    static final int MIN_DISPLAY_SIZE = 128;
    static final int MAX_DISPLAY_SIZE = 16384;
    static final double MIN_PPI = 1.0;
    static final double MAX_PPI = 10000.0;
    static final double MAX_DISTANCE = 10000.0;

    private static final Map<DeviceType, DeviceParams> BUILT_IN;

    static {
        Map<DeviceType, DeviceParams> table = new EnumMap<>(DeviceType.class);
        table.put(DeviceType.MOBILE, DeviceParams.inches(2400, 1080, 421, 421, 13));
        table.put(DeviceType.TABLET, DeviceParams.inches(2800, 1752, 266, 266, 18));
        table.put(DeviceType.PC,     DeviceParams.inches(2560, 1600, 100, 100, 24));
        table.put(DeviceType.TV,     DeviceParams.heights(3840, 2160, 80, 80, 3));
        BUILT_IN = Collections.unmodifiableMap(table);
    }

    private DeviceProfileResolver() {}

    /**
     * Resolves an integer device selector.
     *
     * @param deviceCode   0..4, see {@link DeviceType}
     * @param customParams required when {@code deviceCode} is {@link DeviceType#CUSTOM}; ignored otherwise
     * @throws MosComputationException with {@link MosError#INVALID_DEVICE},
     *         {@link MosError#MISSING_PARAMETER} or {@link MosError#INVALID_CUSTOM_DEVICE}
     */
    public static ResolvedDevice resolve(int deviceCode, DeviceParams customParams) {
        DeviceType type = DeviceType.fromCode(deviceCode)
            .orElseThrow(() -> new MosComputationException(MosError.INVALID_DEVICE,
                "device must be in [0, " + (DeviceType.values().length - 1) + "], got " + deviceCode));
        return resolve(type, customParams);
    }

    /**
     * Resolves a device category.
     *
     * @see #resolve(int, DeviceParams)
     */
    public static ResolvedDevice resolve(DeviceType type, DeviceParams customParams) {
        if (type == null) {
            throw new MosComputationException(MosError.INVALID_DEVICE, "device type is required");
        }

        DeviceParams params;
        if (type == DeviceType.CUSTOM) {
            if (customParams == null) {
                throw new MosComputationException(MosError.MISSING_PARAMETER,
                    "custom device requires device parameters");
            }
            validateCustom(customParams);
            params = customParams;
        } else {
            params = BUILT_IN.get(type);
        }

        return new ResolvedDevice(type, params, distanceInInches(params));
    }

    /** Read-only view of the built-in profile table. */
    public static Map<DeviceType, DeviceParams> builtInProfiles() {
        return BUILT_IN;
    }

    /**
     * Converts a viewing distance expressed in display heights into inches:
     * {@code displayHeight / ppiY * heights}.
     */
    public static double heightsToInches(int displayHeight, double ppiY, double distanceInHeights) {
        if (displayHeight <= 0 || ppiY <= 0 || distanceInHeights <= 0) {
            throw new IllegalArgumentException(String.format(
                "heightsToInches requires positive inputs: height=%d ppiY=%s distance=%s",
                displayHeight, ppiY, distanceInHeights));
        }
        double displayHeightInches = (double) displayHeight / ppiY;
        return displayHeightInches * distanceInHeights;
    }

    // ── Helpers ────────────────────────────────────────────────────

    private static double distanceInInches(DeviceParams params) {
        if (params.distanceUnit() == DistanceType.DISPLAY_HEIGHTS) {
            return heightsToInches(params.displayHeight(), params.ppiY(), params.distance());
        }
        return params.distance();
    }

    private static void validateCustom(DeviceParams p) {
        if (p.displayWidth() < MIN_DISPLAY_SIZE || p.displayWidth() > MAX_DISPLAY_SIZE) {
            throw invalid("displayWidth", p.displayWidth());
        }
        if (p.displayHeight() < MIN_DISPLAY_SIZE || p.displayHeight() > MAX_DISPLAY_SIZE) {
            throw invalid("displayHeight", p.displayHeight());
        }
        // negated comparisons so that NaN is rejected
        if (!(p.ppiX() >= MIN_PPI && p.ppiX() <= MAX_PPI)) {
            throw invalid("ppiX", p.ppiX());
        }
        if (!(p.ppiY() >= MIN_PPI && p.ppiY() <= MAX_PPI)) {
            throw invalid("ppiY", p.ppiY());
        }
        if (p.distanceType() < 0) {
            throw invalid("distanceType", p.distanceType());
        }
        if (!(p.distance() > 0 && p.distance() <= MAX_DISTANCE)) {
            throw invalid("distance", p.distance());
        }
    }

    private static MosComputationException invalid(String field, Object value) {
        return new MosComputationException(MosError.INVALID_CUSTOM_DEVICE,
            "custom device " + field + " out of range: " + value);
    }
}
