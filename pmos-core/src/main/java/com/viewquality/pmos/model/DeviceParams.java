package com.viewquality.pmos.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Physical description of a display and how far the viewer sits from it.
 *
 * <p>Used both for the built-in device table and for caller-supplied
 * {@link DeviceType#CUSTOM} profiles. Bounds are enforced by
 * {@link com.viewquality.pmos.device.DeviceProfileResolver}, not here, so that
 * an out-of-range request can still be deserialized and then rejected with a
 * structured error.
 *
 * @param displayWidth  display width [pixels]
 * @param displayHeight display height [pixels]
 * @param ppiX          horizontal pixel density [ppi]
 * @param ppiY          vertical pixel density [ppi]
 * @param distanceType  0 = absolute inches, non-zero = display heights (see {@link DistanceType})
 * @param distance      viewing distance in the unit given by {@code distanceType}
 */
public record DeviceParams(
    @JsonProperty("displayWidth")  int    displayWidth,
    @JsonProperty("displayHeight") int    displayHeight,
    @JsonProperty("ppiX")          double ppiX,
    @JsonProperty("ppiY")          double ppiY,
    @JsonProperty("distanceType")  int    distanceType,
    @JsonProperty("distance")      double distance
) {
    public static DeviceParams inches(int displayWidth, int displayHeight, double ppiX, double ppiY,
                                      double distanceInches) {
        return new DeviceParams(displayWidth, displayHeight, ppiX, ppiY,
            DistanceType.ABSOLUTE_INCHES.code(), distanceInches);
    }

    public static DeviceParams heights(int displayWidth, int displayHeight, double ppiX, double ppiY,
                                       double distanceInHeights) {
        return new DeviceParams(displayWidth, displayHeight, ppiX, ppiY,
            DistanceType.DISPLAY_HEIGHTS.code(), distanceInHeights);
    }

    @JsonIgnore
    public DistanceType distanceUnit() {
        return DistanceType.fromCode(distanceType);
    }
}
