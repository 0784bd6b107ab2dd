package com.viewquality.pmos.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Perceptual geometry of a viewing setup.
 *
 * @param viewingAngle      horizontal angle subtended by the player window [degrees]
 * @param angularResolution rendered resolution [cycles per degree]
 */
public record ViewingGeometry(
    @JsonProperty("viewingAngle")      double viewingAngle,
    @JsonProperty("angularResolution") double angularResolution
) {
    public static final double MIN_VIEWING_ANGLE = 1.0;
    public static final double MAX_VIEWING_ANGLE = 180.0;
    public static final double MIN_ANGULAR_RESOLUTION = 1.0;
    public static final double MAX_ANGULAR_RESOLUTION = 200.0;

    /**
     * Whether both values fall inside the physically plausible ranges
     * φ ∈ [1, 180] and u ∈ [1, 200]. NaN is never plausible.
     */
    @JsonIgnore
    public boolean isPlausible() {
        return viewingAngle >= MIN_VIEWING_ANGLE && viewingAngle <= MAX_VIEWING_ANGLE
            && angularResolution >= MIN_ANGULAR_RESOLUTION && angularResolution <= MAX_ANGULAR_RESOLUTION;
    }
}
