package com.viewquality.pmos.geometry;

import com.viewquality.pmos.model.ViewingGeometry;

/**
 * Viewing angle and angular resolution of a player window on a display.
 *
 * <h3>Formulas</h3>
 * <pre>
 *   φ = (180/π) · 2 · atan( playerWidth / (2 · distance · ppiX) )
 *
 *   effectiveWidth = min(videoWidth, playerWidth)
 *   cycleAngle     = (180/π) · 2 · atan( playerWidth / (effectiveWidth · distance · ppiX) )
 *   u              = 1 / cycleAngle
 * </pre>
 *
 * <p>A cycle spans two rendered pixels. Rendered resolution is capped by the
 * smaller of the encoded video and the player window, so upscaling a small
 * video into a large window lowers {@code u}.
 *
 * <p>Inputs must be strictly positive; violations are programming errors and
 * raise {@link IllegalArgumentException}. Plausibility of the results is
 * checked by the caller.
 */
public final class ViewingGeometryCalculator {

    private static final double DEGREES_PER_RADIAN = 180.0 / Math.PI;

    private ViewingGeometryCalculator() {}

    /**
     * @param playerWidth    player window width [pixels]
     * @param distanceInches viewing distance [inches]
     * @param ppiX           horizontal pixel density [ppi]
     * @return viewing angle [degrees]
     */
    public static double viewingAngle(int playerWidth, double distanceInches, double ppiX) {
        requirePositive("playerWidth", playerWidth);
        requirePositive("distance", distanceInches);
        requirePositive("ppiX", ppiX);

        return DEGREES_PER_RADIAN * 2 * Math.atan((double) playerWidth / (2.0 * distanceInches * ppiX));
    }

    /**
     * @param videoWidth     encoded video width [pixels]
     * @param playerWidth    player window width [pixels]
     * @param distanceInches viewing distance [inches]
     * @param ppiX           horizontal pixel density [ppi]
     * @return angular resolution [cycles per degree]
     */
    public static double angularResolution(int videoWidth, int playerWidth, double distanceInches, double ppiX) {
        requirePositive("videoWidth", videoWidth);
        requirePositive("playerWidth", playerWidth);
        requirePositive("distance", distanceInches);
        requirePositive("ppiX", ppiX);

        int effectiveWidth = Math.min(videoWidth, playerWidth);
        double cycleAngle = DEGREES_PER_RADIAN * 2
            * Math.atan((double) playerWidth / ((double) effectiveWidth * distanceInches * ppiX));
        return 1.0 / cycleAngle;
    }

    /** Computes both quantities for one setup. */
    public static ViewingGeometry compute(int videoWidth, int playerWidth, double distanceInches, double ppiX) {
        return new ViewingGeometry(
            viewingAngle(playerWidth, distanceInches, ppiX),
            angularResolution(videoWidth, playerWidth, distanceInches, ppiX));
    }

    private static void requirePositive(String name, double value) {
        if (!(value > 0)) {
            throw new IllegalArgumentException(name + " must be > 0, got " + value);
        }
    }
}
