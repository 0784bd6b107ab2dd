package com.viewquality.pmos.wr;

import com.viewquality.pmos.model.UpsamplingMethod;

/**
 * Coefficients of the generalized Westerink-Roufs model.
 *
 * <p>One SDR tuple and one HDR tuple per upsampling method. HDR variants scale
 * the SDR γ and δ by 1.08 and differ in the resolution saturation terms
 * ({@code l}, {@code uS}), reflecting how well each reconstruction method
 * preserves detail.
 *
 * @param alpha  additive offset inside the logarithm
 * @param beta   gain of the angle/resolution product
 * @param gamma  viewing-angle exponent
 * @param delta  angular-resolution exponent
 * @param k      viewing-angle knee sharpness
 * @param l      angular-resolution knee sharpness
 * @param phiS   viewing-angle saturation point [degrees]
 * @param uS     angular-resolution saturation point [cycles per degree]
 */
public record WrModelParameters(
    double alpha,
    double beta,
    double gamma,
    double delta,
    double k,
    double l,
    double phiS,
    double uS
) {
    private static final double HDR_EXPONENT_SCALE = 1.08;

    public static final WrModelParameters SDR =
        new WrModelParameters(2.72, 145.69, 1.55, 2.12, 6.01, 2.11, 35.0, 16.93);

    public static final WrModelParameters HDR_BICUBIC =
        new WrModelParameters(2.72, 106.91, 1.55 * HDR_EXPONENT_SCALE, 2.12 * HDR_EXPONENT_SCALE,
            6.01, 1.76, 35.0, 13.93);

    public static final WrModelParameters HDR_NEAREST_NEIGHBOR =
        new WrModelParameters(2.72, 106.91, 1.55 * HDR_EXPONENT_SCALE, 2.12 * HDR_EXPONENT_SCALE,
            6.01, 2.5, 35.0, 23.4);

    public static final WrModelParameters HDR_SUPER_RESOLUTION =
        new WrModelParameters(2.72, 106.91, 1.55 * HDR_EXPONENT_SCALE, 2.12 * HDR_EXPONENT_SCALE,
            6.01, 2.06, 35.0, 12.24);

    /**
     * Selects the coefficient tuple. SDR ignores the upsampling method.
     */
    public static WrModelParameters select(boolean hdr, UpsamplingMethod upsampling) {
        if (!hdr) return SDR;
        if (upsampling == null) {
            throw new IllegalArgumentException("upsampling method is required for HDR");
        }
        return switch (upsampling) {
            case BICUBIC          -> HDR_BICUBIC;
            case NEAREST_NEIGHBOR -> HDR_NEAREST_NEIGHBOR;
            case SUPER_RESOLUTION -> HDR_SUPER_RESOLUTION;
        };
    }
}
