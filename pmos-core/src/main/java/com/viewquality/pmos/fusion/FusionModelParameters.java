package com.viewquality.pmos.fusion;

import com.viewquality.pmos.model.QualityMetric;

/**
 * Coefficients of one WR+metric fusion model.
 *
 * <p>{@code epsilon} and {@code zeta} only apply to the {@link LinkFunction#LOGISTIC}
 * link; they are {@code NaN} for {@link LinkFunction#IDENTITY}.
 */
public record FusionModelParameters(
    double alpha,
    double beta,
    double gamma,
    double delta,
    double epsilon,
    double zeta,
    LinkFunction link
) {
    public static final FusionModelParameters PSNR =
        logistic(-6.906, 6.130, -0.048, 1.476, 0.228, 23.83);

    public static final FusionModelParameters SSIM =
        logistic(-7.181, 7.662, -0.089, 1.753, 7.492, 0.777);

    public static final FusionModelParameters VIF =
        logistic(-12.09, 12.117, -0.137, 2.763, 4.846, 0.416);

    public static final FusionModelParameters VMAF =
        new FusionModelParameters(-7.682, 0.0753, -0.122, 2.01, Double.NaN, Double.NaN, LinkFunction.IDENTITY);

    public static FusionModelParameters forMetric(QualityMetric metric) {
        return switch (metric) {
            case PSNR -> PSNR;
            case SSIM -> SSIM;
            case VIF  -> VIF;
            case VMAF -> VMAF;
        };
    }

    /** Applies this model's link to a raw metric value. */
    public double link(double metricValue) {
        return link.apply(metricValue, epsilon, zeta);
    }

    private static FusionModelParameters logistic(double alpha, double beta, double gamma, double delta,
                                                  double epsilon, double zeta) {
        return new FusionModelParameters(alpha, beta, gamma, delta, epsilon, zeta, LinkFunction.LOGISTIC);
    }
}
