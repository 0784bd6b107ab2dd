package com.viewquality.pmos.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Full-reference objective metric fused with the WR score.
 *
 * <h3>Accepted domains</h3>
 * <pre>
 *   PSNR  (0, 100)  dB
 *   SSIM  (0, 1]
 *   VIF   (0, 1]
 *   VMAF  (0, 100]
 * </pre>
 * NaN is outside every domain.
 */
public enum QualityMetric {
    PSNR(0.0, 100.0, false),
    SSIM(0.0, 1.0, true),
    VIF(0.0, 1.0, true),
    VMAF(0.0, 100.0, true);

    private final double lowerExclusive;
    private final double upper;
    private final boolean upperInclusive;

    QualityMetric(double lowerExclusive, double upper, boolean upperInclusive) {
        this.lowerExclusive = lowerExclusive;
        this.upper = upper;
        this.upperInclusive = upperInclusive;
    }

    /** Returns true if {@code value} lies in this metric's domain. */
    public boolean accepts(double value) {
        if (Double.isNaN(value) || value <= lowerExclusive) return false;
        return upperInclusive ? value <= upper : value < upper;
    }

    /** Human-readable domain, used in error messages. */
    public String domain() {
        return "(" + format(lowerExclusive) + ", " + format(upper) + (upperInclusive ? "]" : ")");
    }

    /**
     * Case-insensitive lookup by name, e.g. {@code "psnr"} → {@link #PSNR}.
     */
    public static Optional<QualityMetric> fromName(String name) {
        if (name == null) return Optional.empty();
        try {
            return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private static String format(double v) {
        return v == Math.rint(v) ? String.valueOf((long) v) : String.valueOf(v);
    }
}
