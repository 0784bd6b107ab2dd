package com.viewquality.pmos;

import com.viewquality.pmos.device.DeviceProfileResolver;
import com.viewquality.pmos.device.ResolvedDevice;
import com.viewquality.pmos.error.GeometryResult;
import com.viewquality.pmos.error.MosComputationException;
import com.viewquality.pmos.error.MosError;
import com.viewquality.pmos.error.MosResult;
import com.viewquality.pmos.fusion.WrFusionModel;
import com.viewquality.pmos.geometry.ViewingGeometryCalculator;
import com.viewquality.pmos.model.DeviceParams;
import com.viewquality.pmos.model.PlaybackSetup;
import com.viewquality.pmos.model.QualityMetric;
import com.viewquality.pmos.model.UpsamplingMethod;
import com.viewquality.pmos.model.ViewingGeometry;

/**
 * Entry points mapping an objective metric plus viewing context to a device-specific MOS.
 *
 * <h3>Pipeline</h3>
 * <ol>
 *   <li>Validate video size, player size, HDR flag, upsampling and device selectors.</li>
 *   <li>Resolve the device profile ({@link DeviceProfileResolver}).</li>
 *   <li>Compute viewing angle and angular resolution ({@link ViewingGeometryCalculator})
 *       and check they are plausible.</li>
 *   <li>Check the metric value against its domain.</li>
 *   <li>Fuse WR score and metric ({@link WrFusionModel}).</li>
 * </ol>
 * Checks run in that order; the first failure decides the reported {@link MosError}.
 *
 * <h3>Argument conventions</h3>
 * <pre>
 *   hdr         0 = SDR, 1 = HDR
 *   upsampling  0 = bicubic, 1 = nearest neighbour, 2 = super-resolution
 *   device      0 = mobile, 1 = tablet, 2 = PC, 3 = TV, 4 = custom
 * </pre>
 *
 * <p>Pure static utility. No shared mutable state; safe for concurrent use.
 */
public final class ParametricMos {

    static final int MIN_DIMENSION = 1;
    static final int MAX_DIMENSION = 8192;

    private ParametricMos() {}

    /** PSNR [dB] to device-specific MOS. */
    public static MosResult psnr2mos(double psnr, int width, int height, int playerWidth, int playerHeight,
                                     int hdr, int upsampling, int device, DeviceParams params) {
        return predict(QualityMetric.PSNR, psnr, width, height, playerWidth, playerHeight,
            hdr, upsampling, device, params);
    }

    /** SSIM to device-specific MOS. */
    public static MosResult ssim2mos(double ssim, int width, int height, int playerWidth, int playerHeight,
                                     int hdr, int upsampling, int device, DeviceParams params) {
        return predict(QualityMetric.SSIM, ssim, width, height, playerWidth, playerHeight,
            hdr, upsampling, device, params);
    }

    /** VIF to device-specific MOS. */
    public static MosResult vif2mos(double vif, int width, int height, int playerWidth, int playerHeight,
                                    int hdr, int upsampling, int device, DeviceParams params) {
        return predict(QualityMetric.VIF, vif, width, height, playerWidth, playerHeight,
            hdr, upsampling, device, params);
    }

    /** VMAF (0-100 scale) to device-specific MOS. */
    public static MosResult vmaf2mos(double vmaf, int width, int height, int playerWidth, int playerHeight,
                                     int hdr, int upsampling, int device, DeviceParams params) {
        return predict(QualityMetric.VMAF, vmaf, width, height, playerWidth, playerHeight,
            hdr, upsampling, device, params);
    }

    /**
     * Metric-generic form of the four entry points above.
     *
     * @param metric      objective metric kind; {@code null} yields {@link MosError#INVALID_METRIC}
     * @param metricValue objective metric value
     * @param width       encoded video width [pixels]
     * @param height      encoded video height [pixels]
     * @return the fused MOS in [1, 5], or the first validation failure
     */
    public static MosResult predict(QualityMetric metric, double metricValue, int width, int height,
                                    int playerWidth, int playerHeight, int hdr, int upsampling,
                                    int device, DeviceParams params) {
        try {
            ViewingGeometry geometry = resolveGeometry(width, height, playerWidth, playerHeight,
                hdr, upsampling, device, params);

            if (metric == null) {
                throw new MosComputationException(MosError.INVALID_METRIC, "metric kind is required");
            }
            if (!metric.accepts(metricValue)) {
                throw new MosComputationException(MosError.INVALID_METRIC,
                    metric + " must be in " + metric.domain() + ", got " + metricValue);
            }

            // selectors were validated by resolveGeometry
            UpsamplingMethod method = UpsamplingMethod.fromCode(upsampling).orElseThrow();
            double mos = WrFusionModel.forMetric(metric).fuse(geometry.viewingAngle(),
                geometry.angularResolution(), hdr == 1, method, metricValue);
            return MosResult.of(mos, geometry);
        } catch (MosComputationException e) {
            return MosResult.failure(e);
        }
    }

    /** {@link #predict(QualityMetric, double, int, int, int, int, int, int, int, DeviceParams)} for a bundled setup. */
    public static MosResult predict(QualityMetric metric, double metricValue, int width, int height,
                                    PlaybackSetup setup) {
        if (setup == null) {
            return MosResult.failure(MosError.MISSING_PARAMETER, "playback setup is required");
        }
        return predict(metric, metricValue, width, height, setup.playerWidth(), setup.playerHeight(),
            setup.hdr(), setup.upsampling(), setup.device(), setup.customDevice());
    }

    /**
     * Viewing angle and angular resolution for a video shown in a player on a device,
     * without fusing any metric. Runs every check of {@link #predict} except the metric check.
     */
    public static GeometryResult viewingGeometry(int width, int height, int playerWidth, int playerHeight,
                                                 int hdr, int upsampling, int device, DeviceParams params) {
        try {
            return GeometryResult.of(resolveGeometry(width, height, playerWidth, playerHeight,
                hdr, upsampling, device, params));
        } catch (MosComputationException e) {
            return GeometryResult.failure(e);
        }
    }

    // ── Validation and geometry ────────────────────────────────────

    private static ViewingGeometry resolveGeometry(int width, int height, int playerWidth, int playerHeight,
                                                   int hdr, int upsampling, int device, DeviceParams params) {
        if (!inDimensionRange(width) || !inDimensionRange(height)) {
            throw new MosComputationException(MosError.INVALID_RESOLUTION,
                "video size must be within [1, 8192], got " + width + "x" + height);
        }
        if (!inDimensionRange(playerWidth) || !inDimensionRange(playerHeight)) {
            throw new MosComputationException(MosError.INVALID_PLAYER_SIZE,
                "player size must be within [1, 8192], got " + playerWidth + "x" + playerHeight);
        }
        if (hdr != 0 && hdr != 1) {
            throw new MosComputationException(MosError.INVALID_HDR_FLAG, "hdr must be 0 or 1, got " + hdr);
        }
        if (UpsamplingMethod.fromCode(upsampling).isEmpty()) {
            throw new MosComputationException(MosError.INVALID_UPSAMPLING,
                "upsampling must be in [0, " + (UpsamplingMethod.values().length - 1) + "], got " + upsampling);
        }

        ResolvedDevice resolved = DeviceProfileResolver.resolve(device, params);

        ViewingGeometry geometry = ViewingGeometryCalculator.compute(width, playerWidth,
            resolved.distanceInches(), resolved.params().ppiX());

        if (!geometry.isPlausible()) {
            throw new MosComputationException(MosError.INTERNAL_ERROR, String.format(
                "implausible viewing setup: angle=%.4f deg resolution=%.4f cpd", geometry.viewingAngle(),
                geometry.angularResolution()));
        }
        return geometry;
    }

    private static boolean inDimensionRange(int value) {
        return value >= MIN_DIMENSION && value <= MAX_DIMENSION;
    }
}
