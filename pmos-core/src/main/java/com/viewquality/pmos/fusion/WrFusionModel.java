package com.viewquality.pmos.fusion;

import com.viewquality.pmos.model.QualityMetric;
import com.viewquality.pmos.model.UpsamplingMethod;
import com.viewquality.pmos.wr.WesterinkRoufsModel;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * WR+metric fusion model (WR+PSNR2MOS, WR+SSIM2MOS, WR+VIF2MOS, WR+VMAF2MOS).
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>{@code Qwr} = WR score for the viewing geometry.</li>
 *   <li>{@code Q} = link(metric): logistic for PSNR/SSIM/VIF, identity for VMAF.</li>
 *   <li>{@code MOS = α + β · (1 + γ · Qwr) · Q + δ · Qwr}, clamped to [1, 5].</li>
 * </ol>
 *
 * <p>The {@code (1 + γ · Qwr) · Q} term lets viewing conditions modulate how
 * much the objective metric matters instead of adding independently.
 *
 * <p>Instances are immutable; one shared instance exists per metric.
 */
public final class WrFusionModel implements MosFusionModel {

    private static final Map<QualityMetric, WrFusionModel> MODELS;

    static {
        Map<QualityMetric, WrFusionModel> models = new EnumMap<>(QualityMetric.class);
        for (QualityMetric metric : QualityMetric.values()) {
            models.put(metric, new WrFusionModel(metric, FusionModelParameters.forMetric(metric)));
        }
        MODELS = Collections.unmodifiableMap(models);
    }

    private final QualityMetric metric;
    private final FusionModelParameters params;

    WrFusionModel(QualityMetric metric, FusionModelParameters params) {
        this.metric = metric;
        this.params = params;
    }

    public static WrFusionModel forMetric(QualityMetric metric) {
        if (metric == null) {
            throw new IllegalArgumentException("metric is required");
        }
        return MODELS.get(metric);
    }

    @Override
    public QualityMetric metric() {
        return metric;
    }

    public FusionModelParameters parameters() {
        return params;
    }

    @Override
    public double fuse(double viewingAngle, double angularResolution, boolean hdr,
                       UpsamplingMethod upsampling, double metricValue) {
        if (!metric.accepts(metricValue)) {
            throw new IllegalArgumentException(
                metric + " must be in " + metric.domain() + ", got " + metricValue);
        }

        double qwr = WesterinkRoufsModel.score(viewingAngle, angularResolution, hdr, upsampling);
        double q = params.link(metricValue);

        double mos = params.alpha()
            + params.beta() * (1 + params.gamma() * qwr) * q
            + params.delta() * qwr;

        return Math.max(1.0, Math.min(5.0, mos));
    }
}
