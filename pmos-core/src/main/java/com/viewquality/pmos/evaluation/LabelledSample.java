package com.viewquality.pmos.evaluation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.viewquality.pmos.model.QualityMetric;

/**
 * One encoded video from a subjective test: its resolution, objective scores and observed MOS.
 * Metrics not measured for the sample are {@code null}.
 */
public record LabelledSample(
    @JsonProperty("name")   String name,
    @JsonProperty("width")  int    width,
    @JsonProperty("height") int    height,
    @JsonProperty("psnr")   Double psnr,
    @JsonProperty("ssim")   Double ssim,
    @JsonProperty("vif")    Double vif,
    @JsonProperty("vmaf")   Double vmaf,
    @JsonProperty("mos")    double mos
) {
    /** Value of the requested metric, or {@code null} if the sample has none. */
    public Double metricValue(QualityMetric metric) {
        return switch (metric) {
            case PSNR -> psnr;
            case SSIM -> ssim;
            case VIF  -> vif;
            case VMAF -> vmaf;
        };
    }
}
