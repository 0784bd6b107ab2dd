package com.viewquality.pmos.evaluation;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Predicted versus observed MOS for one sample. {@code delta = predictedMos - trueMos}.
 */
public record SamplePrediction(
    @JsonProperty("name")         String name,
    @JsonProperty("width")        int    width,
    @JsonProperty("height")       int    height,
    @JsonProperty("metricValue")  double metricValue,
    @JsonProperty("predictedMos") double predictedMos,
    @JsonProperty("trueMos")      double trueMos,
    @JsonProperty("delta")        double delta
) {}
