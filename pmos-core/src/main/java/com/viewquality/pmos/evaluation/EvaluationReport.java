package com.viewquality.pmos.evaluation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.viewquality.pmos.model.QualityMetric;

import java.util.List;

/**
 * Accuracy of one fusion model over a labelled dataset.
 *
 * @param metric      metric the predictions were made from
 * @param predictions successful predictions in dataset order
 * @param rms         root-mean-square of {@code delta} over {@code predictions}; NaN when empty
 * @param failures    names of samples without the metric or rejected by the model, with the reason
 */
public record EvaluationReport(
    @JsonProperty("metric")      QualityMetric          metric,
    @JsonProperty("predictions") List<SamplePrediction> predictions,
    @JsonProperty("rms")         double                 rms,
    @JsonProperty("failures")    List<String>           failures
) {
    @JsonProperty("evaluated")
    public int evaluated() {
        return predictions.size();
    }
}
