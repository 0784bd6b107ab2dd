package com.viewquality.pmos.evaluation;

import com.viewquality.pmos.ParametricMos;
import com.viewquality.pmos.error.MosResult;
import com.viewquality.pmos.model.PlaybackSetup;
import com.viewquality.pmos.model.QualityMetric;

import java.util.ArrayList;
import java.util.List;

/**
 * Replays a labelled subjective dataset through one fusion model and measures its error.
 *
 * <p>Every sample is predicted under the same {@link PlaybackSetup} (e.g. full-screen on
 * a 4K TV). Null entries and samples lacking the metric or rejected by {@link ParametricMos}
 * are listed in {@link EvaluationReport#failures()} and excluded from the RMS.
 *
 * <p>Pure static utility. No I/O, no state.
 */
public final class MosEvaluator {

    private MosEvaluator() {}

    public static EvaluationReport evaluate(List<LabelledSample> samples, QualityMetric metric,
                                            PlaybackSetup setup) {
        if (metric == null) {
            throw new IllegalArgumentException("metric is required");
        }
        if (setup == null) {
            throw new IllegalArgumentException("playback setup is required");
        }

        List<SamplePrediction> predictions = new ArrayList<>();
        List<String> failures = new ArrayList<>();
        double sumSquares = 0.0;

        List<LabelledSample> dataset = samples == null ? List.of() : samples;
        for (int i = 0; i < dataset.size(); i++) {
            LabelledSample sample = dataset.get(i);
            if (sample == null) {
                failures.add("#" + i + ": null sample");
                continue;
            }
            Double value = sample.metricValue(metric);
            if (value == null) {
                failures.add(sample.name() + ": no " + metric + " value");
                continue;
            }

            MosResult result = ParametricMos.predict(metric, value, sample.width(), sample.height(), setup);
            if (!result.isSuccess()) {
                failures.add(sample.name() + ": " + result.error() + " " + result.message());
                continue;
            }

            double delta = result.mos() - sample.mos();
            sumSquares += delta * delta;
            predictions.add(new SamplePrediction(sample.name(), sample.width(), sample.height(),
                value, result.mos(), sample.mos(), delta));
        }

        double rms = predictions.isEmpty() ? Double.NaN : Math.sqrt(sumSquares / predictions.size());
        return new EvaluationReport(metric, List.copyOf(predictions), rms, List.copyOf(failures));
    }
}
