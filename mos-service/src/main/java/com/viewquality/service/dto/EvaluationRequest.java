package com.viewquality.service.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.viewquality.pmos.evaluation.LabelledSample;
import com.viewquality.pmos.model.PlaybackSetup;

import java.util.List;

/**
 * Caller-supplied dataset for {@code POST /api/v1/mos/evaluation}.
 * A null {@code setup} means full-screen SDR on the built-in TV, matching the reference dataset.
 */
public record EvaluationRequest(
    @JsonProperty("samples") List<LabelledSample> samples,
    @JsonProperty("setup")   PlaybackSetup        setup
) {}
