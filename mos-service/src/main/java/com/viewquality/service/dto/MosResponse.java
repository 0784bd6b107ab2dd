package com.viewquality.service.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.viewquality.pmos.model.QualityMetric;

public record MosResponse(
    @JsonProperty("metric")            QualityMetric metric,
    @JsonProperty("mos")               double        mos,
    @JsonProperty("viewingAngle")      double        viewingAngle,
    @JsonProperty("angularResolution") double        angularResolution
) {}
