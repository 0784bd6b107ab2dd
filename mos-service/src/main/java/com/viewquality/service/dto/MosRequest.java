package com.viewquality.service.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.viewquality.pmos.model.DeviceParams;

/**
 * Body of {@code POST /api/v1/mos/{metric}} and {@code POST /api/v1/mos/viewing-geometry}.
 *
 * <p>Nullable fields fall back to service defaults: player size to the full display of the
 * resolved device, selectors to {@code mos.defaults.*}. {@code metricValue} is ignored by the
 * geometry endpoint.
 */
public record MosRequest(
    @JsonProperty("metricValue")  Double       metricValue,
    @JsonProperty("videoWidth")   int          videoWidth,
    @JsonProperty("videoHeight")  int          videoHeight,
    @JsonProperty("playerWidth")  Integer      playerWidth,
    @JsonProperty("playerHeight") Integer      playerHeight,
    @JsonProperty("hdr")          Integer      hdr,
    @JsonProperty("upsampling")   Integer      upsampling,
    @JsonProperty("device")       Integer      device,
    @JsonProperty("customDevice") DeviceParams customDevice
) {}
