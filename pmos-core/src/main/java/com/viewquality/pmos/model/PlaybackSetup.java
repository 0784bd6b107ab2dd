package com.viewquality.pmos.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Everything about a viewing session except the encoded video itself.
 *
 * <p>Fields use the integer selectors of {@link com.viewquality.pmos.ParametricMos}
 * so that out-of-range values survive deserialization and are rejected with a
 * structured error instead of a parse failure.
 *
 * @param playerWidth  player window width [pixels]
 * @param playerHeight player window height [pixels]
 * @param hdr          1 = HDR, 0 = SDR
 * @param upsampling   {@link UpsamplingMethod} code
 * @param device       {@link DeviceType} code
 * @param customDevice required when {@code device} is {@link DeviceType#CUSTOM}
 */
public record PlaybackSetup(
    @JsonProperty("playerWidth")  int playerWidth,
    @JsonProperty("playerHeight") int playerHeight,
    @JsonProperty("hdr")          int hdr,
    @JsonProperty("upsampling")   int upsampling,
    @JsonProperty("device")       int device,
    @JsonProperty("customDevice") DeviceParams customDevice
) {
    /** Full-screen SDR playback with bicubic upsampling on a built-in device. */
    public static PlaybackSetup fullScreen(DeviceType device, DeviceParams display) {
        return new PlaybackSetup(display.displayWidth(), display.displayHeight(), 0,
            UpsamplingMethod.BICUBIC.code(), device.code(),
            device == DeviceType.CUSTOM ? display : null);
    }
}
