package com.viewquality.service.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Values applied when a request omits the corresponding selector.
 * Codes follow {@link com.viewquality.pmos.ParametricMos}; they are validated per request,
 * so a bad default surfaces as a 400 rather than a start-up failure.
 */
@Data
@ConfigurationProperties(prefix = "mos.defaults")
public class MosDefaultsProperties {

    /** 0 = SDR, 1 = HDR. */
    private int hdr = 0;

    /** 0 = bicubic, 1 = nearest neighbour, 2 = super-resolution. */
    private int upsampling = 0;

    /** 0 = mobile, 1 = tablet, 2 = PC, 3 = TV, 4 = custom. */
    private int device = 3;
}
