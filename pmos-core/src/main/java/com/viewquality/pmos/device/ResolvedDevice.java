package com.viewquality.pmos.device;

import com.viewquality.pmos.model.DeviceParams;
import com.viewquality.pmos.model.DeviceType;

/**
 * A validated device profile with its viewing distance normalized to inches.
 *
 * @param type           device category the profile came from
 * @param params         validated display parameters
 * @param distanceInches absolute viewing distance [inches]
 */
public record ResolvedDevice(
    DeviceType type,
    DeviceParams params,
    double distanceInches
) {}
