package com.demo.altcredit.service.collect.device;

import java.util.Map;

/**
 * Read-only, side-effect free view of hardware/software attributes. Keys are listed in
 * {@link DeviceAttributes}. Throws {@code CollectionException} with
 * {@code SOURCE_UNAVAILABLE} when the device cannot be queried.
 */
public interface DeviceCapabilityProvider {
    Map<String, Object> attributes();
}
