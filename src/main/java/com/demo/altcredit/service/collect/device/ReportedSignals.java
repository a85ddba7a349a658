package com.demo.altcredit.service.collect.device;

import java.util.List;
import java.util.Map;

/**
 * Snapshot a client device reports about itself. Any part may be null when the device
 * could not read it.
 */
public record ReportedSignals(
        Map<String, Object> deviceAttributes,
        NetworkSnapshot network,
        List<String> storageKeys,
        String cookies,
        PermissionStatus locationPermission,
        RawPosition position
) {}
