package com.demo.altcredit.service.collect.device;

import com.demo.altcredit.service.consent.ConsentPurpose;

import java.time.Duration;

public interface LocationProvider {

    PermissionStatus checkPermission();

    /** Asks the platform for permission, citing {@code justification} to the user. */
    PermissionStatus requestPermission(ConsentPurpose justification);

    /** Blocks up to {@code timeout}; throws {@code CollectionException} on failure. */
    RawPosition currentPosition(Duration timeout);
}
