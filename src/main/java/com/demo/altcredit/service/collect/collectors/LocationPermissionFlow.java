package com.demo.altcredit.service.collect.collectors;

import com.demo.altcredit.service.collect.CollectionException;
import com.demo.altcredit.service.collect.device.LocationProvider;
import com.demo.altcredit.service.collect.device.PermissionStatus;
import com.demo.altcredit.service.consent.ConsentPurpose;
import lombok.extern.slf4j.Slf4j;

/**
 * Drives {@code unknown -> requested -> granted|denied|blocked} against a {@link LocationProvider}.
 * A blocked permission is never requested again; it is only re-checked, since the user can lift
 * it in the device settings.
 */
@Slf4j
public class LocationPermissionFlow {

    private final LocationProvider provider;
    private LocationPermissionState state = LocationPermissionState.UNKNOWN;

    public LocationPermissionFlow(LocationProvider provider) {
        this.provider = provider;
    }

    public synchronized LocationPermissionState state() {
        return state;
    }

    /** Returns the resulting state; only {@link LocationPermissionState#GRANTED} allows a position query. */
    public synchronized LocationPermissionState ensureGranted(ConsentPurpose justification) {
        PermissionStatus checked = provider.checkPermission();
        if (checked == PermissionStatus.UNAVAILABLE) {
            throw CollectionException.unavailable("Location services are not available on this device");
        }
        if (checked == PermissionStatus.GRANTED) {
            moveTo(LocationPermissionState.GRANTED);
            return state;
        }
        if (checked == PermissionStatus.BLOCKED || state == LocationPermissionState.BLOCKED) {
            moveTo(LocationPermissionState.BLOCKED);
            return state;
        }
        if (state == LocationPermissionState.GRANTED) {
            // revoked in the settings since last cycle
            moveTo(LocationPermissionState.DENIED);
        }

        moveTo(LocationPermissionState.REQUESTED);
        PermissionStatus answer = provider.requestPermission(justification);
        switch (answer) {
            case GRANTED:
                moveTo(LocationPermissionState.GRANTED);
                break;
            case BLOCKED:
                moveTo(LocationPermissionState.BLOCKED);
                break;
            default:
                moveTo(LocationPermissionState.DENIED);
        }
        return state;
    }

    private void moveTo(LocationPermissionState next) {
        if (state == next) return;
        if (!state.canMoveTo(next)) {
            throw new IllegalStateException("Illegal location permission transition " + state + " -> " + next);
        }
        log.debug("Location permission {} -> {}", state, next);
        state = next;
    }
}
