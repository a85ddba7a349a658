package com.demo.altcredit.service.collect.collectors;

import com.demo.altcredit.service.collect.AbstractSourceCollector;
import com.demo.altcredit.service.collect.CollectionException;
import com.demo.altcredit.service.collect.PayloadBuilder;
import com.demo.altcredit.service.collect.SourceId;
import com.demo.altcredit.service.collect.device.LocationProvider;
import com.demo.altcredit.service.collect.device.RawPosition;
import com.demo.altcredit.service.consent.ConsentPurpose;
import com.demo.altcredit.service.consent.ConsentState;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Coarse location for {@code purpose}. The raw position is coarsened immediately and only
 * the coarse values reach the payload.
 */
public class LocationCollector extends AbstractSourceCollector {

    public static final String LATITUDE = "latitude";
    public static final String LONGITUDE = "longitude";
    public static final String ACCURACY = "accuracy";
    public static final String TIMESTAMP = "timestamp";
    public static final String PRECISION = "precision";
    public static final String MOCKED = "mocked";
    public static final String PERMISSION_STATE = "permissionState";
    public static final String PURPOSE = "purpose";

    private final LocationProvider provider;
    private final LocationPermissionFlow permission;
    private final ConsentPurpose purpose;

    public LocationCollector(ConsentState consent, ObjectMapper objectMapper, Clock clock, Duration timeout,
                             LocationProvider provider, ConsentPurpose purpose) {
        super(SourceId.LOCATION, consent, objectMapper, clock, timeout);
        this.provider = provider;
        this.permission = new LocationPermissionFlow(provider);
        this.purpose = purpose;
    }

    public LocationPermissionState permissionState() {
        return permission.state();
    }

    @Override
    protected void gather(PayloadBuilder payload, List<String> failedSections) {
        LocationPermissionState state = permission.ensureGranted(purpose);
        if (state == LocationPermissionState.BLOCKED) {
            throw CollectionException.permissionBlocked("Location permission blocked; enable it in device settings");
        }
        if (state != LocationPermissionState.GRANTED) {
            throw CollectionException.permissionDenied("Location permission denied");
        }

        RawPosition raw = provider.currentPosition(timeout());
        CoarseLocation coarse = CoarseLocation.of(raw);
        payload.put(LATITUDE, coarse.latitude())
                .put(LONGITUDE, coarse.longitude())
                .put(ACCURACY, coarse.accuracy())
                .put(TIMESTAMP, coarse.timestamp())
                .put(PRECISION, "coarse")
                .put(MOCKED, raw.mocked())
                .put(PERMISSION_STATE, state.name())
                .put(PURPOSE, purpose.name());
    }
}
