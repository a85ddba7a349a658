package com.demo.altcredit.service.collect.collectors;

import com.demo.altcredit.service.collect.AbstractSourceCollector;
import com.demo.altcredit.service.collect.PayloadBuilder;
import com.demo.altcredit.service.collect.SourceId;
import com.demo.altcredit.service.collect.device.NetworkInfoProvider;
import com.demo.altcredit.service.collect.device.NetworkSnapshot;
import com.demo.altcredit.service.collect.device.StorageSignatureProvider;
import com.demo.altcredit.service.consent.ConsentState;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/** Connectivity/service usage and subscription behavior. */
public class UtilityCollector extends AbstractSourceCollector {

    public static final String CONNECTION_TYPE = "connectionType";
    public static final String CONNECTED = "connected";
    public static final String EXPENSIVE = "expensive";
    public static final String SIGNAL_STRENGTH = "signalStrength";
    public static final String WIFI_PERCENTAGE = "wifiPercentage";
    public static final String CELLULAR_PERCENTAGE = "cellularPercentage";
    public static final String CONNECTION_STABILITY = "connectionStability";
    public static final String SUBSCRIPTION_SERVICES = "subscriptionServices";

    private final NetworkInfoProvider network;
    private final StorageSignatureProvider storage;

    public UtilityCollector(ConsentState consent, ObjectMapper objectMapper, Clock clock, Duration timeout,
                            NetworkInfoProvider network, StorageSignatureProvider storage) {
        super(SourceId.UTILITY, consent, objectMapper, clock, timeout);
        this.network = network;
        this.storage = storage;
    }

    @Override
    protected void gather(PayloadBuilder payload, List<String> failedSections) {
        section("connectivity", failedSections, () -> {
            NetworkSnapshot n = network.current();
            payload.put(CONNECTION_TYPE, n.type() == null ? "unknown" : n.type())
                    .put(CONNECTED, n.connected())
                    .put(EXPENSIVE, n.expensive())
                    .put(SIGNAL_STRENGTH, n.signalStrength())
                    .put(WIFI_PERCENTAGE, n.wifiPercentage())
                    .put(CELLULAR_PERCENTAGE, n.cellularPercentage())
                    .put(CONNECTION_STABILITY, n.stabilityScore());
        });

        section("subscriptions", failedSections, () ->
                payload.putHeuristic(SUBSCRIPTION_SERVICES,
                        SignatureHeuristics.subscriptionServices(storage.storageKeys(), storage.cookies())));
    }
}
