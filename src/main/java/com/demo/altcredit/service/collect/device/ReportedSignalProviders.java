package com.demo.altcredit.service.collect.device;

import com.demo.altcredit.service.collect.CollectionException;
import com.demo.altcredit.service.consent.ConsentPurpose;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Backs every provider with the latest snapshot reported by the client. Until a snapshot
 * arrives, or when a part of it is missing, the corresponding provider is unavailable.
 */
@Slf4j
public class ReportedSignalProviders
        implements DeviceCapabilityProvider, NetworkInfoProvider, StorageSignatureProvider, LocationProvider {

    private final AtomicReference<ReportedSignals> latest = new AtomicReference<>();

    public void report(ReportedSignals signals) {
        latest.set(signals);
    }

    public void clear() {
        latest.set(null);
    }

    private ReportedSignals snapshot() {
        ReportedSignals s = latest.get();
        if (s == null) throw CollectionException.unavailable("No device snapshot reported");
        return s;
    }

    @Override
    public Map<String, Object> attributes() {
        Map<String, Object> attrs = snapshot().deviceAttributes();
        if (attrs == null || attrs.isEmpty()) throw CollectionException.unavailable("Device attributes not reported");
        return attrs;
    }

    @Override
    public NetworkSnapshot current() {
        NetworkSnapshot n = snapshot().network();
        if (n == null) throw CollectionException.unavailable("Network info not reported");
        return n;
    }

    @Override
    public Set<String> storageKeys() {
        var keys = snapshot().storageKeys();
        if (keys == null) throw CollectionException.unavailable("Storage signatures not reported");
        return new LinkedHashSet<>(keys);
    }

    @Override
    public String cookies() {
        String c = snapshot().cookies();
        return c == null ? "" : c;
    }

    @Override
    public PermissionStatus checkPermission() {
        PermissionStatus p = snapshot().locationPermission();
        return p == null ? PermissionStatus.DENIED : p;
    }

    /** The client owns the OS prompt; a request just re-reads what it reported afterwards. */
    @Override
    public PermissionStatus requestPermission(ConsentPurpose justification) {
        log.debug("Location permission requested for {}", justification);
        return checkPermission();
    }

    @Override
    public RawPosition currentPosition(Duration timeout) {
        RawPosition p = snapshot().position();
        if (p == null) throw CollectionException.unavailable("Location services are not available");
        return p;
    }
}
