package com.demo.altcredit.service.collect.collectors;

import com.demo.altcredit.service.collect.AbstractSourceCollector;
import com.demo.altcredit.service.collect.CollectionException;
import com.demo.altcredit.service.collect.PayloadBuilder;
import com.demo.altcredit.service.collect.SourceId;
import com.demo.altcredit.service.collect.device.DeviceAttributes;
import com.demo.altcredit.service.collect.device.DeviceCapabilityProvider;
import com.demo.altcredit.service.collect.device.StorageSignatureProvider;
import com.demo.altcredit.service.consent.ConsentState;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

/** Device ownership/usage patterns and payment behavior indicators. */
@Slf4j
public class DigitalFootprintCollector extends AbstractSourceCollector {

    public static final String DAYS_SINCE_FIRST_INSTALL = "daysSinceFirstInstall";
    public static final String OWNERSHIP_STABILITY = "ownershipStability";
    public static final String DEVICE_UPTIME_HOURS = "deviceUptimeHours";
    public static final String BATTERY_LEVEL = "batteryLevel";
    public static final String USAGE_HOUR = "usageHour";
    public static final String BIOMETRIC_ENABLED = "biometricEnabled";
    public static final String IS_EMULATOR = "isEmulator";
    public static final String PAYMENT_METHODS = "paymentMethods";

    private static final long DAY_MS = 24L * 60 * 60 * 1000;
    private static final long HOUR_MS = 60L * 60 * 1000;

    private final DeviceCapabilityProvider device;
    private final StorageSignatureProvider storage;

    public DigitalFootprintCollector(ConsentState consent, ObjectMapper objectMapper, Clock clock, Duration timeout,
                                     DeviceCapabilityProvider device, StorageSignatureProvider storage) {
        super(SourceId.DIGITAL_FOOTPRINT, consent, objectMapper, clock, timeout);
        this.device = device;
        this.storage = storage;
    }

    @Override
    protected void gather(PayloadBuilder payload, List<String> failedSections) {
        section("deviceUsage", failedSections, () -> {
            Map<String, Object> attrs = device.attributes();
            Long firstInstall = DeviceAttributes.number(attrs, DeviceAttributes.FIRST_INSTALL_TIME);
            if (firstInstall == null) throw CollectionException.unavailable("First install time not reported");
            long days = Math.max(0, (clock().millis() - firstInstall) / DAY_MS);
            Long uptime = DeviceAttributes.number(attrs, DeviceAttributes.UPTIME_MS);
            payload.put(DAYS_SINCE_FIRST_INSTALL, days)
                    .put(OWNERSHIP_STABILITY, ownershipStability(days))
                    .put(DEVICE_UPTIME_HOURS, uptime == null ? null : uptime / HOUR_MS)
                    .put(BATTERY_LEVEL, DeviceAttributes.decimal(attrs, DeviceAttributes.BATTERY_LEVEL))
                    .put(USAGE_HOUR, clock().instant().atZone(ZoneOffset.UTC).getHour());
        });

        section("securityProfile", failedSections, () -> {
            Map<String, Object> attrs = device.attributes();
            Boolean biometric = DeviceAttributes.flag(attrs, DeviceAttributes.BIOMETRIC_AVAILABLE);
            Boolean emulator = DeviceAttributes.flag(attrs, DeviceAttributes.IS_EMULATOR);
            if (biometric == null && emulator == null) throw CollectionException.unavailable("Security profile not reported");
            payload.put(BIOMETRIC_ENABLED, biometric).put(IS_EMULATOR, emulator);
        });

        section("paymentBehavior", failedSections, () -> {
            boolean paymentRequest = false;
            boolean mobile = false;
            try {
                Map<String, Object> attrs = device.attributes();
                paymentRequest = Boolean.TRUE.equals(DeviceAttributes.flag(attrs, DeviceAttributes.PAYMENT_REQUEST_SUPPORTED));
                mobile = DeviceAttributes.isMobile(DeviceAttributes.string(attrs, DeviceAttributes.PLATFORM));
            } catch (CollectionException ex) {
                // storage signatures alone still tell us about wallets
                log.debug("Payment inference without device attributes: {}", ex.getMessage());
            }
            payload.putHeuristic(PAYMENT_METHODS, SignatureHeuristics.paymentMethods(
                    storage.storageKeys(), storage.cookies(), paymentRequest, mobile));
        });
    }

    static String ownershipStability(long daysSinceInstall) {
        if (daysSinceInstall > 365) return "very_stable";
        if (daysSinceInstall > 180) return "stable";
        if (daysSinceInstall > 90) return "moderate";
        if (daysSinceInstall > 30) return "new";
        return "very_new";
    }
}
