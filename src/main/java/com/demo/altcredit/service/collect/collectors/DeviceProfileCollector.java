package com.demo.altcredit.service.collect.collectors;

import com.demo.altcredit.service.collect.AbstractSourceCollector;
import com.demo.altcredit.service.collect.CollectionException;
import com.demo.altcredit.service.collect.PayloadBuilder;
import com.demo.altcredit.service.collect.SourceId;
import com.demo.altcredit.service.collect.device.DeviceCapabilityProvider;
import com.demo.altcredit.service.consent.ConsentState;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.demo.altcredit.service.collect.device.DeviceAttributes.*;

/** Hardware profile, security posture and OS/memory stability of the device. */
public class DeviceProfileCollector extends AbstractSourceCollector {

    public static final String HARDWARE = "hardware";
    public static final String SECURITY_SCORE = "securityScore";
    public static final String SECURITY_LEVEL = "securityLevel";
    public static final String RISK_FACTORS = "riskFactors";
    public static final String STABILITY_SCORE = "stabilityScore";

    private static final long TWO_GB = 2L * 1024 * 1024 * 1024;

    private final DeviceCapabilityProvider device;

    public DeviceProfileCollector(ConsentState consent, ObjectMapper objectMapper, Clock clock,
                                  Duration timeout, DeviceCapabilityProvider device) {
        super(SourceId.DEVICE_PROFILE, consent, objectMapper, clock, timeout);
        this.device = device;
    }

    @Override
    protected void gather(PayloadBuilder payload, List<String> failedSections) {
        Map<String, Object> attrs = device.attributes();

        Map<String, Object> hw = new LinkedHashMap<>();
        for (String key : List.of(BRAND, MANUFACTURER, MODEL, PLATFORM, OS_VERSION, DEVICE_TYPE,
                TOTAL_MEMORY_BYTES, TOTAL_STORAGE_BYTES, FREE_STORAGE_BYTES, PROCESSOR_COUNT)) {
            if (attrs.get(key) != null) hw.put(key, attrs.get(key));
        }
        payload.put(HARDWARE, hw);
        payload.put(STABILITY_SCORE, stabilityScore(attrs));

        section("security", failedSections, () -> {
            Boolean emulator = flag(attrs, IS_EMULATOR);
            Boolean rooted = flag(attrs, IS_ROOTED);
            Boolean screenLock = flag(attrs, HAS_SCREEN_LOCK);
            Boolean biometric = flag(attrs, BIOMETRIC_AVAILABLE);
            if (emulator == null && rooted == null && screenLock == null && biometric == null) {
                throw CollectionException.unavailable("No security flags reported");
            }
            List<String> factors = new ArrayList<>();
            int score = 70;
            if (Boolean.TRUE.equals(emulator)) {
                factors.add("Emulator detected");
                score -= 30;
            }
            if (Boolean.TRUE.equals(rooted)) {
                factors.add("Device is rooted/jailbroken");
                score -= 25;
            }
            if (!Boolean.TRUE.equals(screenLock) && !Boolean.TRUE.equals(biometric)) {
                factors.add("No security features enabled");
                score -= 15;
            }
            score = Math.max(0, score);
            payload.put(IS_EMULATOR, emulator)
                    .put(IS_ROOTED, rooted)
                    .put(HAS_SCREEN_LOCK, screenLock)
                    .put(BIOMETRIC_AVAILABLE, biometric)
                    .put(SECURITY_SCORE, score)
                    .put(SECURITY_LEVEL, score >= 80 ? "high" : score >= 60 ? "medium" : "low")
                    .put(RISK_FACTORS, factors);
        });
    }

    static int stabilityScore(Map<String, Object> attrs) {
        int score = 100;
        String platform = string(attrs, PLATFORM);
        String version = string(attrs, OS_VERSION);
        if (platform != null && version != null && !version.isBlank()) {
            int minimumMajor = "ios".equalsIgnoreCase(platform) ? 14 : "android".equalsIgnoreCase(platform) ? 10 : -1;
            if (minimumMajor > 0) {
                try {
                    int major = Integer.parseInt(version.trim().split("\\.")[0]);
                    if (major < minimumMajor) score -= 20;
                } catch (NumberFormatException e) {
                    score -= 10;
                }
            }
        }
        Long memory = number(attrs, TOTAL_MEMORY_BYTES);
        if (memory != null && memory < TWO_GB) score -= 15;
        return Math.max(0, Math.min(100, score));
    }
}
