package com.demo.altcredit.service.collect.device;

import java.util.Map;

/** Attribute names of the flat device record and lenient typed readers over it. */
public final class DeviceAttributes {
    private DeviceAttributes() {}

    public static final String BRAND = "brand";
    public static final String MANUFACTURER = "manufacturer";
    public static final String MODEL = "model";
    public static final String PLATFORM = "platform";
    public static final String OS_VERSION = "osVersion";
    public static final String DEVICE_TYPE = "deviceType";
    public static final String TOTAL_MEMORY_BYTES = "totalMemoryBytes";
    public static final String TOTAL_STORAGE_BYTES = "totalStorageBytes";
    public static final String FREE_STORAGE_BYTES = "freeStorageBytes";
    public static final String PROCESSOR_COUNT = "processorCount";
    public static final String IS_EMULATOR = "isEmulator";
    public static final String IS_ROOTED = "isRooted";
    public static final String HAS_SCREEN_LOCK = "hasScreenLock";
    public static final String BIOMETRIC_AVAILABLE = "biometricAvailable";
    public static final String FIRST_INSTALL_TIME = "firstInstallTime"; // epoch ms
    public static final String UPTIME_MS = "uptimeMs";
    public static final String BATTERY_LEVEL = "batteryLevel";
    public static final String PAYMENT_REQUEST_SUPPORTED = "paymentRequestSupported";

    public static String string(Map<String, Object> attrs, String key) {
        Object v = attrs.get(key);
        return v == null ? null : String.valueOf(v);
    }

    public static Long number(Map<String, Object> attrs, String key) {
        Object v = attrs.get(key);
        if (v instanceof Number) return ((Number) v).longValue();
        if (v instanceof String) {
            try { return Long.parseLong(((String) v).trim()); }
            catch (NumberFormatException e) { return null; }
        }
        return null;
    }

    public static Double decimal(Map<String, Object> attrs, String key) {
        Object v = attrs.get(key);
        if (v instanceof Number) return ((Number) v).doubleValue();
        if (v instanceof String) {
            try { return Double.parseDouble(((String) v).trim()); }
            catch (NumberFormatException e) { return null; }
        }
        return null;
    }

    public static Boolean flag(Map<String, Object> attrs, String key) {
        Object v = attrs.get(key);
        if (v instanceof Boolean) return (Boolean) v;
        if (v instanceof String) return Boolean.parseBoolean((String) v);
        return null;
    }

    public static boolean isMobile(String platform) {
        if (platform == null) return false;
        String p = platform.toLowerCase();
        return p.equals("android") || p.equals("ios");
    }
}
