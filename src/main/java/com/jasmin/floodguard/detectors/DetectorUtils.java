package com.jasmin.floodguard.detectors;

import java.time.Duration;
import java.util.Locale;

public class DetectorUtils {
    private static final double LN_2 = Math.log(2.0);

    /**
     * Canonical form of a source key: trimmed, lower-cased, IPv4-mapped IPv6 prefix removed.
     * Returns {@code null} for null or blank input.
     */
    public static String normalizeSourceKey(String key) {
        if (key == null || key.isBlank()) {
            return null;
        }
        String k = key.trim().toLowerCase(Locale.ROOT);
        return stripIpv6Mapped(k);
    }

    public static String stripIpv6Mapped(String ip) {
        return ip.startsWith("::ffff:") ? ip.substring(7) : ip;
    }

    /** Clamps {@code v} into {@code [min, max]}; NaN maps to {@code min}. */
    public static double clamp(double v, double min, double max) {
        if (Double.isNaN(v)) return min;
        return Math.max(min, Math.min(max, v));
    }

    public static double log2(double v) {
        return Math.log(v) / LN_2;
    }

    /** Events per second over the given window. */
    public static double perSecond(long events, Duration window) {
        long millis = window.toMillis();
        return millis <= 0 ? 0.0 : events * 1000.0 / millis;
    }
}
