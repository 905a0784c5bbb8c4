package org.assetlink.service.resolution;

import java.util.Locale;

/**
 * Display rendering of canonical MAC addresses, e.g. {@code 0b5aa8000102} becomes
 * {@code 0B:5A:A8:00:01:02}. Never used for identity comparison.
 */
public final class MacAddressFormatter {

    public static final String PLACEHOLDER = "—";

    private MacAddressFormatter() {
    }

    public static String format(String normalized) {
        if (normalized == null || normalized.length() != 12) {
            return PLACEHOLDER;
        }
        StringBuilder builder = new StringBuilder(17);
        for (int i = 0; i < normalized.length(); i += 2) {
            if (i > 0) {
                builder.append(':');
            }
            builder.append(normalized, i, i + 2);
        }
        return builder.toString().toUpperCase(Locale.ROOT);
    }
}
