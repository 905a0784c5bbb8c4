package org.assetlink.service.resolution;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Canonical forms for the identity-bearing fields. Every method is total: unusable input yields
 * {@link Optional#empty()} and nothing is ever thrown.
 */
public final class FieldNormalizer {

    private static final Pattern MAC_SEPARATORS = Pattern.compile("[:\\-.]");
    private static final Pattern MAC_HEX = Pattern.compile("^[0-9a-f]{12}$");
    private static final Pattern MAC_PLACEHOLDER = Pattern.compile("^(0+|f+)$");

    // Syntactic only, octets above 255 pass.
    private static final Pattern IPV4 = Pattern.compile("^(?:[0-9]{1,3}\\.){3}[0-9]{1,3}$");
    private static final Set<String> IP_PLACEHOLDERS = Set.of("0.0.0.0", "127.0.0.1");

    private static final Set<String> HOSTNAME_PLACEHOLDERS = Set.of("null", "undefined", "unknown");

    private FieldNormalizer() {
    }

    public static Optional<String> normalizeMac(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String clean = MAC_SEPARATORS.matcher(raw.trim()).replaceAll("").toLowerCase(Locale.ROOT);
        if (!MAC_HEX.matcher(clean).matches() || MAC_PLACEHOLDER.matcher(clean).matches()) {
            return Optional.empty();
        }
        return Optional.of(clean);
    }

    public static Optional<String> normalizeHostname(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String clean = raw.toLowerCase(Locale.ROOT).trim();
        if (clean.isEmpty() || HOSTNAME_PLACEHOLDERS.contains(clean)) {
            return Optional.empty();
        }
        return Optional.of(clean);
    }

    public static Optional<String> normalizeIp(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String clean = raw.trim();
        if (clean.isEmpty() || IP_PLACEHOLDERS.contains(clean) || !IPV4.matcher(clean).matches()) {
            return Optional.empty();
        }
        return Optional.of(clean);
    }

    public static Optional<String> normalizeGenericId(String raw) {
        return trimmed(raw);
    }

    public static Optional<String> normalizeManufacturer(String raw) {
        return trimmed(raw);
    }

    private static Optional<String> trimmed(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String clean = raw.trim();
        return clean.isEmpty() ? Optional.empty() : Optional.of(clean);
    }
}
