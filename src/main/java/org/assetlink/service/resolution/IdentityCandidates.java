package org.assetlink.service.resolution;

import org.assetlink.models.domain.SourceRow;

import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Normalized identity values found in one row. Absent values are {@code null}.
 */
public record IdentityCandidates(
        String mac,
        String hostname,
        String ip,
        String genericId,
        String manufacturer
) {

    public static IdentityCandidates from(SourceRow row) {
        return new IdentityCandidates(
                read(row, FieldType.MAC),
                read(row, FieldType.HOSTNAME),
                read(row, FieldType.IP),
                read(row, FieldType.GENERIC_ID),
                read(row, FieldType.MANUFACTURER)
        );
    }

    public boolean hasIdentity() {
        return mac != null || hostname != null || ip != null || genericId != null;
    }

    /**
     * First present identity value in priority order MAC, hostname, IP, generic id.
     */
    public Optional<String> primaryKey() {
        return Stream.of(mac, hostname, ip, genericId)
                .filter(Objects::nonNull)
                .findFirst();
    }

    public String valueOf(FieldType field) {
        return switch (field) {
            case MAC -> mac;
            case HOSTNAME -> hostname;
            case IP -> ip;
            case GENERIC_ID -> genericId;
            case MANUFACTURER -> manufacturer;
        };
    }

    private static String read(SourceRow row, FieldType field) {
        return FieldExtractor.extract(row, field)
                .flatMap(field::normalize)
                .orElse(null);
    }
}
