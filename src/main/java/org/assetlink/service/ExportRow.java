package org.assetlink.service;

/**
 * One flat line of the asset export.
 */
public record ExportRow(
        String status,
        String primaryIdentifier,
        String matchType,
        String hostname,
        String ip,
        String manufacturer,
        int sourcesCount,
        String sourcesList
) {

    public static final String[] HEADERS = {
            "Status",
            "Primary Identifier",
            "Match Type",
            "Hostname",
            "IP",
            "Manufacturer",
            "Sources Count",
            "Sources List"
    };

    String[] toColumns() {
        return new String[]{
                status,
                primaryIdentifier,
                matchType,
                hostname,
                ip,
                manufacturer,
                Integer.toString(sourcesCount),
                sourcesList
        };
    }
}
