package org.assetlink.models.domain;

/**
 * Provenance of one row that was attached to an asset.
 */
public record SourceDetail(
        String sourceId,
        String sourceLabel,
        String sourceColor,
        SourceRow row
) {

    public static SourceDetail of(Source source, SourceRow row) {
        return new SourceDetail(source.getId(), source.getLabel(), source.getColor(), row);
    }
}
