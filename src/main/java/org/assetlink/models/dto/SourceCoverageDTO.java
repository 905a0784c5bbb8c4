package org.assetlink.models.dto;

public record SourceCoverageDTO(
        String sourceId,
        String label,
        String color,
        long assetCount,
        double share
) {
}
