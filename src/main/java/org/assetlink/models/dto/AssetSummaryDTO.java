package org.assetlink.models.dto;

import org.assetlink.models.enums.ResolutionMode;

import java.util.List;

public record AssetSummaryDTO(
        long totalAssets,
        long syncedAssets,
        long uniqueAssets,
        int rowsConsumed,
        int rowsDropped,
        ResolutionMode mode,
        List<SourceCoverageDTO> coverage
) {
}
