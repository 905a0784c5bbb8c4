package org.assetlink.models.dto;

import java.util.List;

public record AssetDetailDTO(
        AssetDTO asset,
        List<SourceDetailDTO> sourceDetails
) {
}
