package org.assetlink.models.dto;

import java.util.List;

public record AssetPage(
        List<AssetDTO> content,
        long totalElements,
        int limit,
        boolean truncated
) {
}
