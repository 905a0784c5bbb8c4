package org.assetlink.models.dto;

import java.util.Map;

public record SourceDetailDTO(
        String sourceId,
        String sourceLabel,
        String sourceColor,
        Map<String, Object> data
) {
}
