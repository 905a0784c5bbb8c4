package org.assetlink.models.dto;

import java.util.List;

public record SourceDTO(
        String id,
        String label,
        String fileName,
        String color,
        List<String> headers,
        int rowCount
) {
}
