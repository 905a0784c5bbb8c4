package org.assetlink.models.dto;

import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.Map;

public record CreateSourceRequest(
        String label,
        String fileName,
        @NotNull List<Map<String, Object>> rows
) {
}
