package org.assetlink.models.dto;

public record ImportFailure(
        String fileName,
        String reason
) {
}
