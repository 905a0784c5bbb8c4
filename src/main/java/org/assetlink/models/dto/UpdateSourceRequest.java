package org.assetlink.models.dto;

import jakarta.validation.constraints.NotBlank;

public record UpdateSourceRequest(
        @NotBlank String label
) {
}
