package org.assetlink.models.dto;

import java.util.List;

public record ImportReport(
        List<SourceDTO> imported,
        List<ImportFailure> failures
) {
}
