package org.assetlink.service.ingestion;

import org.assetlink.models.domain.Source;
import org.assetlink.models.dto.ImportFailure;

import java.util.List;

public record ImportOutcome(
        List<Source> imported,
        List<ImportFailure> failures
) {
}
