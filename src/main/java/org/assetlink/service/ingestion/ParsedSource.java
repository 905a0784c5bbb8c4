package org.assetlink.service.ingestion;

import org.assetlink.models.domain.SourceRow;

import java.util.List;

public record ParsedSource(
        String fileName,
        List<String> headers,
        List<SourceRow> rows
) {
}
