package org.assetlink.service.ingestion;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.assetlink.models.domain.Source;
import org.assetlink.models.domain.SourceRow;
import org.assetlink.models.dto.ImportFailure;
import org.assetlink.service.SourceRegistry;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Turns uploaded files into registered sources.
 * <p>
 * Files of one batch are parsed concurrently, but are registered in the order they were submitted
 * so asset ids and ordering do not depend on which parse finishes first. A file that cannot be
 * parsed is reported and contributes nothing; the rest of the batch is still imported.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SourceImportService {

    private final List<RecordExtractor> extractors;
    private final SourceRegistry sourceRegistry;

    public ImportOutcome importFiles(List<PendingUpload> uploads, Charset charset) {
        List<Source> imported = new ArrayList<>();
        List<ImportFailure> failures = new ArrayList<>();
        if (uploads == null || uploads.isEmpty()) {
            return new ImportOutcome(imported, failures);
        }

        List<PendingParse> pending = new ArrayList<>();
        for (PendingUpload upload : uploads) {
            RecordExtractor extractor = findExtractor(upload.fileName());
            if (extractor == null) {
                log.warn("Skipping {}: unsupported file type", upload.fileName());
                failures.add(new ImportFailure(upload.fileName(), "Unsupported file type, expected .csv"));
                continue;
            }
            try {
                pending.add(new PendingParse(upload, extractor.extractAsync(upload.fileName(), upload.content(), charset)));
            } catch (TaskRejectedException exception) {
                log.warn("Rejected {}: parse queue is full", upload.fileName());
                failures.add(new ImportFailure(upload.fileName(), "Too many files in one upload, parse queue is full"));
            }
        }

        for (PendingParse parse : pending) {
            PendingUpload upload = parse.upload();
            ParsedSource parsed;
            try {
                parsed = parse.future().get();
            } catch (ExecutionException | CompletionException exception) {
                Throwable cause = exception.getCause() != null ? exception.getCause() : exception;
                log.warn("Failed to import {}: {}", upload.fileName(), cause.getMessage());
                failures.add(new ImportFailure(upload.fileName(), cause.getMessage()));
                continue;
            } catch (InterruptedException exception) {
                Thread.currentThread().interrupt();
                failures.add(new ImportFailure(upload.fileName(), "Import interrupted"));
                continue;
            }

            try {
                imported.add(sourceRegistry.register(upload.label(), parsed.fileName(), parsed.headers(), parsed.rows()));
            } catch (IllegalStateException exception) {
                log.warn("Rejected {}: {}", upload.fileName(), exception.getMessage());
                failures.add(new ImportFailure(upload.fileName(), exception.getMessage()));
            }
        }

        log.info("Imported {} of {} files ({} failed)", imported.size(), uploads.size(), failures.size());
        return new ImportOutcome(imported, failures);
    }

    /**
     * Registers a source from already-typed rows, e.g. a JSON payload. Blank rows are skipped.
     */
    public Source importRows(String label, String fileName, List<Map<String, Object>> rawRows) {
        if (!StringUtils.hasText(fileName) && !StringUtils.hasText(label)) {
            throw new IllegalArgumentException("Either a label or a file name is required");
        }
        if (rawRows == null) {
            throw new IllegalArgumentException("Rows are required");
        }
        Set<String> headers = new LinkedHashSet<>();
        List<SourceRow> rows = new ArrayList<>();
        for (Map<String, Object> rawRow : rawRows) {
            SourceRow row = SourceRow.of(rawRow);
            headers.addAll(row.columns());
            if (!row.isBlank()) {
                rows.add(row);
            }
        }
        String resolvedName = StringUtils.hasText(fileName) ? fileName : label;
        return sourceRegistry.register(label, resolvedName, List.copyOf(headers), rows);
    }

    private RecordExtractor findExtractor(String fileName) {
        return extractors.stream()
                .filter(extractor -> extractor.supports(fileName))
                .findFirst()
                .orElse(null);
    }

    private record PendingParse(PendingUpload upload, CompletableFuture<ParsedSource> future) {
    }
}
