package org.assetlink.controllers;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.assetlink.models.domain.Source;
import org.assetlink.models.dto.CreateSourceRequest;
import org.assetlink.models.dto.ImportFailure;
import org.assetlink.models.dto.ImportReport;
import org.assetlink.models.dto.SourceDTO;
import org.assetlink.models.dto.UpdateSourceRequest;
import org.assetlink.service.SourceNotFoundException;
import org.assetlink.service.SourceRegistry;
import org.assetlink.service.ingestion.ImportOutcome;
import org.assetlink.service.ingestion.PendingUpload;
import org.assetlink.service.ingestion.SourceImportService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@RestController
@RequestMapping("/api/sources")
@RequiredArgsConstructor
public class SourceController {

    private final SourceRegistry sourceRegistry;
    private final SourceImportService sourceImportService;

    @GetMapping
    public ResponseEntity<List<SourceDTO>> getAllSources() {
        List<SourceDTO> sources = sourceRegistry.list().stream()
                .map(SourceController::toDto)
                .collect(Collectors.toList());
        return ResponseEntity.ok(sources);
    }

    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ImportReport> uploadSources(@RequestParam("files") List<MultipartFile> files,
                                                      @RequestParam(value = "labels", required = false) List<String> labels,
                                                      @RequestParam(value = "encoding", defaultValue = "UTF-8") String encoding) {
        if (files == null || files.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "At least one file is required");
        }
        Charset charset = resolveCharset(encoding);
        log.info("Received {} file(s) for import", files.size());

        List<PendingUpload> uploads = new ArrayList<>();
        List<ImportFailure> unreadable = new ArrayList<>();
        for (int i = 0; i < files.size(); i++) {
            MultipartFile file = files.get(i);
            String label = labels != null && i < labels.size() ? labels.get(i) : null;
            try {
                uploads.add(new PendingUpload(file.getOriginalFilename(), label, file.getBytes()));
            } catch (IOException exception) {
                log.error("Error reading uploaded file {}: {}", file.getOriginalFilename(), exception.getMessage(), exception);
                unreadable.add(new ImportFailure(file.getOriginalFilename(), "Failed to read upload: " + exception.getMessage()));
            }
        }

        ImportOutcome outcome = sourceImportService.importFiles(uploads, charset);
        List<ImportFailure> failures = new ArrayList<>(unreadable);
        failures.addAll(outcome.failures());

        List<SourceDTO> imported = outcome.imported().stream()
                .map(SourceController::toDto)
                .collect(Collectors.toList());
        return ResponseEntity.ok(new ImportReport(imported, failures));
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<SourceDTO> addSource(@Valid @RequestBody CreateSourceRequest request) {
        try {
            Source source = sourceImportService.importRows(request.label(), request.fileName(), request.rows());
            return ResponseEntity.ok(toDto(source));
        } catch (IllegalStateException exception) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, exception.getMessage(), exception);
        } catch (IllegalArgumentException exception) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, exception.getMessage(), exception);
        }
    }

    @PatchMapping("/{id}")
    public ResponseEntity<SourceDTO> updateLabel(@PathVariable String id,
                                                 @Valid @RequestBody UpdateSourceRequest request) {
        try {
            return ResponseEntity.ok(toDto(sourceRegistry.relabel(id, request.label())));
        } catch (SourceNotFoundException exception) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, exception.getMessage(), exception);
        }
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteSource(@PathVariable String id) {
        try {
            sourceRegistry.remove(id);
        } catch (SourceNotFoundException exception) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, exception.getMessage(), exception);
        }
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping
    public ResponseEntity<Void> deleteAllSources() {
        sourceRegistry.clear();
        return ResponseEntity.noContent().build();
    }

    static SourceDTO toDto(Source source) {
        return new SourceDTO(
                source.getId(),
                source.getLabel(),
                source.getFileName(),
                source.getColor(),
                source.getHeaders(),
                source.getRows().size()
        );
    }

    private Charset resolveCharset(String encoding) {
        try {
            return Charset.forName(encoding);
        } catch (IllegalArgumentException exception) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unsupported encoding: " + encoding, exception);
        }
    }
}
