package org.assetlink.controllers;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.assetlink.models.domain.NormalizedAsset;
import org.assetlink.models.domain.SourceDetail;
import org.assetlink.models.dto.AssetDTO;
import org.assetlink.models.dto.AssetDetailDTO;
import org.assetlink.models.dto.AssetPage;
import org.assetlink.models.dto.AssetSummaryDTO;
import org.assetlink.models.dto.SourceDetailDTO;
import org.assetlink.models.enums.CardinalityMode;
import org.assetlink.service.AssetExportService;
import org.assetlink.service.AssetQuery;
import org.assetlink.service.AssetQueryService;
import org.assetlink.service.resolution.MacAddressFormatter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
@RestController
@RequestMapping("/api/assets")
@RequiredArgsConstructor
public class AssetController {

    private final AssetQueryService assetQueryService;
    private final AssetExportService assetExportService;

    @Value("${assetlink.display.page-limit:500}")
    private int pageLimit;

    @GetMapping
    public AssetPage listAssets(@RequestParam(value = "q", required = false) String term,
                                @RequestParam(value = "source", required = false) List<String> sourceIds,
                                @RequestParam(value = "mode", required = false) String mode) {
        List<NormalizedAsset> matches = assetQueryService.search(toQuery(term, sourceIds, mode));
        List<AssetDTO> content = matches.stream()
                .limit(pageLimit)
                .map(AssetController::toDto)
                .collect(Collectors.toList());
        return new AssetPage(content, matches.size(), pageLimit, matches.size() > pageLimit);
    }

    @GetMapping("/summary")
    public AssetSummaryDTO summary() {
        return assetQueryService.summarize();
    }

    @GetMapping("/export")
    public ResponseEntity<byte[]> exportAssets(@RequestParam(value = "q", required = false) String term,
                                               @RequestParam(value = "source", required = false) List<String> sourceIds,
                                               @RequestParam(value = "mode", required = false) String mode) {
        List<NormalizedAsset> matches = assetQueryService.search(toQuery(term, sourceIds, mode));
        if (matches.isEmpty()) {
            return ResponseEntity.noContent().build();
        }
        byte[] payload = assetExportService.writeCsv(assetExportService.toRows(matches));
        String filename = assetExportService.exportFilename(LocalDate.now());
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + filename + "\"")
                .contentType(new MediaType("text", "csv", StandardCharsets.UTF_8))
                .body(payload);
    }

    @GetMapping("/{key}")
    public AssetDetailDTO getAsset(@PathVariable int key) {
        NormalizedAsset asset = assetQueryService.findByKey(key)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Asset not found: " + key));
        List<SourceDetailDTO> details = new ArrayList<>();
        for (SourceDetail detail : asset.getSourceDetails()) {
            details.add(new SourceDetailDTO(
                    detail.sourceId(),
                    detail.sourceLabel(),
                    detail.sourceColor(),
                    detail.row().toRawMap()
            ));
        }
        return new AssetDetailDTO(toDto(asset), details);
    }

    private AssetQuery toQuery(String term, List<String> sourceIds, String mode) {
        CardinalityMode cardinality;
        try {
            cardinality = CardinalityMode.fromParameter(mode);
        } catch (IllegalArgumentException exception) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, exception.getMessage(), exception);
        }
        Set<String> sources = sourceIds == null ? Set.of() : Set.copyOf(sourceIds);
        return new AssetQuery(term, sources, cardinality);
    }

    static AssetDTO toDto(NormalizedAsset asset) {
        return new AssetDTO(
                asset.getKey(),
                asset.getId(),
                asset.getMac(),
                asset.getMac() != null ? MacAddressFormatter.format(asset.getMac()) : null,
                asset.getHostname(),
                asset.getIp(),
                asset.getManufacturer(),
                asset.matchType().orElse(null),
                asset.isSynced(),
                List.copyOf(asset.getSources()),
                asset.getSources().size()
        );
    }
}
