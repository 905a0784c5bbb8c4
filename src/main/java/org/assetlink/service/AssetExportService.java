package org.assetlink.service;

import com.opencsv.CSVWriter;
import lombok.extern.slf4j.Slf4j;
import org.assetlink.models.domain.NormalizedAsset;
import org.assetlink.models.domain.SourceDetail;
import org.assetlink.service.resolution.MacAddressFormatter;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
public class AssetExportService {

    static final String UNKNOWN_MANUFACTURER = "Unknown";

    public List<ExportRow> toRows(List<NormalizedAsset> assets) {
        return assets.stream().map(AssetExportService::toRow).toList();
    }

    public byte[] writeCsv(List<ExportRow> rows) {
        StringWriter buffer = new StringWriter();
        try (CSVWriter writer = new CSVWriter(buffer)) {
            writer.writeNext(ExportRow.HEADERS, false);
            for (ExportRow row : rows) {
                writer.writeNext(row.toColumns(), false);
            }
        } catch (IOException exception) {
            throw new UncheckedIOException("Failed to write asset export", exception);
        }
        log.info("Exported {} assets", rows.size());
        return buffer.toString().getBytes(StandardCharsets.UTF_8);
    }

    public String exportFilename(LocalDate date) {
        return "AssetLink_Export_" + DateTimeFormatter.ISO_LOCAL_DATE.format(date) + ".csv";
    }

    static ExportRow toRow(NormalizedAsset asset) {
        return new ExportRow(
                asset.isSynced() ? "Synced" : "Unique",
                asset.getMac() != null ? MacAddressFormatter.format(asset.getMac()) : asset.getId(),
                asset.matchType().map(Enum::name).orElse(""),
                nullToEmpty(asset.getHostname()),
                nullToEmpty(asset.getIp()),
                asset.getManufacturer() != null ? asset.getManufacturer() : UNKNOWN_MANUFACTURER,
                asset.getSources().size(),
                String.join(", ", labelsBySource(asset).values())
        );
    }

    private static Map<String, String> labelsBySource(NormalizedAsset asset) {
        Map<String, String> labels = new LinkedHashMap<>();
        for (String sourceId : asset.getSources()) {
            labels.put(sourceId, sourceId);
        }
        for (SourceDetail detail : asset.getSourceDetails()) {
            labels.replace(detail.sourceId(), detail.sourceId(), detail.sourceLabel());
        }
        return labels;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
