package org.assetlink.service.ingestion;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.assetlink.models.domain.SourceRow;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Reads a CSV inventory whose first record is the header. Header names are trimmed, duplicated
 * names get a numeric suffix, cell values are kept as text and rows without any value are skipped.
 */
@Slf4j
@Component
public class CsvRecordExtractor implements RecordExtractor {

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setIgnoreEmptyLines(true)
            .build();

    @Override
    public boolean supports(String fileName) {
        return fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".csv");
    }

    @Override
    public ParsedSource extract(String fileName, byte[] content, Charset charset) throws SourceParseException {
        if (content == null || content.length == 0) {
            throw new SourceParseException("CSV file is empty: " + fileName);
        }
        String text = new String(content, charset);
        if (!text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK) {
            text = text.substring(1);
        }

        try (CSVParser parser = CSVParser.parse(new StringReader(text), FORMAT)) {
            Iterator<CSVRecord> records = parser.iterator();
            if (!records.hasNext()) {
                throw new SourceParseException("CSV file has no header row: " + fileName);
            }
            List<String> headers = readHeaders(records.next());

            List<SourceRow> rows = new ArrayList<>();
            int skipped = 0;
            while (records.hasNext()) {
                CSVRecord record = records.next();
                Map<String, Object> values = new LinkedHashMap<>();
                for (int i = 0; i < headers.size(); i++) {
                    values.put(headers.get(i), i < record.size() ? record.get(i) : "");
                }
                SourceRow row = SourceRow.of(values);
                if (row.isBlank()) {
                    skipped++;
                    continue;
                }
                rows.add(row);
            }

            log.info("Parsed {} rows from {} ({} blank rows skipped)", rows.size(), fileName, skipped);
            return new ParsedSource(fileName, headers, rows);
        } catch (IOException | UncheckedIOException | IllegalStateException exception) {
            throw new SourceParseException("Failed to parse CSV " + fileName + ": " + exception.getMessage(), exception);
        }
    }

    @Async("sourceParseExecutor")
    @Override
    public CompletableFuture<ParsedSource> extractAsync(String fileName, byte[] content, Charset charset) {
        try {
            return CompletableFuture.completedFuture(extract(fileName, content, charset));
        } catch (SourceParseException exception) {
            return CompletableFuture.failedFuture(exception);
        }
    }

    private List<String> readHeaders(CSVRecord headerRecord) {
        List<String> headers = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (String raw : headerRecord) {
            String header = raw == null ? "" : raw.trim();
            String unique = header;
            int suffix = 1;
            while (!seen.add(unique)) {
                unique = header + "_" + suffix++;
            }
            headers.add(unique);
        }
        return headers;
    }
}
