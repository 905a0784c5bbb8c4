package org.assetlink.service.resolution;

import org.assetlink.models.domain.SourceRow;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Locates a semantic field in a row whose column names are not known in advance.
 * <p>
 * A column matches when its name, lower-cased and stripped of whitespace, hyphens and underscores,
 * equals one of the aliases treated the same way. Columns are scanned in the row's own order and
 * the first match is used even if its value turns out to be blank.
 */
public final class FieldExtractor {

    private static final Pattern HEADER_NOISE = Pattern.compile("[\\s\\-_]");

    private FieldExtractor() {
    }

    public static Optional<String> extract(SourceRow row, FieldType field) {
        return extract(row, field.aliases());
    }

    public static Optional<String> extract(SourceRow row, List<String> aliases) {
        if (row == null || aliases == null || aliases.isEmpty()) {
            return Optional.empty();
        }
        List<String> normalizedAliases = aliases.stream().map(FieldExtractor::normalizeHeader).toList();
        for (String column : row.columns()) {
            if (normalizedAliases.contains(normalizeHeader(column))) {
                String value = row.get(column).asText();
                return value == null || value.isEmpty() ? Optional.empty() : Optional.of(value);
            }
        }
        return Optional.empty();
    }

    public static String normalizeHeader(String header) {
        return HEADER_NOISE.matcher(header.toLowerCase(Locale.ROOT)).replaceAll("");
    }
}
