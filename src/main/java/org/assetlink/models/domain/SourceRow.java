package org.assetlink.models.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * One row of an imported source: column name to cell, in the column order of the source.
 * Column names are trimmed; the row is immutable once built.
 */
public final class SourceRow {

    private final Map<String, CellValue> cells;

    private SourceRow(Map<String, CellValue> cells) {
        this.cells = Collections.unmodifiableMap(cells);
    }

    public static SourceRow of(Map<String, ?> values) {
        Map<String, CellValue> cells = new LinkedHashMap<>();
        if (values != null) {
            values.forEach((column, value) -> {
                if (column != null) {
                    cells.put(column.trim(), CellValue.of(value));
                }
            });
        }
        return new SourceRow(cells);
    }

    public Set<String> columns() {
        return cells.keySet();
    }

    public CellValue get(String column) {
        return cells.getOrDefault(column, CellValue.EMPTY);
    }

    public Map<String, CellValue> cells() {
        return cells;
    }

    public boolean isBlank() {
        return cells.values().stream().allMatch(CellValue::isBlank);
    }

    public Map<String, Object> toRawMap() {
        Map<String, Object> raw = new LinkedHashMap<>();
        cells.forEach((column, cell) -> raw.put(column, cell.raw()));
        return raw;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof SourceRow row)) {
            return false;
        }
        return cells.equals(row.cells);
    }

    @Override
    public int hashCode() {
        return cells.hashCode();
    }

    @Override
    public String toString() {
        return cells.toString();
    }
}
