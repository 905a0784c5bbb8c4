package org.assetlink.models.domain;

import java.math.BigDecimal;

/**
 * A single scalar cell of an imported row. Cells are either text, a number, a boolean or empty.
 */
public sealed interface CellValue permits CellValue.TextCell, CellValue.NumberCell, CellValue.BooleanCell, CellValue.EmptyCell {

    CellValue EMPTY = new EmptyCell();

    /**
     * Trimmed textual rendering of the cell, or {@code null} for an empty cell.
     */
    String asText();

    /**
     * The value as it was supplied, for provenance copies and JSON output.
     */
    Object raw();

    default boolean isBlank() {
        String text = asText();
        return text == null || text.isEmpty();
    }

    static CellValue of(Object value) {
        if (value == null) {
            return EMPTY;
        }
        if (value instanceof CellValue cell) {
            return cell;
        }
        if (value instanceof String str) {
            return new TextCell(str);
        }
        if (value instanceof Number number) {
            return new NumberCell(number);
        }
        if (value instanceof Boolean bool) {
            return new BooleanCell(bool);
        }
        return new TextCell(value.toString());
    }

    record TextCell(String value) implements CellValue {
        public TextCell {
            value = value == null ? "" : value;
        }

        @Override
        public String asText() {
            return value.trim();
        }

        @Override
        public Object raw() {
            return value;
        }
    }

    record NumberCell(Number value) implements CellValue {
        @Override
        public String asText() {
            if (value instanceof BigDecimal decimal) {
                return plain(decimal);
            }
            if ((value instanceof Double || value instanceof Float) && Double.isFinite(value.doubleValue())) {
                return plain(BigDecimal.valueOf(value.doubleValue()));
            }
            return value.toString();
        }

        // 1042.0 renders as "1042" so numeric ids match their CSV text form.
        private static String plain(BigDecimal decimal) {
            return decimal.stripTrailingZeros().toPlainString();
        }

        @Override
        public Object raw() {
            return value;
        }
    }

    record BooleanCell(boolean value) implements CellValue {
        @Override
        public String asText() {
            return Boolean.toString(value);
        }

        @Override
        public Object raw() {
            return value;
        }
    }

    record EmptyCell() implements CellValue {
        @Override
        public String asText() {
            return null;
        }

        @Override
        public Object raw() {
            return null;
        }
    }
}
