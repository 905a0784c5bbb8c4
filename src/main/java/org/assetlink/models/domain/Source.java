package org.assetlink.models.domain;

import lombok.Getter;
import lombok.Setter;

import java.util.List;

/**
 * One imported inventory. The row payload is fixed at import time; only the label can change.
 */
@Getter
public class Source {

    private final String id;

    @Setter
    private String label;

    private final String fileName;

    private final List<String> headers;

    private final List<SourceRow> rows;

    private final String color;

    public Source(String id, String label, String fileName, List<String> headers, List<SourceRow> rows, String color) {
        this.id = id;
        this.label = label;
        this.fileName = fileName;
        this.headers = List.copyOf(headers);
        this.rows = List.copyOf(rows);
        this.color = color;
    }
}
