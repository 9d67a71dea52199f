package com.reelmatch.recommender.catalog;

import java.util.List;
import java.util.Map;

/**
 * Untyped tabular input as read from the source file: a header and string-valued rows.
 * Cells may be missing or {@code null}.
 */
public record RawTable(
    List<String> columns,
    List<Map<String, String>> rows
) {
    public RawTable {
        columns = columns == null ? List.of() : List.copyOf(columns);
        rows = rows == null ? List.of() : List.copyOf(rows);
    }
}
