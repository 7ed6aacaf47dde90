package com.genevis.migrations.rnaseq;

import java.util.List;

/**
 * Raw content of one DEG CSV file: the ordered header and each data row's cells.
 */
public record DegTable(List<String> headers, List<List<String>> rows) {

    public DegTable {
        headers = List.copyOf(headers);
        rows = List.copyOf(rows);
    }
}
