package com.genevis.migrations.rnaseq;

import com.genevis.migrations.db.SqlIdentifiers;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Derives the table layout of one comparison from its DEG CSV header.
 *
 * <p>Annotation and statistics columns are fixed and always created; sample expression,
 * read-count and FPKM columns are created per header. Headers that fit no group are reported
 * in {@link TableSchema#droppedHeaders()} instead of being loaded, or rejected outright when
 * {@code migration.rnaseq.fail-on-unrecognized-columns} is set.</p>
 */
@Component
public class SchemaDeriver {

    private static final List<ColumnSpec> ANNOTATION_COLUMNS = List.of(
            fixed(RnaSeqConstants.COLUMN_GENE_ID, "VARCHAR(50)", ColumnType.TEXT, ColumnBucket.ANNOTATION),
            fixed(RnaSeqConstants.COLUMN_GENE_NAME, "VARCHAR(100)", ColumnType.TEXT, ColumnBucket.ANNOTATION),
            fixed(RnaSeqConstants.COLUMN_GENE_CHR, "VARCHAR(10)", ColumnType.TEXT, ColumnBucket.ANNOTATION),
            fixed("gene_start", "BIGINT", ColumnType.BIGINT, ColumnBucket.ANNOTATION),
            fixed("gene_end", "BIGINT", ColumnType.BIGINT, ColumnBucket.ANNOTATION),
            fixed("gene_strand", "VARCHAR(1)", ColumnType.TEXT, ColumnBucket.ANNOTATION),
            fixed("gene_length", "INTEGER", ColumnType.INTEGER, ColumnBucket.ANNOTATION),
            fixed("gene_biotype", "VARCHAR(50)", ColumnType.TEXT, ColumnBucket.ANNOTATION),
            fixed("gene_description", "TEXT", ColumnType.TEXT, ColumnBucket.ANNOTATION),
            fixed("tf_family", "VARCHAR(50)", ColumnType.TEXT, ColumnBucket.ANNOTATION)
    );

    private static final List<ColumnSpec> STATISTIC_COLUMNS = List.of(
            fixed(RnaSeqConstants.COLUMN_LOG2_FOLD_CHANGE, "DOUBLE PRECISION", ColumnType.DOUBLE, ColumnBucket.STATISTIC),
            fixed("pvalue", "DOUBLE PRECISION", ColumnType.DOUBLE, ColumnBucket.STATISTIC),
            fixed(RnaSeqConstants.COLUMN_PADJ, "DOUBLE PRECISION", ColumnType.DOUBLE, ColumnBucket.STATISTIC),
            fixed(RnaSeqConstants.COLUMN_LOG10_PADJ, "DOUBLE PRECISION", ColumnType.DOUBLE, ColumnBucket.STATISTIC)
    );

    private final RnaSeqProperties rnaSeqProperties;

    public SchemaDeriver(RnaSeqProperties rnaSeqProperties) {
        this.rnaSeqProperties = rnaSeqProperties;
    }

    /**
     * Builds the table layout for {@code comparison} from the ordered CSV header.
     *
     * @throws IllegalArgumentException when the header lacks {@code gene_id}, two headers map to
     *                                  the same column, a loaded header is not a valid column
     *                                  name, or unrecognized headers are configured to be fatal
     */
    public TableSchema derive(String comparison, List<String> headers) {
        String tableName = SqlIdentifiers.requireTableName(comparison);

        Map<String, ColumnSpec> fixedColumns = new LinkedHashMap<>();
        ANNOTATION_COLUMNS.forEach(column -> fixedColumns.put(column.name(), column));
        STATISTIC_COLUMNS.forEach(column -> fixedColumns.put(column.name(), column));

        Map<ColumnBucket, List<ColumnSpec>> dynamicColumns = new EnumMap<>(ColumnBucket.class);
        Map<String, String> headerByColumn = new LinkedHashMap<>();
        List<String> dropped = new ArrayList<>();

        for (int i = 0; i < headers.size(); i++) {
            String header = headers.get(i);
            String name = ColumnNames.canonicalize(header);
            ColumnBucket bucket = classify(name);
            if (bucket == null) {
                dropped.add(header);
                continue;
            }

            SqlIdentifiers.requireColumnName(name);
            String previousHeader = headerByColumn.putIfAbsent(name, header);
            if (previousHeader != null) {
                throw new IllegalArgumentException(
                        RnaSeqConstants.MSG_DUPLICATE_COLUMN.formatted(previousHeader, header, name));
            }

            ColumnSpec fixedColumn = fixedColumns.get(name);
            if (fixedColumn != null) {
                fixedColumns.put(name, fixedColumn.withSourceIndex(i));
            } else {
                dynamicColumns.computeIfAbsent(bucket, key -> new ArrayList<>()).add(dynamicColumn(name, i, bucket));
            }
        }

        if (!headerByColumn.containsKey(RnaSeqConstants.COLUMN_GENE_ID)) {
            throw new IllegalArgumentException(RnaSeqConstants.MSG_GENE_ID_MISSING);
        }
        if (!dropped.isEmpty() && rnaSeqProperties.isFailOnUnrecognizedColumns()) {
            throw new IllegalArgumentException(RnaSeqConstants.MSG_UNRECOGNIZED_COLUMNS.formatted(dropped));
        }

        List<ColumnSpec> columns = new ArrayList<>();
        for (ColumnBucket bucket : ColumnBucket.values()) {
            if (bucket == ColumnBucket.ANNOTATION || bucket == ColumnBucket.STATISTIC) {
                fixedColumns.values().stream().filter(column -> column.bucket() == bucket).forEach(columns::add);
            } else {
                columns.addAll(dynamicColumns.getOrDefault(bucket, List.of()));
            }
        }
        return new TableSchema(tableName, columns, dropped);
    }

    /**
     * Assigns a canonical column name to its group, or returns null when it fits none.
     */
    ColumnBucket classify(String name) {
        if (ANNOTATION_COLUMNS.stream().anyMatch(column -> column.name().equals(name))) {
            return ColumnBucket.ANNOTATION;
        }
        if (STATISTIC_COLUMNS.stream().anyMatch(column -> column.name().equals(name))) {
            return ColumnBucket.STATISTIC;
        }
        String samplePrefix = rnaSeqProperties.getSamplePrefix().toLowerCase(Locale.ROOT);
        if (!samplePrefix.isEmpty() && name.startsWith(samplePrefix)
                && !name.contains(RnaSeqConstants.READ_COUNT_MARKER)
                && !name.contains(RnaSeqConstants.FPKM_MARKER)) {
            return ColumnBucket.SAMPLE_EXPRESSION;
        }
        if (name.contains(RnaSeqConstants.READ_COUNT_SUFFIX) || name.endsWith(RnaSeqConstants.READ_COUNT_MARKER)) {
            return ColumnBucket.READ_COUNT;
        }
        if (name.contains(RnaSeqConstants.FPKM_SUFFIX) || name.endsWith(RnaSeqConstants.FPKM_MARKER)) {
            return ColumnBucket.FPKM;
        }
        return null;
    }

    private ColumnSpec dynamicColumn(String name, int sourceIndex, ColumnBucket bucket) {
        return switch (bucket) {
            case READ_COUNT -> new ColumnSpec(name, sourceIndex, "INTEGER", ColumnType.INTEGER, bucket);
            case SAMPLE_EXPRESSION, FPKM -> new ColumnSpec(name, sourceIndex, "DOUBLE PRECISION", ColumnType.DOUBLE, bucket);
            default -> throw new IllegalStateException("Not a per-sample bucket: " + bucket);
        };
    }

    private static ColumnSpec fixed(String name, String sqlType, ColumnType type, ColumnBucket bucket) {
        return new ColumnSpec(name, -1, sqlType, type, bucket);
    }
}
