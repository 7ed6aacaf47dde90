package com.genevis.migrations.rnaseq;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ColumnTypeTest {

    @Test
    void shouldReadMissingMarkersAsNullForNumericColumns() {
        assertNull(ColumnType.DOUBLE.convert("NA", "padj"));
        assertNull(ColumnType.DOUBLE.convert("NaN", "padj"));
        assertNull(ColumnType.INTEGER.convert("", "shef1_readcount"));
        assertNull(ColumnType.BIGINT.convert(null, "gene_start"));
    }

    @Test
    void shouldKeepMissingMarkersAsTextForTextColumns() {
        assertEquals("NA", ColumnType.TEXT.convert("NA", "gene_name"));
        assertNull(ColumnType.TEXT.convert("   ", "gene_name"));
    }

    @Test
    void shouldParseInfinitiesForDoubleColumns() {
        assertEquals(Double.POSITIVE_INFINITY, ColumnType.DOUBLE.convert("Inf", "log10_padj"));
        assertEquals(Double.NEGATIVE_INFINITY, ColumnType.DOUBLE.convert("-inf", "log2foldchange"));
        assertEquals(1.5e-8, (double) ColumnType.DOUBLE.convert("1.5e-8", "padj"), 1e-20);
    }

    @Test
    void shouldAcceptIntegralDecimalsForIntegerColumns() {
        assertEquals(12, ColumnType.INTEGER.convert("12.0", "shef1_readcount"));
        assertEquals(1000L, ColumnType.BIGINT.convert("1e3", "gene_start"));
    }

    @Test
    void shouldRejectUnconvertibleCells() {
        IllegalArgumentException fractional = assertThrows(IllegalArgumentException.class,
                () -> ColumnType.INTEGER.convert("12.5", "shef1_readcount"));
        assertTrue(fractional.getMessage().contains("shef1_readcount"));
        assertThrows(IllegalArgumentException.class, () -> ColumnType.DOUBLE.convert("abc", "padj"));
    }
}
