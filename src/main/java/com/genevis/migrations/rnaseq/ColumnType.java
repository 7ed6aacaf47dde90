package com.genevis.migrations.rnaseq;

import java.math.BigDecimal;
import java.sql.Types;
import java.util.Locale;

/**
 * Value type of a DEG table column: how a CSV cell is converted and bound.
 */
public enum ColumnType {

    TEXT(Types.VARCHAR) {
        @Override
        Object parse(String value) {
            return value;
        }
    },
    BIGINT(Types.BIGINT) {
        @Override
        Object parse(String value) {
            return new BigDecimal(value).longValueExact();
        }
    },
    INTEGER(Types.INTEGER) {
        @Override
        Object parse(String value) {
            return new BigDecimal(value).intValueExact();
        }
    },
    DOUBLE(Types.DOUBLE) {
        @Override
        Object parse(String value) {
            return switch (value.toLowerCase(Locale.ROOT)) {
                case "inf", "+inf", "infinity", "+infinity" -> Double.POSITIVE_INFINITY;
                case "-inf", "-infinity" -> Double.NEGATIVE_INFINITY;
                default -> Double.parseDouble(value);
            };
        }
    };

    private final int jdbcType;

    ColumnType(int jdbcType) {
        this.jdbcType = jdbcType;
    }

    public int jdbcType() {
        return jdbcType;
    }

    /**
     * Converts a raw cell to its bind value. Blank cells are NULL for every type; numeric
     * columns also read {@code NA}/{@code NaN}/{@code null} as NULL.
     *
     * @throws IllegalArgumentException when the cell is not a valid value of this type
     */
    public Object convert(String raw, String columnName) {
        String value = raw == null ? "" : raw.trim();
        if (value.isEmpty()) {
            return null;
        }
        if (this != TEXT && RnaSeqConstants.NULL_TOKENS.contains(value.toLowerCase(Locale.ROOT))) {
            return null;
        }
        try {
            return parse(value);
        } catch (NumberFormatException | ArithmeticException ex) {
            throw new IllegalArgumentException(
                    RnaSeqConstants.MSG_INVALID_VALUE.formatted(name(), value, columnName), ex);
        }
    }

    abstract Object parse(String value);
}
