package com.genevis.migrations.db;

import java.util.regex.Pattern;

/**
 * Validation and quoting for identifiers that end up in generated SQL.
 */
public final class SqlIdentifiers {

    private static final Pattern VALID_TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern VALID_COLUMN_NAME = Pattern.compile("[a-z_][a-z0-9_]*");

    private SqlIdentifiers() {
    }

    /**
     * Accepts only plain identifier characters; case is kept because table names are always quoted.
     */
    public static String requireTableName(String input) {
        if (input == null || !VALID_TABLE_NAME.matcher(input).matches()) {
            throw new IllegalArgumentException("Invalid table name: " + input);
        }
        return input;
    }

    public static String requireRoleName(String input) {
        if (input == null || !VALID_TABLE_NAME.matcher(input).matches()) {
            throw new IllegalArgumentException("Invalid role name: " + input);
        }
        return input;
    }

    /**
     * Accepts only lowercase identifier characters.
     */
    public static String requireColumnName(String input) {
        if (!isValidColumnName(input)) {
            throw new IllegalArgumentException("Invalid column name: " + input);
        }
        return input;
    }

    public static boolean isValidColumnName(String input) {
        return input != null && VALID_COLUMN_NAME.matcher(input).matches();
    }

    public static String quote(String identifier) {
        return "\"" + identifier + "\"";
    }
}
