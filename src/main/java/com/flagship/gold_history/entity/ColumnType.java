package com.flagship.gold_history.entity;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.LocalDate;

/**
 * SQL type of a business column in a history table.
 *
 * Each type knows how to read itself from a JDBC result set and how to
 * render a value in the canonical form used for record hashing.
 */
public enum ColumnType {
    TEXT(Types.VARCHAR),
    DECIMAL(Types.NUMERIC),
    DATE(Types.DATE);

    /**
     * Scale of every numeric column in the Gold schema (numeric(12,2)).
     */
    public static final int DECIMAL_SCALE = 2;

    private final int sqlType;

    ColumnType(int sqlType) {
        this.sqlType = sqlType;
    }

    public int getSqlType() {
        return sqlType;
    }

    public Object read(ResultSet rs, String column) throws SQLException {
        return switch (this) {
            case TEXT -> rs.getString(column);
            case DECIMAL -> rs.getBigDecimal(column);
            case DATE -> rs.getObject(column, LocalDate.class);
        };
    }

    /**
     * Canonical string for hashing. Returns null for null so that a missing
     * value stays distinct from an empty string.
     */
    public String canonical(Object value) {
        if (value == null) {
            return null;
        }
        return switch (this) {
            case TEXT -> value.toString();
            case DECIMAL -> toDecimal(value).setScale(DECIMAL_SCALE, RoundingMode.HALF_UP).toPlainString();
            case DATE -> value.toString();
        };
    }

    private static BigDecimal toDecimal(Object value) {
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        throw new IllegalArgumentException("Not a numeric value: " + value);
    }
}
