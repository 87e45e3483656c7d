package com.flagship.gold_history.entity;

import lombok.Value;

/**
 * A business column of a history table.
 */
@Value
public class HistoryColumn {
    String name;
    ColumnType type;

    public static HistoryColumn text(String name) {
        return new HistoryColumn(name, ColumnType.TEXT);
    }

    public static HistoryColumn decimal(String name) {
        return new HistoryColumn(name, ColumnType.DECIMAL);
    }

    public static HistoryColumn date(String name) {
        return new HistoryColumn(name, ColumnType.DATE);
    }
}
