package com.brokerbridge.tables;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Column layout of one live table.
 *
 * <p>Every schema starts with the {@link #RECEIVE_TIME} column, holding the instant
 * the session translated the event into a row. That instant is independent of any
 * timestamp the broker reports inside the event.</p>
 */
public final class TableSchema {

    public static final String RECEIVE_TIME = "ReceiveTime";

    private final String name;
    private final List<Column> columns;
    private final Map<String, Integer> indexByName;

    private TableSchema(String name, List<Column> columns) {
        this.name = name;
        this.columns = Collections.unmodifiableList(columns);
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            if (index.put(columns.get(i).getName(), i) != null) {
                throw new IllegalArgumentException(
                        "Duplicate column name in table " + name + ": " + columns.get(i).getName());
            }
        }
        this.indexByName = index;
    }

    public String getName() {
        return name;
    }

    public List<Column> getColumns() {
        return columns;
    }

    public int size() {
        return columns.size();
    }

    /**
     * @return the column position, or -1 if the table has no such column
     */
    public int indexOf(String column) {
        Integer index = indexByName.get(column);
        return index != null ? index : -1;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder {
        private final String name;
        private final List<Column> columns = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
            columns.add(new Column(RECEIVE_TIME, ColumnType.INSTANT));
        }

        public Builder column(String columnName, ColumnType type) {
            columns.add(new Column(columnName, type));
            return this;
        }

        public Builder columns(List<Column> shared) {
            columns.addAll(shared);
            return this;
        }

        public TableSchema build() {
            return new TableSchema(name, new ArrayList<>(columns));
        }
    }

    /**
     * A named, typed column.
     */
    public static final class Column {
        private final String name;
        private final ColumnType type;

        public Column(String name, ColumnType type) {
            this.name = name;
            this.type = type;
        }

        public String getName() {
            return name;
        }

        public ColumnType getType() {
            return type;
        }

        @Override
        public String toString() {
            return name + ":" + type;
        }
    }

    @Override
    public String toString() {
        return "TableSchema{" + name + columns + "}";
    }
}
