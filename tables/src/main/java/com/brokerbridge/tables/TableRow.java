package com.brokerbridge.tables;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * One immutable row appended to a live table.
 */
public final class TableRow {

    private final TableSchema schema;
    private final Object[] values;

    TableRow(TableSchema schema, Object[] values) {
        if (values.length != schema.size()) {
            throw new IllegalArgumentException("Table " + schema.getName() + " expects "
                    + schema.size() + " values, got " + values.length);
        }
        this.schema = schema;
        this.values = values;
    }

    public TableSchema getSchema() {
        return schema;
    }

    public String getTableName() {
        return schema.getName();
    }

    public Instant getReceiveTime() {
        return (Instant) values[0];
    }

    public Object get(int index) {
        return values[index];
    }

    /**
     * @throws IllegalArgumentException if the table has no such column
     */
    public Object get(String column) {
        int index = schema.indexOf(column);
        if (index < 0) {
            throw new IllegalArgumentException("No column " + column + " in table " + schema.getName());
        }
        return values[index];
    }

    public String getString(String column) {
        return (String) get(column);
    }

    public Long getLong(String column) {
        return (Long) get(column);
    }

    public Double getDouble(String column) {
        return (Double) get(column);
    }

    public List<Object> values() {
        return Collections.unmodifiableList(Arrays.asList(values));
    }

    @Override
    public String toString() {
        return schema.getName() + Arrays.toString(values);
    }
}
