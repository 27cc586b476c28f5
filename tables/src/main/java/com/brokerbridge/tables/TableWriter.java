package com.brokerbridge.tables;

import com.brokerbridge.config.ClockProvider;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Writes rows of one schema into a {@link TableSink}.
 *
 * <p>The writer prepends the receipt instant and normalizes values before
 * appending:</p>
 * <ul>
 *   <li>empty strings are written as null</li>
 *   <li>{@code BigDecimal} and {@code Float} become {@code Double}</li>
 *   <li>{@code Integer} and {@code Short} become {@code Long}</li>
 *   <li>collections written to a {@link ColumnType#STRING_SET} column become a set of strings</li>
 * </ul>
 */
public class TableWriter {

    private final TableSchema schema;
    private final TableSink sink;
    private final ClockProvider clock;

    public TableWriter(TableSchema schema, TableSink sink, ClockProvider clock) {
        this.schema = Objects.requireNonNull(schema, "schema");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
        sink.define(schema);
    }

    public TableSchema getSchema() {
        return schema;
    }

    /**
     * Write a row. {@code values} holds every column except {@code ReceiveTime}.
     *
     * @return the appended row
     * @throws IllegalArgumentException if the value count or a value type does not match the schema
     */
    public TableRow write(Object... values) {
        if (values.length != schema.size() - 1) {
            throw new IllegalArgumentException("Table " + schema.getName() + " expects "
                    + (schema.size() - 1) + " values, got " + values.length);
        }

        Object[] row = new Object[schema.size()];
        row[0] = clock.instant();
        for (int i = 0; i < values.length; i++) {
            TableSchema.Column column = schema.getColumns().get(i + 1);
            Object value = normalize(column.getType(), values[i]);
            if (!column.getType().accepts(value)) {
                throw new IllegalArgumentException("Column " + schema.getName() + "." + column.getName()
                        + " is " + column.getType() + " but value is " + value.getClass().getSimpleName()
                        + " (" + value + ")");
            }
            row[i + 1] = value;
        }

        TableRow tableRow = new TableRow(schema, row);
        sink.append(schema.getName(), tableRow);
        return tableRow;
    }

    private static Object normalize(ColumnType type, Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof String) {
            return ((String) value).isEmpty() ? null : value;
        }
        if (value instanceof BigDecimal || value instanceof Float) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof Integer || value instanceof Short) {
            if (type == ColumnType.DOUBLE) {
                return Double.valueOf(((Number) value).doubleValue());
            }
            return Long.valueOf(((Number) value).longValue());
        }
        if (value instanceof Long && type == ColumnType.DOUBLE) {
            return ((Long) value).doubleValue();
        }
        if (type == ColumnType.STRING_SET && value instanceof Collection) {
            Set<String> strings = new LinkedHashSet<>();
            for (Object element : (Collection<?>) value) {
                strings.add(String.valueOf(element));
            }
            return strings;
        }
        return value;
    }
}
