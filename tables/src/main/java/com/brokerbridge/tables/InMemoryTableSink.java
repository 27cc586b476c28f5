package com.brokerbridge.tables;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * {@link TableSink} keeping rows in memory.
 *
 * <p>Appends are lock-free; readers get snapshots and may run concurrently with
 * the receipt thread. Used when no query engine is attached and in tests.</p>
 */
public class InMemoryTableSink implements TableSink {

    private final Map<String, Queue<TableRow>> tables = new ConcurrentHashMap<>();
    private final Map<String, TableSchema> schemas = new ConcurrentHashMap<>();

    @Override
    public void define(TableSchema schema) {
        schemas.putIfAbsent(schema.getName(), schema);
        tables.computeIfAbsent(schema.getName(), name -> new ConcurrentLinkedQueue<>());
    }

    @Override
    public void append(String tableName, TableRow row) {
        tables.computeIfAbsent(tableName, name -> new ConcurrentLinkedQueue<>()).add(row);
    }

    /**
     * Snapshot of the rows appended to a table so far, in append order.
     */
    public List<TableRow> rows(String tableName) {
        Queue<TableRow> rows = tables.get(tableName);
        if (rows == null) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(new ArrayList<>(rows));
    }

    public int size(String tableName) {
        Queue<TableRow> rows = tables.get(tableName);
        return rows == null ? 0 : rows.size();
    }

    public Optional<TableRow> lastRow(String tableName) {
        List<TableRow> rows = rows(tableName);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(rows.size() - 1));
    }

    public Optional<TableSchema> schema(String tableName) {
        return Optional.ofNullable(schemas.get(tableName));
    }

    public Set<String> tableNames() {
        return Collections.unmodifiableSet(new TreeSet<>(tables.keySet()));
    }

    public void clear() {
        tables.values().forEach(Queue::clear);
    }
}
