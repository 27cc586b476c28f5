package com.brokerbridge.tables;

/**
 * Append target for live tables owned by the query engine.
 *
 * <p>Implementations must make {@link #append(String, TableRow)} cheap and
 * non-blocking: it is called from the transport's event-receipt thread. Visibility
 * of appended rows to concurrent readers is the sink's concern.</p>
 */
public interface TableSink {

    /**
     * Announce a table before its first row. Sinks that create tables lazily can
     * ignore this.
     *
     * @param schema the table layout
     */
    default void define(TableSchema schema) {
    }

    /**
     * Append a row. Fire-and-forget.
     *
     * @param tableName the target table
     * @param row the row to append
     */
    void append(String tableName, TableRow row);
}
