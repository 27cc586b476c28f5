package com.brokerbridge.tables;

import java.time.Instant;
import java.util.Set;

/**
 * Value types a live table column can hold.
 */
public enum ColumnType {
    LONG(Long.class),
    DOUBLE(Double.class),
    STRING(String.class),
    BOOLEAN(Boolean.class),
    INSTANT(Instant.class),
    /** An unordered set of strings, e.g. derivative security types */
    STRING_SET(Set.class);

    private final Class<?> javaType;

    ColumnType(Class<?> javaType) {
        this.javaType = javaType;
    }

    public Class<?> getJavaType() {
        return javaType;
    }

    /**
     * Check whether a (normalized) value fits this column. Nulls always fit.
     */
    public boolean accepts(Object value) {
        return value == null || javaType.isInstance(value);
    }
}
