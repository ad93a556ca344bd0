package com.flagship.spv_ledger.history;

import java.util.Collections;
import java.util.HexFormat;
import java.util.Map;

/**
 * One result row of an {@link AggregationQuery}, keyed by the projected column or alias.
 *
 * Rows are read once by a rebuild phase and then discarded.
 */
public final class AggregatedRow {

    private final Map<String, Object> values;

    AggregatedRow(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static AggregatedRow of(Map<String, Object> values) {
        return new AggregatedRow(values);
    }

    public Object get(String key) {
        if (!values.containsKey(key)) {
            throw new IllegalArgumentException("Column not projected: " + key + " (available: " + values.keySet() + ")");
        }
        return values.get(key);
    }

    public String getString(String key) {
        Object value = get(key);
        return value == null ? null : value.toString();
    }

    /**
     * Numeric column as long. SQL {@code SUM} over no values yields null, read here as 0.
     */
    public long getLong(String key) {
        Object value = get(key);
        if (value == null) {
            return 0L;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        return Long.parseLong(value.toString());
    }

    public byte[] getBytes(String key) {
        Object value = get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof byte[] bytes) {
            return bytes;
        }
        throw new IllegalArgumentException("Column " + key + " is not binary: " + value.getClass().getName());
    }

    public String getHex(String key) {
        byte[] bytes = getBytes(key);
        return bytes == null ? null : HexFormat.of().formatHex(bytes);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return "AggregatedRow" + values;
    }
}
