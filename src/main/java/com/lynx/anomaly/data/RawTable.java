package com.lynx.anomaly.data;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Column-oriented raw telemetry as read from the input file. Missing or unparseable
 * cells are NaN. Every operation returns a new table.
 */
public final class RawTable {

    private final Map<String, double[]> columns;
    private final int rowCount;

    public RawTable(Map<String, double[]> columns, int rowCount) {
        this.columns = new LinkedHashMap<>();
        columns.forEach((name, values) -> {
            if (values.length != rowCount) {
                throw new IllegalArgumentException(String.format(
                        "Column '%s' has %d values, expected %d", name, values.length, rowCount));
            }
            this.columns.put(name, values.clone());
        });
        this.rowCount = rowCount;
    }

    public int rowCount() {
        return rowCount;
    }

    public boolean isEmpty() {
        return rowCount == 0;
    }

    public List<String> columnNames() {
        return new ArrayList<>(columns.keySet());
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    public double[] column(String name) {
        double[] values = columns.get(name);
        if (values == null) {
            throw new IllegalArgumentException("No such column: " + name);
        }
        return values.clone();
    }

    public int missingCount(String name) {
        int count = 0;
        for (double v : columns.get(name)) {
            if (Double.isNaN(v)) count++;
        }
        return count;
    }

    public RawTable withoutColumns(Collection<String> names) {
        Map<String, double[]> kept = new LinkedHashMap<>(columns);
        names.forEach(kept::remove);
        return new RawTable(kept, rowCount);
    }

    public RawTable withColumn(String name, double[] values) {
        Map<String, double[]> updated = new LinkedHashMap<>(columns);
        updated.put(name, values);
        return new RawTable(updated, rowCount);
    }
}
