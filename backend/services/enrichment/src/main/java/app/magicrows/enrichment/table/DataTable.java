package app.magicrows.enrichment.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class DataTable {

    private final List<String> columns;
    private final List<Map<String, Object>> rows;

    private DataTable(List<String> columns, List<Map<String, Object>> rows) {
        this.columns = columns;
        this.rows = rows;
    }

    public static DataTable of(List<String> columns, List<? extends Map<String, ?>> rows) {
        Set<String> unique = new LinkedHashSet<>(columns);
        if (unique.size() != columns.size()) {
            throw new IllegalArgumentException("Duplicate column names: " + columns);
        }
        List<String> columnList = List.copyOf(columns);
        List<Map<String, Object>> copied = new ArrayList<>(rows.size());
        for (Map<String, ?> row : rows) {
            Map<String, Object> normalized = new LinkedHashMap<>();
            for (String column : columnList) {
                normalized.put(column, row == null ? null : row.get(column));
            }
            copied.add(Collections.unmodifiableMap(normalized));
        }
        return new DataTable(columnList, Collections.unmodifiableList(copied));
    }

    public List<String> columns() {
        return columns;
    }

    public int rowCount() {
        return rows.size();
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public Map<String, Object> row(int index) {
        return rows.get(index);
    }

    public List<Map<String, Object>> rows() {
        return rows;
    }

    public Object value(int rowIndex, String column) {
        return rows.get(rowIndex).get(column);
    }

    public List<Object> column(String column) {
        if (!hasColumn(column)) {
            throw new IllegalArgumentException("Unknown column: " + column);
        }
        List<Object> values = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            values.add(row.get(column));
        }
        return values;
    }

    public Map<String, Object> project(int rowIndex, List<String> projection) {
        Map<String, Object> row = rows.get(rowIndex);
        Map<String, Object> projected = new LinkedHashMap<>();
        for (String column : projection) {
            if (row.containsKey(column)) {
                projected.put(column, row.get(column));
            }
        }
        return projected;
    }

    @Override
    public String toString() {
        return "DataTable{columns=" + columns + ", rows=" + rows.size() + "}";
    }
}
