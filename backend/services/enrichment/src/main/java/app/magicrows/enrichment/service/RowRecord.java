package app.magicrows.enrichment.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class RowRecord {

    private final int rowIndex;
    private final Map<String, Object> fields = new LinkedHashMap<>();

    public RowRecord(int rowIndex) {
        this.rowIndex = rowIndex;
    }

    public int rowIndex() {
        return rowIndex;
    }

    public void put(String field, Object value) {
        fields.put(field, value);
    }

    public Object get(String field) {
        return fields.get(field);
    }

    public boolean has(String field) {
        return fields.containsKey(field);
    }

    public Map<String, Object> fields() {
        return Collections.unmodifiableMap(fields);
    }
}
