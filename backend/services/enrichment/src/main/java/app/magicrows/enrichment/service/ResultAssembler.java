package app.magicrows.enrichment.service;

import app.magicrows.enrichment.domain.OutputSpecification;
import app.magicrows.enrichment.domain.TaskConfiguration;
import app.magicrows.enrichment.error.EnrichmentError;
import app.magicrows.enrichment.table.DataTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the result table from per-row records, either by widening the source table with
 * one column per enrichment field or by expanding list values into one row per combination.
 */
public class ResultAssembler {

    private static final Logger log = LoggerFactory.getLogger(ResultAssembler.class);

    public DataTable assemble(DataTable source,
                              List<RowRecord> records,
                              TaskConfiguration config,
                              boolean reasoningOverride) {
        List<String> fields = enrichmentFields(config, reasoningOverride);
        return switch (config.outputFormat()) {
            case NEW_COLUMNS -> widen(source, records, fields);
            case NEW_ROWS -> expand(source, records, config, reasoningOverride);
        };
    }

    public static List<String> enrichmentFields(TaskConfiguration config, boolean reasoningOverride) {
        List<String> fields = new ArrayList<>();
        for (OutputSpecification output : config.outputs()) {
            fields.add(output.name());
            if (output.reasoningRequested(reasoningOverride)) {
                fields.add(output.reasoningField());
            }
        }
        return fields;
    }

    private DataTable widen(DataTable source, List<RowRecord> records, List<String> fields) {
        List<String> columns = new ArrayList<>(source.columns());
        for (String field : fields) {
            if (columns.contains(field)) {
                log.warn("Enrichment field replaces existing column column={}", field);
            } else {
                columns.add(field);
            }
        }

        Map<Integer, RowRecord> byIndex = new HashMap<>();
        for (RowRecord record : records) {
            byIndex.put(record.rowIndex(), record);
        }

        List<Map<String, Object>> rows = new ArrayList<>(source.rowCount());
        for (int i = 0; i < source.rowCount(); i++) {
            Map<String, Object> row = new LinkedHashMap<>(source.row(i));
            RowRecord record = byIndex.get(i);
            for (String field : fields) {
                row.put(field, record == null ? null : record.get(field));
            }
            rows.add(row);
        }
        return DataTable.of(columns, rows);
    }

    private DataTable expand(DataTable source,
                             List<RowRecord> records,
                             TaskConfiguration config,
                             boolean reasoningOverride) {
        List<String> contextColumns = expansionContextColumns(source, config);
        List<String> columns = new ArrayList<>(contextColumns);
        for (String field : enrichmentFields(config, reasoningOverride)) {
            if (!columns.contains(field)) {
                columns.add(field);
            }
        }

        List<RowRecord> ordered = new ArrayList<>(records);
        ordered.sort(Comparator.comparingInt(RowRecord::rowIndex));

        List<Map<String, Object>> rows = new ArrayList<>();
        for (RowRecord record : ordered) {
            Map<String, Object> base = record.rowIndex() < source.rowCount()
                    ? source.project(record.rowIndex(), contextColumns)
                    : new LinkedHashMap<>();

            List<List<Object>> axes = new ArrayList<>();
            for (OutputSpecification output : config.outputs()) {
                axes.add(valuesOf(record, output));
            }
            for (List<Object> combination : cartesianProduct(axes)) {
                Map<String, Object> row = new LinkedHashMap<>(base);
                for (int i = 0; i < config.outputs().size(); i++) {
                    OutputSpecification output = config.outputs().get(i);
                    row.put(output.name(), combination.get(i));
                    if (output.reasoningRequested(reasoningOverride)) {
                        row.put(output.reasoningField(), record.get(output.reasoningField()));
                    }
                }
                rows.add(row);
            }
        }
        return DataTable.of(columns, rows);
    }

    private List<String> expansionContextColumns(DataTable source, TaskConfiguration config) {
        Set<String> declared = new LinkedHashSet<>(config.contextColumns());
        if (declared.isEmpty()) {
            for (OutputSpecification output : config.outputs()) {
                declared.addAll(output.contextColumns());
            }
        }
        List<String> present = new ArrayList<>();
        for (String column : declared) {
            if (source.hasColumn(column)) {
                present.add(column);
            } else {
                log.warn("Context column not present in source, skipped from expansion column={}", column);
            }
        }
        return present;
    }

    private List<Object> valuesOf(RowRecord record, OutputSpecification output) {
        List<Object> single = new ArrayList<>(1);
        Object value = record.get(output.name());
        if (value == null || value instanceof EnrichmentError) {
            single.add(value);
            return single;
        }
        if (value instanceof List<?> list) {
            if (list.isEmpty()) {
                single.add(null);
                return single;
            }
            return new ArrayList<>(list);
        }
        if (output.multiple()) {
            log.warn("Expected a list value for expansion rowIndex={} output={}", record.rowIndex(), output.name());
        }
        single.add(value);
        return single;
    }

    static List<List<Object>> cartesianProduct(List<List<Object>> axes) {
        List<List<Object>> combinations = new ArrayList<>();
        combinations.add(new ArrayList<>());
        for (List<Object> axis : axes) {
            List<List<Object>> next = new ArrayList<>(combinations.size() * Math.max(axis.size(), 1));
            for (List<Object> prefix : combinations) {
                for (Object value : axis) {
                    List<Object> combination = new ArrayList<>(prefix);
                    combination.add(value);
                    next.add(combination);
                }
            }
            combinations = next;
        }
        return combinations;
    }
}
