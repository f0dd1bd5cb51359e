package app.magicrows.enrichment.table;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public final class CsvTables {

    private static final String LIST_SEPARATOR = "; ";

    private CsvTables() {
    }

    public static DataTable read(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .setTrim(true)
                .setIgnoreEmptyLines(true)
                .build();
        try (CSVParser parser = new CSVParser(reader, format)) {
            List<String> headers = List.copyOf(parser.getHeaderNames());
            List<Map<String, Object>> rows = new ArrayList<>();
            for (CSVRecord record : parser) {
                Map<String, Object> row = new LinkedHashMap<>();
                for (int i = 0; i < headers.size(); i++) {
                    String value = i < record.size() ? record.get(i) : null;
                    row.put(headers.get(i), value == null || value.isEmpty() ? null : value);
                }
                rows.add(row);
            }
            return DataTable.of(headers, rows);
        }
    }

    public static void write(DataTable table, Writer writer) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader(table.columns().toArray(String[]::new))
                .build();
        try (CSVPrinter printer = new CSVPrinter(writer, format)) {
            for (Map<String, Object> row : table.rows()) {
                List<String> values = new ArrayList<>(table.columns().size());
                for (String column : table.columns()) {
                    values.add(render(row.get(column)));
                }
                printer.printRecord(values);
            }
        }
    }

    static String render(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Collection<?> collection) {
            return collection.stream()
                    .map(CsvTables::render)
                    .collect(Collectors.joining(LIST_SEPARATOR));
        }
        return value.toString();
    }
}
