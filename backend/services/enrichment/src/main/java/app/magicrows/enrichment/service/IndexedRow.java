package app.magicrows.enrichment.service;

import java.util.Map;

public record IndexedRow(
        int rowIndex,
        Map<String, Object> values
) {
}
