package com.olympiadregistration.infrastructure.csv;

import java.util.List;
import java.util.Map;

/**
 * A decoded delimited file: the header and one map per data row, keyed by
 * header text. Cells missing at the end of a short row are absent from its map.
 */
public record Spreadsheet(List<String> header, List<Map<String, String>> rows) {
}
