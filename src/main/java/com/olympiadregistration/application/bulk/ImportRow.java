package com.olympiadregistration.application.bulk;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One cleaned data row of a bulk import file. Cells are trimmed, empty
 * cells are absent, and comma-separated columns are split into lists.
 *
 * @param number 1-based row number, the header being row 0
 * @param header every column name in the file's header
 * @param values non-empty scalar cells by column name
 * @param lists split list cells by column name
 */
public record ImportRow(int number, Set<String> header, Map<String, String> values,
                        Map<String, List<String>> lists) {

    public String get(String column) {
        return values.get(column);
    }

    /**
     * @return the list, or null if the cell was empty or absent
     */
    public List<String> list(String column) {
        List<String> list = lists.get(column);
        return list == null ? null : Collections.unmodifiableList(list);
    }

    /**
     * Whether the file has this column at all, even if this row leaves it empty.
     */
    public boolean hasColumn(String column) {
        return header.contains(column);
    }

    public boolean has(String column) {
        return values.containsKey(column) || lists.containsKey(column);
    }
}
