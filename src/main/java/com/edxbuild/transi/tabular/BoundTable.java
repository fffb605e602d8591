package com.edxbuild.transi.tabular;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;

/**
 * A table whose schema columns have been resolved to actual headers.
 *
 * Cell access goes through canonical column names, so a file headed {@code CODE} and one headed
 * {@code Code} read the same way.
 */
@Getter
public class BoundTable {

    private final TableSchema schema;
    private final TableData table;
    private final Map<String, String> headers;

    BoundTable(TableSchema schema, TableData table, Map<String, String> headers) {
        this.schema = schema;
        this.table = table;
        this.headers = Collections.unmodifiableMap(headers);
    }

    public boolean has(String canonical) {
        return headers.containsKey(canonical);
    }

    /**
     * Cell value for a canonical column, {@code ""} when the column is not present.
     */
    public String get(Map<String, String> row, String canonical) {
        String header = headers.get(canonical);
        if (header == null) {
            return "";
        }
        String value = row.get(header);
        return value == null ? "" : value;
    }

    /**
     * Table columns in file order, with bound headers renamed to their canonical names.
     */
    public List<String> canonicalColumns() {
        Map<String, String> renames = reverseHeaders();
        List<String> result = new ArrayList<>(table.getColumns().size());
        for (String column : table.getColumns()) {
            result.add(renames.getOrDefault(column, column));
        }
        return result;
    }

    /**
     * A row keyed by {@link #canonicalColumns()}.
     */
    public Map<String, String> canonicalRow(Map<String, String> row) {
        Map<String, String> renames = reverseHeaders();
        Map<String, String> result = new LinkedHashMap<>();
        for (Map.Entry<String, String> cell : row.entrySet()) {
            result.put(renames.getOrDefault(cell.getKey(), cell.getKey()), cell.getValue());
        }
        return result;
    }

    public List<Map<String, String>> rows() {
        return table.getRows();
    }

    private Map<String, String> reverseHeaders() {
        Map<String, String> reverse = new HashMap<>();
        headers.forEach((canonical, header) -> reverse.put(header, canonical));
        return reverse;
    }
}
