package com.edxbuild.transi.tabular;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import lombok.Value;

/**
 * Encoding-agnostic in-memory table: an ordered header and rows of string cells keyed by header.
 *
 * Every row holds exactly the table's columns, in column order. Absent cells are {@code ""},
 * never {@code null}.
 *
 * A table may also carry workbook-only extras: per-column formulas, written in place of the
 * cell values with those values kept as the cached results, and a workbook name covering the
 * whole table. CSV ignores both.
 */
@Value
public class TableData {

    /**
     * Placeholder for the 1-based sheet row number in a formula template.
     */
    public static final String ROW_PLACEHOLDER = "{row}";

    String name;
    List<String> columns;
    List<Map<String, String>> rows;

    /**
     * Column to formula template, e.g. {@code IF($E{row}="","",...)}, without the leading {@code =}.
     */
    Map<String, String> formulas;

    /**
     * Workbook name defined over the header and all rows, or {@code null}.
     */
    String rangeName;

    private TableData(String name, List<String> columns, List<Map<String, String>> rows,
                      Map<String, String> formulas, String rangeName) {
        this.name = name;
        this.columns = columns;
        this.rows = rows;
        this.formulas = formulas;
        this.rangeName = rangeName;
    }

    public static TableData of(String name, List<String> columns, List<? extends Map<String, String>> rows) {
        List<String> header = List.copyOf(columns);
        List<Map<String, String>> normalized = new ArrayList<>(rows.size());
        for (Map<String, String> row : rows) {
            Map<String, String> cells = new LinkedHashMap<>();
            for (String column : header) {
                String value = row.get(column);
                cells.put(column, value == null ? "" : value);
            }
            normalized.add(Collections.unmodifiableMap(cells));
        }
        return new TableData(name, header, Collections.unmodifiableList(normalized), Map.of(), null);
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * Finds the header matching {@code column}, ignoring case and surrounding blanks.
     */
    public Optional<String> findColumn(String column) {
        if (columns.contains(column)) {
            return Optional.of(column);
        }
        String wanted = column.trim().toLowerCase(Locale.ROOT);
        return columns.stream()
                .filter(c -> c.trim().toLowerCase(Locale.ROOT).equals(wanted))
                .findFirst();
    }

    /**
     * @throws IllegalArgumentException when a formula names a column the table does not have
     */
    public TableData withFormulas(Map<String, String> columnFormulas) {
        for (String column : columnFormulas.keySet()) {
            if (!columns.contains(column)) {
                throw new IllegalArgumentException("Formula for unknown column " + column + " in " + name);
            }
        }
        return new TableData(name, columns, rows, Map.copyOf(columnFormulas), rangeName);
    }

    public TableData withRangeName(String workbookName) {
        return new TableData(name, columns, rows, formulas, workbookName);
    }

    /**
     * Formula of {@code column} for the given 1-based sheet row, if the column has one.
     */
    public Optional<String> formula(String column, int sheetRow) {
        return Optional.ofNullable(formulas.get(column))
                .map(template -> template.replace(ROW_PLACEHOLDER, String.valueOf(sheetRow)));
    }
}
