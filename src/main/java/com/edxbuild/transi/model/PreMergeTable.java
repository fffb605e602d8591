package com.edxbuild.transi.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.edxbuild.transi.tabular.TableColumns;
import com.edxbuild.transi.tabular.TableData;

import lombok.Value;

/**
 * PreMerge (or merged final) rows together with the RAW column order they carry.
 */
@Value
public class PreMergeTable {

    List<String> rawColumns;
    List<PreMergeRow> rows;

    public PreMergeTable(List<String> rawColumns, List<PreMergeRow> rows) {
        this.rawColumns = List.copyOf(rawColumns);
        this.rows = List.copyOf(rows);
    }

    /**
     * RAW columns followed by the derived columns.
     */
    public List<String> columns() {
        Set<String> columns = new LinkedHashSet<>(rawColumns);
        columns.addAll(TableColumns.DERIVED);
        return new ArrayList<>(columns);
    }

    public TableData toTableData(String name) {
        List<Map<String, String>> cells = new ArrayList<>(rows.size());
        for (PreMergeRow row : rows) {
            cells.add(row.toCells());
        }
        return TableData.of(name, columns(), cells);
    }

    public PreMergeTable withRows(List<PreMergeRow> newRows) {
        return new PreMergeTable(rawColumns, newRows);
    }
}
