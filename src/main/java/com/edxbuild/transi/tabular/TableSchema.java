package com.edxbuild.transi.tabular;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.edxbuild.transi.error.MissingRequiredColumnException;

import lombok.Value;

/**
 * Expected columns of one kind of table, validated eagerly when a table is bound.
 */
@Value
public class TableSchema {

    String kind;
    List<ColumnSpec> columns;

    public static TableSchema of(String kind, ColumnSpec... columns) {
        return new TableSchema(kind, List.of(columns));
    }

    /**
     * Resolves each expected column to a header of {@code table}.
     *
     * @throws MissingRequiredColumnException listing every required column that has no header
     */
    public BoundTable bind(TableData table, Path source) {
        Map<String, String> headers = new LinkedHashMap<>();
        List<String> missing = new ArrayList<>();
        for (ColumnSpec spec : columns) {
            Optional<String> header = spec.candidates().stream()
                    .map(table::findColumn)
                    .flatMap(Optional::stream)
                    .findFirst();
            if (header.isPresent()) {
                headers.put(spec.getName(), header.get());
            } else if (spec.isRequired()) {
                missing.add(spec.getName());
            }
        }
        if (!missing.isEmpty()) {
            throw new MissingRequiredColumnException(kind, source, missing);
        }
        return new BoundTable(this, table, headers);
    }
}
