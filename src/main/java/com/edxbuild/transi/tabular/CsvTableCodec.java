package com.edxbuild.transi.tabular;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * UTF-8 CSV encoding. The first record is the header; values are kept verbatim (no trimming)
 * and records whose every value is empty are skipped.
 * Output starts with a byte-order mark so spreadsheet tools detect UTF-8.
 */
public class CsvTableCodec implements TableCodec {

    private static final Logger log = LoggerFactory.getLogger(CsvTableCodec.class);

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setIgnoreEmptyLines(true)
            .build();

    private static final char BOM = '\uFEFF';

    @Override
    public TableData read(Path path, String sheet) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            skipByteOrderMark(reader);
            return read(path, reader);
        }
    }

    private TableData read(Path path, BufferedReader reader) throws IOException {
        try (CSVParser parser = FORMAT.parse(reader)) {

            Iterator<CSVRecord> records = parser.iterator();
            if (!records.hasNext()) {
                return TableData.of(tableName(path), List.of(), List.of());
            }

            List<String> columns = HeaderNormalizer.normalize(records.next().toList());
            List<Map<String, String>> rows = new ArrayList<>();
            while (records.hasNext()) {
                CSVRecord record = records.next();
                if (record.size() > columns.size()) {
                    log.warn("{}: line {} has {} values for {} columns; extra values dropped",
                            path.getFileName(), record.getRecordNumber(), record.size(), columns.size());
                }
                Map<String, String> row = new LinkedHashMap<>();
                boolean hasContent = false;
                for (int i = 0; i < columns.size(); i++) {
                    String value = i < record.size() ? record.get(i) : "";
                    hasContent |= !value.isEmpty();
                    row.put(columns.get(i), value);
                }
                if (hasContent) {
                    rows.add(row);
                }
            }
            log.debug("Read {} row(s) x {} column(s) from {}", rows.size(), columns.size(), path);
            return TableData.of(tableName(path), columns, rows);
        }
    }

    @Override
    public void write(List<TableData> tables, Path path) throws IOException {
        TableData table = tables.get(0);
        if (tables.size() > 1) {
            log.debug("CSV holds one table; writing '{}' to {}", table.getName(), path);
        }
        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            writer.write(BOM);
            try (CSVPrinter printer = new CSVPrinter(writer, FORMAT)) {
                printer.printRecord(table.getColumns());
                for (Map<String, String> row : table.getRows()) {
                    List<String> values = new ArrayList<>(table.getColumns().size());
                    for (String column : table.getColumns()) {
                        values.add(row.get(column));
                    }
                    printer.printRecord(values);
                }
            }
        }
    }

    /**
     * Drops a leading byte-order mark before parsing, so a quoted first header is still unquoted.
     */
    private static void skipByteOrderMark(BufferedReader reader) throws IOException {
        reader.mark(1);
        if (reader.read() != BOM) {
            reader.reset();
        }
    }

    private static String tableName(Path path) {
        String file = path.getFileName().toString();
        int dot = file.lastIndexOf('.');
        return dot > 0 ? file.substring(0, dot) : file;
    }
}
