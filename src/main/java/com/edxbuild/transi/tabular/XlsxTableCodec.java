package com.edxbuild.transi.tabular;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

import com.edxbuild.transi.error.TransiGenException;

import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Name;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.util.AreaReference;
import org.apache.poi.ss.util.CellReference;
import org.apache.poi.ss.util.WorkbookUtil;
import org.apache.poi.xssf.usermodel.XSSFFont;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Excel workbook encoding. Reads one sheet (by index or name); writes every table as a sheet.
 *
 * Cells are read through {@link DataFormatter}, so numbers keep their displayed form ({@code 1},
 * not {@code 1.0}) and formulas yield the result cached in the file; they are never re-evaluated.
 * Rows with no content are skipped.
 * Every cell is written as a string cell; columns with a formula template get the formula, with
 * the cell value as its cached result.
 */
public class XlsxTableCodec implements TableCodec {

    private static final Logger log = LoggerFactory.getLogger(XlsxTableCodec.class);

    private static final Pattern SHEET_INDEX = Pattern.compile("\\d{1,4}");

    @Override
    public TableData read(Path path, String sheet) throws IOException {
        try (InputStream in = Files.newInputStream(path);
             Workbook workbook = new XSSFWorkbook(in)) {

            Sheet worksheet = selectSheet(workbook, sheet, path);
            DataFormatter formatter = new DataFormatter();
            formatter.setUseCachedValuesForFormulaCells(true);

            Row headerRow = worksheet.getRow(worksheet.getFirstRowNum());
            if (headerRow == null) {
                return TableData.of(worksheet.getSheetName(), List.of(), List.of());
            }

            int width = Math.max(headerRow.getLastCellNum(), 0);
            List<String> rawHeaders = new ArrayList<>(width);
            for (int c = 0; c < width; c++) {
                rawHeaders.add(text(headerRow.getCell(c), formatter));
            }
            List<String> columns = HeaderNormalizer.normalize(rawHeaders);

            List<Map<String, String>> rows = new ArrayList<>();
            for (int r = headerRow.getRowNum() + 1; r <= worksheet.getLastRowNum(); r++) {
                Row row = worksheet.getRow(r);
                if (row == null) {
                    continue;
                }
                Map<String, String> cells = new LinkedHashMap<>();
                boolean hasContent = false;
                for (int c = 0; c < columns.size(); c++) {
                    String value = text(row.getCell(c), formatter);
                    hasContent |= !value.isEmpty();
                    cells.put(columns.get(c), value);
                }
                if (hasContent) {
                    rows.add(cells);
                }
            }
            log.debug("Read {} row(s) x {} column(s) from {} [{}]", rows.size(), columns.size(), path,
                    worksheet.getSheetName());
            return TableData.of(worksheet.getSheetName(), columns, rows);
        }
    }

    @Override
    public void write(List<TableData> tables, Path path) throws IOException {
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            CellStyle headerStyle = headerStyle(workbook);
            Set<String> usedNames = new HashSet<>();
            List<Sheet> sheets = new ArrayList<>(tables.size());
            // names first, so formulas on any sheet can refer to them
            for (TableData table : tables) {
                Sheet sheet = workbook.createSheet(uniqueSheetName(table.getName(), usedNames));
                sheets.add(sheet);
                if (table.getRangeName() != null) {
                    defineName(workbook, table, sheet.getSheetName());
                }
            }
            for (int t = 0; t < tables.size(); t++) {
                fill(sheets.get(t), tables.get(t), headerStyle);
            }
            try (OutputStream out = Files.newOutputStream(path)) {
                workbook.write(out);
            }
        }
    }

    private static void fill(Sheet sheet, TableData table, CellStyle headerStyle) {
        Row header = sheet.createRow(0);
        List<String> columns = table.getColumns();
        for (int c = 0; c < columns.size(); c++) {
            Cell cell = header.createCell(c);
            cell.setCellValue(columns.get(c));
            cell.setCellStyle(headerStyle);
        }
        int r = 1;
        for (Map<String, String> values : table.getRows()) {
            Row row = sheet.createRow(r++);
            for (int c = 0; c < columns.size(); c++) {
                Cell cell = row.createCell(c);
                Optional<String> formula = table.formula(columns.get(c), r);
                if (formula.isPresent()) {
                    cell.setCellFormula(formula.get());
                }
                // on a formula cell this sets the cached result
                cell.setCellValue(values.get(columns.get(c)));
            }
        }
        sheet.createFreezePane(0, 1);
    }

    private static void defineName(Workbook workbook, TableData table, String sheetName) {
        int lastColumn = Math.max(table.getColumns().size() - 1, 0);
        String reference = new AreaReference(new CellReference(sheetName, 0, 0, true, true),
                new CellReference(sheetName, table.size(), lastColumn, true, true),
                SpreadsheetVersion.EXCEL2007).formatAsString();
        Name name = workbook.createName();
        name.setNameName(table.getRangeName());
        name.setRefersToFormula(reference);
        log.debug("Defined {} as {}", table.getRangeName(), reference);
    }

    private static Sheet selectSheet(Workbook workbook, String sheet, Path path) {
        if (sheet == null || sheet.isBlank()) {
            return workbook.getSheetAt(0);
        }
        String wanted = sheet.trim();
        Sheet byName = workbook.getSheet(wanted);
        if (byName != null) {
            return byName;
        }
        if (SHEET_INDEX.matcher(wanted).matches()) {
            int index = Integer.parseInt(wanted);
            if (index < workbook.getNumberOfSheets()) {
                return workbook.getSheetAt(index);
            }
        }
        throw new TransiGenException("Sheet '" + wanted + "' not found in " + path);
    }

    private static String text(Cell cell, DataFormatter formatter) {
        if (cell == null) {
            return "";
        }
        return formatter.formatCellValue(cell);
    }

    private static CellStyle headerStyle(XSSFWorkbook workbook) {
        XSSFFont bold = workbook.createFont();
        bold.setBold(true);
        CellStyle style = workbook.createCellStyle();
        style.setFont(bold);
        return style;
    }

    private static String uniqueSheetName(String name, Set<String> usedNames) {
        String base = WorkbookUtil.createSafeSheetName(name == null || name.isBlank() ? "Sheet" : name);
        String candidate = base;
        int suffix = 2;
        while (!usedNames.add(candidate.toLowerCase())) {
            String tail = "_" + suffix++;
            candidate = base.substring(0, Math.min(base.length(), 31 - tail.length())) + tail;
        }
        return candidate;
    }
}
