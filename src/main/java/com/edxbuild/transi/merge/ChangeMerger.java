package com.edxbuild.transi.merge;

import static com.edxbuild.transi.tabular.TableColumns.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.edxbuild.transi.error.StartHereViolationException;
import com.edxbuild.transi.model.ChangeRecord;
import com.edxbuild.transi.model.PreMergeRow;
import com.edxbuild.transi.model.PreMergeTable;
import com.edxbuild.transi.tabular.TableData;

/**
 * Applies a reviewer-edited copy of a PreMerge table to the original.
 *
 * A non-blank edited cell that differs from the original overwrites it and is logged; a blank
 * edited cell means "no opinion" and never clears content. {@code Mismatch} is recomputed per
 * row from the changes and is not itself editable. Exactly one merged row must be flagged
 * {@code start_here = Yes}.
 */
public class ChangeMerger {

    private static final Logger log = LoggerFactory.getLogger(ChangeMerger.class);

    /**
     * @throws StartHereViolationException when zero or several merged rows start the document
     */
    public MergeOutcome merge(PreMergeTable original, TableData edited) {
        Map<String, Map<String, String>> editedByCode = indexByCode(edited);
        List<String> editableColumns = new ArrayList<>();
        for (String column : original.columns()) {
            if (!CODE.equals(column) && !MISMATCH.equals(column)) {
                editableColumns.add(column);
            }
        }

        List<PreMergeRow> merged = new ArrayList<>(original.getRows().size());
        List<ChangeRecord> changes = new ArrayList<>();
        for (PreMergeRow row : original.getRows()) {
            Map<String, String> editedRow = editedByCode.remove(row.getCode());
            PreMergeRow result = row;
            int before = changes.size();
            if (editedRow != null) {
                for (String column : editableColumns) {
                    Optional<String> editedColumn = edited.findColumn(column);
                    if (editedColumn.isEmpty()) {
                        continue;
                    }
                    String to = normalize(column, editedRow.getOrDefault(editedColumn.get(), ""));
                    String from = result.cell(column);
                    if (!to.isBlank() && !to.equals(from)) {
                        changes.add(new ChangeRecord(row.getCode(), column, from, to));
                        result = result.withCell(column, to);
                    }
                }
            }
            boolean changed = changes.size() > before;
            merged.add(result.withCell(MISMATCH, changed ? YES : NO));
        }

        if (!editedByCode.isEmpty()) {
            log.warn("Ignoring {} edited row(s) whose Code is not in the PreMerge table: {}",
                    editedByCode.size(), String.join(", ", editedByCode.keySet()));
        }

        List<String> startCodes = merged.stream()
                .filter(PreMergeRow::isStartHere)
                .map(PreMergeRow::getCode)
                .toList();
        if (startCodes.size() != 1) {
            throw new StartHereViolationException(startCodes);
        }

        log.info("Merged edits: {} change(s) across {} row(s); start row {}",
                changes.size(), merged.stream().filter(PreMergeRow::isMismatch).count(), startCodes.get(0));
        return new MergeOutcome(original.withRows(merged), List.copyOf(changes));
    }

    /**
     * {@code start_here} is written as {@code Yes} whatever case the reviewer typed.
     */
    private static String normalize(String column, String value) {
        if (START_HERE.equals(column) && YES.equalsIgnoreCase(value.trim())) {
            return YES;
        }
        return value;
    }

    private static Map<String, Map<String, String>> indexByCode(TableData edited) {
        String codeColumn = edited.findColumn(CODE).orElse(CODE);
        Map<String, Map<String, String>> byCode = new LinkedHashMap<>();
        for (Map<String, String> row : edited.getRows()) {
            String code = row.getOrDefault(codeColumn, "").trim();
            if (code.isEmpty()) {
                continue;
            }
            if (byCode.putIfAbsent(code, row) != null) {
                log.warn("Edited table repeats Code {}; using its first row", code);
            }
        }
        return byCode;
    }
}
