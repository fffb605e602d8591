package com.edxbuild.transi.catalog;

import static com.edxbuild.transi.tabular.TableColumns.*;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.edxbuild.transi.model.ManualMapEntry;
import com.edxbuild.transi.model.NarrEntry;
import com.edxbuild.transi.model.PreMergeRow;
import com.edxbuild.transi.model.PreMergeTable;
import com.edxbuild.transi.model.RawStep;
import com.edxbuild.transi.tabular.BoundTable;
import com.edxbuild.transi.tabular.TableData;
import com.edxbuild.transi.tabular.TableSchemas;
import com.edxbuild.transi.tabular.TabularSource;

import lombok.RequiredArgsConstructor;

/**
 * Loads the pipeline's input tables and turns them into typed collections.
 *
 * Every table is validated against its schema before a single row is read; codes are trimmed
 * and rows without a code are skipped with a warning.
 */
@RequiredArgsConstructor
public class CatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(CatalogLoader.class);

    private final TabularSource source;

    public RawStepTable loadRawSteps(Path path) {
        BoundTable table = TableSchemas.RAW.bind(source.load(path), path);
        List<String> columns = table.canonicalColumns();

        List<RawStep> steps = new ArrayList<>();
        int skipped = 0;
        for (Map<String, String> row : table.rows()) {
            String code = table.get(row, CODE).trim();
            if (code.isEmpty()) {
                skipped++;
                continue;
            }
            steps.add(RawStep.builder()
                    .code(code)
                    .title(table.get(row, TITLE))
                    .decisionQuestion(table.get(row, DECI_QUESTION))
                    .next1Code(table.get(row, NEXT1_CODE).trim())
                    .next2Code(table.get(row, NEXT2_CODE).trim())
                    .next3Code(table.get(row, NEXT3_CODE).trim())
                    .cells(withCode(table.canonicalRow(row), code))
                    .build());
        }
        if (skipped > 0) {
            log.warn("Skipped {} RAW row(s) without a Code in {}", skipped, path);
        }
        return RawStepTable.of(columns, steps);
    }

    public NarrCatalog loadNarrCatalog(Path path, String sheet) {
        BoundTable table = TableSchemas.NARR.bind(source.load(path, sheet), path);

        List<NarrEntry> entries = new ArrayList<>();
        int skipped = 0;
        for (Map<String, String> row : table.rows()) {
            String code = table.get(row, CODE).trim();
            if (code.isEmpty()) {
                skipped++;
                continue;
            }
            entries.add(NarrEntry.builder()
                    .code(code)
                    .opmStep(table.get(row, OPM_STEP).trim())
                    .sourceTitle(table.get(row, SOURCE_TITLE))
                    .narrSimple(table.get(row, STEP_NARR_OUT_SIMPLE))
                    .narrFull(table.get(row, STEP_NARR_OUT))
                    .narrMSimple(table.get(row, STEP_NARR_M_OUT_SIMPLE))
                    .narrMFull(table.get(row, STEP_NARR_M_OUT))
                    .build());
        }
        if (skipped > 0) {
            log.warn("Skipped {} narration row(s) without a Code in {}", skipped, path);
        }
        return NarrCatalog.of(entries);
    }

    /**
     * Reads a manual map. {@code Match} wins; a blank {@code Match} falls back to {@code OPM_Step}.
     * Rows with neither leave their raw step unmapped.
     */
    public ManualMap loadManualMap(Path path) {
        BoundTable table = TableSchemas.MANUAL_MAP.bind(source.load(path), path);

        List<ManualMapEntry> entries = new ArrayList<>();
        for (Map<String, String> row : table.rows()) {
            String code = table.get(row, MAP_CODE).trim();
            if (code.isEmpty()) {
                continue;
            }
            String match = table.get(row, MATCH).trim();
            String token = match.isEmpty() ? table.get(row, OPM_STEP).trim() : match;
            if (!token.isEmpty()) {
                entries.add(new ManualMapEntry(code, token));
            }
        }
        log.info("Manual map {} maps {} raw step(s)", path.getFileName(), entries.size());
        return ManualMap.of(entries);
    }

    /**
     * Reads a previously written PreMerge artifact.
     */
    public PreMergeTable loadPreMerge(Path path) {
        BoundTable table = TableSchemas.PREMERGE.bind(source.load(path), path);
        List<String> rawColumns = new ArrayList<>();
        for (String column : table.canonicalColumns()) {
            if (!DERIVED.contains(column)) {
                rawColumns.add(column);
            }
        }
        List<PreMergeRow> rows = new ArrayList<>();
        for (Map<String, String> row : table.rows()) {
            Map<String, String> cells = table.canonicalRow(row);
            String code = cells.getOrDefault(CODE, "").trim();
            if (code.isEmpty()) {
                log.warn("Skipping PreMerge row without a Code in {}", path);
                continue;
            }
            rows.add(PreMergeRow.fromCells(withCode(cells, code)));
        }
        return new PreMergeTable(rawColumns, rows);
    }

    /**
     * Reads the reviewer-edited copy of a PreMerge artifact, keyed by canonical column names.
     */
    public TableData loadEdited(Path path) {
        BoundTable table = TableSchemas.EDITED.bind(source.load(path), path);
        List<Map<String, String>> rows = new ArrayList<>();
        for (Map<String, String> row : table.rows()) {
            Map<String, String> cells = table.canonicalRow(row);
            cells.put(CODE, cells.getOrDefault(CODE, "").trim());
            rows.add(cells);
        }
        return TableData.of(table.getTable().getName(), table.canonicalColumns(), rows);
    }

    public BoundTable loadLegacyMapping(Path path) {
        return TableSchemas.LEGACY_MAP.bind(source.load(path), path);
    }

    private static Map<String, String> withCode(Map<String, String> cells, String code) {
        Map<String, String> copy = new LinkedHashMap<>(cells);
        copy.put(CODE, code);
        return Collections.unmodifiableMap(copy);
    }
}
