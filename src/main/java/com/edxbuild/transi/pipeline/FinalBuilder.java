package com.edxbuild.transi.pipeline;

import static com.edxbuild.transi.tabular.TableColumns.*;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.edxbuild.transi.merge.ChangeMerger;
import com.edxbuild.transi.merge.MergeOutcome;
import com.edxbuild.transi.model.ChangeRecord;
import com.edxbuild.transi.model.PreMergeTable;
import com.edxbuild.transi.tabular.TableData;
import com.edxbuild.transi.tabular.TabularSource;

/**
 * Applies reviewer edits to a PreMerge table and writes the final mk_tw_in table with its
 * change log. A start_here violation aborts the run before anything is written.
 */
public class FinalBuilder extends PipelineStage {

    private static final Logger log = LoggerFactory.getLogger(FinalBuilder.class);

    public static final String STAGE = "mk_tw_in";
    public static final String CHANGE_LOG_SHEET = "ChangeLog";

    private final ChangeMerger merger = new ChangeMerger();

    public FinalBuilder(RunConfig config) {
        super(config);
    }

    public FinalBuilder(RunConfig config, TabularSource source) {
        super(config, source);
    }

    @Override
    public String getStage() {
        return STAGE;
    }

    @Override
    protected RunResult.RunResultBuilder execute(RunSummary summary, String timestamp) throws Exception {
        summary.input("PreMerge", config.getPremergePath());
        summary.input("Edited", config.getEditedPath());

        // Step 1: Load tables
        log.info("Step 1: Loading PreMerge and edited tables...");
        PreMergeTable original = loader.loadPreMerge(config.getPremergePath());
        TableData edited = loader.loadEdited(config.getEditedPath());

        // Step 2: Merge
        log.info("Step 2: Merging edits into {} row(s)...", original.getRows().size());
        MergeOutcome outcome = merger.merge(original, edited);
        summary.count("Rows", outcome.getTable().getRows().size());
        summary.count("Changes", outcome.getChanges().size());
        summary.count("Changed rows", outcome.changedRowCount());
        summary.getChanges().addAll(outcome.getChanges());

        // Step 3: Write artifacts
        log.info("Step 3: Writing mk_tw_in artifacts...");
        ensureOutputDir();
        List<Path> artifacts = artifactWriter.write(config, STAGE, timestamp,
                outcome.getTable().toTableData(STAGE), List.of(changeLog(outcome.getChanges())));

        return written(artifacts)
                .rowCount(outcome.getTable().getRows().size())
                .changeCount(outcome.getChanges().size())
                .changedRowCount(outcome.changedRowCount());
    }

    static TableData changeLog(List<ChangeRecord> changes) {
        List<Map<String, String>> rows = new ArrayList<>(changes.size());
        for (ChangeRecord change : changes) {
            Map<String, String> row = new LinkedHashMap<>();
            row.put(CODE, change.getCode());
            row.put(FIELD, change.getField());
            row.put(FROM, change.getFrom());
            row.put(TO, change.getTo());
            rows.add(row);
        }
        return TableData.of(CHANGE_LOG_SHEET, CHANGE_LOG, rows);
    }
}
