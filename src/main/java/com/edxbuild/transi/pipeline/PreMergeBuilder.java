package com.edxbuild.transi.pipeline;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.edxbuild.transi.catalog.ManualMap;
import com.edxbuild.transi.catalog.NarrCatalog;
import com.edxbuild.transi.catalog.RawStepTable;
import com.edxbuild.transi.derive.Derivation;
import com.edxbuild.transi.derive.FieldDeriver;
import com.edxbuild.transi.match.MatchResolver;
import com.edxbuild.transi.model.ManualMapEntry;
import com.edxbuild.transi.model.MatchResolution;
import com.edxbuild.transi.model.PreMergeRow;
import com.edxbuild.transi.model.PreMergeTable;
import com.edxbuild.transi.model.RawStep;
import com.edxbuild.transi.model.UnresolvedReference;
import com.edxbuild.transi.tabular.TabularSource;

/**
 * Builds the reviewable PreMerge table from RAW steps, the narration catalog and an optional
 * manual map.
 */
public class PreMergeBuilder extends PipelineStage {

    private static final Logger log = LoggerFactory.getLogger(PreMergeBuilder.class);

    public static final String STAGE = "PreMerge";

    private final FieldDeriver deriver = new FieldDeriver();

    public PreMergeBuilder(RunConfig config) {
        super(config);
    }

    public PreMergeBuilder(RunConfig config, TabularSource source) {
        super(config, source);
    }

    @Override
    public String getStage() {
        return STAGE;
    }

    @Override
    protected RunResult.RunResultBuilder execute(RunSummary summary, String timestamp) throws Exception {
        summary.input("RAW", config.getRawPath());
        summary.input("Narr", config.getNarrPath());
        summary.input("Manual map", config.getManualMapPath());

        // Step 1: Load inputs
        log.info("Step 1: Loading RAW steps and narration catalog...");
        RawStepTable steps = loader.loadRawSteps(config.getRawPath());
        NarrCatalog catalog = loader.loadNarrCatalog(config.getNarrPath(), config.getNarrSheet());
        ManualMap manualMap = config.getManualMapPath() != null
                ? loader.loadManualMap(config.getManualMapPath())
                : ManualMap.empty();

        // Step 2: Resolve and derive
        log.info("Step 2: Resolving matches and deriving narration for {} step(s)...", steps.size());
        PreMergeTable table = derive(steps, catalog, manualMap, summary);

        // Step 3: Write artifacts
        log.info("Step 3: Writing PreMerge artifacts...");
        ensureOutputDir();
        List<Path> artifacts = artifactWriter.write(config, STAGE, timestamp, table.toTableData(STAGE), List.of());

        return written(artifacts)
                .rowCount(table.getRows().size())
                .mClassCount(summary.get("M"))
                .nonMClassCount(summary.get("NON_M"))
                .unmatchedCount(summary.get("NONE"))
                .unresolvedReferenceCount(summary.getUnresolvedReferences().size());
    }

    /**
     * Resolves and derives every raw step, in RAW order. Nothing is written.
     */
    public PreMergeTable derive(RawStepTable steps, NarrCatalog catalog, ManualMap manualMap, RunSummary summary) {
        MatchResolver resolver = new MatchResolver(catalog, config.getMClassPrefix());
        summary.count("Rows", steps.size());
        summary.count("M", 0);
        summary.count("NON_M", 0);
        summary.count("NONE", 0);

        List<PreMergeRow> rows = new ArrayList<>(steps.size());
        for (RawStep step : steps.getSteps()) {
            Optional<ManualMapEntry> manualEntry = manualMap.find(step.getCode());
            MatchResolution resolution = resolver.resolve(step, manualEntry);
            if (manualEntry.isPresent() && !resolution.isMatched()) {
                summary.getWarnings().add("Step " + step.getCode() + ": manual match '"
                        + manualEntry.get().getMatchToken() + "' names no narration entry");
            }
            Derivation derivation = deriver.derive(step, resolution, steps);
            rows.add(derivation.getRow());
            summary.increment(derivation.getMatchClass().name());
            for (UnresolvedReference ref : derivation.getUnresolvedReferences()) {
                log.warn("Step {}: {} points at unknown code {}", ref.getCode(), ref.getColumn(), ref.getTarget());
                summary.getUnresolvedReferences().add(ref);
            }
        }
        log.info("Matched {} M, {} non-M, {} unmatched", summary.get("M"), summary.get("NON_M"), summary.get("NONE"));
        return new PreMergeTable(steps.getColumns(), rows);
    }
}
