package com.edxbuild.transi.pipeline;

import static com.edxbuild.transi.tabular.TableColumns.*;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.edxbuild.transi.catalog.NarrCatalog;
import com.edxbuild.transi.catalog.RawStepTable;
import com.edxbuild.transi.derive.TitleText;
import com.edxbuild.transi.match.MatchResolver;
import com.edxbuild.transi.model.NarrEntry;
import com.edxbuild.transi.model.RawStep;
import com.edxbuild.transi.tabular.BoundTable;
import com.edxbuild.transi.tabular.TableData;
import com.edxbuild.transi.tabular.TabularSource;

/**
 * Direct path from RAW, the narration catalog and a mapping sheet to an mk_tw_in table,
 * skipping the PreMerge review.
 *
 * The mapping value of each step is reduced to its leading code, which selects the narration
 * entry. Narration then follows the lead code of the entry's {@code OPM_Step} (or of the mapping
 * value when the entry is missing):
 * <ul>
 *   <li>{@code D...}: the title phrased as a question;</li>
 *   <li>{@code Y...} / {@code N...}: the first half of the title;</li>
 *   <li>otherwise the simple narration, or the title when that is blank, plus the M variants in
 *       Narr2/Narr3 when the lead code contains {@code M}.</li>
 * </ul>
 */
public class LegacyMappingBuilder extends PipelineStage {

    private static final Logger log = LoggerFactory.getLogger(LegacyMappingBuilder.class);

    public static final String STAGE = "mk_tw_in";

    static final List<String> LEADING_COLUMNS =
            List.of(CODE, MATCH_CODE_OPM, TITLE, SOURCE_TITLE, NARR1, NARR2, NARR3);

    public LegacyMappingBuilder(RunConfig config) {
        super(config);
    }

    public LegacyMappingBuilder(RunConfig config, TabularSource source) {
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
        summary.input("Mapping", config.getMappingPath());

        // Step 1: Load inputs
        log.info("Step 1: Loading RAW steps, narration catalog and mapping sheet...");
        RawStepTable steps = loader.loadRawSteps(config.getRawPath());
        NarrCatalog catalog = loader.loadNarrCatalog(config.getNarrPath(), config.getNarrSheet());
        Map<String, String> mapping = matchCodes(loader.loadLegacyMapping(config.getMappingPath()));

        // Step 2: Derive narration
        log.info("Step 2: Deriving narration for {} step(s)...", steps.size());
        TableData table = build(steps, catalog, mapping, summary);

        // Step 3: Write artifacts
        log.info("Step 3: Writing mk_tw_in artifacts...");
        ensureOutputDir();
        List<Path> artifacts = artifactWriter.write(config, STAGE, timestamp, table, List.of());

        return written(artifacts)
                .rowCount(table.size())
                .mClassCount(summary.get("M"))
                .nonMClassCount(summary.get("Matched") - summary.get("M"))
                .unmatchedCount(summary.get("Unmatched"));
    }

    /**
     * Raw code to the leading code of its mapping value. The first row of a repeated code wins.
     */
    static Map<String, String> matchCodes(BoundTable mapping) {
        if (!mapping.has(MATCH_CODE_OPM)) {
            log.warn("Mapping sheet has no match column; every step will be unmatched");
        }
        Map<String, String> codes = new HashMap<>();
        for (Map<String, String> row : mapping.rows()) {
            String code = mapping.get(row, CODE).trim();
            if (code.isEmpty()) {
                continue;
            }
            String match = MatchResolver.leadCode(mapping.get(row, MATCH_CODE_OPM)).orElse("");
            if (codes.putIfAbsent(code, match) != null) {
                log.warn("Mapping sheet repeats Code {}; using its first row", code);
            }
        }
        return codes;
    }

    TableData build(RawStepTable steps, NarrCatalog catalog, Map<String, String> mapping, RunSummary summary) {
        Set<String> columns = new LinkedHashSet<>(LEADING_COLUMNS);
        columns.addAll(steps.getColumns());
        summary.count("Rows", steps.size());
        summary.count("Matched", 0);
        summary.count("M", 0);
        summary.count("Unmatched", 0);

        List<Map<String, String>> rows = new ArrayList<>(steps.size());
        for (RawStep step : steps.getSteps()) {
            String matchCode = mapping.getOrDefault(step.getCode(), "");
            Optional<NarrEntry> entry = matchCode.isEmpty() ? Optional.empty() : catalog.findByCode(matchCode);
            if (entry.isPresent()) {
                summary.increment("Matched");
            } else {
                summary.increment("Unmatched");
                if (!matchCode.isEmpty()) {
                    log.warn("Step {}: mapped code {} is not in the narration catalog", step.getCode(), matchCode);
                    summary.getWarnings().add("Step " + step.getCode() + ": mapped code " + matchCode
                            + " is not in the narration catalog");
                }
            }
            String lead = entry.flatMap(e -> MatchResolver.leadCode(e.getOpmStep())).orElse(matchCode);

            Map<String, String> row = new LinkedHashMap<>();
            row.put(CODE, step.getCode());
            row.put(MATCH_CODE_OPM, matchCode);
            row.put(TITLE, step.getTitle());
            row.put(SOURCE_TITLE, entry.map(NarrEntry::getSourceTitle).orElse(""));
            narrate(row, step, entry, lead, summary);
            for (String column : steps.getColumns()) {
                row.putIfAbsent(column, step.cell(column));
            }
            rows.add(row);
        }
        return TableData.of(STAGE, new ArrayList<>(columns), rows);
    }

    private void narrate(Map<String, String> row, RawStep step, Optional<NarrEntry> entry, String lead,
                         RunSummary summary) {
        String upper = lead.toUpperCase(Locale.ROOT);
        String narr1;
        String narr2 = "";
        String narr3 = "";
        if (upper.startsWith("D")) {
            narr1 = TitleText.questionize(step.getTitle());
        } else if (upper.startsWith("Y") || upper.startsWith("N")) {
            narr1 = TitleText.firstHalf(step.getTitle());
        } else {
            String simple = entry.map(NarrEntry::getNarrSimple).orElse("");
            narr1 = simple.isEmpty() ? step.getTitle() : simple;
            if (entry.isPresent() && upper.contains("M")) {
                narr2 = entry.get().getNarrMSimple();
                narr3 = entry.get().getNarrMFull();
                summary.increment("M");
            }
        }
        row.put(NARR1, narr1);
        row.put(NARR2, narr2);
        row.put(NARR3, narr3);
    }
}
