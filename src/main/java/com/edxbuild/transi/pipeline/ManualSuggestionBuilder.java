package com.edxbuild.transi.pipeline;

import static com.edxbuild.transi.tabular.TableColumns.*;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.edxbuild.transi.catalog.NarrCatalog;
import com.edxbuild.transi.catalog.RawStepTable;
import com.edxbuild.transi.model.NarrEntry;
import com.edxbuild.transi.model.Suggestion;
import com.edxbuild.transi.suggest.FuzzySuggester;
import com.edxbuild.transi.suggest.StepSuggestions;
import com.edxbuild.transi.tabular.TableData;
import com.edxbuild.transi.tabular.TabularSource;

/**
 * Writes the Manual_Match workbook: a pre-filled manual map for reviewers to correct.
 *
 * {@code Map_Entries} has one row per raw step with the top suggestion (if any) in
 * {@code match_code_OPM}; the sheet can be fed back as the manual map of a PreMerge run.
 * {@code Candidates} lists every ranked suggestion and {@code OPM_Code_Lookup} the whole catalog.
 *
 * In the workbook, {@code OPM_Code_Lookup} is also a workbook name, and the {@code OPM_Step} and
 * {@code Source_Title} cells of {@code Map_Entries} look up the row's {@code match_code_OPM} in it,
 * so correcting a match refreshes them. The CSV companions hold the same values without formulas.
 */
public class ManualSuggestionBuilder extends PipelineStage {

    private static final Logger log = LoggerFactory.getLogger(ManualSuggestionBuilder.class);

    public static final String STAGE = "Manual_Match";
    public static final String MAP_ENTRIES_SHEET = "Map_Entries";
    public static final String CANDIDATES_SHEET = "Candidates";
    public static final String LOOKUP_SHEET = "OPM_Code_Lookup";

    static final List<String> MAP_ENTRIES_COLUMNS =
            List.of(CODE, OPM_STEP, TITLE, SOURCE_TITLE, MATCH_CODE_OPM, MATCH_CONF);
    static final List<String> CANDIDATES_COLUMNS =
            List.of(CODE, RANK, NARR_CODE, OPM_STEP, SOURCE_TITLE, SCORE);
    static final List<String> LOOKUP_COLUMNS =
            List.of(CODE, OPM_STEP, SOURCE_TITLE, STEP_NARR_OUT_SIMPLE);

    static final Map<String, String> MAP_ENTRIES_FORMULAS = Map.of(
            OPM_STEP, lookupFormula(OPM_STEP),
            SOURCE_TITLE, lookupFormula(SOURCE_TITLE));

    public ManualSuggestionBuilder(RunConfig config) {
        super(config);
    }

    public ManualSuggestionBuilder(RunConfig config, TabularSource source) {
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

        // Step 1: Load inputs
        log.info("Step 1: Loading RAW steps and narration catalog...");
        RawStepTable steps = loader.loadRawSteps(config.getRawPath());
        NarrCatalog catalog = loader.loadNarrCatalog(config.getNarrPath(), config.getNarrSheet());

        // Step 2: Score
        log.info("Step 2: Scoring titles with {} similarity...", config.getSimilarityMetric());
        FuzzySuggester suggester = FuzzySuggester.builder()
                .similarity(config.getSimilarityMetric().create())
                .threshold(config.getSuggestionThreshold())
                .maxCandidates(config.getMaxCandidates())
                .ignoredPrefixes(config.getIgnoredPrefixes())
                .build();
        List<StepSuggestions> suggestions = suggester.suggest(steps, catalog);
        int suggested = (int) suggestions.stream().filter(s -> s.top().isPresent()).count();
        summary.count("Rows", steps.size());
        summary.count("Suggested", suggested);
        summary.count("Without suggestion", steps.size() - suggested);

        // Step 3: Write workbook
        log.info("Step 3: Writing Manual_Match workbook...");
        ensureOutputDir();
        List<Path> artifacts = artifactWriter.write(config, STAGE, timestamp, mapEntries(suggestions),
                List.of(candidates(suggestions), lookup(catalog)));

        return written(artifacts)
                .rowCount(steps.size())
                .suggestedCount(suggested);
    }

    static TableData mapEntries(List<StepSuggestions> suggestions) {
        List<Map<String, String>> rows = new ArrayList<>(suggestions.size());
        for (StepSuggestions forStep : suggestions) {
            Optional<NarrEntry> top = forStep.top().map(Suggestion::getNarrEntry);
            Map<String, String> row = new LinkedHashMap<>();
            row.put(CODE, forStep.getStep().getCode());
            row.put(OPM_STEP, top.map(NarrEntry::getOpmStep).orElse(""));
            row.put(TITLE, forStep.getStep().getTitle());
            row.put(SOURCE_TITLE, top.map(NarrEntry::getSourceTitle).orElse(""));
            row.put(MATCH_CODE_OPM, top.map(NarrEntry::getCode).orElse(""));
            row.put(MATCH_CONF, String.valueOf(forStep.confidencePercent()));
            rows.add(row);
        }
        return TableData.of(MAP_ENTRIES_SHEET, MAP_ENTRIES_COLUMNS, rows).withFormulas(MAP_ENTRIES_FORMULAS);
    }

    static TableData candidates(List<StepSuggestions> suggestions) {
        List<Map<String, String>> rows = new ArrayList<>();
        for (StepSuggestions forStep : suggestions) {
            for (Suggestion suggestion : forStep.getCandidates()) {
                NarrEntry entry = suggestion.getNarrEntry();
                Map<String, String> row = new LinkedHashMap<>();
                row.put(CODE, suggestion.getRawCode());
                row.put(RANK, String.valueOf(suggestion.getRank()));
                row.put(NARR_CODE, entry.getCode());
                row.put(OPM_STEP, entry.getOpmStep());
                row.put(SOURCE_TITLE, entry.getSourceTitle());
                row.put(SCORE, String.format(Locale.ROOT, "%.4f", suggestion.getScore()));
                rows.add(row);
            }
        }
        return TableData.of(CANDIDATES_SHEET, CANDIDATES_COLUMNS, rows);
    }

    static TableData lookup(NarrCatalog catalog) {
        List<Map<String, String>> rows = new ArrayList<>(catalog.size());
        for (NarrEntry entry : catalog.getEntries()) {
            Map<String, String> row = new LinkedHashMap<>();
            row.put(CODE, entry.getCode());
            row.put(OPM_STEP, entry.getOpmStep());
            row.put(SOURCE_TITLE, entry.getSourceTitle());
            row.put(STEP_NARR_OUT_SIMPLE, entry.getNarrSimple());
            rows.add(row);
        }
        return TableData.of(LOOKUP_SHEET, LOOKUP_COLUMNS, rows).withRangeName(LOOKUP_SHEET);
    }

    /**
     * Blank when the row has no match, else the lookup column's value, blank when not found.
     */
    static String lookupFormula(String lookupColumn) {
        char matchColumn = (char) ('A' + MAP_ENTRIES_COLUMNS.indexOf(MATCH_CODE_OPM));
        String match = "$" + matchColumn + TableData.ROW_PLACEHOLDER;
        int index = LOOKUP_COLUMNS.indexOf(lookupColumn) + 1;
        return "IF(" + match + "=\"\",\"\",IFERROR(VLOOKUP(" + match + "," + LOOKUP_SHEET + ","
                + index + ",FALSE),\"\"))";
    }
}
