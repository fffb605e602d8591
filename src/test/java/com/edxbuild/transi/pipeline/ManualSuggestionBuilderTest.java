package com.edxbuild.transi.pipeline;

import static com.edxbuild.transi.pipeline.PipelineFixtures.*;
import static org.assertj.core.api.Assertions.*;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.edxbuild.transi.tabular.TableData;
import com.edxbuild.transi.tabular.TabularSource;

/**
 * Tests for ManualSuggestionBuilder.
 */
class ManualSuggestionBuilderTest {

    @TempDir
    Path tempDir;

    private final TabularSource source = new TabularSource();

    @Test
    void testWritesSuggestionWorkbook() throws Exception {
        Path out = tempDir.resolve("out");
        RunConfig config = config(out)
                .rawPath(write(tempDir, "raw.csv", RAW_CSV))
                .narrPath(write(tempDir, "narr.csv", NARR_CSV))
                .build();

        RunResult result = new ManualSuggestionBuilder(config).build();

        assertThat(result.isSuccess()).as("run error: %s", result.getErrorMessage()).isTrue();
        assertThat(result.getSuggestedCount()).isEqualTo(2);
        Path workbook = out.resolve("Tech_Manual_Match_" + TIMESTAMP + ".xlsx");
        assertThat(result.getArtifacts()).contains(workbook,
                out.resolve("Tech_Manual_Match_" + TIMESTAMP + ".csv"),
                out.resolve("Tech_Manual_Match_" + TIMESTAMP + "_Candidates.csv"),
                out.resolve("Tech_Manual_Match_" + TIMESTAMP + "_OPM_Code_Lookup.csv"));

        TableData entries = source.load(workbook, "Map_Entries");
        assertThat(entries.getColumns())
                .containsExactly("Code", "OPM_Step", "Title", "Source_Title", "match_code_OPM", "Match_Conf");
        Map<String, String> s1 = entries.getRows().get(0);
        assertThat(s1.get("match_code_OPM")).isEmpty();
        assertThat(Integer.parseInt(s1.get("Match_Conf"))).isLessThan(80);
        Map<String, String> s2 = entries.getRows().get(1);
        assertThat(s2).containsEntry("match_code_OPM", "M7")
                .containsEntry("OPM_Step", "M7: Press start")
                .containsEntry("Match_Conf", "100");

        TableData candidates = source.load(workbook, "Candidates");
        assertThat(candidates.getRows()).extracting(r -> r.get("Code") + "->" + r.get("Narr_Code"))
                .containsExactly("S2->M7", "S3->P3");
        assertThat(candidates.getRows().get(0)).containsEntry("Rank", "1").containsEntry("Score", "1.0000");

        TableData lookup = source.load(workbook, "OPM_Code_Lookup");
        assertThat(lookup.getColumns()).containsExactly("Code", "OPM_Step", "Source_Title", "Step_narr_out_simple");
        assertThat(lookup.size()).isEqualTo(4);
    }

    @Test
    void testMapEntriesLookUpCorrectedMatch() throws Exception {
        Path out = tempDir.resolve("out");
        RunConfig config = config(out)
                .rawPath(write(tempDir, "raw.csv", RAW_CSV))
                .narrPath(write(tempDir, "narr.csv", NARR_CSV))
                .build();
        new ManualSuggestionBuilder(config).build();

        Path workbookFile = out.resolve("Tech_Manual_Match_" + TIMESTAMP + ".xlsx");
        try (InputStream in = Files.newInputStream(workbookFile); XSSFWorkbook workbook = new XSSFWorkbook(in)) {
            assertThat(workbook.getName("OPM_Code_Lookup")).isNotNull();
            Row s2 = workbook.getSheet("Map_Entries").getRow(2);
            assertThat(s2.getCell(1).getCellType()).isEqualTo(CellType.FORMULA);
            assertThat(s2.getCell(1).getCellFormula())
                    .isEqualTo("IF($E3=\"\",\"\",IFERROR(VLOOKUP($E3,OPM_Code_Lookup,2,FALSE),\"\"))");
            assertThat(s2.getCell(3).getCellType()).isEqualTo(CellType.FORMULA);

            s2.getCell(4).setCellValue("P3");
            FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();
            assertThat(evaluator.evaluate(s2.getCell(1)).getStringValue()).isEqualTo("P3: Check panel");
            assertThat(evaluator.evaluate(s2.getCell(3)).getStringValue()).isEqualTo("Check the panel");
        }

        TableData csv = source.load(out.resolve("Tech_Manual_Match_" + TIMESTAMP + ".csv"));
        assertThat(csv.getRows().get(1)).containsEntry("OPM_Step", "M7: Press start")
                .containsEntry("Source_Title", "Press start button");
    }

    @Test
    void testIgnoredPrefixesNeverSuggested() throws Exception {
        RunConfig config = config(tempDir.resolve("out"))
                .rawPath(write(tempDir, "raw.csv", RAW_CSV))
                .narrPath(write(tempDir, "narr.csv", NARR_CSV))
                .suggestionThreshold(0.0)
                .maxCandidates(10)
                .build();

        new ManualSuggestionBuilder(config).build();

        TableData candidates = source.load(tempDir.resolve("out/Tech_Manual_Match_" + TIMESTAMP + "_Candidates.csv"));
        assertThat(candidates.getRows()).extracting(r -> r.get("Narr_Code")).containsOnly("M7", "P3");
    }

    @Test
    void testMapEntriesFeedBackAsManualMap() throws Exception {
        Path out = tempDir.resolve("out");
        Path raw = write(tempDir, "raw.csv", RAW_CSV);
        Path narr = write(tempDir, "narr.csv", NARR_CSV);
        new ManualSuggestionBuilder(config(out).rawPath(raw).narrPath(narr).build()).build();

        RunResult premerge = new PreMergeBuilder(config(out).rawPath(raw).narrPath(narr)
                .manualMapPath(out.resolve("Tech_Manual_Match_latest.csv")).build()).build();

        assertThat(premerge.isSuccess()).as("run error: %s", premerge.getErrorMessage()).isTrue();
        assertThat(premerge.getMClassCount()).isEqualTo(1);
        assertThat(premerge.getNonMClassCount()).isEqualTo(1);
        assertThat(premerge.getUnmatchedCount()).isEqualTo(1);
    }
}
