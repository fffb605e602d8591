package com.edxbuild.transi.pipeline;

import static com.edxbuild.transi.pipeline.PipelineFixtures.*;
import static org.assertj.core.api.Assertions.*;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.edxbuild.transi.tabular.TableData;
import com.edxbuild.transi.tabular.TabularSource;

/**
 * Tests for LegacyMappingBuilder, the direct mapping-sheet path to mk_tw_in.
 */
class LegacyMappingBuilderTest {

    @TempDir
    Path tempDir;

    private final TabularSource source = new TabularSource();

    private Path out;
    private RunResult result;

    @BeforeEach
    void run() throws Exception {
        out = tempDir.resolve("out");
        String raw = RAW_CSV
                + "deck.pptx,S4,Is the panel on.,,4\n"
                + "deck.pptx,S5,Wrap up,,5\n";
        RunConfig config = config(out)
                .rawPath(write(tempDir, "raw.csv", raw))
                .narrPath(write(tempDir, "narr.csv", NARR_CSV))
                .mappingPath(write(tempDir, "map.csv", "Code,selected_code\n"
                        + "S1,Y1 open\n"
                        + "S2,M7: Press start\n"
                        + "S3,p3\n"
                        + "S4,D3\n"
                        + "S5,Q1\n"))
                .build();
        result = new LegacyMappingBuilder(config).build();
    }

    @Test
    void testCountsAndArtifacts() {
        assertThat(result.isSuccess()).as("run error: %s", result.getErrorMessage()).isTrue();
        assertThat(result.getRowCount()).isEqualTo(5);
        assertThat(result.getMClassCount()).isEqualTo(1);
        assertThat(result.getNonMClassCount()).isEqualTo(3);
        assertThat(result.getUnmatchedCount()).isEqualTo(1);
        assertThat(result.getArtifacts()).containsExactly(
                out.resolve("Tech_mk_tw_in_" + TIMESTAMP + ".csv"),
                out.resolve("Tech_mk_tw_in_" + TIMESTAMP + ".xlsx"));
    }

    @Test
    void testColumnOrder() {
        TableData table = source.load(out.resolve("Tech_mk_tw_in_" + TIMESTAMP + ".csv"));

        assertThat(table.getColumns()).containsExactly("Code", "match_code_OPM", "Title", "Source_Title",
                "Narr1", "Narr2", "Narr3", "Source_PPT", "next1_code", "SlideIndex");
    }

    @Test
    void testNarrationFollowsLeadCode() {
        List<Map<String, String>> rows = source.load(out.resolve("Tech_mk_tw_in_" + TIMESTAMP + ".xlsx")).getRows();

        assertThat(rows.get(0)).containsEntry("match_code_OPM", "Y1").containsEntry("Narr1", "Open panel")
                .containsEntry("Narr2", "");
        assertThat(rows.get(1)).containsEntry("match_code_OPM", "M7")
                .containsEntry("Narr1", "Press start now")
                .containsEntry("Narr2", "Press start")
                .containsEntry("Narr3", "Press the start button to begin")
                .containsEntry("Source_Title", "Press start button");
        assertThat(rows.get(2)).containsEntry("match_code_OPM", "P3").containsEntry("Narr1", "Check it")
                .containsEntry("Narr2", "").containsEntry("Narr3", "");
        assertThat(rows.get(3)).containsEntry("Narr1", "Is the panel on?");
        assertThat(rows.get(4)).containsEntry("match_code_OPM", "Q1").containsEntry("Narr1", "Wrap up")
                .containsEntry("Source_Title", "");
    }
}
