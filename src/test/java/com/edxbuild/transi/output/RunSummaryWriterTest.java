package com.edxbuild.transi.output;

import static org.assertj.core.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.edxbuild.transi.model.ChangeRecord;
import com.edxbuild.transi.model.UnresolvedReference;
import com.edxbuild.transi.pipeline.RunSummary;

/**
 * Unit tests for RunSummaryWriter.
 */
class RunSummaryWriterTest {

    @TempDir
    Path tempDir;

    private final RunSummaryWriter writer = new RunSummaryWriter(new ArtifactNaming(Clock.systemUTC(), ZoneOffset.UTC));

    @Test
    void testRendersCountsReferencesAndChanges() throws Exception {
        RunSummary summary = new RunSummary("mk_tw_in", "Tech");
        summary.input("PreMerge", tempDir.resolve("Tech_PreMerge_latest.csv"));
        summary.count("Rows", 12);
        summary.increment("Changes");
        summary.getUnresolvedReferences().add(new UnresolvedReference("S2", "next1_code", "S9"));
        summary.getChanges().add(new ChangeRecord("S1", "UAP Label", "", "Go"));
        summary.getArtifacts().add(tempDir.resolve("Tech_mk_tw_in_010124_0000.csv"));

        Path report = writer.write(summary, tempDir, "010124_0000");

        assertThat(report).isEqualTo(tempDir.resolve("Tech_mk_tw_in_summary_010124_0000.md"));
        String text = Files.readString(report);
        assertThat(text).contains("# Tech mk_tw_in run summary");
        assertThat(text).contains("| Rows | 12 |");
        assertThat(text).contains("| Changes | 1 |");
        assertThat(text).contains("| S2 | next1_code | S9 |");
        assertThat(text).contains("| S1 | UAP Label |  | Go |");
        assertThat(text).contains("Tech_mk_tw_in_010124_0000.csv");
        assertThat(text).doesNotContain("## Warnings");
    }

    @Test
    void testEmptySectionsSayNone() throws Exception {
        RunSummary summary = new RunSummary("PreMerge", "Tech");
        summary.getWarnings().add("Step S4: manual match 'X1' names no narration entry");

        String text = writer.render(summary, "010124_0000");

        assertThat(text).contains("## Unresolved references\n\n_None._");
        assertThat(text).contains("## Warnings");
        assertThat(text).contains("- Step S4: manual match 'X1' names no narration entry");
    }

    @Test
    void testChangeCellsKeepTableShape() throws Exception {
        RunSummary summary = new RunSummary("mk_tw_in", "Tech");
        summary.getChanges().add(new ChangeRecord("S1", "Narr1", "Yes | No", "line one\nline two"));

        String text = writer.render(summary, "010124_0000");

        assertThat(text).contains("| S1 | Narr1 | Yes \\| No | line one<br>line two |");
    }
}
