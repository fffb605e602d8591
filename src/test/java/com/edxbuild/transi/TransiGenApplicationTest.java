package com.edxbuild.transi;

import static org.assertj.core.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.edxbuild.transi.tabular.TableData;
import com.edxbuild.transi.tabular.TabularSource;

/**
 * End-to-end tests running the command line through picocli.
 */
class TransiGenApplicationTest {

    @TempDir
    Path tempDir;

    private final TabularSource source = new TabularSource();

    private static final String RAW = "Code,Title,next1_code\nS1,Open panel,S2\nS2,Press start button,\n";
    private static final String NARR =
            "Code,OPM_Step,Source_Title,Step_narr_out_simple,Step_narr_out,Step_narr_m_out_simple,Step_narr_m_out\n"
            + "M7,M7: Press start,Press start button,Press start now,Press the start button now,Press start,Press the start button to begin\n";

    @Test
    void testPremergeThenMkTwIn() throws IOException {
        Path raw = Files.writeString(tempDir.resolve("raw.csv"), RAW);
        Path narr = Files.writeString(tempDir.resolve("narr.csv"), NARR);
        Path map = Files.writeString(tempDir.resolve("map.csv"), "CODE,Match\nS2,M7\n");
        Path out = tempDir.resolve("out");

        int premerge = TransiGenApplication.execute("--gen", "premerge", "--sop", "Tech", "--raw", raw.toString(),
                "--narr", narr.toString(), "--resp-transi-in", map.toString(), "--out", out.toString(), "--zone", "UTC");

        assertThat(premerge).isEqualTo(0);
        assertThat(out.resolve("Tech_PreMerge_latest.csv")).exists();
        assertThat(out.resolve("Tech_PreMerge_latest.xlsx")).exists();
        assertThat(fileNames(out)).anyMatch(n -> n.startsWith("Tech_PreMerge_summary_") && n.endsWith(".md"));

        Path untouched = tempDir.resolve("untouched.csv");
        Files.copy(out.resolve("Tech_PreMerge_latest.csv"), untouched);
        assertThat(TransiGenApplication.execute("--gen", "mk-tw-in", "--sop", "Tech",
                "--resp-merge", untouched.toString(), "--out", out.toString())).isEqualTo(1);

        TableData premergeTable = source.load(out.resolve("Tech_PreMerge_latest.xlsx"));
        List<Map<String, String>> rows = new ArrayList<>();
        for (Map<String, String> row : premergeTable.getRows()) {
            Map<String, String> copy = new LinkedHashMap<>(row);
            copy.put("start_here", "S1".equals(row.get("Code")) ? "Yes" : "");
            rows.add(copy);
        }
        Path resp = tempDir.resolve("resp.xlsx");
        source.save(TableData.of("resp_merge", premergeTable.getColumns(), rows), resp);

        int mkTwIn = TransiGenApplication.execute("--gen", "MK-TW-IN", "--sop", "Tech",
                "--resp-merge", resp.toString(), "--out", out.toString(), "--no-summary", "--no-latest");

        assertThat(mkTwIn).isEqualTo(0);
        assertThat(out.resolve("Tech_mk_tw_in_latest.csv")).doesNotExist();
        assertThat(fileNames(out)).anyMatch(n -> n.startsWith("Tech_mk_tw_in_") && n.endsWith("_ChangeLog.csv"))
                .noneMatch(n -> n.startsWith("Tech_mk_tw_in_summary_"));
    }

    @Test
    void testInvalidOptionsExitCode() {
        int code = TransiGenApplication.execute("--gen", "premerge", "--raw", tempDir.resolve("none.csv").toString(),
                "--out", tempDir.toString());

        assertThat(code).isEqualTo(2);
    }

    @Test
    void testUnknownModeIsUsageError() {
        assertThat(TransiGenApplication.execute("--gen", "bogus")).isEqualTo(2);
    }

    @Test
    void testMissingInputColumnFailsRun() throws IOException {
        Path raw = Files.writeString(tempDir.resolve("raw.csv"), "Code,Heading\nS1,Open\n");
        Path narr = Files.writeString(tempDir.resolve("narr.csv"), NARR);
        Path out = tempDir.resolve("out");

        int code = TransiGenApplication.execute("--gen", "manual", "--raw", raw.toString(),
                "--narr", narr.toString(), "--out", out.toString());

        assertThat(code).isEqualTo(1);
        assertThat(out).doesNotExist();
    }

    private static List<String> fileNames(Path dir) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            return files.map(p -> p.getFileName().toString()).collect(Collectors.toList());
        }
    }
}
