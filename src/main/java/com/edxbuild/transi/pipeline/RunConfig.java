package com.edxbuild.transi.pipeline;

import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneId;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import com.edxbuild.transi.suggest.SimilarityMetric;
import com.edxbuild.transi.tabular.TableFormat;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Everything one pipeline run needs. Passed explicitly to every stage; there is no ambient
 * "current SOP" or working directory.
 */
@Value
@Builder(toBuilder = true)
public class RunConfig {

    /**
     * SOP code scoping the run; prefixes every artifact name.
     */
    @NonNull
    String sop;

    /**
     * Directory receiving all artifacts.
     */
    @NonNull
    Path outputDir;

    // ---- inputs (each mode uses a subset) ----

    Path rawPath;

    Path narrPath;

    /**
     * Narration sheet index or name when the catalog is a workbook.
     */
    @Builder.Default
    String narrSheet = "0";

    /**
     * Optional reviewer map of raw code to narration code or OPM_Step (premerge).
     */
    Path manualMapPath;

    /**
     * PreMerge artifact the edits were made against (mk_tw_in).
     */
    Path premergePath;

    /**
     * Reviewer-edited PreMerge copy (mk_tw_in).
     */
    Path editedPath;

    /**
     * Mapping sheet for the legacy direct path (twee).
     */
    Path mappingPath;

    // ---- matching ----

    @Builder.Default
    String mClassPrefix = "M";

    @Builder.Default
    double suggestionThreshold = 0.80;

    @Builder.Default
    int maxCandidates = 3;

    /**
     * Narration codes starting with one of these are never suggested.
     */
    @Builder.Default
    List<String> ignoredPrefixes = List.of("D", "N", "Y");

    @Builder.Default
    SimilarityMetric similarityMetric = SimilarityMetric.SEQUENCE;

    // ---- output ----

    @Builder.Default
    Set<TableFormat> formats = EnumSet.allOf(TableFormat.class);

    @Builder.Default
    boolean writeLatestAlias = true;

    @Builder.Default
    boolean writeSummary = true;

    @Builder.Default
    ZoneId zone = ZoneId.of("America/New_York");

    @Builder.Default
    Clock clock = Clock.systemUTC();
}
