package com.edxbuild.transi.suggest;

import static org.assertj.core.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.edxbuild.transi.catalog.NarrCatalog;
import com.edxbuild.transi.catalog.RawStepTable;
import com.edxbuild.transi.model.NarrEntry;
import com.edxbuild.transi.model.RawStep;
import com.edxbuild.transi.model.Suggestion;

/**
 * Unit tests for FuzzySuggester.
 */
class FuzzySuggesterTest {

    private final RawStepTable steps = RawStepTable.of(List.of("Code", "Title"), List.of(
            RawStep.builder().code("S1").title("P3: Check the panel").build(),
            RawStep.builder().code("S2").title("Something unrelated entirely").build(),
            RawStep.builder().code("S3").title("").build()));

    private final NarrCatalog catalog = NarrCatalog.of(List.of(
            NarrEntry.builder().code("P3").opmStep("P3: Check panel").sourceTitle("Check the panel").build(),
            NarrEntry.builder().code("P7").opmStep("P7: Check the panels").sourceTitle("").build(),
            NarrEntry.builder().code("D1").opmStep("D1").sourceTitle("Check the panel").build(),
            NarrEntry.builder().code("M2").opmStep("M2").sourceTitle("Open the door").build()));

    @Test
    void testRanksCandidatesAboveThreshold() {
        FuzzySuggester suggester = FuzzySuggester.builder()
                .threshold(0.80).maxCandidates(3).ignoredPrefixes(List.of("D", "N", "Y")).build();

        List<StepSuggestions> result = suggester.suggest(steps, catalog);

        assertThat(result).hasSize(3);
        StepSuggestions s1 = result.get(0);
        assertThat(s1.getCandidates()).extracting(s -> s.getNarrEntry().getCode()).containsExactly("P3", "P7");
        assertThat(s1.getCandidates()).extracting(Suggestion::getRank).containsExactly(1, 2);
        assertThat(s1.top().get().getScore()).isEqualTo(1.0);
        assertThat(s1.confidencePercent()).isEqualTo(100);
    }

    @Test
    void testIgnoredPrefixesAreNeverSuggested() {
        FuzzySuggester suggester = FuzzySuggester.builder()
                .threshold(0.5).maxCandidates(10).ignoredPrefixes(List.of("d")).build();

        List<StepSuggestions> result = suggester.suggest(steps, catalog);

        assertThat(result.get(0).getCandidates()).extracting(s -> s.getNarrEntry().getCode())
                .doesNotContain("D1");
    }

    @Test
    void testNoCandidateBelowThresholdButBestScoreKept() {
        FuzzySuggester suggester = FuzzySuggester.builder().threshold(0.95).maxCandidates(3).build();

        StepSuggestions s2 = suggester.suggest(steps, catalog).get(1);

        assertThat(s2.getCandidates()).isEmpty();
        assertThat(s2.top()).isEmpty();
        assertThat(s2.getBestScore()).isBetween(0.0, 0.95);
    }

    @Test
    void testBlankTitleHasNoSuggestion() {
        FuzzySuggester suggester = FuzzySuggester.builder().threshold(0.0).maxCandidates(3).build();

        StepSuggestions s3 = suggester.suggest(steps, catalog).get(2);

        assertThat(s3.getCandidates()).isEmpty();
        assertThat(s3.confidencePercent()).isZero();
    }

    @Test
    void testMaxCandidatesLimitsRanking() {
        FuzzySuggester suggester = FuzzySuggester.builder().threshold(0.0).maxCandidates(1).build();

        assertThat(suggester.suggest(steps, catalog).get(0).getCandidates()).hasSize(1);
    }

    @Test
    void testTiesKeepCatalogOrder() {
        NarrCatalog twins = NarrCatalog.of(List.of(
                NarrEntry.builder().code("P1").sourceTitle("Check the panel").build(),
                NarrEntry.builder().code("P2").sourceTitle("Check the panel").build()));
        FuzzySuggester suggester = FuzzySuggester.builder().threshold(0.8).maxCandidates(5).build();

        assertThat(suggester.suggest(steps, twins).get(0).getCandidates())
                .extracting(s -> s.getNarrEntry().getCode()).containsExactly("P1", "P2");
    }
}
