package com.edxbuild.transi.derive;

import static org.assertj.core.api.Assertions.*;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.edxbuild.transi.catalog.RawStepTable;
import com.edxbuild.transi.model.MatchClass;
import com.edxbuild.transi.model.MatchResolution;
import com.edxbuild.transi.model.NarrEntry;
import com.edxbuild.transi.model.PreMergeRow;
import com.edxbuild.transi.model.RawStep;
import com.edxbuild.transi.model.UnresolvedReference;

/**
 * Unit tests for FieldDeriver.
 */
class FieldDeriverTest {

    private final FieldDeriver deriver = new FieldDeriver();

    private final RawStep s1 = RawStep.builder()
            .code("S1").title("Open panel \u2013 step one").next1Code("S2").build();
    private final RawStep s2 = RawStep.builder()
            .code("S2").title("Press the green button").next1Code("S9").build();
    private final RawStepTable steps = RawStepTable.of(List.of("Code", "Title", "next1_code"), List.of(s1, s2));

    private final NarrEntry m7 = NarrEntry.builder()
            .code("M7").opmStep("M7: Press start").sourceTitle("Press start")
            .narrSimple("Press start now").narrFull("Press the start button now")
            .narrMSimple("Press start").narrMFull("Press the start button to begin")
            .build();

    private final NarrEntry p3 = NarrEntry.builder()
            .code("P3").opmStep("P3: Check panel").sourceTitle("Check panel")
            .narrSimple("Check the panel").narrFull("Check the panel for warnings")
            .narrMSimple("unused").narrMFull("unused too")
            .build();

    @Test
    void testUnmatchedStepUsesTitleBeforeSeparator() {
        Derivation derivation = deriver.derive(s1, MatchResolution.none(), steps);

        PreMergeRow row = derivation.getRow();
        assertThat(derivation.getMatchClass()).isEqualTo(MatchClass.NONE);
        assertThat(row.getNarr1()).isEqualTo("Open panel");
        assertThat(row.getNarr2()).isEmpty();
        assertThat(row.getNarr3()).isEmpty();
        assertThat(row.getMatchCodeOpm()).isEmpty();
        assertThat(row.getOpmStep()).isEmpty();
        assertThat(row.getSourceTitle()).isEmpty();
    }

    @Test
    void testDisplayLabelIsTitleOfNextStep() {
        PreMergeRow row = deriver.derive(s1, MatchResolution.none(), steps).getRow();

        assertThat(row.getDispNext1()).isEqualTo("Press the green button");
        assertThat(row.getDispNext2()).isEmpty();
        assertThat(row.getDispNext3()).isEmpty();
    }

    @Test
    void testUnknownNextCodeIsReportedAndLeftBlank() {
        Derivation derivation = deriver.derive(s2, MatchResolution.none(), steps);

        assertThat(derivation.getRow().getDispNext1()).isEmpty();
        assertThat(derivation.getUnresolvedReferences())
                .containsExactly(new UnresolvedReference("S2", "next1_code", "S9"));
    }

    @Test
    void testNextCodeLookupIsCaseSensitive() {
        RawStep lower = RawStep.builder().code("S3").title("Lower").next1Code("s1").build();
        RawStepTable table = RawStepTable.of(List.of("Code", "Title"), List.of(s1, lower));

        Derivation derivation = deriver.derive(lower, MatchResolution.none(), table);

        assertThat(derivation.getRow().getDispNext1()).isEmpty();
        assertThat(derivation.getUnresolvedReferences()).hasSize(1);
    }

    @Test
    void testMClassMatchUsesMVariants() {
        Derivation derivation = deriver.derive(s1, MatchResolution.of(m7, MatchClass.M), steps);

        PreMergeRow row = derivation.getRow();
        assertThat(derivation.getMatchClass()).isEqualTo(MatchClass.M);
        assertThat(row.getNarr1()).isEqualTo("Press start now");
        assertThat(row.getNarr2()).isEqualTo("Press start");
        assertThat(row.getNarr3()).isEqualTo("Press the start button to begin");
        assertThat(row.getMatchCodeOpm()).isEqualTo("M7");
        assertThat(row.getOpmStep()).isEqualTo("M7: Press start");
        assertThat(row.getSourceTitle()).isEqualTo("Press start");
    }

    @Test
    void testMClassWithBlankSimpleTextFallsBackToTitle() {
        NarrEntry blankSimple = m7.toBuilder().narrSimple("").build();

        PreMergeRow row = deriver.derive(s1, MatchResolution.of(blankSimple, MatchClass.M), steps).getRow();

        assertThat(row.getNarr1()).isEqualTo("Open panel");
        assertThat(row.getNarr2()).isEqualTo("Press start");
    }

    @Test
    void testNonMClassMatchUsesSimpleAndFullText() {
        PreMergeRow row = deriver.derive(s1, MatchResolution.of(p3, MatchClass.NON_M), steps).getRow();

        assertThat(row.getNarr1()).isEqualTo("Check the panel");
        assertThat(row.getNarr2()).isEqualTo("Check the panel for warnings");
        assertThat(row.getNarr3()).isEmpty();
    }

    @Test
    void testNonMClassKeepsExistingNarr3FromRaw() {
        RawStep withNarr3 = s1.toBuilder()
                .cells(Map.of("Code", "S1", "Title", s1.getTitle(), "Narr3", "Earlier text"))
                .build();

        PreMergeRow row = deriver.derive(withNarr3, MatchResolution.of(p3, MatchClass.NON_M), steps).getRow();

        assertThat(row.getNarr3()).isEqualTo("Earlier text");
        assertThat(row.getRawCells()).doesNotContainKey("Narr3");
    }

    @Test
    void testReviewColumnsStartEmpty() {
        PreMergeRow row = deriver.derive(s1, MatchResolution.none(), steps).getRow();

        assertThat(row.getUapUrl()).isEmpty();
        assertThat(row.getUapLabel()).isEmpty();
        assertThat(row.getStartHere()).isEqualTo("No");
        assertThat(row.getMismatch()).isEqualTo("No");
        assertThat(row.getCode()).isEqualTo("S1");
        assertThat(row.getTitle()).isEqualTo("Open panel \u2013 step one");
    }
}
