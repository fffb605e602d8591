package com.edxbuild.transi.derive;

import static com.edxbuild.transi.tabular.TableColumns.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.edxbuild.transi.catalog.RawStepTable;
import com.edxbuild.transi.model.MatchClass;
import com.edxbuild.transi.model.MatchResolution;
import com.edxbuild.transi.model.NarrEntry;
import com.edxbuild.transi.model.PreMergeRow;
import com.edxbuild.transi.model.RawStep;
import com.edxbuild.transi.model.UnresolvedReference;

/**
 * Computes the narration and next-step display columns of a PreMerge row.
 *
 * <ul>
 *   <li>{@code M}: Narr1 = simple text (first half of the title when blank), Narr2/Narr3 = M variants.</li>
 *   <li>{@code NON_M}: Narr1 = simple text, Narr2 = full text, Narr3 = the RAW row's own Narr3 if any.</li>
 *   <li>{@code NONE}: Narr1 = first half of the title, Narr2 and Narr3 empty.</li>
 * </ul>
 * {@code Disp_nextK} is the title of the step whose code equals {@code nextK_code}, else empty.
 *
 * Stateless: the result depends only on the arguments.
 */
public class FieldDeriver {

    public Derivation derive(RawStep step, MatchResolution resolution, RawStepTable steps) {
        PreMergeRow.PreMergeRowBuilder row = PreMergeRow.builder()
                .rawCells(rawCells(step));

        Optional<NarrEntry> entry = resolution.entry();
        entry.ifPresent(e -> row
                .matchCodeOpm(e.getCode())
                .opmStep(e.getOpmStep())
                .sourceTitle(e.getSourceTitle()));

        MatchClass matchClass = entry.isPresent() ? resolution.getMatchClass() : MatchClass.NONE;
        switch (matchClass) {
            case M: {
                NarrEntry e = entry.get();
                row.narr1(e.getNarrSimple().isBlank() ? TitleText.firstHalf(step.getTitle()) : e.getNarrSimple())
                        .narr2(e.getNarrMSimple())
                        .narr3(e.getNarrMFull());
                break;
            }
            case NON_M: {
                NarrEntry e = entry.get();
                row.narr1(e.getNarrSimple())
                        .narr2(e.getNarrFull())
                        .narr3(step.cell(NARR3));
                break;
            }
            default:
                row.narr1(TitleText.firstHalf(step.getTitle()))
                        .narr2("")
                        .narr3("");
        }

        List<UnresolvedReference> unresolved = new ArrayList<>();
        row.dispNext1(displayLabel(step, 1, steps, unresolved))
                .dispNext2(displayLabel(step, 2, steps, unresolved))
                .dispNext3(displayLabel(step, 3, steps, unresolved));

        return new Derivation(row.build(), matchClass, List.copyOf(unresolved));
    }

    private static String displayLabel(RawStep step, int k, RawStepTable steps, List<UnresolvedReference> unresolved) {
        String target = step.nextCode(k);
        if (target.isEmpty()) {
            return "";
        }
        Optional<RawStep> next = steps.find(target);
        if (next.isEmpty()) {
            unresolved.add(new UnresolvedReference(step.getCode(), NEXT_CODES.get(k - 1), target));
            return "";
        }
        return next.get().getTitle();
    }

    private static Map<String, String> rawCells(RawStep step) {
        Map<String, String> cells = new LinkedHashMap<>();
        step.getCells().forEach((column, value) -> {
            if (!DERIVED.contains(column)) {
                cells.put(column, value);
            }
        });
        cells.putIfAbsent(CODE, step.getCode());
        cells.putIfAbsent(TITLE, step.getTitle());
        return Collections.unmodifiableMap(cells);
    }
}
