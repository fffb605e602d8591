package com.edxbuild.transi.model;

import static com.edxbuild.transi.tabular.TableColumns.*;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One row of the PreMerge table: the RAW row's cells followed by the derived columns.
 *
 * After reviewer edits are merged the same shape is the final (mk_tw_in) row, with
 * {@code mismatch} marking rows that were changed.
 */
@Value
@Builder(toBuilder = true)
public class PreMergeRow {

    /**
     * RAW cells in source column order. Never contains a derived column name.
     */
    @NonNull
    @Builder.Default
    Map<String, String> rawCells = Map.of();

    @Builder.Default
    String matchCodeOpm = "";
    @Builder.Default
    String opmStep = "";
    @Builder.Default
    String sourceTitle = "";
    @Builder.Default
    String narr1 = "";
    @Builder.Default
    String narr2 = "";
    @Builder.Default
    String narr3 = "";
    @Builder.Default
    String dispNext1 = "";
    @Builder.Default
    String dispNext2 = "";
    @Builder.Default
    String dispNext3 = "";
    @Builder.Default
    String uapUrl = "";
    @Builder.Default
    String uapLabel = "";
    @Builder.Default
    String startHere = NO;
    @Builder.Default
    String mismatch = NO;

    public String getCode() {
        return rawCells.getOrDefault(CODE, "");
    }

    public String getTitle() {
        return rawCells.getOrDefault(TITLE, "");
    }

    public boolean isStartHere() {
        return YES.equalsIgnoreCase(startHere.trim());
    }

    public boolean isMismatch() {
        return YES.equalsIgnoreCase(mismatch.trim());
    }

    /**
     * Value of any column, RAW or derived; {@code ""} for unknown columns.
     */
    public String cell(String column) {
        switch (column) {
            case MATCH_CODE_OPM:
                return matchCodeOpm;
            case OPM_STEP:
                return opmStep;
            case SOURCE_TITLE:
                return sourceTitle;
            case NARR1:
                return narr1;
            case NARR2:
                return narr2;
            case NARR3:
                return narr3;
            case DISP_NEXT1:
                return dispNext1;
            case DISP_NEXT2:
                return dispNext2;
            case DISP_NEXT3:
                return dispNext3;
            case UAP_URL:
                return uapUrl;
            case UAP_LABEL:
                return uapLabel;
            case START_HERE:
                return startHere;
            case MISMATCH:
                return mismatch;
            default:
                return rawCells.getOrDefault(column, "");
        }
    }

    /**
     * RAW cells then derived columns, in output order.
     */
    public Map<String, String> toCells() {
        Map<String, String> cells = new LinkedHashMap<>(rawCells);
        for (String column : DERIVED) {
            cells.put(column, cell(column));
        }
        return cells;
    }

    /**
     * Rebuilds a row from a loaded PreMerge (or edited) table row.
     */
    public static PreMergeRow fromCells(Map<String, String> cells) {
        Map<String, String> raw = new LinkedHashMap<>();
        PreMergeRowBuilder builder = PreMergeRow.builder();
        for (Map.Entry<String, String> cell : cells.entrySet()) {
            String value = cell.getValue() == null ? "" : cell.getValue();
            if (!applyDerived(builder, cell.getKey(), value)) {
                raw.put(cell.getKey(), value);
            }
        }
        return builder.rawCells(Collections.unmodifiableMap(raw)).build();
    }

    /**
     * Copy with one column replaced.
     */
    public PreMergeRow withCell(String column, String value) {
        PreMergeRowBuilder builder = toBuilder();
        if (!applyDerived(builder, column, value)) {
            Map<String, String> raw = new LinkedHashMap<>(rawCells);
            raw.put(column, value);
            builder.rawCells(Collections.unmodifiableMap(raw));
        }
        return builder.build();
    }

    private static boolean applyDerived(PreMergeRowBuilder builder, String column, String value) {
        switch (column) {
            case MATCH_CODE_OPM:
                builder.matchCodeOpm(value);
                return true;
            case OPM_STEP:
                builder.opmStep(value);
                return true;
            case SOURCE_TITLE:
                builder.sourceTitle(value);
                return true;
            case NARR1:
                builder.narr1(value);
                return true;
            case NARR2:
                builder.narr2(value);
                return true;
            case NARR3:
                builder.narr3(value);
                return true;
            case DISP_NEXT1:
                builder.dispNext1(value);
                return true;
            case DISP_NEXT2:
                builder.dispNext2(value);
                return true;
            case DISP_NEXT3:
                builder.dispNext3(value);
                return true;
            case UAP_URL:
                builder.uapUrl(value);
                return true;
            case UAP_LABEL:
                builder.uapLabel(value);
                return true;
            case START_HERE:
                builder.startHere(value);
                return true;
            case MISMATCH:
                builder.mismatch(value);
                return true;
            default:
                return false;
        }
    }
}
