package com.edxbuild.transi.model;

import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One row of the RAW slide/step export.
 *
 * {@code cells} holds the complete source row in source column order, including columns the
 * pipeline does not interpret (slide index, image url, ...), so they can be carried through.
 */
@Value
@Builder(toBuilder = true)
public class RawStep {

    @NonNull
    String code;

    @NonNull
    String title;

    @Builder.Default
    String decisionQuestion = "";

    @Builder.Default
    String next1Code = "";

    @Builder.Default
    String next2Code = "";

    @Builder.Default
    String next3Code = "";

    @Builder.Default
    Map<String, String> cells = Map.of();

    /**
     * Successor code {@code k} (1..3), {@code ""} when absent.
     */
    public String nextCode(int k) {
        switch (k) {
            case 1:
                return next1Code;
            case 2:
                return next2Code;
            case 3:
                return next3Code;
            default:
                throw new IllegalArgumentException("Successor index must be 1..3, got " + k);
        }
    }

    public String cell(String column) {
        return cells.getOrDefault(column, "");
    }
}
