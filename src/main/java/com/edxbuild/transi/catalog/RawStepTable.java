package com.edxbuild.transi.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.edxbuild.transi.error.DuplicateKeyException;
import com.edxbuild.transi.model.RawStep;

import lombok.Getter;

/**
 * All RAW steps of one run, in source order, indexed by code.
 */
@Getter
public class RawStepTable {

    private final List<String> columns;
    private final List<RawStep> steps;
    private final Map<String, RawStep> stepsByCode;

    private RawStepTable(List<String> columns, List<RawStep> steps, Map<String, RawStep> stepsByCode) {
        this.columns = columns;
        this.steps = steps;
        this.stepsByCode = stepsByCode;
    }

    /**
     * @throws DuplicateKeyException when two steps share a code
     */
    public static RawStepTable of(List<String> columns, List<RawStep> steps) {
        Map<String, RawStep> byCode = new LinkedHashMap<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (RawStep step : steps) {
            if (byCode.putIfAbsent(step.getCode(), step) != null) {
                duplicates.add(step.getCode());
            }
        }
        if (!duplicates.isEmpty()) {
            throw new DuplicateKeyException("RAW", new ArrayList<>(duplicates));
        }
        return new RawStepTable(List.copyOf(columns), List.copyOf(steps), Collections.unmodifiableMap(byCode));
    }

    /**
     * Case-sensitive exact lookup.
     */
    public Optional<RawStep> find(String code) {
        if (code == null || code.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(stepsByCode.get(code));
    }

    public int size() {
        return steps.size();
    }
}
