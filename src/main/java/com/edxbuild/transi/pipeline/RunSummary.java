package com.edxbuild.transi.pipeline;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.edxbuild.transi.model.ChangeRecord;
import com.edxbuild.transi.model.UnresolvedReference;

import lombok.Getter;

/**
 * Facts gathered during a run for the summary report.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
@Getter
public class RunSummary {

    private final String stage;
    private final String sop;
    private final Map<String, String> inputs = new LinkedHashMap<>();
    private final Map<String, Integer> counts = new LinkedHashMap<>();
    private final List<UnresolvedReference> unresolvedReferences = new ArrayList<>();
    private final List<ChangeRecord> changes = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private final List<Path> artifacts = new ArrayList<>();

    public RunSummary(String stage, String sop) {
        this.stage = stage;
        this.sop = sop;
    }

    public void input(String name, Path path) {
        if (path != null) {
            inputs.put(name, path.toAbsolutePath().normalize().toString());
        }
    }

    public void count(String name, int value) {
        counts.put(name, value);
    }

    public void increment(String name) {
        counts.merge(name, 1, Integer::sum);
    }

    public int get(String name) {
        return counts.getOrDefault(name, 0);
    }
}
