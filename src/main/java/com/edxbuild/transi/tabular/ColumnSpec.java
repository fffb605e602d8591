package com.edxbuild.transi.tabular;

import java.util.ArrayList;
import java.util.List;

import lombok.Value;

/**
 * One expected column: its canonical name, the alternative headers accepted for it
 * (in order of preference) and whether a table is unusable without it.
 */
@Value
public class ColumnSpec {

    String name;
    List<String> aliases;
    boolean required;

    public static ColumnSpec required(String name, String... aliases) {
        return new ColumnSpec(name, List.of(aliases), true);
    }

    public static ColumnSpec optional(String name, String... aliases) {
        return new ColumnSpec(name, List.of(aliases), false);
    }

    /**
     * Canonical name first, then aliases.
     */
    public List<String> candidates() {
        List<String> all = new ArrayList<>(aliases.size() + 1);
        all.add(name);
        all.addAll(aliases);
        return all;
    }
}
