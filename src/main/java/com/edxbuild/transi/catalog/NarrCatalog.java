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
import com.edxbuild.transi.model.NarrEntry;

import lombok.Getter;

/**
 * The narration catalog: entries in insertion order, indexed by code and by {@code OPM_Step}.
 */
@Getter
public class NarrCatalog {

    private final List<NarrEntry> entries;
    private final Map<String, NarrEntry> entriesByCode;
    private final Map<String, List<NarrEntry>> entriesByOpmStep;

    private NarrCatalog(List<NarrEntry> entries, Map<String, NarrEntry> entriesByCode,
                        Map<String, List<NarrEntry>> entriesByOpmStep) {
        this.entries = entries;
        this.entriesByCode = entriesByCode;
        this.entriesByOpmStep = entriesByOpmStep;
    }

    /**
     * @throws DuplicateKeyException when two entries share a code
     */
    public static NarrCatalog of(List<NarrEntry> entries) {
        Map<String, NarrEntry> byCode = new LinkedHashMap<>();
        Map<String, List<NarrEntry>> byOpmStep = new LinkedHashMap<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (NarrEntry entry : entries) {
            if (byCode.putIfAbsent(entry.getCode(), entry) != null) {
                duplicates.add(entry.getCode());
            }
            if (!entry.getOpmStep().isEmpty()) {
                byOpmStep.computeIfAbsent(entry.getOpmStep(), k -> new ArrayList<>()).add(entry);
            }
        }
        if (!duplicates.isEmpty()) {
            throw new DuplicateKeyException("Narr", new ArrayList<>(duplicates));
        }
        Map<String, List<NarrEntry>> frozen = new LinkedHashMap<>();
        byOpmStep.forEach((step, list) -> frozen.put(step, List.copyOf(list)));
        return new NarrCatalog(List.copyOf(entries), Collections.unmodifiableMap(byCode),
                Collections.unmodifiableMap(frozen));
    }

    public Optional<NarrEntry> findByCode(String code) {
        return Optional.ofNullable(entriesByCode.get(code));
    }

    /**
     * Every entry whose {@code OPM_Step} equals {@code opmStep} exactly.
     */
    public List<NarrEntry> findByOpmStep(String opmStep) {
        return entriesByOpmStep.getOrDefault(opmStep, List.of());
    }

    public int size() {
        return entries.size();
    }
}
