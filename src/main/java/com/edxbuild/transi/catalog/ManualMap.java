package com.edxbuild.transi.catalog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.edxbuild.transi.model.ManualMapEntry;

/**
 * Reviewer-chosen matches keyed by raw code. A later row for the same code replaces an earlier one.
 */
public class ManualMap {

    private static final Logger log = LoggerFactory.getLogger(ManualMap.class);

    private static final ManualMap EMPTY = new ManualMap(Map.of());

    private final Map<String, ManualMapEntry> entriesByRawCode;

    private ManualMap(Map<String, ManualMapEntry> entriesByRawCode) {
        this.entriesByRawCode = entriesByRawCode;
    }

    public static ManualMap empty() {
        return EMPTY;
    }

    public static ManualMap of(List<ManualMapEntry> entries) {
        Map<String, ManualMapEntry> byCode = new LinkedHashMap<>();
        for (ManualMapEntry entry : entries) {
            ManualMapEntry previous = byCode.put(entry.getRawCode(), entry);
            if (previous != null) {
                log.debug("Manual map row for {} replaces earlier match '{}' with '{}'",
                        entry.getRawCode(), previous.getMatchToken(), entry.getMatchToken());
            }
        }
        return new ManualMap(Collections.unmodifiableMap(byCode));
    }

    public Optional<ManualMapEntry> find(String rawCode) {
        return Optional.ofNullable(entriesByRawCode.get(rawCode));
    }

    public int size() {
        return entriesByRawCode.size();
    }
}
