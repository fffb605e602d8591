package com.edxbuild.transi.model;

import java.util.Optional;

import lombok.Value;

@Value
public class MatchResolution {

    private static final MatchResolution NONE = new MatchResolution(null, MatchClass.NONE);

    NarrEntry narrEntry;
    MatchClass matchClass;

    public static MatchResolution none() {
        return NONE;
    }

    public static MatchResolution of(NarrEntry entry, MatchClass matchClass) {
        if (entry == null || matchClass == MatchClass.NONE) {
            return NONE;
        }
        return new MatchResolution(entry, matchClass);
    }

    public Optional<NarrEntry> entry() {
        return Optional.ofNullable(narrEntry);
    }

    public boolean isMatched() {
        return narrEntry != null;
    }
}
