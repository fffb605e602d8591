package com.edxbuild.transi.error;

import java.util.List;

/**
 * A manual-map token names an {@code OPM_Step} shared by several narration entries.
 */
public class AmbiguousMatchException extends TransiGenException {

    private static final long serialVersionUID = 1L;

    private final String rawCode;
    private final String matchToken;
    private final List<String> candidateCodes;

    public AmbiguousMatchException(String rawCode, String matchToken, List<String> candidateCodes) {
        super("Manual match '" + matchToken + "' for raw step " + rawCode
                + " is ambiguous; OPM_Step is shared by narration codes " + String.join(", ", candidateCodes));
        this.rawCode = rawCode;
        this.matchToken = matchToken;
        this.candidateCodes = List.copyOf(candidateCodes);
    }

    public String getRawCode() {
        return rawCode;
    }

    public String getMatchToken() {
        return matchToken;
    }

    public List<String> getCandidateCodes() {
        return candidateCodes;
    }
}
