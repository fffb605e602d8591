package com.edxbuild.transi.error;

import java.util.List;

/**
 * After merging edits, the number of rows flagged {@code start_here = Yes} is not exactly one.
 */
public class StartHereViolationException extends TransiGenException {

    private static final long serialVersionUID = 1L;

    private final List<String> startCodes;

    public StartHereViolationException(List<String> startCodes) {
        super(startCodes.isEmpty()
                ? "No row has start_here = Yes; exactly one is required"
                : "Exactly one row may have start_here = Yes, found " + startCodes.size() + ": "
                        + String.join(", ", startCodes));
        this.startCodes = List.copyOf(startCodes);
    }

    public List<String> getStartCodes() {
        return startCodes;
    }
}
