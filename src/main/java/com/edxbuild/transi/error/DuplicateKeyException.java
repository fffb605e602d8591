package com.edxbuild.transi.error;

import java.util.List;

/**
 * The same {@code Code} occurs more than once within RAW or within the narration catalog.
 */
public class DuplicateKeyException extends TransiGenException {

    private static final long serialVersionUID = 1L;

    private final String tableKind;
    private final List<String> duplicateCodes;

    public DuplicateKeyException(String tableKind, List<String> duplicateCodes) {
        super("Duplicate Code value(s) in " + tableKind + ": " + String.join(", ", duplicateCodes));
        this.tableKind = tableKind;
        this.duplicateCodes = List.copyOf(duplicateCodes);
    }

    public String getTableKind() {
        return tableKind;
    }

    public List<String> getDuplicateCodes() {
        return duplicateCodes;
    }
}
