package com.edxbuild.transi.error;

import java.nio.file.Path;
import java.util.List;

/**
 * A loaded table lacks one or more columns its schema requires.
 */
public class MissingRequiredColumnException extends TransiGenException {

    private static final long serialVersionUID = 1L;

    private final String tableKind;
    private final List<String> missingColumns;

    public MissingRequiredColumnException(String tableKind, Path source, List<String> missingColumns) {
        super(tableKind + " table " + source + " is missing required column(s): " + String.join(", ", missingColumns));
        this.tableKind = tableKind;
        this.missingColumns = List.copyOf(missingColumns);
    }

    public String getTableKind() {
        return tableKind;
    }

    public List<String> getMissingColumns() {
        return missingColumns;
    }
}
