package com.edxbuild.transi.error;

import java.nio.file.Path;

public class UnsupportedTableFormatException extends TransiGenException {

    private static final long serialVersionUID = 1L;

    public UnsupportedTableFormatException(Path path) {
        super("Unsupported table file (expected .csv or .xlsx): " + path);
    }
}
