package com.edxbuild.transi.tabular;

import java.nio.file.Path;
import java.util.Locale;

import com.edxbuild.transi.error.UnsupportedTableFormatException;

/**
 * The two interchangeable row-oriented file encodings, chosen by file extension.
 */
public enum TableFormat {

    CSV(".csv"),
    XLSX(".xlsx");

    private final String extension;

    TableFormat(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    public static TableFormat fromPath(Path path) {
        String name = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
        for (TableFormat format : values()) {
            if (name.endsWith(format.extension)) {
                return format;
            }
        }
        throw new UnsupportedTableFormatException(path);
    }

    public static boolean isSupported(Path path) {
        try {
            fromPath(path);
            return true;
        } catch (UnsupportedTableFormatException e) {
            return false;
        }
    }
}
