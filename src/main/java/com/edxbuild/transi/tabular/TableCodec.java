package com.edxbuild.transi.tabular;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads and writes {@link TableData} in one file encoding.
 */
public interface TableCodec {

    /**
     * @param sheet sheet index or name; encodings without sheets ignore it
     */
    TableData read(Path path, String sheet) throws IOException;

    /**
     * Writes the tables to {@code path}. Encodings holding a single table write only the first.
     */
    void write(List<TableData> tables, Path path) throws IOException;
}
