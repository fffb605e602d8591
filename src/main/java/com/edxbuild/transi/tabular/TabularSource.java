package com.edxbuild.transi.tabular;

import java.io.IOException;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.edxbuild.transi.error.TableIoException;
import com.edxbuild.transi.util.FileWriteUtil;

/**
 * Single entry point for loading and saving tables, whatever the file encoding.
 * The encoding is picked from the file extension.
 */
public class TabularSource {

    private static final Logger log = LoggerFactory.getLogger(TabularSource.class);

    private final Map<TableFormat, TableCodec> codecs = new EnumMap<>(TableFormat.class);

    public TabularSource() {
        codecs.put(TableFormat.CSV, new CsvTableCodec());
        codecs.put(TableFormat.XLSX, new XlsxTableCodec());
    }

    public TableData load(Path path) {
        return load(path, null);
    }

    /**
     * Loads one table. The file is fully read and closed before this returns.
     *
     * @param sheet sheet index or name for workbooks; {@code null} means the first sheet
     */
    public TableData load(Path path, String sheet) {
        TableCodec codec = codecs.get(TableFormat.fromPath(path));
        try {
            TableData table = codec.read(path, sheet);
            log.info("Loaded {} row(s) from {}", table.size(), path);
            return table;
        } catch (IOException e) {
            throw new TableIoException("Failed to read " + path, e);
        }
    }

    public void save(TableData table, Path path) {
        save(List.of(table), path);
    }

    /**
     * Writes tables atomically: the target is replaced only once the whole file is written.
     */
    public void save(List<TableData> tables, Path path) {
        if (tables.isEmpty()) {
            throw new IllegalArgumentException("Nothing to write to " + path);
        }
        TableCodec codec = codecs.get(TableFormat.fromPath(path));
        try {
            FileWriteUtil.writeAtomically(path, temp -> codec.write(tables, temp));
            log.debug("Wrote {} table(s) to {}", tables.size(), path);
        } catch (IOException e) {
            throw new TableIoException("Failed to write " + path, e);
        }
    }
}
