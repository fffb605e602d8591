package com.edxbuild.transi.output;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.edxbuild.transi.error.TableIoException;
import com.edxbuild.transi.pipeline.RunConfig;
import com.edxbuild.transi.tabular.TableData;
import com.edxbuild.transi.tabular.TableFormat;
import com.edxbuild.transi.tabular.TabularSource;
import com.edxbuild.transi.util.FileWriteUtil;

/**
 * Writes a stage's tables under timestamped names, in every configured encoding.
 *
 * A workbook holds the primary table and each secondary table as its own sheet. CSV holds one
 * table per file, so secondary tables go to companion files suffixed with the table name
 * ({@code ..._ChangeLog.csv}). Each file is written atomically and, when enabled, copied to the
 * stage's {@code _latest} alias.
 */
public class ArtifactWriter {

    private static final Logger log = LoggerFactory.getLogger(ArtifactWriter.class);

    private final TabularSource source;
    private final ArtifactNaming naming;

    public ArtifactWriter(TabularSource source, ArtifactNaming naming) {
        this.source = source;
        this.naming = naming;
    }

    /**
     * Every stamped file is written before any alias is touched, so a failed write leaves the
     * previous {@code _latest} files in place.
     *
     * @return the stamped files written, excluding the latest aliases
     */
    public List<Path> write(RunConfig config, String stage, String timestamp,
                            TableData primary, List<TableData> secondary) {
        String base = naming.baseName(config.getSop(), stage, timestamp);
        String latest = naming.latestBaseName(config.getSop(), stage);
        Path dir = config.getOutputDir();

        Map<Path, Path> aliases = new LinkedHashMap<>();
        for (TableFormat format : TableFormat.values()) {
            if (!config.getFormats().contains(format)) {
                continue;
            }
            String ext = format.getExtension();
            if (format == TableFormat.XLSX) {
                List<TableData> sheets = new ArrayList<>();
                sheets.add(primary);
                sheets.addAll(secondary);
                writeOne(sheets, dir.resolve(base + ext), dir.resolve(latest + ext), aliases);
            } else {
                writeOne(List.of(primary), dir.resolve(base + ext), dir.resolve(latest + ext), aliases);
                for (TableData table : secondary) {
                    String suffix = "_" + table.getName() + ext;
                    writeOne(List.of(table), dir.resolve(base + suffix), dir.resolve(latest + suffix), aliases);
                }
            }
        }

        if (config.isWriteLatestAlias()) {
            aliases.forEach(this::refreshAlias);
        }
        return new ArrayList<>(aliases.keySet());
    }

    private void writeOne(List<TableData> tables, Path target, Path alias, Map<Path, Path> written) {
        source.save(tables, target);
        log.info("Wrote {}", target);
        written.put(target, alias);
    }

    private void refreshAlias(Path target, Path alias) {
        try {
            FileWriteUtil.copyAtomically(target, alias);
            log.debug("Refreshed {}", alias);
        } catch (IOException e) {
            throw new TableIoException("Failed to refresh " + alias, e);
        }
    }
}
