package com.edxbuild.transi.cli.model;

import java.nio.file.Path;
import java.time.ZoneId;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps TransiGenCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedTransiGenOptions {
    Path outputDir;
    Path premergePath;
    List<String> ignoredPrefixes;
    ZoneId zone;
}
