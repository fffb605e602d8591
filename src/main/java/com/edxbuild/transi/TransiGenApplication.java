package com.edxbuild.transi;

import com.edxbuild.transi.cli.TransiGenCommand;

import picocli.CommandLine;

/**
 * Main entry point for transi-gen.
 * Merges a slide/step export with a narration catalog into reviewable PreMerge tables and the
 * final mk_tw_in table consumed by the branching-document authoring step.
 */
public class TransiGenApplication {

    public static void main(String[] args) {
        System.exit(execute(args));
    }

    static int execute(String... args) {
        return new CommandLine(new TransiGenCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
    }
}
