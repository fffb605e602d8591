package com.edxbuild.transi.cli;

import java.util.concurrent.Callable;

import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.edxbuild.transi.cli.exception.OptionsValidationException;
import com.edxbuild.transi.cli.model.TransiGenOptions;
import com.edxbuild.transi.cli.model.ValidatedTransiGenOptions;
import com.edxbuild.transi.cli.output.TransiGenResultsPrinter;
import com.edxbuild.transi.cli.validation.TransiGenOptionsValidator;
import com.edxbuild.transi.pipeline.FinalBuilder;
import com.edxbuild.transi.pipeline.LegacyMappingBuilder;
import com.edxbuild.transi.pipeline.ManualSuggestionBuilder;
import com.edxbuild.transi.pipeline.PipelineStage;
import com.edxbuild.transi.pipeline.PreMergeBuilder;
import com.edxbuild.transi.pipeline.RunConfig;
import com.edxbuild.transi.pipeline.RunResult;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command running one stage of the RAW + narration merge pipeline.
 */
@Command(
        name = "transi-gen",
        mixinStandardHelpOptions = true,
        version = "transi-gen 1.0.0",
        description = "Builds PreMerge, mk_tw_in and Manual_Match tables from a slide/step export and a narration catalog."
)
public class TransiGenCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(TransiGenCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_INVALID_OPTIONS = 2;

    private static final String BASE_PACKAGE = "com.edxbuild.transi";

    @Mixin
    private TransiGenOptions options = new TransiGenOptions();

    private final TransiGenOptionsValidator validator = new TransiGenOptionsValidator();
    private final TransiGenResultsPrinter printer = new TransiGenResultsPrinter();

    @Override
    public Integer call() {
        if (options.isVerbose()) {
            enableDebugLogging();
        }

        ValidatedTransiGenOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            log.error(e.getMessage());
            return EXIT_INVALID_OPTIONS;
        }

        printer.printBanner(options, validated);

        RunResult result = createStage(toRunConfig(validated)).build();
        if (!result.isSuccess()) {
            printer.printFailure(result);
            return EXIT_FAILED;
        }

        printer.printSuccess(options, result);
        return EXIT_OK;
    }

    RunConfig toRunConfig(ValidatedTransiGenOptions v) {
        return RunConfig.builder()
                .sop(options.getSop().trim())
                .outputDir(v.getOutputDir())
                .rawPath(options.getRaw())
                .narrPath(options.getNarr())
                .narrSheet(options.getNarrSheet())
                .manualMapPath(options.getManualMap())
                .mappingPath(options.getMapping())
                .premergePath(v.getPremergePath())
                .editedPath(options.getRespMerge())
                .mClassPrefix(options.getMPrefix())
                .suggestionThreshold(options.getThreshold())
                .maxCandidates(options.getMaxCandidates())
                .ignoredPrefixes(v.getIgnoredPrefixes())
                .similarityMetric(options.getSimilarity())
                .zone(v.getZone())
                .writeLatestAlias(!options.isNoLatest())
                .writeSummary(!options.isNoSummary())
                .build();
    }

    private PipelineStage createStage(RunConfig config) {
        switch (options.getMode()) {
            case PREMERGE:
                return new PreMergeBuilder(config);
            case MK_TW_IN:
                return new FinalBuilder(config);
            case MANUAL:
                return new ManualSuggestionBuilder(config);
            case TWEE:
                return new LegacyMappingBuilder(config);
            default:
                throw new IllegalStateException("Unhandled mode " + options.getMode());
        }
    }

    private static void enableDebugLogging() {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (factory instanceof LoggerContext) {
            ((LoggerContext) factory).getLogger(BASE_PACKAGE).setLevel(Level.DEBUG);
        } else {
            log.warn("--verbose has no effect with logging backend {}", factory.getClass().getName());
        }
    }
}
