package com.edxbuild.transi.cli.output;

import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.edxbuild.transi.cli.model.GenerationMode;
import com.edxbuild.transi.cli.model.TransiGenOptions;
import com.edxbuild.transi.cli.model.ValidatedTransiGenOptions;
import com.edxbuild.transi.pipeline.RunResult;

/**
 * Responsible only for printing CLI output for the transi-gen command.
 * No validation, no execution.
 */
public class TransiGenResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(TransiGenResultsPrinter.class);

    private static final String RULE = "=================================================";

    public void printBanner(TransiGenOptions o, ValidatedTransiGenOptions v) {
        log.info(RULE);
        log.info("transi-gen");
        log.info(RULE);
        log.info("Mode: {}", o.getMode().getValue());
        log.info("SOP: {}", o.getSop());

        switch (o.getMode()) {
            case MK_TW_IN:
                log.info("PreMerge: {}", describe(v.getPremergePath()));
                log.info("Edited: {}", describe(o.getRespMerge()));
                break;
            default:
                log.info("RAW: {}", describe(o.getRaw()));
                log.info("Narration: {} (sheet {})", describe(o.getNarr()), o.getNarrSheet());
                if (o.getMode() == GenerationMode.PREMERGE) {
                    log.info("Manual map: {}", describe(o.getManualMap()));
                } else if (o.getMode() == GenerationMode.TWEE) {
                    log.info("Mapping: {}", describe(o.getMapping()));
                } else {
                    log.info("Similarity: {} >= {} (top {}), ignoring {}", o.getSimilarity(), o.getThreshold(),
                            o.getMaxCandidates(), v.getIgnoredPrefixes());
                }
        }

        log.info("Output Directory: {}", v.getOutputDir());
        log.info(RULE);
    }

    public void printSuccess(TransiGenOptions o, RunResult result) {
        log.info("");
        log.info(RULE);
        log.info("{} SUCCESSFUL", result.getStage());
        log.info(RULE);
        log.info("Rows: {}", result.getRowCount());

        switch (o.getMode()) {
            case PREMERGE:
            case TWEE:
                log.info("Matched M: {}", result.getMClassCount());
                log.info("Matched non-M: {}", result.getNonMClassCount());
                log.info("Unmatched: {}", result.getUnmatchedCount());
                if (result.getUnresolvedReferenceCount() > 0) {
                    log.info("Unresolved next-step codes: {}", result.getUnresolvedReferenceCount());
                }
                break;
            case MK_TW_IN:
                log.info("Changes: {} across {} row(s)", result.getChangeCount(), result.getChangedRowCount());
                break;
            case MANUAL:
                log.info("Steps with a suggestion: {}", result.getSuggestedCount());
                break;
            default:
                break;
        }

        log.info("");
        log.info("Artifacts:");
        for (Path artifact : result.getArtifacts()) {
            log.info("  {}", artifact);
        }
        if (result.getSummaryPath() != null) {
            log.info("Summary: {}", result.getSummaryPath());
        }
        log.info(RULE);
    }

    public void printFailure(RunResult result) {
        log.error("{} failed: {}", result.getStage(), result.getErrorMessage());
        if (result.getErrorType() != null) {
            log.error("Error type: {}", result.getErrorType());
        }
    }

    private static String describe(Path p) {
        return p != null ? p.toAbsolutePath().toString() : "None";
    }
}
