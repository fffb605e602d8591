package com.edxbuild.transi.cli.model;

import java.nio.file.Path;
import java.util.List;

import com.edxbuild.transi.suggest.SimilarityMetric;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the transi-gen command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class TransiGenOptions {

	@Option(names = { "--gen", "-g" }, required = true, converter = GenerationMode.Converter.class,
			completionCandidates = GenerationMode.Candidates.class,
			description = "Stage to generate: ${COMPLETION-CANDIDATES}")
	private GenerationMode mode;

	@Option(names = { "--sop" }, defaultValue = "Tech", description = "SOP code prefixing every artifact (default: ${DEFAULT-VALUE})")
	private String sop;

	// Inputs
	@Option(names = { "--raw" }, description = "(premerge/manual/twee) RAW slide/step export, CSV or XLSX")
	private Path raw;

	@Option(names = { "--narr" }, description = "(premerge/manual/twee) Narration catalog, CSV or XLSX")
	private Path narr;

	@Option(names = { "--narr-sheet" }, defaultValue = "0", description = "Narration sheet name or index (default: ${DEFAULT-VALUE})")
	private String narrSheet;

	@Option(names = { "--resp-transi-in" }, description = "(premerge) Reviewer manual map of raw Code to narration Code or OPM_Step")
	private Path manualMap;

	@Option(names = { "--map" }, description = "(twee) Mapping sheet of raw Code to narration code")
	private Path mapping;

	@Option(names = { "--premerge" }, description = "(mk-tw-in) PreMerge table the edits were made against (default: <out>/<SOP>_PreMerge_latest.csv)")
	private Path premerge;

	@Option(names = { "--resp-merge" }, description = "(mk-tw-in) Reviewer-edited copy of the PreMerge table")
	private Path respMerge;

	@Option(names = { "--out", "-o" }, description = "Output directory (default: Outputs/<SOP>/transi)")
	private Path out;

	// Suggestions
	@Option(names = { "--thresh" }, defaultValue = "0.80", description = "(manual) Minimum similarity of a suggestion (default: ${DEFAULT-VALUE})")
	private double threshold;

	@Option(names = { "--ignore-codes-prefix" }, split = ",", defaultValue = "D,N,Y",
			description = "(manual) Narration code prefixes never suggested, comma-separated (default: ${DEFAULT-VALUE})")
	private List<String> ignoredPrefixes;

	@Option(names = { "--similarity" }, defaultValue = "SEQUENCE", description = "(manual) Similarity metric: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
	private SimilarityMetric similarity;

	@Option(names = { "--max-candidates" }, defaultValue = "3", description = "(manual) Ranked candidates kept per step (default: ${DEFAULT-VALUE})")
	private int maxCandidates;

	// Matching and output
	@Option(names = { "--m-prefix" }, defaultValue = "M", description = "Code prefix of M-class narration entries (default: ${DEFAULT-VALUE})")
	private String mPrefix;

	@Option(names = { "--zone" }, defaultValue = "America/New_York", description = "Time zone of artifact timestamps (default: ${DEFAULT-VALUE})")
	private String zone;

	@Option(names = { "--no-latest" }, description = "Do not refresh the <SOP>_<stage>_latest aliases")
	private boolean noLatest;

	@Option(names = { "--no-summary" }, description = "Do not write the run summary report")
	private boolean noSummary;

	@Option(names = { "--verbose", "-v" }, description = "Debug logging")
	private boolean verbose;

}
