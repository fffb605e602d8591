package com.edxbuild.transi.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.edxbuild.transi.cli.exception.OptionsValidationException;
import com.edxbuild.transi.cli.model.GenerationMode;
import com.edxbuild.transi.cli.model.TransiGenOptions;
import com.edxbuild.transi.cli.model.ValidatedTransiGenOptions;
import com.edxbuild.transi.tabular.TableFormat;

public class TransiGenOptionsValidator {

	public ValidatedTransiGenOptions validate(TransiGenOptions o) {
		List<String> errors = new ArrayList<>();

		if (isBlank(o.getSop())) {
			errors.add("SOP code must not be blank (--sop).");
		}

		Path outputDir = (o.getOut() == null ? Path.of("Outputs", nullToEmpty(o.getSop()).trim(), "transi") : o.getOut())
				.toAbsolutePath().normalize();
		if (Files.exists(outputDir) && !Files.isDirectory(outputDir)) {
			errors.add("Output path exists and is not a directory: " + outputDir);
		}

		Path premergePath = o.getPremerge();
		GenerationMode mode = o.getMode();
		if (mode == GenerationMode.PREMERGE || mode == GenerationMode.MANUAL || mode == GenerationMode.TWEE) {
			requireTable(o.getRaw(), "--raw", mode, errors);
			requireTable(o.getNarr(), "--narr", mode, errors);
		}
		if (mode == GenerationMode.PREMERGE && o.getManualMap() != null) {
			checkTable(o.getManualMap(), "--resp-transi-in", errors);
		}
		if (mode == GenerationMode.TWEE) {
			requireTable(o.getMapping(), "--map", mode, errors);
		}
		if (mode == GenerationMode.MK_TW_IN) {
			if (premergePath == null) {
				premergePath = outputDir.resolve(nullToEmpty(o.getSop()).trim() + "_PreMerge_latest.csv");
				if (!Files.isRegularFile(premergePath)) {
					errors.add("--premerge is required for --gen mk-tw-in (no " + premergePath + " to fall back on).");
				}
			} else {
				checkTable(premergePath, "--premerge", errors);
			}
			requireTable(o.getRespMerge(), "--resp-merge", mode, errors);
		}

		if (o.getThreshold() < 0.0 || o.getThreshold() > 1.0) {
			errors.add("Suggestion threshold must be in range 0.0-1.0. Got: " + o.getThreshold());
		}
		if (o.getMaxCandidates() < 1) {
			errors.add("Max candidates must be >= 1. Got: " + o.getMaxCandidates());
		}
		if (!isBlank(o.getNarrSheet()) && o.getNarrSheet().trim().startsWith("-")) {
			errors.add("Narration sheet index must be >= 0. Got: " + o.getNarrSheet());
		}

		ZoneId zone = parseZone(o.getZone(), errors);
		List<String> ignoredPrefixes = parsePrefixes(o.getIgnoredPrefixes());

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedTransiGenOptions(outputDir, premergePath, ignoredPrefixes, zone);
	}

	private static void requireTable(Path p, String option, GenerationMode mode, List<String> errors) {
		if (p == null) {
			errors.add(option + " is required for --gen " + mode.getValue() + ".");
			return;
		}
		checkTable(p, option, errors);
	}

	private static void checkTable(Path p, String option, List<String> errors) {
		if (!Files.isRegularFile(p)) {
			errors.add("File for " + option + " does not exist: " + p);
		} else if (!TableFormat.isSupported(p)) {
			errors.add("File for " + option + " must be .csv or .xlsx: " + p);
		}
	}

	private static ZoneId parseZone(String zone, List<String> errors) {
		try {
			return ZoneId.of(nullToEmpty(zone).trim());
		} catch (DateTimeException e) {
			errors.add("Unknown time zone: " + zone);
			return null;
		}
	}

	private static List<String> parsePrefixes(List<String> raw) {
		if (raw == null) {
			return List.of();
		}
		return raw.stream().map(String::trim).filter(s -> !s.isEmpty()).map(s -> s.toUpperCase(Locale.ROOT))
				.toList();
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}

	private static String nullToEmpty(String s) {
		return s == null ? "" : s;
	}
}
