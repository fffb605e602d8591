package com.edxbuild.transi.cli.validation;

import static org.assertj.core.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.edxbuild.transi.cli.exception.OptionsValidationException;
import com.edxbuild.transi.cli.model.TransiGenOptions;
import com.edxbuild.transi.cli.model.ValidatedTransiGenOptions;

import picocli.CommandLine;

/**
 * Unit tests for TransiGenOptionsValidator.
 */
class TransiGenOptionsValidatorTest {

	@TempDir
	Path tempDir;

	private final TransiGenOptionsValidator validator = new TransiGenOptionsValidator();

	private Path raw;
	private Path narr;
	private Path out;

	@BeforeEach
	void setUp() throws IOException {
		raw = Files.writeString(tempDir.resolve("raw.csv"), "Code,Title\nS1,Start\n");
		narr = Files.writeString(tempDir.resolve("narr.xlsx"), "");
		out = tempDir.resolve("out");
	}

	private static TransiGenOptions parse(String... args) {
		return CommandLine.populateCommand(new TransiGenOptions(), args);
	}

	@Test
	void testValidPremergeOptions() {
		ValidatedTransiGenOptions validated = validator.validate(parse("--gen", "premerge", "--raw", raw.toString(),
				"--narr", narr.toString(), "--out", out.toString(), "--ignore-codes-prefix", " d, n ,,y"));

		assertThat(validated.getOutputDir()).isEqualTo(out.toAbsolutePath().normalize());
		assertThat(validated.getIgnoredPrefixes()).containsExactly("D", "N", "Y");
		assertThat(validated.getZone()).isEqualTo(ZoneId.of("America/New_York"));
		assertThat(validated.getPremergePath()).isNull();
	}

	@Test
	void testDefaultOutputDirUsesSop() {
		ValidatedTransiGenOptions validated = validator.validate(parse("--gen", "manual", "--sop", "Ops",
				"--raw", raw.toString(), "--narr", narr.toString()));

		assertThat(validated.getOutputDir()).isEqualTo(Path.of("Outputs", "Ops", "transi").toAbsolutePath().normalize());
	}

	@Test
	void testCollectsEveryError() {
		OptionsValidationException e = catchThrowableOfType(() -> validator.validate(parse("--gen", "twee",
				"--sop", " ", "--raw", tempDir.resolve("missing.csv").toString(), "--narr", raw.toString(),
				"--thresh", "1.5", "--max-candidates", "0", "--zone", "Mars/Olympus")),
				OptionsValidationException.class);

		assertThat(e).isNotNull();
		assertThat(e.getErrors()).hasSize(6);
		assertThat(e.getErrors()).anyMatch(m -> m.contains("--sop"))
				.anyMatch(m -> m.contains("--raw") && m.contains("does not exist"))
				.anyMatch(m -> m.contains("--map is required"))
				.anyMatch(m -> m.contains("threshold"))
				.anyMatch(m -> m.contains("Max candidates"))
				.anyMatch(m -> m.contains("Mars/Olympus"));
	}

	@Test
	void testRejectsUnsupportedExtension() throws IOException {
		Path text = Files.writeString(tempDir.resolve("narr.txt"), "x");

		assertThatThrownBy(() -> validator.validate(parse("--gen", "premerge", "--raw", raw.toString(),
				"--narr", text.toString(), "--out", out.toString())))
				.isInstanceOf(OptionsValidationException.class)
				.satisfies(e -> assertThat(((OptionsValidationException) e).getErrors())
						.containsExactly("File for --narr must be .csv or .xlsx: " + text));
	}

	@Test
	void testOutputPathMustBeDirectory() {
		assertThatThrownBy(() -> validator.validate(parse("--gen", "premerge", "--raw", raw.toString(),
				"--narr", narr.toString(), "--out", raw.toString())))
				.isInstanceOf(OptionsValidationException.class)
				.hasMessageContaining("not a directory");
	}

	@Test
	void testMkTwInFallsBackToLatestPreMerge() throws IOException {
		Files.createDirectories(out);
		Path latest = Files.writeString(out.resolve("Tech_PreMerge_latest.csv"), "Code\nS1\n");
		Path edited = Files.writeString(tempDir.resolve("edited.csv"), "Code\nS1\n");

		ValidatedTransiGenOptions validated = validator.validate(parse("--gen", "mk-tw-in",
				"--resp-merge", edited.toString(), "--out", out.toString()));

		assertThat(validated.getPremergePath()).isEqualTo(latest.toAbsolutePath().normalize());
	}

	@Test
	void testMkTwInWithoutPreMerge() {
		assertThatThrownBy(() -> validator.validate(parse("--gen", "mk-tw-in", "--out", out.toString())))
				.isInstanceOf(OptionsValidationException.class)
				.satisfies(e -> assertThat(((OptionsValidationException) e).getErrors())
						.anyMatch(m -> m.startsWith("--premerge is required"))
						.anyMatch(m -> m.equals("--resp-merge is required for --gen mk-tw-in.")));
	}

	@Test
	void testNegativeNarrSheet() {
		assertThatThrownBy(() -> validator.validate(parse("--gen", "manual", "--raw", raw.toString(),
				"--narr", narr.toString(), "--out", out.toString(), "--narr-sheet", "-1")))
				.isInstanceOf(OptionsValidationException.class)
				.hasMessageContaining("Narration sheet");
	}
}
