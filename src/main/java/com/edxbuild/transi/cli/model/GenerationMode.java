package com.edxbuild.transi.cli.model;

import java.util.Arrays;
import java.util.Iterator;
import java.util.Locale;

import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.TypeConversionException;

/**
 * Pipeline stage selected with {@code --gen}.
 */
public enum GenerationMode {

	PREMERGE("premerge"),
	MK_TW_IN("mk-tw-in"),
	MANUAL("manual"),
	TWEE("twee");

	private final String value;

	GenerationMode(String value) {
		this.value = value;
	}

	public String getValue() {
		return value;
	}

	public static GenerationMode fromValue(String text) {
		String normalized = text == null ? "" : text.trim().toLowerCase(Locale.ROOT).replace('_', '-');
		return Arrays.stream(values())
				.filter(mode -> mode.value.equals(normalized))
				.findFirst()
				.orElseThrow(() -> new TypeConversionException(
						"Unknown mode '" + text + "'; expected one of " + Arrays.toString(valueNames())));
	}

	private static String[] valueNames() {
		return Arrays.stream(values()).map(GenerationMode::getValue).toArray(String[]::new);
	}

	/**
	 * Accepts the dashed command-line spelling ({@code mk-tw-in}) in any case.
	 */
	public static class Converter implements ITypeConverter<GenerationMode> {
		@Override
		public GenerationMode convert(String value) {
			return fromValue(value);
		}
	}

	public static class Candidates implements Iterable<String> {
		@Override
		public Iterator<String> iterator() {
			return Arrays.asList(valueNames()).iterator();
		}
	}
}
