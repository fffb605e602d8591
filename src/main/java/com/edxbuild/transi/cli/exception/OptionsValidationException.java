package com.edxbuild.transi.cli.exception;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Every problem found in one pass over the command-line options.
 */
public class OptionsValidationException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final List<String> errors;

	public OptionsValidationException(List<String> errors) {
		super(describe(errors));
		this.errors = List.copyOf(errors);
	}

	public List<String> getErrors() {
		return errors;
	}

	private static String describe(List<String> errors) {
		return errors.size() + " invalid option(s):" + errors.stream()
				.map(error -> System.lineSeparator() + "  - " + error)
				.collect(Collectors.joining());
	}
}
