package org.javai.units.conformance;

/**
 * One record of the common conformance corpus. At least one of {@code input} and
 * {@code output} is present; every other field is optional.
 *
 * @param input unit text to parse, or null
 * @param expectedAst expected parse result in Polish notation, or null
 * @param expectedOutput text a generator should produce, or null
 * @param dimensions expected dimension vector, or null
 */
public record ConformanceCase(String input, String expectedAst, String expectedOutput, DimensionVector dimensions) {

	public ConformanceCase {
		if (input == null && expectedOutput == null) {
			throw new ConformanceFormatException("A conformance case needs an input or an output");
		}
	}

	public boolean hasInput() {
		return input != null;
	}

	public boolean hasExpectedAst() {
		return expectedAst != null;
	}

	public boolean hasExpectedOutput() {
		return expectedOutput != null;
	}

	public boolean hasDimensions() {
		return dimensions != null;
	}
}
