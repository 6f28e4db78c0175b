package org.javai.units.parse;

/**
 * Switches that select between grammar variants when reading unit text.
 *
 * <pre>{@code
 * TokenizerOptions legacy = TokenizerOptions.builder()
 *         .legacyDigitExponents(true)
 *         .build();
 * }</pre>
 *
 * @param legacyDigitExponents accept an integer written directly after a unit symbol
 * as its exponent ({@code m2}, {@code s-1}) in addition to the caret form
 * @param allowCompoundPrefixes allow more than one prefix in front of a unit
 */
public record TokenizerOptions(boolean legacyDigitExponents, boolean allowCompoundPrefixes) {

	public static TokenizerOptions defaults() {
		return new TokenizerOptions(false, true);
	}

	public static Builder builder() {
		return new Builder();
	}

	public static class Builder {
		private boolean legacyDigitExponents = false;
		private boolean allowCompoundPrefixes = true;

		private Builder() {}

		public Builder legacyDigitExponents(boolean legacyDigitExponents) {
			this.legacyDigitExponents = legacyDigitExponents;
			return this;
		}

		public Builder allowCompoundPrefixes(boolean allowCompoundPrefixes) {
			this.allowCompoundPrefixes = allowCompoundPrefixes;
			return this;
		}

		public TokenizerOptions build() {
			return new TokenizerOptions(legacyDigitExponents, allowCompoundPrefixes);
		}
	}
}
