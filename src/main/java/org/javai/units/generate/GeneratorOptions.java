package org.javai.units.generate;

/**
 * Rendering choices for {@link UnitGenerator}.
 *
 * <pre>{@code
 * GeneratorOptions options = GeneratorOptions.builder()
 *         .numberFormat(GeneratorOptions.NumberFormat.SCIENTIFIC)
 *         .spacing(GeneratorOptions.Spacing.MINIMAL)
 *         .build();
 * }</pre>
 *
 * @param useCaretForExponents write exponents as {@code ^n}; when false, integer
 * exponents on units are written as trailing digits ({@code m2}), which only the
 * legacy digit-exponent grammar reads back
 * @param numberFormat how numbers and exponents are written
 * @param spacing how numerator terms are separated
 */
public record GeneratorOptions(boolean useCaretForExponents, NumberFormat numberFormat, Spacing spacing) {

	public enum NumberFormat {
		/** Positional notation, {@code 0.001}. */
		PLAIN,
		/** One leading digit and a decimal exponent, {@code 1e-3}. */
		SCIENTIFIC
	}

	public enum Spacing {
		/** A space only where the text would otherwise tokenize differently. */
		MINIMAL,
		/** A single space between all numerator terms. */
		CANONICAL
	}

	public GeneratorOptions {
		if (numberFormat == null) {
			numberFormat = NumberFormat.PLAIN;
		}
		if (spacing == null) {
			spacing = Spacing.CANONICAL;
		}
	}

	public static GeneratorOptions defaults() {
		return new GeneratorOptions(true, NumberFormat.PLAIN, Spacing.CANONICAL);
	}

	public static Builder builder() {
		return new Builder();
	}

	public static class Builder {
		private boolean useCaretForExponents = true;
		private NumberFormat numberFormat = NumberFormat.PLAIN;
		private Spacing spacing = Spacing.CANONICAL;

		private Builder() {}

		public Builder useCaretForExponents(boolean useCaretForExponents) {
			this.useCaretForExponents = useCaretForExponents;
			return this;
		}

		public Builder numberFormat(NumberFormat numberFormat) {
			this.numberFormat = numberFormat;
			return this;
		}

		public Builder spacing(Spacing spacing) {
			this.spacing = spacing;
			return this;
		}

		public GeneratorOptions build() {
			return new GeneratorOptions(useCaretForExponents, numberFormat, spacing);
		}
	}
}
