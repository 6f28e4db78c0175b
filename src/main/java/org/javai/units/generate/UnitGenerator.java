package org.javai.units.generate;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.units.UnitsException;
import org.javai.units.ast.Expression;
import org.javai.units.ast.Factor;
import org.javai.units.ast.FactorValue;
import org.javai.units.ast.Term;
import org.javai.units.ast.ExpressionVisitor;
import org.javai.units.definitions.DefinitionsTable;
import org.javai.units.parse.TokenizerOptions;
import org.javai.units.parse.UnitToken;
import org.javai.units.parse.UnitTokenizer;

/**
 * Renders expression trees as unit text.
 * <p>
 * Numerator terms are joined by a single space, or by nothing when
 * {@link GeneratorOptions.Spacing#MINIMAL} is chosen and the joined text still
 * tokenizes into the same tokens. A denominator follows a {@code /}; it is
 * parenthesized unless it is a single factor. Numerator groups keep their
 * parentheses. The output is not the original source text, but it reads back to
 * an equivalent canonical form. Generation never fails for a well-formed tree.
 */
public class UnitGenerator implements ExpressionVisitor<String> {

	private final DefinitionsTable table;
	private final GeneratorOptions options;
	private final TokenizerOptions readBackOptions;

	public UnitGenerator(DefinitionsTable table, GeneratorOptions options) {
		this.table = Objects.requireNonNull(table, "table must not be null");
		this.options = options != null ? options : GeneratorOptions.defaults();
		this.readBackOptions = TokenizerOptions.builder()
				.legacyDigitExponents(!this.options.useCaretForExponents())
				.build();
	}

	public UnitGenerator(DefinitionsTable table) {
		this(table, GeneratorOptions.defaults());
	}

	public String generate(Term term) {
		return term.accept(this);
	}

	/**
	 * Static convenience method to render with default options.
	 */
	public static String generate(Term term, DefinitionsTable table) {
		return new UnitGenerator(table).generate(term);
	}

	@Override
	public String visitExpression(List<Term> numerator, Term denominator) {
		List<String> pieces = new ArrayList<>();
		for (Term term : numerator) {
			String rendered = term.accept(this);
			pieces.add(term instanceof Expression ? "(" + rendered + ")" : rendered);
		}
		StringBuilder output = new StringBuilder(pieces.get(0));
		for (int i = 1; i < pieces.size(); i++) {
			if (needsSeparator(pieces.get(i - 1), pieces.get(i))) {
				output.append(' ');
			}
			output.append(pieces.get(i));
		}
		if (denominator != null) {
			output.append('/').append(renderDenominator(denominator));
		}
		return output.toString();
	}

	@Override
	public String visitFactor(FactorValue value, BigDecimal exponent) {
		String base;
		if (value instanceof FactorValue.NumberValue number) {
			base = formatNumber(number.value());
		} else if (value instanceof FactorValue.PrefixedUnit unit) {
			base = unit.symbol();
			if (exponent != null && !options.useCaretForExponents() && isInteger(exponent)) {
				return base + exponent.toBigIntegerExact();
			}
		} else {
			FactorValue.OtherMark mark = (FactorValue.OtherMark) value;
			base = mark.kind().render(mark.payload());
		}
		return exponent == null ? base : base + "^" + formatNumber(exponent);
	}

	private String renderDenominator(Term denominator) {
		if (denominator instanceof Factor) {
			return denominator.accept(this);
		}
		Expression expression = (Expression) denominator;
		if (expression.numerator().size() == 1 && !expression.hasDenominator()
				&& expression.numerator().get(0) instanceof Factor single) {
			return single.accept(this);
		}
		return "(" + expression.accept(this) + ")";
	}

	private boolean needsSeparator(String left, String right) {
		if (options.spacing() == GeneratorOptions.Spacing.CANONICAL) {
			return true;
		}
		try {
			List<UnitToken> separate = new ArrayList<>(tokens(left));
			separate.addAll(tokens(right));
			List<UnitToken> joined = tokens(left + right);
			if (separate.size() != joined.size()) {
				return true;
			}
			for (int i = 0; i < joined.size(); i++) {
				if (!joined.get(i).sameAs(separate.get(i))) {
					return true;
				}
			}
			return false;
		}
		catch (UnitsException e) {
			// joined text no longer tokenizes, keep the space
			return true;
		}
	}

	private List<UnitToken> tokens(String text) {
		List<UnitToken> tokens = new UnitTokenizer(text, table, readBackOptions).tokenize();
		return tokens.subList(0, tokens.size() - 1);
	}

	private String formatNumber(BigDecimal value) {
		if (options.numberFormat() == GeneratorOptions.NumberFormat.PLAIN) {
			return value.toPlainString();
		}
		return scientific(value);
	}

	static String scientific(BigDecimal value) {
		if (value.signum() == 0) {
			return "0";
		}
		BigDecimal stripped = value.stripTrailingZeros();
		String digits = stripped.unscaledValue().abs().toString();
		long exponent = (long) digits.length() - 1 - stripped.scale();
		StringBuilder sb = new StringBuilder();
		if (stripped.signum() < 0) {
			sb.append('-');
		}
		sb.append(digits.charAt(0));
		if (digits.length() > 1) {
			sb.append('.').append(digits, 1, digits.length());
		}
		if (exponent != 0) {
			sb.append('e').append(exponent);
		}
		return sb.toString();
	}

	private static boolean isInteger(BigDecimal value) {
		return value.signum() == 0 || value.stripTrailingZeros().scale() <= 0;
	}
}
