package org.javai.units.polish;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.units.ast.Expression;
import org.javai.units.ast.ExpressionVisitor;
import org.javai.units.ast.Factor;
import org.javai.units.ast.FactorValue;
import org.javai.units.ast.MarkKind;
import org.javai.units.ast.Term;
import org.javai.units.definitions.DefinitionsException;
import org.javai.units.definitions.DefinitionsTable;
import org.javai.units.definitions.Prefix;
import org.javai.units.definitions.UnitDefinition;

/**
 * Structural prefix-operator serialization of expression trees, used to state
 * expected parse results in conformance fixtures.
 *
 * <pre>
 * W/(m K)      (/ (* W) (* m K))
 * km^2         (* (^ (prefix k m) 2))
 * 3 {chem: CO2} (* 3 (chem 'CO2'))
 * </pre>
 *
 * Every expression is a {@code *} list, wrapped in a {@code /} list when it has a
 * denominator, so groups stay distinguishable from factors. The serialization
 * records structure, not meaning: two equivalent expressions may print differently.
 */
public final class PolishNotation {

	public static final String MULTIPLY = "*";
	public static final String DIVIDE = "/";
	public static final String POWER = "^";
	public static final String PREFIX = "prefix";

	private static final Writer WRITER = new Writer();

	private PolishNotation() {
	}

	public static PolishNode toNode(Term term) {
		return term.accept(WRITER);
	}

	/**
	 * Compact one-line form.
	 */
	public static String write(Term term) {
		return PolishPrinter.printCompact(toNode(term));
	}

	/**
	 * Read fixture text back into an expression. A bare factor reads as a
	 * one-factor expression.
	 *
	 * @throws PolishFormatException if the text is malformed or names unknown symbols
	 * @throws DefinitionsException if a currency mark names an unlisted code
	 */
	public static Expression read(String text, DefinitionsTable table) {
		Objects.requireNonNull(table, "table must not be null");
		PolishNode node = new PolishReader(new PolishTokenizer(text).tokenize()).parse();
		Term term = toTerm(node, table);
		return term instanceof Expression expression ? expression : Expression.of(term);
	}

	public static Term toTerm(PolishNode node, DefinitionsTable table) {
		if (node.isList(MULTIPLY)) {
			if (node.args().isEmpty()) {
				throw new PolishFormatException("'*' needs at least one term");
			}
			List<Term> terms = new ArrayList<>();
			node.args().forEach(arg -> terms.add(toTerm(arg, table)));
			return new Expression(terms, null);
		}
		if (node.isList(DIVIDE)) {
			if (node.args().size() != 2 || !node.args().get(0).isList(MULTIPLY)) {
				throw new PolishFormatException("'/' needs a '*' numerator and one denominator: "
						+ PolishPrinter.printCompact(node));
			}
			Expression numerator = (Expression) toTerm(node.args().get(0), table);
			return numerator.dividedBy(toTerm(node.args().get(1), table));
		}
		return toFactor(node, table);
	}

	private static Factor toFactor(PolishNode node, DefinitionsTable table) {
		switch (node.kind()) {
			case NUMBER:
				return Factor.number(number(node));
			case SYMBOL:
				return Factor.unit(unit(node.value(), table));
			case STRING:
				throw new PolishFormatException("Quoted text is only allowed inside a mark: '" + node.value() + "'");
			default:
				break;
		}
		List<PolishNode> args = node.args();
		switch (node.value()) {
			case POWER: {
				if (args.size() != 2 || args.get(1).kind() != PolishNode.Kind.NUMBER) {
					throw new PolishFormatException("'^' needs a factor and a number: " + PolishPrinter.printCompact(node));
				}
				Factor base = toFactor(args.get(0), table);
				if (base.hasExponent()) {
					throw new PolishFormatException("Nested exponents are not allowed: " + PolishPrinter.printCompact(node));
				}
				return base.withExponent(number(args.get(1)));
			}
			case PREFIX: {
				if (args.size() < 2) {
					throw new PolishFormatException("'prefix' needs prefixes and a unit: " + PolishPrinter.printCompact(node));
				}
				List<Prefix> prefixes = new ArrayList<>();
				for (PolishNode arg : args.subList(0, args.size() - 1)) {
					String symbol = symbolText(arg);
					prefixes.add(table.lookupPrefix(symbol)
							.orElseThrow(() -> new PolishFormatException("Unknown prefix '" + symbol + "'")));
				}
				return Factor.prefixedUnit(prefixes, unit(symbolText(args.get(args.size() - 1)), table));
			}
			case "chem":
				return Factor.mark(MarkKind.CHEMICAL, singlePayload(node));
			case "user":
				return Factor.mark(MarkKind.USER, singlePayload(node));
			case "currency": {
				String code = singlePayload(node);
				if (!table.isCurrencyCode(code)) {
					throw new DefinitionsException("Currency code '" + code + "' is not listed");
				}
				return Factor.mark(MarkKind.CURRENCY, code);
			}
			default:
				throw new PolishFormatException("Unknown form '" + node.value() + "'");
		}
	}

	private static BigDecimal number(PolishNode node) {
		try {
			return new BigDecimal(node.value());
		} catch (NumberFormatException e) {
			throw new PolishFormatException("Malformed number '" + node.value() + "'");
		}
	}

	private static UnitDefinition unit(String symbol, DefinitionsTable table) {
		return table.lookupUnit(symbol)
				.orElseThrow(() -> new PolishFormatException("Unknown unit '" + symbol + "'"));
	}

	private static String symbolText(PolishNode node) {
		if (node.kind() != PolishNode.Kind.SYMBOL) {
			throw new PolishFormatException("Symbol expected, found " + PolishPrinter.printCompact(node));
		}
		return node.value();
	}

	private static String singlePayload(PolishNode node) {
		if (node.args().size() != 1 || node.args().get(0).kind() == PolishNode.Kind.LIST
				|| node.args().get(0).kind() == PolishNode.Kind.NUMBER) {
			throw new PolishFormatException("'" + node.value() + "' needs one payload: " + PolishPrinter.printCompact(node));
		}
		return node.args().get(0).value();
	}

	private static final class Writer implements ExpressionVisitor<PolishNode> {

		@Override
		public PolishNode visitExpression(List<Term> numerator, Term denominator) {
			List<PolishNode> terms = new ArrayList<>();
			numerator.forEach(term -> terms.add(term.accept(this)));
			PolishNode product = PolishNode.list(MULTIPLY, terms);
			return denominator == null ? product : PolishNode.list(DIVIDE, product, denominator.accept(this));
		}

		@Override
		public PolishNode visitFactor(FactorValue value, BigDecimal exponent) {
			PolishNode base;
			if (value instanceof FactorValue.NumberValue number) {
				base = PolishNode.number(number.value().toString());
			} else if (value instanceof FactorValue.PrefixedUnit unit) {
				if (unit.prefixes().isEmpty()) {
					base = PolishNode.symbol(unit.unit().symbol());
				} else {
					List<PolishNode> parts = new ArrayList<>();
					unit.prefixes().forEach(p -> parts.add(PolishNode.symbol(p.symbol())));
					parts.add(PolishNode.symbol(unit.unit().symbol()));
					base = PolishNode.list(PREFIX, parts);
				}
			} else {
				FactorValue.OtherMark mark = (FactorValue.OtherMark) value;
				base = switch (mark.kind()) {
					case CHEMICAL -> PolishNode.list("chem", PolishNode.string(mark.payload()));
					case CURRENCY -> PolishNode.list("currency", PolishNode.symbol(mark.payload()));
					case USER -> PolishNode.list("user", PolishNode.string(mark.payload()));
				};
			}
			return exponent == null ? base : PolishNode.list(POWER, base, PolishNode.number(exponent.toString()));
		}
	}
}
