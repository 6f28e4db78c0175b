package org.javai.units.parse;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.units.ast.FactorValue.OtherMark;
import org.javai.units.ast.MarkKind;
import org.javai.units.definitions.CurrencyCode;
import org.javai.units.definitions.DefinitionsException;
import org.javai.units.definitions.DefinitionsTable;

/**
 * Decides what kind of mark the text between a pair of braces is.
 * <p>
 * Chemical and currency readings take priority over user marks. A payload that
 * has the currency shape ({@code currency: XYZ}) must name a listed code;
 * anything that cannot be read as a currency at all becomes a user mark.
 */
public final class MarkClassifier {

	private static final Pattern CHEMICAL = Pattern.compile("\\s*chem\\s*:\\s*(\\S.*?)\\s*", Pattern.DOTALL);
	private static final Pattern CURRENCY = Pattern.compile("\\s*currency\\s*:\\s*(\\S+)\\s*");

	private final DefinitionsTable table;

	public MarkClassifier(DefinitionsTable table) {
		this.table = Objects.requireNonNull(table, "table must not be null");
	}

	/**
	 * @param content the text between the braces
	 * @param offset offset of the opening brace, used in error reports
	 * @throws DefinitionsException if the mark names an unlisted currency code
	 * @throws UnitSyntaxException if the braces are empty
	 */
	public OtherMark classify(String content, int offset) {
		if (content.isBlank()) {
			throw new UnitSyntaxException("Empty mark", offset);
		}
		Matcher chemical = CHEMICAL.matcher(content);
		if (chemical.matches()) {
			return new OtherMark(MarkKind.CHEMICAL, chemical.group(1));
		}
		Matcher currency = CURRENCY.matcher(content);
		if (currency.matches() && CurrencyCode.hasCurrencyShape(currency.group(1))) {
			String code = currency.group(1);
			if (!table.isCurrencyCode(code)) {
				throw new DefinitionsException("Currency code '" + code + "' is not listed", offset);
			}
			return new OtherMark(MarkKind.CURRENCY, code);
		}
		return new OtherMark(MarkKind.USER, content);
	}
}
